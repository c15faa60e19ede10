package partitions.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import partitions.diagnostics.PartitionDiagnostic;
import partitions.profile.GeneratorProfiler.GeneratorProfile;
import partitions.profile.GeneratorProfiler.ProfileRun;
import partitions.validate.ValidationReport;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(List<ValidationReport> reports) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta("verify"));
    root.put("valid", reports.stream().allMatch(ValidationReport::isValid));
    List<Map<String, Object>> entries = new ArrayList<>();
    for (ValidationReport report : reports) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("n", report.n());
      map.put("produced", report.produced());
      map.put("expected", report.expected());
      map.put("valid", report.isValid());
      map.put("time_ms", report.elapsedMillis());
      if (!report.diagnostics().isEmpty()) {
        map.put("diagnostics", diagnosticSummaries(report.diagnostics()));
        map.put("truncated", report.truncated());
      }
      entries.add(map);
    }
    root.put("reports", entries);
    return gson.toJson(root);
  }

  String build(GeneratorProfile profile) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta("profile"));
    root.put("recycled_buffer", profile.recycledBuffer());
    root.put("total_partitions", profile.totalPartitions());
    root.put("total_ms", profile.totalElapsedMillis());
    List<Map<String, Object>> runs = new ArrayList<>();
    for (ProfileRun run : profile.runs()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("n", run.n());
      map.put("partitions", run.partitions());
      map.put("elapsed_ns", run.elapsedNanos());
      map.put("ns_per_partition", Math.round(run.nanosPerPartition() * 100.0) / 100.0);
      runs.add(map);
    }
    root.put("runs", runs);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(String command) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("command", command);
    return meta;
  }

  private List<Map<String, Object>> diagnosticSummaries(List<PartitionDiagnostic> diagnostics) {
    List<Map<String, Object>> summaries = new ArrayList<>();
    for (PartitionDiagnostic diagnostic : diagnostics) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("partition_index", diagnostic.partitionIndex());
      map.put("reason", diagnostic.reason().name());
      if (!diagnostic.attributes().isEmpty()) {
        map.put("attributes", new TreeMap<>(diagnostic.attributes()));
      }
      summaries.add(map);
    }
    return summaries;
  }
}
