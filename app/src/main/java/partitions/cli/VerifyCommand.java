package partitions.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.diagnostics.PartitionDiagnostic;
import partitions.validate.PartitionValidator;
import partitions.validate.ValidationReport;

/** Handles the `verify` command. */
final class VerifyCommand {
  private static final Logger LOG = LoggerFactory.getLogger(VerifyCommand.class);

  private final PrintStream out;
  private final PartitionValidator validator;

  VerifyCommand(PrintStream out) {
    this(out, new PartitionValidator());
  }

  VerifyCommand(PrintStream out, PartitionValidator validator) {
    this.out = out;
    this.validator = validator;
  }

  int execute(CliOptions options) {
    List<ValidationReport> reports = new ArrayList<>(options.ns().size());
    for (int n : options.ns()) {
      ValidationReport report = validator.validate(n);
      reports.add(report);
      logReport(report);
    }

    if (options.json()) {
      out.println(new JsonReportBuilder().build(reports));
    }
    long failures = reports.stream().filter(report -> !report.isValid()).count();
    if (failures > 0) {
      LOG.error("{} of {} value(s) of n failed verification", failures, reports.size());
      return Main.EXIT_VERIFICATION_FAILED;
    }
    LOG.info("All {} value(s) of n verified", reports.size());
    return 0;
  }

  private void logReport(ValidationReport report) {
    if (report.isValid()) {
      LOG.info(
          "- n={}: {} partitions, ok ({} ms)",
          report.n(),
          report.produced(),
          report.elapsedMillis());
      return;
    }
    LOG.warn(
        "- n={}: {} partitions, expected {}",
        report.n(),
        report.produced(),
        report.expected() != null ? report.expected() : "?");
    for (PartitionDiagnostic diagnostic : report.diagnostics()) {
      LOG.warn("  {}", diagnostic.describe());
    }
    if (report.truncated()) {
      LOG.warn("  further violations omitted");
    }
  }
}
