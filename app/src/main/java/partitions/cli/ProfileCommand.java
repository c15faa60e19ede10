package partitions.cli;

import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.profile.GeneratorProfiler;
import partitions.profile.GeneratorProfiler.GeneratorProfile;
import partitions.profile.GeneratorProfiler.ProfileRun;

/** Handles the `profile` command. */
final class ProfileCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ProfileCommand.class);

  private final PrintStream out;

  ProfileCommand(PrintStream out) {
    this.out = out;
  }

  int execute(CliOptions options) {
    GeneratorProfiler profiler = new GeneratorProfiler();
    GeneratorProfile report = profiler.profile(options.ns(), options.recycle());
    logProfileReport(report);
    if (options.json()) {
      out.println(new JsonReportBuilder().build(report));
    }
    return 0;
  }

  private void logProfileReport(GeneratorProfile report) {
    LOG.info(
        "Profiling {} value(s) of n with recycleBuffer={}",
        report.runs().size(),
        report.recycledBuffer());
    for (ProfileRun run : report.runs()) {
      LOG.info(
          "- n={}: partitions={}, elapsed={}ms, {} ns/partition",
          run.n(),
          run.partitions(),
          run.elapsedMillis(),
          String.format(Locale.ROOT, "%.1f", run.nanosPerPartition()));
    }
    LOG.info(
        "Total: {} partitions in {} ms", report.totalPartitions(), report.totalElapsedMillis());
  }
}
