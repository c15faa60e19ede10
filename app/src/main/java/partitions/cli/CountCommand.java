package partitions.cli;

import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.generator.Partitions;
import partitions.util.Timing;

/** Handles the `count` command: prints {@code n p(n)} for each requested n. */
final class CountCommand {
  private static final Logger LOG = LoggerFactory.getLogger(CountCommand.class);

  private final PrintStream out;

  CountCommand(PrintStream out) {
    this.out = out;
  }

  int execute(CliOptions options) {
    Timing timing = Timing.start();
    for (int n : options.ns()) {
      out.println(n + " " + Partitions.count(n));
    }
    LOG.info("Counted {} value(s) of n in {} ms", options.ns().size(), timing.elapsedMillis());
    return 0;
  }
}
