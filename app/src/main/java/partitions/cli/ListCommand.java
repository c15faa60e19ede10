package partitions.cli;

import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.generator.PartitionGenerator;
import partitions.generator.PartitionView;

/** Handles the `list` command: prints the partitions of one n, one per line. */
final class ListCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ListCommand.class);

  private final PrintStream out;

  ListCommand(PrintStream out) {
    this.out = out;
  }

  int execute(CliOptions options) {
    int n = options.singleN();
    long limit = options.limit();
    PartitionGenerator generator = new PartitionGenerator(n);
    for (PartitionView view = generator.next(); view != null; view = generator.next()) {
      out.println(options.format().render(view));
      if (limit > 0 && generator.produced() >= limit) {
        LOG.info("Stopped after {} partitions of n={} (--limit)", limit, n);
        break;
      }
    }
    LOG.debug("Listed {} partitions of n={}", generator.produced(), n);
    return 0;
  }
}
