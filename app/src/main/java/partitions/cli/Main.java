package partitions.cli;

import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code list <n> [--limit N] [--format brackets|plus]}
 *   <li>{@code count <ns>}, where {@code <ns>} is e.g. {@code 0-10,20}
 *   <li>{@code verify <ns> [--json]}
 *   <li>{@code profile <ns> [--recycle] [--json]}
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_USAGE = 1;
  static final int EXIT_VERIFICATION_FAILED = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static int run(String[] args, PrintStream out) {
    CliOptions options;
    try {
      options = CliParsers.parseOptions(args);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      printUsage(out);
      return EXIT_USAGE;
    }

    try {
      return switch (options.command()) {
        case "list" -> new ListCommand(out).execute(options);
        case "count" -> new CountCommand(out).execute(options);
        case "verify" -> new VerifyCommand(out).execute(options);
        case "profile" -> new ProfileCommand(out).execute(options);
        default -> throw new IllegalArgumentException("Unknown command: " + options.command());
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      printUsage(out);
      return EXIT_USAGE;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  list <n> [--limit N] [--format brackets|plus]");
    out.println("  count <ns>");
    out.println("  verify <ns> [--json]");
    out.println("  profile <ns> [--recycle] [--json]");
    out.println("where <ns> is a comma separated list of values and ranges, e.g. 0-10,20");
  }
}
