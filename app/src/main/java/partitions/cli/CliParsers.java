package partitions.cli;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import partitions.generator.GeneratorDefaults;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter RANGE_SPLITTER = Splitter.on('-').trimResults().limit(2);

  static final Set<String> COMMANDS = Set.of("list", "count", "verify", "profile");

  private CliParsers() {}

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static int parseInt(String raw, int defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, long defaultValue, String optionName) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  /**
   * Parses a comma separated list of values and inclusive ranges, e.g. {@code 0-5,10,20}, keeping
   * the order given. At most {@link GeneratorDefaults#MAX_REQUESTED_NS} values may be requested.
   */
  static List<Integer> parseNs(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("No values of n provided.");
    }
    List<Integer> ns = new ArrayList<>();
    for (String token : LIST_SPLITTER.split(raw)) {
      List<String> bounds = RANGE_SPLITTER.splitToList(token);
      if (bounds.size() == 1) {
        requireCapacity(ns.size() + 1L);
        ns.add(parseN(bounds.get(0)));
        continue;
      }
      int from = parseN(bounds.get(0));
      int to = parseN(bounds.get(1));
      if (to < from) {
        throw new IllegalArgumentException("Descending range: " + token);
      }
      // to <= MAX_N, so n++ cannot wrap
      requireCapacity(ns.size() + (long) to - from + 1);
      for (int n = from; n <= to; n++) {
        ns.add(n);
      }
    }
    if (ns.isEmpty()) {
      throw new IllegalArgumentException("No values of n provided.");
    }
    return List.copyOf(ns);
  }

  /**
   * Parses {@code <command> <ns> [--limit N] [--format F] [--json] [--recycle]}. Options accept
   * both {@code --option value} and {@code --option=value}.
   */
  static CliOptions parseOptions(String[] args) {
    if (args == null || args.length == 0) {
      throw new IllegalArgumentException("Missing command.");
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    if (!COMMANDS.contains(command)) {
      throw new IllegalArgumentException("Unknown command: " + args[0]);
    }
    CliOptions.Builder builder = CliOptions.builder(command);
    String nsRaw = null;

    for (int i = 1; i < args.length; i++) {
      String rawArg = args[i];
      if (!rawArg.startsWith("--")) {
        if (nsRaw != null) {
          throw new IllegalArgumentException("Unexpected argument: " + rawArg);
        }
        nsRaw = rawArg;
        continue;
      }
      String option = rawArg;
      String inlineValue = null;
      int equalsIndex = rawArg.indexOf('=');
      if (equalsIndex > 0) {
        option = rawArg.substring(0, equalsIndex);
        inlineValue = rawArg.substring(equalsIndex + 1);
      }

      switch (option) {
        case "--limit" -> {
          String value = inlineValue != null ? inlineValue : nextValue(args, ++i, option);
          builder.limit(parseLong(value, 0L, option));
        }
        case "--format" -> {
          String value = inlineValue != null ? inlineValue : nextValue(args, ++i, option);
          builder.format(OutputFormat.parse(value));
        }
        case "--json" -> builder.json(true);
        case "--recycle" -> builder.recycle(true);
        default -> throw new IllegalArgumentException("Unknown option: " + rawArg);
      }
    }

    return builder.ns(parseNs(nsRaw)).build();
  }

  private static int parseN(String raw) {
    int n = parseInt(raw, -1, "n");
    if (n < 0) {
      throw new IllegalArgumentException("n must be a non-negative integer: " + raw);
    }
    if (n > GeneratorDefaults.MAX_N) {
      throw new IllegalArgumentException(
          "n exceeds supported maximum " + GeneratorDefaults.MAX_N + ": " + raw);
    }
    return n;
  }

  private static void requireCapacity(long requested) {
    if (requested > GeneratorDefaults.MAX_REQUESTED_NS) {
      throw new IllegalArgumentException(
          "At most " + GeneratorDefaults.MAX_REQUESTED_NS + " values of n may be requested.");
    }
  }
}
