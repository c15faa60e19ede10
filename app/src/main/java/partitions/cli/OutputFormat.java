package partitions.cli;

import java.util.Locale;
import partitions.generator.PartitionView;

/** How the {@code list} command renders a partition. */
enum OutputFormat {
  BRACKETS,
  PLUS;

  String render(PartitionView partition) {
    return switch (this) {
      case BRACKETS -> partition.toString();
      case PLUS -> partition.isEmpty() ? "0" : partition.join("+");
    };
  }

  static OutputFormat parse(String raw) {
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "brackets", "list" -> BRACKETS;
      case "plus", "sum" -> PLUS;
      default -> throw new IllegalArgumentException("Invalid format: " + raw);
    };
  }
}
