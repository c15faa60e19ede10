package partitions.diagnostics;

import java.util.Map;
import java.util.Objects;

/**
 * Structured diagnostic entry describing why a partition, or the sequence as a whole, violates an
 * enumeration invariant. {@code partitionIndex} is the zero-based position in the produced
 * sequence, or {@code null} for sequence-level findings.
 */
public record PartitionDiagnostic(
    Long partitionIndex, PartitionDiagnosticReason reason, Map<String, Object> attributes) {

  public static final String ATTR_EXPECTED_SUM = "expectedSum";
  public static final String ATTR_ACTUAL_SUM = "actualSum";
  public static final String ATTR_POSITION = "position";
  public static final String ATTR_VALUE = "value";
  public static final String ATTR_PREVIOUS = "previous";
  public static final String ATTR_FIRST_SEEN = "firstSeenAt";
  public static final String ATTR_EXPECTED_COUNT = "expectedCount";
  public static final String ATTR_ACTUAL_COUNT = "actualCount";

  public PartitionDiagnostic {
    Objects.requireNonNull(reason, "reason");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static PartitionDiagnostic sumMismatch(long partitionIndex, long expected, long actual) {
    return new PartitionDiagnostic(
        partitionIndex,
        PartitionDiagnosticReason.SUM_MISMATCH,
        Map.of(ATTR_EXPECTED_SUM, expected, ATTR_ACTUAL_SUM, actual));
  }

  public static PartitionDiagnostic nonPositivePart(long partitionIndex, int position, int value) {
    return new PartitionDiagnostic(
        partitionIndex,
        PartitionDiagnosticReason.NON_POSITIVE_PART,
        Map.of(ATTR_POSITION, position, ATTR_VALUE, value));
  }

  public static PartitionDiagnostic descendingParts(
      long partitionIndex, int position, int previous, int value) {
    return new PartitionDiagnostic(
        partitionIndex,
        PartitionDiagnosticReason.DESCENDING_PARTS,
        Map.of(ATTR_POSITION, position, ATTR_PREVIOUS, previous, ATTR_VALUE, value));
  }

  public static PartitionDiagnostic duplicate(long partitionIndex, long firstSeenAt) {
    return new PartitionDiagnostic(
        partitionIndex,
        PartitionDiagnosticReason.DUPLICATE_PARTITION,
        Map.of(ATTR_FIRST_SEEN, firstSeenAt));
  }

  public static PartitionDiagnostic countMismatch(long expected, long actual) {
    return new PartitionDiagnostic(
        null,
        PartitionDiagnosticReason.COUNT_MISMATCH,
        Map.of(ATTR_EXPECTED_COUNT, expected, ATTR_ACTUAL_COUNT, actual));
  }

  public String describe() {
    String where = partitionIndex == null ? "sequence" : "partition #" + partitionIndex;
    return where + ": " + reason + " " + attributes;
  }
}
