package partitions.diagnostics;

/** Enumerates structured reasons why a produced partition or sequence was rejected. */
public enum PartitionDiagnosticReason {
  SUM_MISMATCH,
  NON_POSITIVE_PART,
  DESCENDING_PARTS,
  DUPLICATE_PARTITION,
  COUNT_MISMATCH;
}
