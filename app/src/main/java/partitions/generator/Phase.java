package partitions.generator;

/** Resumption point of a {@link PartitionGenerator} between calls. */
public enum Phase {
  /** No simple increment is pending; the next call resettles the buffer from {@code k}. */
  OUTER,
  /**
   * The last call split the remainder into two trailing parts {@code x <= y}; the next call tries
   * {@code (x + 1, y - 1)} in the same two slots.
   */
  INNER;
}
