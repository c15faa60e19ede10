package partitions.generator;

/** Shared constants for partition generation and its consumers. */
public final class GeneratorDefaults {
  private GeneratorDefaults() {}

  /**
   * Largest supported {@code n}. The working buffer holds {@code n + 1} slots and must fit in a
   * Java array.
   */
  public static final int MAX_N = Integer.MAX_VALUE - 9;

  /** Upper bound on diagnostics a single validation report keeps. */
  public static final int MAX_DIAGNOSTICS = 100;

  /** Partitions beyond this index are no longer tracked for duplicate detection. */
  public static final int UNIQUENESS_TRACKING_LIMIT = 1_000_000;

  /** Upper bound on how many values of n one command line may request. */
  public static final int MAX_REQUESTED_NS = 10_000;

  /** Default cap on partitions printed by the {@code list} command; 0 means "no limit". */
  public static final long LIST_LIMIT = 0L;

  static int checkN(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must be non-negative: " + n);
    }
    if (n > MAX_N) {
      throw new IllegalArgumentException("n exceeds supported maximum " + MAX_N + ": " + n);
    }
    return n;
  }
}
