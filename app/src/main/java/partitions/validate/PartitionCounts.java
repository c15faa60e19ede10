package partitions.validate;

import java.util.Arrays;

/**
 * Reference values of the partition function {@code p(n)}, computed with Euler's pentagonal
 * number recurrence rather than by enumeration.
 *
 * <p>{@code p(n) = sum over k >= 1 of (-1)^(k+1) * (p(n - k(3k-1)/2) + p(n - k(3k+1)/2))}
 */
public final class PartitionCounts {
  /** Largest {@code n} whose partition count fits in a {@code long}. */
  public static final int MAX_N = 405;

  private static final long[] TABLE = compute(MAX_N);

  private PartitionCounts() {}

  public static long of(int n) {
    if (n < 0 || n > MAX_N) {
      throw new IllegalArgumentException(
          "partition count is only tabulated for 0 <= n <= " + MAX_N + ": " + n);
    }
    return TABLE[n];
  }

  public static boolean isTabulated(int n) {
    return n >= 0 && n <= MAX_N;
  }

  /** Returns {@code p(0) .. p(upTo)}. */
  public static long[] table(int upTo) {
    of(upTo);
    return Arrays.copyOf(TABLE, upTo + 1);
  }

  private static long[] compute(int upTo) {
    long[] p = new long[upTo + 1];
    p[0] = 1;
    for (int n = 1; n <= upTo; n++) {
      long total = 0;
      for (int k = 1; ; k++) {
        int first = k * (3 * k - 1) / 2;
        if (first > n) {
          break;
        }
        long term = p[n - first];
        int second = k * (3 * k + 1) / 2;
        if (second <= n) {
          term += p[n - second];
        }
        total += (k & 1) == 1 ? term : -term;
      }
      p[n] = total;
    }
    return p;
  }
}
