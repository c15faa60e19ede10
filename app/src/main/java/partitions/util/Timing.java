package partitions.util;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/** Lightweight stopwatch for measuring enumeration runs. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  public long elapsedMillis() {
    return TimeUnit.NANOSECONDS.toMillis(elapsedNanos());
  }

  /** Formats a nanosecond duration as milliseconds with two decimals, e.g. {@code 12.34 ms}. */
  public static String formatMillis(long nanos) {
    return String.format(Locale.ROOT, "%.2f ms", nanos / 1_000_000.0);
  }
}
