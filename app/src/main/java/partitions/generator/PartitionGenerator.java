package partitions.generator;

/**
 * Enumerates the partitions of a non-negative integer {@code n} in constant amortized time per
 * partition, using Kelleher's accelerated ascending-composition algorithm.
 *
 * <p>Every partition is reported as a non-decreasing sequence of positive parts. For {@code n = 4}
 * the sequence is {@code [1,1,1,1] [1,1,2] [1,3] [2,2] [4]}; {@code n = 0} yields the empty
 * partition once.
 *
 * <p>State between calls: a working buffer of {@code n + 1} slots, the settled boundary {@code
 * k}, the unassigned remainder {@code y} and a {@link Phase}. In {@link Phase#INNER} the
 * generator also carries {@code x} (the smaller of the two trailing parts) and {@code l} (the
 * index of the last live slot). Successive partitions differ only in the slots the state machine
 * touches, which is where the amortized bound comes from.
 *
 * <p>{@link #next()} returns a view into the buffer that is overwritten by the following call;
 * {@link #nextCopy()} returns an owned array instead. Instances are not thread-safe.
 */
public final class PartitionGenerator {
  private final int n;
  private final PartitionView view = new PartitionView();

  private PartitionBuffer buffer;
  private int k;
  private int y;
  private Phase phase = Phase.OUTER;
  private int x;
  private int l;
  private long produced;

  public PartitionGenerator(int n) {
    this(n, new PartitionBuffer(GeneratorDefaults.checkN(n) + 1));
  }

  private PartitionGenerator(int n, PartitionBuffer buffer) {
    this.n = GeneratorDefaults.checkN(n);
    this.buffer = buffer;
    buffer.reset(n + 1);
    this.k = n == 0 ? 0 : 1;
    this.y = n == 0 ? 0 : n - 1;
  }

  /**
   * Creates a generator for {@code n} that takes ownership of {@code buffer}. The buffer's contents
   * are discarded and replaced with {@code n + 1} zeros; its backing array is reused when large
   * enough. A {@code null} buffer behaves like {@link #PartitionGenerator(int)}.
   */
  public static PartitionGenerator recycle(int n, PartitionBuffer buffer) {
    GeneratorDefaults.checkN(n);
    return new PartitionGenerator(n, buffer != null ? buffer : new PartitionBuffer(n + 1));
  }

  /**
   * Advances to the next partition.
   *
   * @return view of the new partition, valid until the next call; {@code null} once every
   *     partition has been produced, and on every call after that
   */
  public PartitionView next() {
    int[] a = open().slots();
    if (phase == Phase.INNER) {
      x += 1;
      y -= 1;
      if (x <= y) {
        a[k] = x;
        a[l] = y;
        return emit(a, k + 2);
      }
      a[k] = x + y;
      y = x + y - 1;
      phase = Phase.OUTER;
      return emit(a, k + 1);
    }

    if (k == 0) {
      // n == 0 leaves a single slot that is popped once the empty partition goes out.
      if (buffer.length() == 1) {
        buffer.pop();
        return emit(a, 0);
      }
      return null;
    }

    k -= 1;
    int part = a[k] + 1;
    // 2 * part <= y, kept overflow free
    while (part <= y - part) {
      a[k] = part;
      y -= part;
      k += 1;
    }

    if (part <= y) {
      a[k] = part;
      a[k + 1] = y;
      x = part;
      l = k + 1;
      phase = Phase.INNER;
      return emit(a, k + 2);
    }
    a[k] = part + y;
    y = part + y - 1;
    return emit(a, k + 1);
  }

  /** Like {@link #next()}, but returns an owned copy of the partition. */
  public int[] nextCopy() {
    PartitionView partition = next();
    return partition == null ? null : partition.toArray();
  }

  /**
   * Closes the generator and hands its buffer back for reuse. The buffer's contents are left in an
   * unspecified state.
   */
  public PartitionBuffer end() {
    PartitionBuffer released = open();
    buffer = null;
    return released;
  }

  public int n() {
    return n;
  }

  public Phase phase() {
    return phase;
  }

  /** Number of partitions produced so far. */
  public long produced() {
    return produced;
  }

  /** True once {@link #next()} can only return {@code null}. */
  public boolean isExhausted() {
    PartitionBuffer current = open();
    return phase == Phase.OUTER && k == 0 && current.length() != 1;
  }

  private PartitionView emit(int[] a, int size) {
    produced++;
    view.point(a, size);
    return view;
  }

  private PartitionBuffer open() {
    if (buffer == null) {
      throw new IllegalStateException("generator for n=" + n + " has been ended");
    }
    return buffer;
  }

  @Override
  public String toString() {
    return "PartitionGenerator[n="
        + n
        + ", phase="
        + phase
        + ", produced="
        + produced
        + (buffer == null ? ", ended" : "")
        + "]";
  }
}
