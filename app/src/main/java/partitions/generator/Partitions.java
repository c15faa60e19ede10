package partitions.generator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** Convenience entry points that drain a {@link PartitionGenerator}. */
public final class Partitions {
  private Partitions() {}

  /** Iterator over owned copies of every partition of {@code n}, in generator order. */
  public static Iterator<int[]> iterator(int n) {
    return new CopyingIterator(new PartitionGenerator(n));
  }

  /** Iterator over owned copies of the partitions still pending in {@code generator}. */
  public static Iterator<int[]> iterator(PartitionGenerator generator) {
    return new CopyingIterator(Objects.requireNonNull(generator, "generator"));
  }

  public static Stream<int[]> stream(int n) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator(n), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Passes every partition of {@code n} to {@code action} without copying. The view handed to the
   * action is only valid for the duration of that call.
   *
   * @return number of partitions visited
   */
  public static long forEach(int n, Consumer<? super PartitionView> action) {
    Objects.requireNonNull(action, "action");
    PartitionGenerator generator = new PartitionGenerator(n);
    for (PartitionView view = generator.next(); view != null; view = generator.next()) {
      action.accept(view);
    }
    return generator.produced();
  }

  /** Counts the partitions of {@code n} by enumerating them. */
  public static long count(int n) {
    return count(new PartitionGenerator(n));
  }

  /** Drains {@code generator} and returns how many partitions it produced in total. */
  public static long count(PartitionGenerator generator) {
    Objects.requireNonNull(generator, "generator");
    while (generator.next() != null) {
      // drain
    }
    return generator.produced();
  }

  /** Materializes every partition of {@code n}; intended for small {@code n}. */
  public static List<int[]> list(int n) {
    List<int[]> partitions = new ArrayList<>();
    iterator(n).forEachRemaining(partitions::add);
    return partitions;
  }

  private static final class CopyingIterator implements Iterator<int[]> {
    private final PartitionGenerator generator;
    private int[] curr;

    CopyingIterator(PartitionGenerator generator) {
      this.generator = generator;
    }

    @Override
    public boolean hasNext() {
      if (curr == null) {
        curr = generator.nextCopy();
      }
      return curr != null;
    }

    @Override
    public int[] next() {
      if (!hasNext()) {
        throw new NoSuchElementException("no partitions left for n=" + generator.n());
      }
      int[] rv = curr;
      curr = null;
      return rv;
    }
  }
}
