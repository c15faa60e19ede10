package partitions.generator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Read-only window onto the live prefix of a generator's working buffer.
 *
 * <p>A generator hands out the same view instance on every call and re-points it at the new
 * prefix, so a view is only meaningful until the next call to {@link PartitionGenerator#next()}.
 * Use {@link #toArray()} to keep a partition around.
 */
public final class PartitionView {
  private int[] parts = new int[0];
  private int size;

  PartitionView() {}

  void point(int[] parts, int size) {
    this.parts = parts;
    this.size = size;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int part(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
    }
    return parts[index];
  }

  public long sum() {
    long total = 0;
    for (int i = 0; i < size; i++) {
      total += parts[i];
    }
    return total;
  }

  public int[] toArray() {
    return Arrays.copyOf(parts, size);
  }

  public List<Integer> toList() {
    List<Integer> list = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      list.add(parts[i]);
    }
    return list;
  }

  /** Formats the parts joined by {@code delimiter}, e.g. {@code 1+1+2}. */
  public String join(String delimiter) {
    StringJoiner joiner = new StringJoiner(delimiter);
    for (int i = 0; i < size; i++) {
      joiner.add(Integer.toString(parts[i]));
    }
    return joiner.toString();
  }

  @Override
  public String toString() {
    return "[" + join(", ") + "]";
  }
}
