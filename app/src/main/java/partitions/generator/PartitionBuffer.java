package partitions.generator;

import java.util.Arrays;

/**
 * Growable {@code int} buffer backing a {@link PartitionGenerator}.
 *
 * <p>The buffer separates its logical length from the capacity of its backing array so that a
 * buffer handed back by {@link PartitionGenerator#end()} can be given to {@link
 * PartitionGenerator#recycle(int, PartitionBuffer)} without reallocating whenever it is already
 * large enough.
 *
 * <p>Not thread-safe. A buffer must be owned by at most one generator at a time.
 */
public final class PartitionBuffer {
  private static final int[] EMPTY = new int[0];

  private int[] slots;
  private int length;

  public PartitionBuffer() {
    this.slots = EMPTY;
  }

  public PartitionBuffer(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
    }
    this.slots = capacity == 0 ? EMPTY : new int[capacity];
  }

  /** Returns a buffer holding a copy of {@code values}. */
  static PartitionBuffer of(int... values) {
    PartitionBuffer buffer = new PartitionBuffer(values.length);
    System.arraycopy(values, 0, buffer.slots, 0, values.length);
    buffer.length = values.length;
    return buffer;
  }

  /**
   * Clears the buffer and refills it with {@code size} zeros. The backing array is kept when its
   * capacity is at least {@code size}.
   */
  public void reset(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size must be non-negative: " + size);
    }
    if (slots.length < size) {
      slots = new int[size];
    } else {
      Arrays.fill(slots, 0, size, 0);
    }
    length = size;
  }

  void add(int value) {
    if (length == slots.length) {
      slots = Arrays.copyOf(slots, Math.max(8, slots.length + (slots.length >> 1)));
    }
    slots[length++] = value;
  }

  /** Drops the last slot. */
  public void pop() {
    if (length == 0) {
      throw new IllegalStateException("buffer is empty");
    }
    length--;
  }

  int get(int index) {
    checkIndex(index);
    return slots[index];
  }

  void set(int index, int value) {
    checkIndex(index);
    slots[index] = value;
  }

  public int length() {
    return length;
  }

  public int capacity() {
    return slots.length;
  }

  public int[] toArray() {
    return Arrays.copyOf(slots, length);
  }

  /** Backing array, shared with views; indices at or past {@link #length()} are stale. */
  int[] slots() {
    return slots;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + length);
    }
  }

  @Override
  public String toString() {
    return "PartitionBuffer[length=" + length + ", capacity=" + slots.length + "]";
  }
}
