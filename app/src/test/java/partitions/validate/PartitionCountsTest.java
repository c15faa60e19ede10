package partitions.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import partitions.generator.Partitions;

final class PartitionCountsTest {

  @Test
  void knownValues() {
    assertEquals(1, PartitionCounts.of(0));
    assertEquals(42, PartitionCounts.of(10));
    assertEquals(627, PartitionCounts.of(20));
    assertEquals(204226, PartitionCounts.of(50));
    assertEquals(190569292L, PartitionCounts.of(100));
    assertEquals(3972999029388L, PartitionCounts.of(200));
    assertEquals(9147679068859117602L, PartitionCounts.of(PartitionCounts.MAX_N));
  }

  @Test
  void agreesWithEnumeration() {
    for (int n = 0; n <= 30; n++) {
      assertEquals(PartitionCounts.of(n), Partitions.count(n), "n=" + n);
    }
  }

  @Test
  void tableIsACopy() {
    long[] table = PartitionCounts.table(5);
    assertEquals(6, table.length);
    table[5] = -1;
    assertEquals(7, PartitionCounts.of(5));
  }

  @Test
  void rejectsUntabulatedN() {
    assertTrue(PartitionCounts.isTabulated(0));
    assertFalse(PartitionCounts.isTabulated(406));
    assertThrows(IllegalArgumentException.class, () -> PartitionCounts.of(-1));
    assertThrows(IllegalArgumentException.class, () -> PartitionCounts.of(406));
  }
}
