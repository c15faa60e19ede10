package partitions.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import partitions.generator.GeneratorDefaults;

final class CliParsersTest {

  @Test
  void parsesValuesAndRanges() {
    assertEquals(List.of(0, 1, 2, 3, 10, 20), CliParsers.parseNs("0-3, 10,,20"));
    assertEquals(List.of(7), CliParsers.parseNs("7-7"));
  }

  @Test
  void rejectsMalformedNs() {
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs(""));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs("5-2"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs("-3"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs("abc"));
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs(","));
  }

  @Test
  void rejectsRangesReachingIntegerMaximum() {
    IllegalArgumentException ex =
        assertTimeoutPreemptively(
            Duration.ofSeconds(5),
            () ->
                assertThrows(
                    IllegalArgumentException.class,
                    () -> CliParsers.parseNs("2147483646-2147483647")));
    assertTrue(ex.getMessage().contains("maximum"), ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs("2147483647"));
  }

  @Test
  void acceptsLargestSupportedN() {
    assertEquals(List.of(GeneratorDefaults.MAX_N), CliParsers.parseNs("2147483638"));
  }

  @Test
  void capsNumberOfRequestedValues() {
    assertTimeoutPreemptively(
        Duration.ofSeconds(5),
        () ->
            assertThrows(IllegalArgumentException.class, () -> CliParsers.parseNs("0-100000000")));
    assertEquals(
        GeneratorDefaults.MAX_REQUESTED_NS,
        CliParsers.parseNs("1-" + GeneratorDefaults.MAX_REQUESTED_NS).size());
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseNs("1-" + GeneratorDefaults.MAX_REQUESTED_NS + ",0"));
  }

  @Test
  void rejectsUnknownCommandBeforeValues() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> CliParsers.parseOptions(new String[] {"explode"}));
    assertEquals("Unknown command: explode", ex.getMessage());
  }

  @Test
  void parsesOptions() {
    CliOptions options =
        CliParsers.parseOptions(new String[] {"LIST", "6", "--limit=3", "--format", "plus"});

    assertEquals("list", options.command());
    assertEquals(6, options.singleN());
    assertEquals(3L, options.limit());
    assertEquals(OutputFormat.PLUS, options.format());
    assertFalse(options.json());

    CliOptions profile =
        CliParsers.parseOptions(new String[] {"profile", "1-4", "--recycle", "--json"});
    assertTrue(profile.recycle());
    assertTrue(profile.json());
    assertEquals(List.of(1, 2, 3, 4), profile.ns());
  }

  @Test
  void rejectsBadOptions() {
    assertThrows(IllegalArgumentException.class, () -> CliParsers.parseOptions(new String[0]));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"list", "3", "--bogus"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"list", "3", "--limit"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"list", "3", "4"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"list", "3", "--limit", "-1"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> CliParsers.parseOptions(new String[] {"list", "3", "--format", "csv"}));
  }
}
