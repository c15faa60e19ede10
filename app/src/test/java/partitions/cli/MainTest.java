package partitions.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

final class MainTest {

  @Test
  void listPrintsPartitionsInOrder() {
    Result result = run("list", "4");
    assertEquals(0, result.exitCode());
    assertEquals(
        List.of("[1, 1, 1, 1]", "[1, 1, 2]", "[1, 3]", "[2, 2]", "[4]"), result.lines());
  }

  @Test
  void listHonoursLimitAndFormat() {
    Result result = run("list", "5", "--limit", "2", "--format=plus");
    assertEquals(0, result.exitCode());
    assertEquals(List.of("1+1+1+1+1", "1+1+1+2"), result.lines());
  }

  @Test
  void listOfZeroPrintsEmptyPartition() {
    assertEquals(List.of("0"), run("list", "0", "--format", "plus").lines());
    assertEquals(List.of("[]"), run("list", "0").lines());
  }

  @Test
  void countPrintsPartitionFunction() {
    Result result = run("count", "0-4,10");
    assertEquals(0, result.exitCode());
    assertEquals(List.of("0 1", "1 1", "2 2", "3 3", "4 5", "10 42"), result.lines());
  }

  @Test
  void verifyEmitsJsonReport() {
    Result result = run("verify", "3,6", "--json");
    assertEquals(0, result.exitCode());

    JsonObject root = JsonParser.parseString(result.output()).getAsJsonObject();
    assertTrue(root.get("valid").getAsBoolean());
    assertEquals("verify", root.getAsJsonObject("meta").get("command").getAsString());
    JsonArray reports = root.getAsJsonArray("reports");
    assertEquals(2, reports.size());
    assertEquals(11, reports.get(1).getAsJsonObject().get("produced").getAsLong());
    assertEquals(11, reports.get(1).getAsJsonObject().get("expected").getAsLong());
  }

  @Test
  void profileEmitsJsonReport() {
    Result result = run("profile", "8,9", "--recycle", "--json");
    assertEquals(0, result.exitCode());

    JsonObject root = JsonParser.parseString(result.output()).getAsJsonObject();
    assertTrue(root.get("recycled_buffer").getAsBoolean());
    assertEquals(52, root.get("total_partitions").getAsLong());
    assertEquals(2, root.getAsJsonArray("runs").size());
  }

  @Test
  void usageErrorsExitWithOne() {
    assertEquals(Main.EXIT_USAGE, run().exitCode());
    assertEquals(Main.EXIT_USAGE, run("list", "x").exitCode());
    assertEquals(Main.EXIT_USAGE, run("explode", "3").exitCode());
    assertEquals(Main.EXIT_USAGE, run("list", "1,2").exitCode());
  }

  @Test
  void unknownCommandPrintsUsage() {
    Result result = run("explode");
    assertEquals(Main.EXIT_USAGE, result.exitCode());
    assertTrue(result.output().startsWith("Usage:"), result.output());
  }

  @Test
  void commandErrorsPrintUsage() {
    Result result = run("list", "1,2");
    assertEquals(Main.EXIT_USAGE, result.exitCode());
    assertTrue(result.output().startsWith("Usage:"), result.output());
  }

  private static Result run(String... args) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    int exitCode = Main.run(args, out);
    return new Result(exitCode, bytes.toString(StandardCharsets.UTF_8));
  }

  private record Result(int exitCode, String output) {
    List<String> lines() {
      return output.lines().toList();
    }
  }
}
