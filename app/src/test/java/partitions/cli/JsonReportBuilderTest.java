package partitions.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.util.List;
import org.junit.jupiter.api.Test;
import partitions.diagnostics.PartitionDiagnostic;
import partitions.validate.ValidationReport;

final class JsonReportBuilderTest {

  @Test
  void keepsSequenceLevelDiagnosticIndexAsNull() {
    ValidationReport report =
        new ValidationReport(
            4, 6, 5L, List.of(PartitionDiagnostic.countMismatch(5, 6)), false, 0L);

    JsonObject root =
        JsonParser.parseString(new JsonReportBuilder().build(List.of(report))).getAsJsonObject();
    JsonObject entry = root.getAsJsonArray("reports").get(0).getAsJsonObject();
    JsonObject diagnostic = entry.getAsJsonArray("diagnostics").get(0).getAsJsonObject();

    assertFalse(root.get("valid").getAsBoolean());
    assertTrue(diagnostic.has("partition_index"), diagnostic.toString());
    assertTrue(diagnostic.get("partition_index").isJsonNull());
    assertEquals("COUNT_MISMATCH", diagnostic.get("reason").getAsString());
  }

  @Test
  void keepsMissingReferenceCountAsNull() {
    ValidationReport report = new ValidationReport(500, 12, null, List.of(), false, 3L);

    JsonObject entry =
        JsonParser.parseString(new JsonReportBuilder().build(List.of(report)))
            .getAsJsonObject()
            .getAsJsonArray("reports")
            .get(0)
            .getAsJsonObject();

    assertTrue(entry.has("expected"), entry.toString());
    assertTrue(entry.get("expected").isJsonNull());
    assertEquals(12, entry.get("produced").getAsLong());
  }
}
