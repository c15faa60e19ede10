package partitions.validate;

import java.util.List;
import java.util.Objects;
import partitions.diagnostics.PartitionDiagnostic;

/**
 * Outcome of validating the partitions produced for one {@code n}.
 *
 * @param expected reference count, or {@code null} when {@code n} is beyond the reference table
 * @param truncated whether more violations were found than {@code diagnostics} holds
 */
public record ValidationReport(
    int n,
    long produced,
    Long expected,
    List<PartitionDiagnostic> diagnostics,
    boolean truncated,
    long elapsedMillis) {

  public ValidationReport {
    diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
  }

  public boolean isValid() {
    return diagnostics.isEmpty();
  }
}
