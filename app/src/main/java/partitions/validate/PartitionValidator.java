package partitions.validate;

import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.diagnostics.PartitionDiagnostic;
import partitions.generator.GeneratorDefaults;
import partitions.generator.PartitionGenerator;
import partitions.generator.PartitionView;
import partitions.util.Timing;

/**
 * Checks produced partitions against the enumeration invariants: every partition sums to {@code
 * n}, has positive parts listed in non-decreasing order, appears only once, and the sequence holds
 * exactly {@code p(n)} partitions.
 *
 * <p>Duplicate detection keeps a copy of each partition and stops after {@code uniquenessLimit}
 * partitions; the remaining checks run over the whole sequence.
 */
public final class PartitionValidator {
  private static final Logger LOG = LoggerFactory.getLogger(PartitionValidator.class);

  private final int maxDiagnostics;
  private final int uniquenessLimit;

  public PartitionValidator() {
    this(GeneratorDefaults.MAX_DIAGNOSTICS, GeneratorDefaults.UNIQUENESS_TRACKING_LIMIT);
  }

  public PartitionValidator(int maxDiagnostics, int uniquenessLimit) {
    if (maxDiagnostics < 1) {
      throw new IllegalArgumentException("maxDiagnostics must be positive");
    }
    if (uniquenessLimit < 0) {
      throw new IllegalArgumentException("uniquenessLimit must be non-negative");
    }
    this.maxDiagnostics = maxDiagnostics;
    this.uniquenessLimit = uniquenessLimit;
  }

  /** Enumerates every partition of {@code n} and validates the sequence. */
  public ValidationReport validate(int n) {
    Timing timing = Timing.start();
    PartitionGenerator generator = new PartitionGenerator(n);
    Run run = new Run(n);
    for (PartitionView view = generator.next(); view != null; view = generator.next()) {
      run.accept(view.toArray());
    }
    return run.finish(timing);
  }

  /** Validates an arbitrary sequence of partitions claimed to be the partitions of {@code n}. */
  public ValidationReport validate(int n, Iterator<int[]> source) {
    Objects.requireNonNull(source, "source");
    Timing timing = Timing.start();
    Run run = new Run(n);
    while (source.hasNext()) {
      run.accept(source.next());
    }
    return run.finish(timing);
  }

  /** Checks a single partition in isolation (sum, positivity and ordering). */
  public List<PartitionDiagnostic> checkPartition(int n, long index, int[] parts) {
    Objects.requireNonNull(parts, "parts");
    List<PartitionDiagnostic> found = new ArrayList<>();
    long sum = 0;
    for (int i = 0; i < parts.length; i++) {
      int part = parts[i];
      sum += part;
      if (part <= 0) {
        found.add(PartitionDiagnostic.nonPositivePart(index, i, part));
      }
      if (i > 0 && part < parts[i - 1]) {
        found.add(PartitionDiagnostic.descendingParts(index, i, parts[i - 1], part));
      }
    }
    if (sum != n) {
      found.add(PartitionDiagnostic.sumMismatch(index, n, sum));
    }
    return found;
  }

  /** Mutable state of one validation pass. */
  private final class Run {
    private final int n;
    private final List<PartitionDiagnostic> diagnostics = new ArrayList<>();
    private final Map<ImmutableIntArray, Long> seen = new HashMap<>();
    private long index;
    private boolean truncated;

    Run(int n) {
      if (n < 0) {
        throw new IllegalArgumentException("n must be non-negative: " + n);
      }
      this.n = n;
    }

    void accept(int[] parts) {
      Objects.requireNonNull(parts, "parts");
      for (PartitionDiagnostic diagnostic : checkPartition(n, index, parts)) {
        record(diagnostic);
      }
      if (index < uniquenessLimit) {
        Long firstSeen = seen.putIfAbsent(ImmutableIntArray.copyOf(parts), index);
        if (firstSeen != null) {
          record(PartitionDiagnostic.duplicate(index, firstSeen));
        }
      }
      index++;
    }

    ValidationReport finish(Timing timing) {
      Long expected = null;
      if (PartitionCounts.isTabulated(n)) {
        expected = PartitionCounts.of(n);
        if (expected != index) {
          record(PartitionDiagnostic.countMismatch(expected, index));
        }
      } else {
        LOG.debug("No reference count for n={}; count check skipped", n);
      }
      if (index > uniquenessLimit) {
        LOG.debug(
            "Duplicate tracking for n={} covered the first {} of {} partitions",
            n,
            uniquenessLimit,
            index);
      }
      ValidationReport report =
          new ValidationReport(n, index, expected, diagnostics, truncated, timing.elapsedMillis());
      if (report.isValid()) {
        LOG.debug("n={}: {} partitions valid in {} ms", n, index, report.elapsedMillis());
      } else {
        LOG.warn("n={}: {} violation(s) across {} partitions", n, diagnostics.size(), index);
      }
      return report;
    }

    private void record(PartitionDiagnostic diagnostic) {
      if (diagnostics.size() < maxDiagnostics) {
        diagnostics.add(diagnostic);
      } else {
        truncated = true;
      }
    }
  }
}
