package partitions.profile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import partitions.generator.PartitionBuffer;
import partitions.generator.PartitionGenerator;
import partitions.util.Timing;

/** Utility for timing full partition enumerations across several values of {@code n}. */
public final class GeneratorProfiler {
  private static final Logger LOG = LoggerFactory.getLogger(GeneratorProfiler.class);

  /** Per-{@code n} profiling outcome. */
  public record ProfileRun(int n, long partitions, long elapsedNanos) {
    public long elapsedMillis() {
      return TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    }

    /** Average cost of one partition; 0 when nothing was produced. */
    public double nanosPerPartition() {
      return partitions == 0 ? 0.0 : (double) elapsedNanos / partitions;
    }
  }

  /** Aggregated profiling report. */
  public record GeneratorProfile(List<ProfileRun> runs, boolean recycledBuffer) {
    public GeneratorProfile {
      runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
    }

    public long totalPartitions() {
      return runs.stream().mapToLong(ProfileRun::partitions).sum();
    }

    public long totalElapsedNanos() {
      return runs.stream().mapToLong(ProfileRun::elapsedNanos).sum();
    }

    public long totalElapsedMillis() {
      return TimeUnit.NANOSECONDS.toMillis(totalElapsedNanos());
    }
  }

  /**
   * Enumerates every partition of each value in {@code ns}. With {@code recycleBuffer} a single
   * working buffer is handed from one generator to the next.
   */
  public GeneratorProfile profile(List<Integer> ns, boolean recycleBuffer) {
    Objects.requireNonNull(ns, "ns");
    if (ns.isEmpty()) {
      throw new IllegalArgumentException("Profiling requires at least one value of n.");
    }

    List<ProfileRun> runs = new ArrayList<>(ns.size());
    PartitionBuffer buffer = null;
    for (Integer n : ns) {
      Objects.requireNonNull(n, "n");
      Timing timing = Timing.start();
      PartitionGenerator generator =
          recycleBuffer ? PartitionGenerator.recycle(n, buffer) : new PartitionGenerator(n);
      while (generator.next() != null) {
        // drain
      }
      ProfileRun run = new ProfileRun(n, generator.produced(), timing.elapsedNanos());
      if (recycleBuffer) {
        buffer = generator.end();
      }
      LOG.debug(
          "n={}: {} partitions in {} ({} ns/partition)",
          n,
          run.partitions(),
          Timing.formatMillis(run.elapsedNanos()),
          Math.round(run.nanosPerPartition()));
      runs.add(run);
    }
    return new GeneratorProfile(runs, recycleBuffer);
  }
}
