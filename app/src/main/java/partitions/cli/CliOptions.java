package partitions.cli;

import java.util.List;
import java.util.Objects;
import partitions.generator.GeneratorDefaults;

/** Parsed command line options shared by all commands. */
record CliOptions(
    String command,
    List<Integer> ns,
    long limit,
    OutputFormat format,
    boolean json,
    boolean recycle) {

  CliOptions {
    Objects.requireNonNull(command, "command");
    ns = ns == null ? List.of() : List.copyOf(ns);
    format = format == null ? OutputFormat.BRACKETS : format;
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be non-negative");
    }
  }

  /** The single {@code n} of commands that take exactly one. */
  int singleN() {
    if (ns.size() != 1) {
      throw new IllegalArgumentException(command + " expects exactly one value of n, got " + ns);
    }
    return ns.get(0);
  }

  static Builder builder(String command) {
    return new Builder(command);
  }

  static final class Builder {
    private final String command;
    private List<Integer> ns = List.of();
    private long limit = GeneratorDefaults.LIST_LIMIT;
    private OutputFormat format = OutputFormat.BRACKETS;
    private boolean json;
    private boolean recycle;

    private Builder(String command) {
      this.command = command;
    }

    Builder ns(List<Integer> ns) {
      this.ns = ns;
      return this;
    }

    Builder limit(long limit) {
      this.limit = limit;
      return this;
    }

    Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder recycle(boolean recycle) {
      this.recycle = recycle;
      return this;
    }

    CliOptions build() {
      return new CliOptions(command, ns, limit, format, json, recycle);
    }
  }
}
