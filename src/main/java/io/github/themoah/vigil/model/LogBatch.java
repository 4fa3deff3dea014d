package io.github.themoah.vigil.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Raw log lines read from one log group over {@code [start, end)}.
 * Lines are never null; a null element is rejected on construction.
 */
public record LogBatch(
  String logGroup,
  Instant start,
  Instant end,
  List<String> lines
) {

  public LogBatch {
    Objects.requireNonNull(logGroup, "logGroup cannot be null");
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  public int size() {
    return lines.size();
  }
}
