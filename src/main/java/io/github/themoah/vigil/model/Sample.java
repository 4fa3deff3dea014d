package io.github.themoah.vigil.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a metric.
 *
 * @param timestamp when the value was observed
 * @param value the observed value
 */
public record Sample(
  Instant timestamp,
  double value
) {
  public Sample {
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
  }
}
