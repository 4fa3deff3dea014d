package io.github.themoah.vigil.model;

/**
 * Aggregation statistic of a metric series, named the way telemetry backends name them.
 */
public enum Statistic {
  AVERAGE("Average"),
  SUM("Sum"),
  MAXIMUM("Maximum"),
  MINIMUM("Minimum"),
  SAMPLE_COUNT("SampleCount");

  private final String value;

  Statistic(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Resolves a statistic from its backend name, ignoring case.
   *
   * @param value the statistic name, e.g. "Average" or "sum"
   * @return the matching statistic
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Statistic fromValue(String value) {
    if (value == null || value.isBlank()) {
      return AVERAGE;
    }
    for (Statistic statistic : values()) {
      if (statistic.value.equalsIgnoreCase(value.trim())) {
        return statistic;
      }
    }
    throw new IllegalArgumentException("Unknown statistic: " + value);
  }
}
