package io.github.themoah.vigil.model;

/**
 * Direction of the recent part of a metric series.
 */
public enum Trend {
  INCREASING,
  DECREASING,
  STABLE;

  /**
   * Returns true for increasing or decreasing trends.
   */
  public boolean isDirectional() {
    return this != STABLE;
  }

  /**
   * Returns a lowercase representation used in JSON payloads.
   *
   * @return the trend name in lowercase
   */
  public String toJsonValue() {
    return name().toLowerCase();
  }
}
