package io.github.themoah.vigil.model;

/**
 * Ordinal severity tier assigned to an anomaly score.
 * Declaration order is the escalation order.
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Returns true if this tier is at or above the given tier.
   *
   * @param other the tier to compare against
   * @return true if this tier is not lower than {@code other}
   */
  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  /**
   * Returns the higher of two tiers.
   */
  public static Severity max(Severity a, Severity b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
