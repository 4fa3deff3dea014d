package io.github.themoah.vigil.health;

/**
 * Up/down state of the service or one of its backends.
 */
public enum HealthStatus {
  UP,
  DOWN;

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }
}
