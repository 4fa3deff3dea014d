package io.github.themoah.vigil.model;

/**
 * Terminal state of a numeric scoring call.
 */
public enum ScoreStatus {
  SCORED("scored"),
  INSUFFICIENT_DATA("insufficient_data");

  private final String value;

  ScoreStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
