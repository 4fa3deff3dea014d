package io.github.themoah.vigil.alert;

/**
 * Pipeline that raised an alert.
 */
public enum AlertType {
  ANOMALY_DETECTION("anomaly_detection"),
  LOG_ANALYSIS("log_analysis");

  private final String value;

  AlertType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
