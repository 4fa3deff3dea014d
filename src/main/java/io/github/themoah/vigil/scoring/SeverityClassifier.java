package io.github.themoah.vigil.scoring;

import io.github.themoah.vigil.model.Severity;

/**
 * Threshold tables mapping scores to severity tiers.
 *
 * <p>Numeric metric scores (0 to 1) and log scores (0 to 100) use independent tables.
 * Both are monotonic: a higher score never yields a lower tier.
 */
public final class SeverityClassifier {

  private SeverityClassifier() {}

  /**
   * Table for numeric series scores.
   *
   * @param score composite score in [0, 1]
   * @return CRITICAL at 0.7, HIGH at 0.5, MEDIUM at 0.3, otherwise LOW
   */
  public static Severity forMetricScore(double score) {
    if (score >= 0.7) {
      return Severity.CRITICAL;
    } else if (score >= 0.5) {
      return Severity.HIGH;
    } else if (score >= 0.3) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  /**
   * Table for log batch scores. The raw error count escalates the tier on its own.
   *
   * @param score log anomaly score in [0, 100]
   * @param errorCount number of error lines in the batch
   * @return the highest tier triggered by either input
   */
  public static Severity forLogScore(double score, int errorCount) {
    if (score >= 70 || errorCount > 100) {
      return Severity.CRITICAL;
    } else if (score >= 40 || errorCount > 20) {
      return Severity.HIGH;
    } else if (score >= 20 || errorCount > 5) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }
}
