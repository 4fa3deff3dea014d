package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of scoring one metric series.
 *
 * <p>When {@code status} is {@link ScoreStatus#INSUFFICIENT_DATA} only
 * {@code sampleCount} is meaningful and the score is 0.0.
 *
 * @param status whether the series was scored
 * @param score composite anomaly score, 0.0 to 0.86
 * @param severity tier derived from the score
 * @param baselineMean mean of the baseline population
 * @param baselineStd population standard deviation of the baseline (epsilon-smoothed)
 * @param zScore absolute standardized deviation of the current value
 * @param percentile percentile rank of the current value within the baseline, 0 to 100
 * @param trend direction of the recent population
 * @param currentValue the most recent sample value
 * @param sampleCount number of samples in the series
 */
public record ScoreResult(
  ScoreStatus status,
  double score,
  Severity severity,
  double baselineMean,
  double baselineStd,
  double zScore,
  double percentile,
  Trend trend,
  double currentValue,
  int sampleCount
) {

  public static ScoreResult insufficientData(int sampleCount) {
    return new ScoreResult(ScoreStatus.INSUFFICIENT_DATA, 0.0, Severity.LOW,
      0.0, 0.0, 0.0, 0.0, Trend.STABLE, 0.0, sampleCount);
  }

  public boolean isScored() {
    return status == ScoreStatus.SCORED;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("status", status.getValue())
      .put("anomaly_score", score)
      .put("data_points", sampleCount);
    if (!isScored()) {
      return json;
    }
    return json
      .put("severity", severity.name())
      .put("current_value", currentValue)
      .put("baseline_mean", baselineMean)
      .put("baseline_std", baselineStd)
      .put("z_score", zScore)
      .put("percentile", percentile)
      .put("trend", trend.toJsonValue());
  }
}
