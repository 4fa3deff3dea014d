package io.github.themoah.vigil.alert;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.model.Severity;
import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Notification payload handed to an {@link AlertPublisher}.
 *
 * @param type the pipeline that raised the alert
 * @param severity severity of the scored item
 * @param subject one-line summary
 * @param message structured details
 */
public record Alert(
  AlertType type,
  Severity severity,
  String subject,
  JsonObject message
) {

  /**
   * Builds the alert for a scored metric.
   */
  public static Alert forMetric(MetricDescriptor descriptor, ScoreResult result, Instant timestamp) {
    String subject = "Vigil Anomaly Alert: " + result.severity() + " - " + descriptor.metricName();
    JsonObject message = new JsonObject()
      .put("alert_type", AlertType.ANOMALY_DETECTION.getValue())
      .put("severity", result.severity().name())
      .put("namespace", descriptor.namespace())
      .put("metric_name", descriptor.metricName())
      .put("dimensions", descriptor.dimensionsJson())
      .put("anomaly_score", result.score())
      .put("current_value", result.currentValue())
      .put("baseline_mean", result.baselineMean())
      .put("z_score", result.zScore())
      .put("trend", result.trend().toJsonValue())
      .put("timestamp", timestamp.toString());
    return new Alert(AlertType.ANOMALY_DETECTION, result.severity(), subject, message);
  }

  /**
   * Builds the alert for an analyzed log group.
   */
  public static Alert forLogGroup(String logGroup, LogAnalysis analysis, Instant timestamp) {
    String subject = "Vigil Alert: " + analysis.severity() + " - " + logGroup;
    JsonObject message = new JsonObject()
      .put("alert_type", AlertType.LOG_ANALYSIS.getValue())
      .put("severity", analysis.severity().name())
      .put("log_group", logGroup)
      .put("error_count", analysis.errorCount())
      .put("error_rate", analysis.errorRate())
      .put("anomaly_score", analysis.anomalyScore())
      .put("timestamp", timestamp.toString());
    analysis.aiInsight().ifPresent(insight -> message.put("ai_insights", insight.toJson()));
    return new Alert(AlertType.LOG_ANALYSIS, analysis.severity(), subject, message);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("subject", subject)
      .put("message", message.copy());
  }
}
