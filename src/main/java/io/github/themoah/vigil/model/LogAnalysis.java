package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Features and score derived from one log batch.
 *
 * @param totalEvents number of lines analyzed; 0 means the batch had no events
 * @param errorCount lines matching at least one error indicator
 * @param errorRate errorCount / totalEvents
 * @param errorTypes error indicator to number of lines it matched first
 * @param uniquePatterns distinct structural tokens in the sampled lines
 * @param avgMessageLength mean line length in characters
 * @param anomalyScore score from 0 to 100
 * @param severity tier derived from score and error count
 * @param aiInsight insight provider response, when one was requested
 */
public record LogAnalysis(
  int totalEvents,
  int errorCount,
  double errorRate,
  Map<String, Integer> errorTypes,
  int uniquePatterns,
  double avgMessageLength,
  double anomalyScore,
  Severity severity,
  Optional<InsightResult> aiInsight
) {

  public LogAnalysis {
    errorTypes = errorTypes == null
      ? Map.of()
      : Collections.unmodifiableMap(new LinkedHashMap<>(errorTypes));
    aiInsight = aiInsight == null ? Optional.empty() : aiInsight;
  }

  /**
   * Result for a batch without any lines.
   */
  public static LogAnalysis noEvents() {
    return new LogAnalysis(0, 0, 0.0, Map.of(), 0, 0.0, 0.0, Severity.LOW, Optional.empty());
  }

  public boolean hasEvents() {
    return totalEvents > 0;
  }

  public LogAnalysis withInsight(InsightResult insight) {
    return new LogAnalysis(totalEvents, errorCount, errorRate, errorTypes, uniquePatterns,
      avgMessageLength, anomalyScore, severity, Optional.of(insight));
  }

  public JsonObject toJson() {
    if (!hasEvents()) {
      return new JsonObject()
        .put("total_events", 0)
        .put("analysis", "No events found");
    }

    JsonObject types = new JsonObject();
    errorTypes.forEach(types::put);

    JsonObject json = new JsonObject()
      .put("total_events", totalEvents)
      .put("error_count", errorCount)
      .put("error_rate", errorRate)
      .put("error_types", types)
      .put("unique_patterns", uniquePatterns)
      .put("avg_message_length", avgMessageLength)
      .put("anomaly_score", anomalyScore)
      .put("severity", severity.name());
    aiInsight.ifPresent(insight -> json.put("ai_insights", insight.toJson()));
    return json;
  }
}
