package io.github.themoah.vigil.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the JSON shape of batch results.
 */
public class ReportJsonTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");
  private static final MetricDescriptor DESCRIPTOR = MetricDescriptor.of("AWS/Lambda", "Errors", Statistic.SUM);

  @Test
  void metricReport_scored() {
    ScoreResult result = new ScoreResult(ScoreStatus.SCORED, 0.5, Severity.HIGH, 2.0, 1.0, 3.0, 100.0,
      Trend.INCREASING, 5.0, 12);

    JsonObject json = MetricScoreReport.scored(DESCRIPTOR, result, NOW).toJson();

    assertEquals("AWS/Lambda", json.getString("namespace"));
    assertEquals("Errors", json.getString("metric_name"));
    assertEquals("Sum", json.getString("statistic"));
    assertEquals("scored", json.getString("status"));
    assertEquals(0.5, json.getDouble("anomaly_score"));
    assertEquals("HIGH", json.getString("severity"));
    assertEquals("increasing", json.getString("trend"));
    assertEquals(12, json.getInteger("data_points"));
    assertEquals("2024-01-15T10:30:00Z", json.getString("timestamp"));
  }

  @Test
  void metricReport_insufficientData() {
    JsonObject json = MetricScoreReport.scored(DESCRIPTOR, ScoreResult.insufficientData(4), NOW).toJson();

    assertEquals("insufficient_data", json.getString("status"));
    assertEquals(0.0, json.getDouble("anomaly_score"));
    assertEquals(4, json.getInteger("data_points"));
    assertFalse(json.containsKey("severity"));
  }

  @Test
  void metricReport_error() {
    JsonObject json = MetricScoreReport.failed(DESCRIPTOR, "connection refused", NOW).toJson();

    assertEquals("connection refused", json.getString("error"));
    assertFalse(json.containsKey("anomaly_score"));
  }

  @Test
  void logGroupReport_withEventsHasTimeRange() {
    LogAnalysis analysis = new LogAnalysis(10, 2, 0.2, Map.of("ERROR", 2), 1, 12.5, 17.0,
      Severity.LOW, Optional.empty());

    JsonObject json = LogGroupReport.analyzed("app", NOW.minusSeconds(3600), NOW, analysis).toJson();

    assertEquals("app", json.getString("log_group"));
    assertEquals(2, json.getJsonObject("error_types").getInteger("ERROR"));
    assertEquals("2024-01-15T09:30:00Z", json.getJsonObject("time_range").getString("start"));
    assertFalse(json.containsKey("ai_insights"));
  }

  @Test
  void logGroupReport_noEvents() {
    JsonObject json = LogGroupReport.analyzed("app", NOW, NOW, LogAnalysis.noEvents()).toJson();

    assertEquals(new JsonObject().put("log_group", "app").put("total_events", 0)
      .put("analysis", "No events found"), json);
  }

  @Test
  void logGroupReport_error() {
    LogGroupReport report = LogGroupReport.failed("app", NOW, NOW, "timeout");

    assertTrue(report.isError());
    assertEquals("timeout", report.toJson().getString("error"));
  }

  @Test
  void descriptorFromJson() {
    MetricDescriptor descriptor = MetricDescriptor.fromJson(new JsonObject()
      .put("namespace", "AWS/ApplicationELB")
      .put("metric_name", "TargetResponseTime")
      .put("dimensions", new JsonObject().put("LoadBalancer", "app/web/123")));

    assertEquals(Statistic.AVERAGE, descriptor.statistic());
    assertEquals(Map.of("LoadBalancer", "app/web/123"), descriptor.dimensions());
  }

  @Test
  void descriptorFromJson_rejectsInvalidInput() {
    assertThrows(IllegalArgumentException.class,
      () -> MetricDescriptor.fromJson(new JsonObject().put("namespace", "AWS/Lambda")));
    assertThrows(IllegalArgumentException.class, () -> MetricDescriptor.fromJson(new JsonObject()
      .put("namespace", "AWS/Lambda").put("metric_name", "Errors").put("statistic", "p99")));
  }
}
