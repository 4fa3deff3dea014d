package io.github.themoah.vigil.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.model.ScoreStatus;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.model.Statistic;
import io.github.themoah.vigil.model.Trend;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MicrometerReporter.
 */
public class MicrometerReporterTest {

  private static final MetricDescriptor DESCRIPTOR = new MetricDescriptor("AWS/Lambda", "Duration",
    Map.of("FunctionName", "checkout"), Statistic.AVERAGE);

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MicrometerReporter reporter = new MicrometerReporter(registry);

  @Test
  void reportScore_registersScoreAndZScore() {
    reporter.reportScore(DESCRIPTOR, scored(0.42, 1.7));

    Gauge score = registry.find("vigil.anomaly.score")
      .tag("namespace", "AWS/Lambda")
      .tag("metric_name", "Duration")
      .tag("statistic", "Average")
      .tag("dimensions", "FunctionName=checkout")
      .gauge();
    assertNotNull(score);
    assertEquals(0.42, score.value(), 1e-9);
    assertEquals(1.7, registry.find("vigil.anomaly.z_score").gauge().value(), 1e-9);
  }

  @Test
  void reportScore_updatesExistingGauge() {
    reporter.reportScore(DESCRIPTOR, scored(0.1, 0.2));
    reporter.reportScore(DESCRIPTOR, scored(0.6, 2.5));

    assertEquals(0.6, registry.find("vigil.anomaly.score").gauge().value(), 1e-9);
    assertEquals(2, reporter.gaugeCount());
  }

  @Test
  void reportScore_insufficientData_scoreOnly() {
    reporter.reportScore(DESCRIPTOR, ScoreResult.insufficientData(3));

    assertEquals(0.0, registry.find("vigil.anomaly.score").gauge().value());
    assertNull(registry.find("vigil.anomaly.z_score").gauge());
  }

  @Test
  void reportLogAnalysis_registersScoreAndErrorCount() {
    LogAnalysis analysis = new LogAnalysis(100, 30, 0.3, Map.of("ERROR", 30), 12, 40.0, 51.0,
      Severity.HIGH, Optional.empty());

    reporter.reportLogAnalysis("/aws/lambda/api", analysis);

    assertEquals(51.0, registry.find("vigil.log.anomaly_score").tag("log_group", "/aws/lambda/api").gauge().value());
    assertEquals(30.0, registry.find("vigil.log.error_count").tag("log_group", "/aws/lambda/api").gauge().value());
  }

  @Test
  void cleanupStale_removesAfterTwoMissedScans() {
    reporter.reportLogAnalysis("a", analysis(10.0));
    reporter.reportLogAnalysis("b", analysis(20.0));
    reporter.cleanupStale();

    // Scan 2: only "a" reported, "b" is marked
    reporter.reportLogAnalysis("a", analysis(11.0));
    reporter.cleanupStale();
    assertNotNull(registry.find("vigil.log.anomaly_score").tag("log_group", "b").gauge());

    // Scan 3: "b" still missing, removed
    reporter.reportLogAnalysis("a", analysis(12.0));
    reporter.cleanupStale();
    assertNull(registry.find("vigil.log.anomaly_score").tag("log_group", "b").gauge());
    assertNotNull(registry.find("vigil.log.anomaly_score").tag("log_group", "a").gauge());
    assertEquals(2, reporter.gaugeCount());
  }

  @Test
  void cleanupStale_unreportedRequestGaugeRemovedOnSecondMissedCleanup() {
    MetricDescriptor adHoc = new MetricDescriptor("Custom/App", "QueueDepth", Map.of("queue", "orders"),
      Statistic.MAXIMUM);
    reporter.reportScore(adHoc, ScoreResult.insufficientData(3));
    assertEquals(1, registry.getMeters().size());

    reporter.cleanupStale();
    assertNotNull(registry.find("vigil.anomaly.score").tag("metric_name", "QueueDepth").gauge());

    reporter.cleanupStale();
    assertNotNull(registry.find("vigil.anomaly.score").tag("metric_name", "QueueDepth").gauge());

    reporter.cleanupStale();
    assertNull(registry.find("vigil.anomaly.score").tag("metric_name", "QueueDepth").gauge());
    assertEquals(0, reporter.gaugeCount());
    assertEquals(0, registry.getMeters().size());
  }

  @Test
  void cleanupStale_reappearingSeriesKept() {
    reporter.reportLogAnalysis("b", analysis(20.0));
    reporter.cleanupStale();
    reporter.cleanupStale();
    reporter.reportLogAnalysis("b", analysis(21.0));
    reporter.cleanupStale();

    assertEquals(21.0, registry.find("vigil.log.anomaly_score").tag("log_group", "b").gauge().value());
  }

  @Test
  void dimensionsTag_sortedByKey() {
    Map<String, String> dimensions = new LinkedHashMap<>();
    dimensions.put("b", "2");
    dimensions.put("a", "1");

    assertEquals("a=1,b=2", MicrometerReporter.dimensionsTag(dimensions));
    assertEquals("", MicrometerReporter.dimensionsTag(Map.of()));
  }

  private static ScoreResult scored(double score, double zScore) {
    return new ScoreResult(ScoreStatus.SCORED, score, Severity.LOW, 10.0, 1.0, zScore, 50.0,
      Trend.STABLE, 11.0, 10);
  }

  private static LogAnalysis analysis(double score) {
    return new LogAnalysis(10, 1, 0.1, Map.of("ERROR", 1), 0, 20.0, score, Severity.LOW, Optional.empty());
  }
}
