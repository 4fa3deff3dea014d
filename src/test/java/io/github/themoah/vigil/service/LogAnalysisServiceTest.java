package io.github.themoah.vigil.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.vigil.config.ScoringConfig;
import io.github.themoah.vigil.logs.LogBatchAnalyzer;
import io.github.themoah.vigil.model.InsightResult;
import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.LogGroupReport;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.service.FakeCollaborators.FakeLogSource;
import io.github.themoah.vigil.service.FakeCollaborators.RecordingAlertPublisher;
import io.github.themoah.vigil.service.FakeCollaborators.RecordingReporter;
import io.github.themoah.vigil.service.FakeCollaborators.StubInsightProvider;
import io.github.themoah.vigil.source.TelemetryException;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for LogAnalysisService.
 */
@ExtendWith(VertxExtension.class)
public class LogAnalysisServiceTest {

  private static final Instant NOW = Instant.parse("2024-01-15T10:30:00Z");

  private FakeLogSource source;
  private RecordingReporter reporter;
  private RecordingAlertPublisher publisher;
  private StubInsightProvider insights;
  private ScoringConfig config;

  @BeforeEach
  void setUp() {
    source = new FakeLogSource();
    reporter = new RecordingReporter();
    publisher = new RecordingAlertPublisher();
    insights = new StubInsightProvider();
    ScoringConfig defaults = ScoringConfig.defaults();
    config = new ScoringConfig(defaults.windowHours(), defaults.minDataPoints(), defaults.anomalyThreshold(),
      defaults.stepSeconds(), defaults.defaultMetrics(), List.of("noisy", "quiet"), 1, 0);

    source.logs.put("noisy", errorLines(60));
    source.logs.put("quiet", List.of("started", "ready"));
    source.logs.put("empty", List.of());
  }

  @Test
  void emptyRequest_usesConfiguredGroupsAndLookback(VertxTestContext testContext) {
    service(null).analyzeAll(List.of(), null).onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
      assertEquals(2, reports.size());
      assertEquals("noisy", reports.get(0).logGroup());
      assertEquals("quiet", reports.get(1).logGroup());
      assertEquals(NOW.minus(Duration.ofHours(1)), reports.get(0).start());
      assertEquals(NOW, reports.get(0).end());
      testContext.completeNow();
    })));
  }

  @Test
  void severeGroup_alertedCleanGroupNot(VertxTestContext testContext) {
    service(null).analyzeAll(List.of("noisy", "quiet"), 2)
      .onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
        assertEquals(NOW.minus(Duration.ofHours(2)), reports.get(0).start());
        LogAnalysis noisy = reports.get(0).analysis().get();
        assertEquals(Severity.HIGH, noisy.severity());
        assertEquals(1, publisher.published.size());
        assertEquals("Vigil Alert: HIGH - noisy", publisher.published.get(0).subject());
        assertEquals(2, reporter.logAnalyses.size());
        testContext.completeNow();
      })));
  }

  @Test
  void fetchFailure_isolatedToItsGroup(VertxTestContext testContext) {
    service(null).analyzeAll(List.of("missing", "quiet"), null)
      .onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
        LogGroupReport missing = reports.get(0);
        assertTrue(missing.isError());
        assertEquals("log group not found: missing", missing.error().get());
        assertFalse(reports.get(1).isError());
        assertFalse(reporter.logAnalyses.containsKey("missing"));
        testContext.completeNow();
      })));
  }

  @Test
  void emptyBatch_noEventsAndNotReported(VertxTestContext testContext) {
    service(null).analyzeAll(List.of("empty"), null)
      .onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
        assertFalse(reports.get(0).analysis().get().hasEvents());
        assertEquals("No events found", reports.get(0).toJson().getString("analysis"));
        assertTrue(reporter.logAnalyses.isEmpty());
        assertTrue(publisher.published.isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void insights_requestedWithFirstFiftyLinesWhenErrors(VertxTestContext testContext) {
    service(insights).analyzeAll(List.of("noisy", "quiet"), null)
      .onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
        assertEquals(1, insights.requests.size());
        assertEquals(LogAnalysisService.INSIGHT_LINE_LIMIT, insights.requests.get(0).size());
        assertEquals("db", reports.get(0).analysis().get().aiInsight().get().payload().getString("root_cause"));
        assertTrue(reports.get(1).analysis().get().aiInsight().isEmpty());
        testContext.completeNow();
      })));
  }

  @Test
  void insightFailure_becomesErrorMarker(VertxTestContext testContext) {
    insights.response = Future.failedFuture(new TelemetryException("throttled"));

    service(insights).analyzeAll(List.of("noisy"), null)
      .onComplete(testContext.succeeding(reports -> testContext.verify(() -> {
        LogGroupReport report = reports.get(0);
        assertFalse(report.isError());
        InsightResult insight = report.analysis().get().aiInsight().get();
        assertTrue(insight.isError());
        assertEquals("throttled", report.toJson().getJsonObject("ai_insights").getString("error"));
        testContext.completeNow();
      })));
  }

  private LogAnalysisService service(StubInsightProvider provider) {
    return new LogAnalysisService(source, new LogBatchAnalyzer(), provider, "model-x", reporter, publisher,
      config, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static List<String> errorLines(int n) {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      lines.add(i % 2 == 0 ? "ERROR request " + i + " failed" : "request " + i + " ok");
    }
    return lines;
  }
}
