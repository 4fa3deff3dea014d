package io.github.themoah.vigil.service;

import io.github.themoah.vigil.alert.Alert;
import io.github.themoah.vigil.alert.AlertPublisher;
import io.github.themoah.vigil.config.ScoringConfig;
import io.github.themoah.vigil.insight.InsightProvider;
import io.github.themoah.vigil.logs.LogBatchAnalyzer;
import io.github.themoah.vigil.metrics.ScoreReporter;
import io.github.themoah.vigil.model.InsightResult;
import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.LogBatch;
import io.github.themoah.vigil.model.LogGroupReport;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.source.LogSource;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches, analyzes and emits a batch of log groups.
 *
 * <p>When an insight provider is configured, batches containing errors are sent to it
 * and its response is attached to the analysis. Provider failures become an error
 * marker on the analysis.
 */
public class LogAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(LogAnalysisService.class);

  static final int INSIGHT_LINE_LIMIT = 50;

  private final LogSource logSource;
  private final LogBatchAnalyzer analyzer;
  private final InsightProvider insightProvider;
  private final String modelId;
  private final ScoreReporter reporter;
  private final AlertPublisher alertPublisher;
  private final ScoringConfig config;
  private final Clock clock;

  /**
   * @param insightProvider provider to query for batches with errors, or null to skip insights
   * @param modelId model identifier passed to the provider
   */
  public LogAnalysisService(
    LogSource logSource,
    LogBatchAnalyzer analyzer,
    InsightProvider insightProvider,
    String modelId,
    ScoreReporter reporter,
    AlertPublisher alertPublisher,
    ScoringConfig config,
    Clock clock
  ) {
    this.logSource = logSource;
    this.analyzer = analyzer;
    this.insightProvider = insightProvider;
    this.modelId = modelId;
    this.reporter = reporter;
    this.alertPublisher = alertPublisher;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Analyzes every log group over the last {@code hours} hours.
   *
   * @param logGroups log groups to analyze; the configured groups when null or empty
   * @param hours lookback window; the configured default when null
   * @return Future with one report per log group, in request order; never fails
   */
  public Future<List<LogGroupReport>> analyzeAll(List<String> logGroups, Integer hours) {
    List<String> targets = (logGroups == null || logGroups.isEmpty()) ? config.logGroups() : logGroups;
    int lookback = hours != null ? hours : config.logLookbackHours();
    log.info("Analyzing {} log groups over the last {}h", targets.size(), lookback);

    Instant end = clock.instant();
    Instant start = end.minus(Duration.ofHours(lookback));

    Future<List<LogGroupReport>> chain = Future.succeededFuture(new ArrayList<>());
    for (String logGroup : targets) {
      chain = chain.compose(reports -> analyzeOne(logGroup, start, end).map(report -> {
        reports.add(report);
        return reports;
      }));
    }
    return chain;
  }

  Future<LogGroupReport> analyzeOne(String logGroup, Instant start, Instant end) {
    return logSource.fetchLogs(logGroup, start, end)
      .compose(batch -> withInsight(batch, analyzer.analyze(batch)))
      .map(analysis -> LogGroupReport.analyzed(logGroup, start, end, analysis))
      .otherwise(err -> {
        log.error("Failed to analyze log group {}", logGroup, err);
        return LogGroupReport.failed(logGroup, start, end, BatchSupport.errorMessage(err));
      })
      .compose(report -> emit(report, end).map(report));
  }

  private Future<LogAnalysis> withInsight(LogBatch batch, LogAnalysis analysis) {
    if (insightProvider == null || analysis.errorCount() == 0) {
      return Future.succeededFuture(analysis);
    }
    List<String> lines = batch.lines().subList(0, Math.min(INSIGHT_LINE_LIMIT, batch.size()));

    Future<InsightResult> insight;
    try {
      insight = insightProvider.insights(lines, modelId);
    } catch (RuntimeException e) {
      insight = Future.failedFuture(e);
    }
    return insight
      .otherwise(err -> {
        log.warn("Insight request failed for {}: {}", batch.logGroup(), err.getMessage());
        return InsightResult.failed(BatchSupport.errorMessage(err));
      })
      .map(analysis::withInsight);
  }

  private Future<Void> emit(LogGroupReport report, Instant timestamp) {
    if (report.analysis().isEmpty() || !report.analysis().get().hasEvents()) {
      return Future.succeededFuture();
    }
    String logGroup = report.logGroup();
    LogAnalysis analysis = report.analysis().get();

    try {
      reporter.reportLogAnalysis(logGroup, analysis);
    } catch (RuntimeException e) {
      log.warn("Failed to report log analysis for {}", logGroup, e);
    }

    if (!analysis.severity().isAtLeast(Severity.HIGH)) {
      return Future.succeededFuture();
    }

    log.info("Log anomaly detected for {}: score={}, severity={}", logGroup,
      String.format("%.1f", analysis.anomalyScore()), analysis.severity());
    return BatchSupport.publishQuietly(alertPublisher, Alert.forLogGroup(logGroup, analysis, timestamp));
  }
}
