package io.github.themoah.vigil.service;

import io.github.themoah.vigil.alert.Alert;
import io.github.themoah.vigil.alert.AlertPublisher;
import io.github.themoah.vigil.config.ScoringConfig;
import io.github.themoah.vigil.metrics.ScoreReporter;
import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.MetricRequest;
import io.github.themoah.vigil.model.MetricScoreReport;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.scoring.NumericSeriesScorer;
import io.github.themoah.vigil.source.TelemetrySource;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches, scores and emits a batch of metrics.
 *
 * <p>Descriptors are processed one after another. A failure while fetching or scoring
 * one descriptor becomes that descriptor's error and does not affect the others.
 */
public class MetricScoringService {

  private static final Logger log = LoggerFactory.getLogger(MetricScoringService.class);

  private final TelemetrySource telemetrySource;
  private final NumericSeriesScorer scorer;
  private final ScoreReporter reporter;
  private final AlertPublisher alertPublisher;
  private final ScoringConfig config;
  private final Clock clock;

  public MetricScoringService(
    TelemetrySource telemetrySource,
    NumericSeriesScorer scorer,
    ScoreReporter reporter,
    AlertPublisher alertPublisher,
    ScoringConfig config,
    Clock clock
  ) {
    this.telemetrySource = telemetrySource;
    this.scorer = scorer;
    this.reporter = reporter;
    this.alertPublisher = alertPublisher;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Scores every descriptor, or the configured default set when the list is empty.
   *
   * @param descriptors metrics to score
   * @return Future with one report per descriptor, in request order; never fails
   */
  public Future<List<MetricScoreReport>> scoreAll(List<MetricDescriptor> descriptors) {
    List<MetricRequest> requests = new ArrayList<>();
    if (descriptors != null) {
      descriptors.forEach(descriptor -> requests.add(MetricRequest.of(descriptor)));
    }
    return scoreRequests(requests);
  }

  /**
   * Scores request items in order. Rejected items are reported as errors without a fetch.
   *
   * @param requests parsed request items; the configured default set when empty
   * @return Future with one report per item, in request order; never fails
   */
  public Future<List<MetricScoreReport>> scoreRequests(List<MetricRequest> requests) {
    List<MetricRequest> targets = new ArrayList<>();
    if (requests == null || requests.isEmpty()) {
      config.defaultMetrics().forEach(descriptor -> targets.add(MetricRequest.of(descriptor)));
    } else {
      targets.addAll(requests);
    }
    log.info("Scoring {} metrics", targets.size());

    Future<List<MetricScoreReport>> chain = Future.succeededFuture(new ArrayList<>());
    for (MetricRequest request : targets) {
      chain = chain.compose(reports -> scoreRequest(request).map(report -> {
        reports.add(report);
        return reports;
      }));
    }
    return chain;
  }

  private Future<MetricScoreReport> scoreRequest(MetricRequest request) {
    if (request.isValid()) {
      return scoreOne(request.descriptor());
    }
    log.warn("Rejected metric {}/{}: {}", request.namespace(), request.metricName(), request.error());
    return Future.succeededFuture(MetricScoreReport.rejected(request, clock.instant()));
  }

  /**
   * Scores a single descriptor over the configured window ending now.
   */
  Future<MetricScoreReport> scoreOne(MetricDescriptor descriptor) {
    Instant end = clock.instant();
    Instant start = end.minus(Duration.ofHours(config.windowHours()));

    return telemetrySource.fetchSeries(descriptor, start, end)
      .map(series -> MetricScoreReport.scored(descriptor, scorer.score(series), end))
      .otherwise(err -> {
        log.error("Failed to score metric {}", descriptor.displayName(), err);
        return MetricScoreReport.failed(descriptor, BatchSupport.errorMessage(err), end);
      })
      .compose(report -> emit(report).map(report));
  }

  private Future<Void> emit(MetricScoreReport report) {
    if (report.result().isEmpty()) {
      return Future.succeededFuture();
    }
    MetricDescriptor descriptor = report.descriptor();
    ScoreResult result = report.result().get();

    try {
      reporter.reportScore(descriptor, result);
    } catch (RuntimeException e) {
      log.warn("Failed to report score for {}", descriptor.displayName(), e);
    }

    if (!result.isScored() || result.score() < config.anomalyThreshold()) {
      return Future.succeededFuture();
    }

    log.info("Anomaly detected for {}: score={}, severity={}", descriptor.displayName(),
      String.format("%.3f", result.score()), result.severity());
    return BatchSupport.publishQuietly(alertPublisher, Alert.forMetric(descriptor, result, report.timestamp()));
  }
}
