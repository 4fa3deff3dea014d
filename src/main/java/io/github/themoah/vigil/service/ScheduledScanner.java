package io.github.themoah.vigil.service;

import io.github.themoah.vigil.model.LogGroupReport;
import io.github.themoah.vigil.model.MetricScoreReport;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically scores the default metrics and analyzes the default log groups.
 * A tick is skipped while the previous scan is still running.
 */
public class ScheduledScanner {

  private static final Logger log = LoggerFactory.getLogger(ScheduledScanner.class);

  private final Vertx vertx;
  private final MetricScoringService metricService;
  private final LogAnalysisService logService;
  private final long intervalMs;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private Long timerId;

  public ScheduledScanner(
    Vertx vertx,
    MetricScoringService metricService,
    LogAnalysisService logService,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.metricService = metricService;
    this.logService = logService;
    this.intervalMs = intervalMs;
  }

  public Future<Void> start() {
    log.info("Starting scheduled scanner with interval: {}ms", intervalMs);
    timerId = vertx.setPeriodic(intervalMs, id -> scan());
    return Future.succeededFuture();
  }

  public Future<Void> stop() {
    log.info("Stopping scheduled scanner");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return Future.succeededFuture();
  }

  /**
   * Runs one scan unless one is already in progress.
   *
   * @return Future completing when the scan finishes, or immediately when skipped
   */
  Future<Void> scan() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Previous scan still running, skipping this tick");
      return Future.succeededFuture();
    }
    long startedAt = System.currentTimeMillis();

    return metricService.scoreAll(List.of())
      .compose(metrics -> logService.analyzeAll(List.of(), null)
        .map(logs -> {
          logSummary(metrics, logs, System.currentTimeMillis() - startedAt);
          return logs;
        }))
      .onComplete(ar -> {
        running.set(false);
        if (ar.failed()) {
          log.error("Scheduled scan failed", ar.cause());
        }
      })
      .mapEmpty();
  }

  boolean isRunning() {
    return running.get();
  }

  private static void logSummary(List<MetricScoreReport> metrics, List<LogGroupReport> logs, long elapsedMs) {
    long metricErrors = metrics.stream().filter(MetricScoreReport::isError).count();
    long logErrors = logs.stream().filter(LogGroupReport::isError).count();
    log.info("Scan completed in {}ms: {} metrics ({} failed), {} log groups ({} failed)",
      elapsedMs, metrics.size(), metricErrors, logs.size(), logErrors);
  }
}
