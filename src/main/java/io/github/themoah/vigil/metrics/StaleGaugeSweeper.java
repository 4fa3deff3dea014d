package io.github.themoah.vigil.metrics;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link ScoreReporter#cleanupStale()} on a timer, so gauges registered by ad-hoc
 * requests are dropped once nothing reports them anymore.
 */
public class StaleGaugeSweeper {

  private static final Logger log = LoggerFactory.getLogger(StaleGaugeSweeper.class);

  private final Vertx vertx;
  private final ScoreReporter reporter;
  private final long intervalMs;

  private Long timerId;

  public StaleGaugeSweeper(Vertx vertx, ScoreReporter reporter, long intervalMs) {
    this.vertx = vertx;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
  }

  public Future<Void> start() {
    log.info("Starting stale gauge cleanup with interval: {}ms", intervalMs);
    timerId = vertx.setPeriodic(intervalMs, id -> sweep());
    return Future.succeededFuture();
  }

  public Future<Void> stop() {
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    return Future.succeededFuture();
  }

  void sweep() {
    try {
      reporter.cleanupStale();
    } catch (RuntimeException e) {
      log.warn("Stale gauge cleanup failed", e);
    }
  }
}
