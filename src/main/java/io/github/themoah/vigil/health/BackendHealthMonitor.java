package io.github.themoah.vigil.health;

import io.github.themoah.vigil.source.TelemetrySource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the telemetry backend on a timer and keeps the last outcome for readiness checks.
 */
public class BackendHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BackendHealthMonitor.class);

  private final Vertx vertx;
  private final TelemetrySource telemetrySource;
  private final long intervalMs;
  private final AtomicReference<HealthStatus> status = new AtomicReference<>(HealthStatus.DOWN);
  private final AtomicReference<String> lastError = new AtomicReference<>();

  private Long timerId;

  public BackendHealthMonitor(Vertx vertx, TelemetrySource telemetrySource, long intervalMs) {
    this.vertx = vertx;
    this.telemetrySource = telemetrySource;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs a first probe, then schedules the periodic one. Completes even if the first probe fails.
   */
  public Future<Void> start() {
    log.info("Starting telemetry backend health monitor with interval: {}ms", intervalMs);
    return probe()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> probe());
        log.debug("Health monitor timer ID: {}", timerId);
      });
  }

  public Future<Void> stop() {
    log.info("Stopping telemetry backend health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    status.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public boolean isBackendReachable() {
    return status.get() == HealthStatus.UP;
  }

  public String lastError() {
    return lastError.get();
  }

  Future<Void> probe() {
    return telemetrySource.ping()
      .onSuccess(version -> {
        lastError.set(null);
        if (status.getAndSet(HealthStatus.UP) == HealthStatus.DOWN) {
          log.info("Telemetry backend reachable, version: {}", version);
        }
      })
      .onFailure(err -> {
        lastError.set(err.getMessage());
        if (status.getAndSet(HealthStatus.DOWN) == HealthStatus.UP) {
          log.warn("Telemetry backend unreachable: {}", err.getMessage());
        } else {
          log.debug("Telemetry backend probe failed: {}", err.getMessage());
        }
      })
      .<Void>mapEmpty()
      .otherwise((Void) null);
  }
}
