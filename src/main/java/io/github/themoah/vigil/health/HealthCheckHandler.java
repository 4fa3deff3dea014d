package io.github.themoah.vigil.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves /healthz (liveness) and /readyz (telemetry backend reachability).
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BackendHealthMonitor healthMonitor;

  public HealthCheckHandler(BackendHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(ctx -> respond(ctx, HealthCheckResponse.liveness()));
    router.get("/readyz").handler(ctx -> respond(ctx,
      HealthCheckResponse.readiness(healthMonitor.isBackendReachable(), healthMonitor.lastError())));
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.httpStatus())
      .end(response.toJson().encode());
  }
}
