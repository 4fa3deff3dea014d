package io.github.themoah.vigil.health;

import io.vertx.core.json.JsonObject;

/**
 * Body of the liveness and readiness probes.
 *
 * @param status overall status
 * @param telemetry telemetry backend state, absent for liveness
 * @param lastError message of the last failed backend probe, if any
 */
public record HealthCheckResponse(
  HealthStatus status,
  String telemetry,
  String lastError
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  /**
   * Readiness follows the last telemetry backend probe.
   */
  public static HealthCheckResponse readiness(boolean telemetryReachable, String lastError) {
    return new HealthCheckResponse(
      HealthStatus.of(telemetryReachable),
      telemetryReachable ? "reachable" : "unreachable",
      telemetryReachable ? null : lastError
    );
  }

  public int httpStatus() {
    return status == HealthStatus.UP ? 200 : 503;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (telemetry != null) {
      json.put("telemetry", telemetry);
    }
    if (lastError != null) {
      json.put("last_error", lastError);
    }
    return json;
  }
}
