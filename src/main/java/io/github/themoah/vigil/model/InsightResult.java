package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * Response of a text-insight provider: either its structured payload or an error marker.
 * The payload is embedded as returned and never interpreted.
 */
public record InsightResult(
  JsonObject payload,
  String error
) {

  public static InsightResult of(JsonObject payload) {
    return new InsightResult(Objects.requireNonNull(payload, "payload cannot be null"), null);
  }

  public static InsightResult failed(String error) {
    return new InsightResult(null, error == null ? "unknown error" : error);
  }

  public boolean isError() {
    return error != null;
  }

  public JsonObject toJson() {
    return isError() ? new JsonObject().put("error", error) : payload.copy();
  }
}
