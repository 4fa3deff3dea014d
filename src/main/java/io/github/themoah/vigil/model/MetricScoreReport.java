package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-descriptor outcome of a metric scoring batch: a score result or an error.
 * The descriptor is null only for items rejected before scoring.
 */
public record MetricScoreReport(
  String namespace,
  String metricName,
  MetricDescriptor descriptor,
  Optional<ScoreResult> result,
  Optional<String> error,
  Instant timestamp
) {

  public static MetricScoreReport scored(MetricDescriptor descriptor, ScoreResult result, Instant timestamp) {
    return new MetricScoreReport(descriptor.namespace(), descriptor.metricName(), descriptor,
      Optional.of(result), Optional.empty(), timestamp);
  }

  public static MetricScoreReport failed(MetricDescriptor descriptor, String error, Instant timestamp) {
    return new MetricScoreReport(descriptor.namespace(), descriptor.metricName(), descriptor,
      Optional.empty(), Optional.of(error), timestamp);
  }

  public static MetricScoreReport rejected(MetricRequest request, Instant timestamp) {
    return new MetricScoreReport(request.namespace(), request.metricName(), null,
      Optional.empty(), Optional.of(request.error()), timestamp);
  }

  public boolean isError() {
    return error.isPresent();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("namespace", namespace)
      .put("metric_name", metricName);
    if (error.isPresent()) {
      return json.put("error", error.get());
    }
    json.put("dimensions", descriptor.dimensionsJson())
      .put("statistic", descriptor.statistic().getValue())
      .put("timestamp", timestamp.toString());
    result.ifPresent(r -> json.mergeIn(r.toJson()));
    return json;
  }
}
