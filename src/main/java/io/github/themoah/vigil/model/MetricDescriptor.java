package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies a metric series to score: namespace, name, dimensions and statistic.
 *
 * @param namespace the metric namespace, e.g. "AWS/Lambda"
 * @param metricName the metric name, e.g. "Duration"
 * @param dimensions dimension name to value, never null
 * @param statistic the aggregation statistic, never null
 */
public record MetricDescriptor(
  String namespace,
  String metricName,
  Map<String, String> dimensions,
  Statistic statistic
) {

  public MetricDescriptor {
    Objects.requireNonNull(namespace, "namespace cannot be null");
    Objects.requireNonNull(metricName, "metricName cannot be null");
    dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
    statistic = statistic == null ? Statistic.AVERAGE : statistic;
  }

  public static MetricDescriptor of(String namespace, String metricName, Statistic statistic) {
    return new MetricDescriptor(namespace, metricName, Map.of(), statistic);
  }

  /**
   * Parses a descriptor from a request item.
   *
   * <p>Expected shape:
   * <pre>{"namespace": "AWS/Lambda", "metric_name": "Duration",
   *  "dimensions": {"FunctionName": "fn"}, "statistic": "Average"}</pre>
   *
   * @param json the request item
   * @return the parsed descriptor
   * @throws IllegalArgumentException if a required field is missing or the statistic is unknown
   * @throws ClassCastException if a field has the wrong JSON type
   */
  public static MetricDescriptor fromJson(JsonObject json) {
    String namespace = json.getString("namespace");
    String metricName = json.getString("metric_name");
    if (namespace == null || namespace.isBlank() || metricName == null || metricName.isBlank()) {
      throw new IllegalArgumentException("Metric entries require 'namespace' and 'metric_name'");
    }

    Map<String, String> dimensions = new LinkedHashMap<>();
    JsonObject dims = json.getJsonObject("dimensions");
    if (dims != null) {
      for (String key : dims.fieldNames()) {
        dimensions.put(key, String.valueOf(dims.getValue(key)));
      }
    }

    return new MetricDescriptor(namespace, metricName, dimensions,
      Statistic.fromValue(json.getString("statistic")));
  }

  /**
   * Returns "namespace/metricName", used in logs and alert subjects.
   */
  public String displayName() {
    return namespace + "/" + metricName;
  }

  public JsonObject dimensionsJson() {
    JsonObject json = new JsonObject();
    dimensions.forEach(json::put);
    return json;
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("namespace", namespace)
      .put("metric_name", metricName)
      .put("dimensions", dimensionsJson())
      .put("statistic", statistic.getValue());
  }
}
