package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;

/**
 * One item of a metric scoring request: a descriptor, or the reason the item was rejected.
 *
 * @param namespace namespace as given, may be null when rejected
 * @param metricName metric name as given, may be null when rejected
 * @param descriptor parsed descriptor, null when rejected
 * @param error rejection reason, null when valid
 */
public record MetricRequest(
  String namespace,
  String metricName,
  MetricDescriptor descriptor,
  String error
) {

  public static MetricRequest of(MetricDescriptor descriptor) {
    return new MetricRequest(descriptor.namespace(), descriptor.metricName(), descriptor, null);
  }

  public static MetricRequest rejected(String namespace, String metricName, String error) {
    return new MetricRequest(namespace, metricName, null, error);
  }

  /**
   * Parses a request item. Missing names and unknown statistics reject the item only.
   *
   * @throws ClassCastException if a field has the wrong JSON type
   */
  public static MetricRequest fromJson(JsonObject item) {
    try {
      return of(MetricDescriptor.fromJson(item));
    } catch (IllegalArgumentException e) {
      return rejected(item.getString("namespace"), item.getString("metric_name"), e.getMessage());
    }
  }

  public boolean isValid() {
    return descriptor != null;
  }
}
