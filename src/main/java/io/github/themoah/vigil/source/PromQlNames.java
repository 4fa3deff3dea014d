package io.github.themoah.vigil.source;

import io.github.themoah.vigil.model.MetricDescriptor;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Maps metric descriptors onto Prometheus names, following the CloudWatch exporter
 * convention {@code <namespace>_<metric>_<statistic>} in snake case, with dimensions
 * as label matchers.
 *
 * <p>Example: AWS/Lambda Duration Average {FunctionName=checkout} becomes
 * {@code aws_lambda_duration_average{function_name="checkout"}}.
 */
public final class PromQlNames {

  private PromQlNames() {}

  public static String metricName(MetricDescriptor descriptor) {
    return snakeCase(descriptor.namespace())
      + "_" + snakeCase(descriptor.metricName())
      + "_" + snakeCase(descriptor.statistic().getValue());
  }

  /**
   * Builds an instant vector selector. Labels are emitted in name order.
   */
  public static String selector(MetricDescriptor descriptor) {
    String name = metricName(descriptor);
    if (descriptor.dimensions().isEmpty()) {
      return name;
    }
    StringJoiner labels = new StringJoiner(",", "{", "}");
    Map<String, String> sorted = new TreeMap<>();
    descriptor.dimensions().forEach((key, value) -> sorted.put(snakeCase(key), value));
    sorted.forEach((key, value) -> labels.add(key + "=\"" + escapeLabelValue(value) + "\""));
    return name + labels;
  }

  /**
   * "AWS/ApplicationELB" -> "aws_application_elb", "TargetResponseTime" -> "target_response_time".
   */
  static String snakeCase(String value) {
    String separated = value
      .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
      .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
    return separated
      .replaceAll("[^A-Za-z0-9]+", "_")
      .replaceAll("^_+|_+$", "")
      .toLowerCase(Locale.ROOT);
  }

  static String escapeLabelValue(String value) {
    return value
      .replace("\\", "\\\\")
      .replace("\"", "\\\"")
      .replace("\n", "\\n");
  }
}
