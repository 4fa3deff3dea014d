package io.github.themoah.vigil.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Micrometer registry that score gauges are published to.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String DEFAULT_SERVICE_NAME = "vigil";
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a meter registry for the reporter type.
   *
   * @param reporterType prometheus, datadog or otlp
   * @return the registry, or null when the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }
    return createRegistry(reporterType, System.getenv());
  }

  static MeterRegistry createRegistry(String reporterType, Map<String, String> env) {
    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "datadog" -> createDatadogRegistry(env);
      case "otlp" -> createOtlpRegistry(env);
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Datadog registry driven by DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  static MeterRegistry createDatadogRegistry(Map<String, String> env) {
    log.info("Creating Datadog meter registry");
    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return env.get("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return env.get("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + env.getOrDefault("DD_SITE", "datadoghq.com");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };
    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * OTLP registry over HTTP with cumulative temporality.
   * Reads OTLP_* variables first and the standard OTEL_EXPORTER_OTLP_* ones as fallback.
   */
  static MeterRegistry createOtlpRegistry(Map<String, String> env) {
    log.info("Creating OTLP meter registry");
    String url = otlpUrl(env);
    Duration step = otlpStep(env);
    Map<String, String> headers = parseKeyValues(
      firstNonBlank(env, "OTLP_HEADERS", "OTEL_EXPORTER_OTLP_METRICS_HEADERS", "OTEL_EXPORTER_OTLP_HEADERS"));
    Map<String, String> attributes = resourceAttributes(env);

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> headers() {
        return headers;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    log.info("OTLP registry created - endpoint: {}, step: {}, service: {}",
      url, step, attributes.get("service.name"));
    return new OtlpMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * Binds JVM memory, GC, thread and CPU metrics to the registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static String otlpUrl(Map<String, String> env) {
    String url = firstNonBlank(env, "OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
    if (url != null) {
      return url;
    }
    String base = firstNonBlank(env, "OTEL_EXPORTER_OTLP_ENDPOINT");
    if (base == null) {
      return DEFAULT_OTLP_URL;
    }
    return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
  }

  static Duration otlpStep(Map<String, String> env) {
    String name = env.containsKey("OTLP_STEP_MS") ? "OTLP_STEP_MS" : "OTEL_METRIC_EXPORT_INTERVAL";
    String value = firstNonBlank(env, name);
    if (value == null) {
      return DEFAULT_STEP;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value));
    } catch (NumberFormatException e) {
      log.warn("Invalid {}: {}, using default 60s", name, value);
      return DEFAULT_STEP;
    }
  }

  /**
   * OTEL_SERVICE_NAME, then OTEL_RESOURCE_ATTRIBUTES, then OTLP_RESOURCE_ATTRIBUTES overrides.
   * service.name defaults to "vigil".
   */
  static Map<String, String> resourceAttributes(Map<String, String> env) {
    Map<String, String> attributes = new HashMap<>();
    String serviceName = firstNonBlank(env, "OTEL_SERVICE_NAME");
    if (serviceName != null) {
      attributes.put("service.name", serviceName);
    }
    attributes.putAll(parseKeyValues(env.get("OTEL_RESOURCE_ATTRIBUTES")));
    attributes.putAll(parseKeyValues(env.get("OTLP_RESOURCE_ATTRIBUTES")));
    attributes.putIfAbsent("service.name", DEFAULT_SERVICE_NAME);
    return attributes;
  }

  /**
   * Parses "key1=value1,key2=value2". Entries without '=' are skipped with a warning.
   */
  static Map<String, String> parseKeyValues(String raw) {
    Map<String, String> result = new HashMap<>();
    if (raw == null || raw.isBlank()) {
      return result;
    }
    for (String entry : raw.split(",")) {
      String[] parts = entry.trim().split("=", 2);
      if (parts.length == 2) {
        result.put(parts[0].trim(), parts[1].trim());
      } else {
        log.warn("Invalid entry format (expected key=value): {}", entry);
      }
    }
    return result;
  }

  private static String firstNonBlank(Map<String, String> env, String... names) {
    for (String name : names) {
      String value = env.get(name);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
