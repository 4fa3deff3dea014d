package io.github.themoah.vigil.metrics;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for publishing scores through Micrometer.
 *
 * @param reporterType registry type: prometheus, datadog, otlp or none
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 * @param cleanupIntervalMs period of stale gauge cleanup; a gauge not reported for two
 *     periods is removed
 */
public record ReportingConfig(
  String reporterType,
  boolean jvmMetricsEnabled,
  long cleanupIntervalMs
) {

  private static final Logger log = LoggerFactory.getLogger(ReportingConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";
  private static final String DISABLED = "none";
  private static final long DEFAULT_CLEANUP_INTERVAL_MS = 300_000L;

  public boolean isEnabled() {
    return reporterType != null && !DISABLED.equalsIgnoreCase(reporterType);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - prometheus, datadog, otlp or none (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   *   <li>METRICS_CLEANUP_INTERVAL_MS - Stale gauge cleanup period (default: 300000)</li>
   * </ul>
   */
  public static ReportingConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static ReportingConfig fromMap(Map<String, String> env) {
    String type = env.getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    if (type.isBlank()) {
      type = DEFAULT_REPORTER;
    }
    boolean jvm = Boolean.parseBoolean(env.getOrDefault("METRICS_JVM_ENABLED", "false"));
    long cleanupIntervalMs = parseCleanupInterval(env.get("METRICS_CLEANUP_INTERVAL_MS"));

    ReportingConfig config = new ReportingConfig(type.trim().toLowerCase(), jvm, cleanupIntervalMs);
    log.info("Reporting config: reporter={}, jvmMetrics={}, cleanupIntervalMs={}",
      config.reporterType(), jvm, cleanupIntervalMs);
    return config;
  }

  private static long parseCleanupInterval(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_CLEANUP_INTERVAL_MS;
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid METRICS_CLEANUP_INTERVAL_MS '{}', using default: {}", raw, DEFAULT_CLEANUP_INTERVAL_MS);
      return DEFAULT_CLEANUP_INTERVAL_MS;
    }
    if (value < 1) {
      log.warn("METRICS_CLEANUP_INTERVAL_MS must be >= 1, using default: {}", DEFAULT_CLEANUP_INTERVAL_MS);
      return DEFAULT_CLEANUP_INTERVAL_MS;
    }
    return value;
  }
}
