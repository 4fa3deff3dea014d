package io.github.themoah.vigil.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param healthCheckIntervalMs telemetry backend health check interval in milliseconds
 */
public record AppConfig(
  int httpPort,
  long healthCheckIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8080;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>HTTP_PORT - HTTP server port (default: 8080)</li>
   *   <li>BACKEND_HEALTH_CHECK_INTERVAL_MS - Backend probe interval (default: 30000)</li>
   * </ul>
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static AppConfig fromMap(Map<String, String> environment) {
    Env env = new Env(environment);
    int port = env.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = env.getLong("BACKEND_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    log.info("AppConfig loaded: httpPort={}, healthCheckIntervalMs={}", port, interval);
    return new AppConfig(port, interval);
  }
}
