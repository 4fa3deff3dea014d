package io.github.themoah.vigil.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Endpoints of the telemetry backends and the alert webhook.
 */
public class BackendConfig {

  private static final Logger log = LoggerFactory.getLogger(BackendConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_PROMETHEUS_URL = "vigil.prometheus.url";
  private static final String PROP_LOKI_URL = "vigil.loki.url";
  private static final String PROP_WEBHOOK_URL = "vigil.alert.webhook.url";
  private static final String PROP_REQUEST_TIMEOUT_MS = "vigil.request.timeout.ms";
  private static final String PROP_WEBHOOK_HEADER_PREFIX = "vigil.alert.webhook.header.";

  private static final String DEFAULT_PROMETHEUS_URL = "http://localhost:9090";
  private static final String DEFAULT_LOKI_URL = "http://localhost:3100";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;

  private final String prometheusUrl;
  private final String lokiUrl;
  private final String webhookUrl;
  private final int requestTimeoutMs;
  private final Map<String, String> webhookHeaders;

  private BackendConfig(Builder builder) {
    this.prometheusUrl = stripTrailingSlash(builder.prometheusUrl);
    this.lokiUrl = stripTrailingSlash(builder.lokiUrl);
    this.webhookUrl = builder.webhookUrl;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.webhookHeaders = Map.copyOf(builder.webhookHeaders);
  }

  public String getPrometheusUrl() {
    return prometheusUrl;
  }

  public String getLokiUrl() {
    return lokiUrl;
  }

  /**
   * Returns the alert webhook URL, or null when alerts are only logged.
   */
  public String getWebhookUrl() {
    return webhookUrl;
  }

  public boolean hasWebhook() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }

  public int getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public Map<String, String> getWebhookHeaders() {
    return webhookHeaders;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>PROMETHEUS_URL - Prometheus base URL (default: http://localhost:9090)</li>
   *   <li>LOKI_URL - Loki base URL (default: http://localhost:3100)</li>
   *   <li>ALERT_WEBHOOK_URL - Alert webhook URL (default: none, alerts are logged)</li>
   *   <li>BACKEND_REQUEST_TIMEOUT_MS - Request timeout (default: 30000)</li>
   * </ul>
   */
  public static BackendConfig fromEnvironment() {
    Env env = Env.system();
    return builder()
      .prometheusUrl(env.getString("PROMETHEUS_URL", DEFAULT_PROMETHEUS_URL))
      .lokiUrl(env.getString("LOKI_URL", DEFAULT_LOKI_URL))
      .webhookUrl(env.getString("ALERT_WEBHOOK_URL", null))
      .requestTimeoutMs(env.getInt("BACKEND_REQUEST_TIMEOUT_MS", DEFAULT_REQUEST_TIMEOUT_MS))
      .build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return BackendConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static BackendConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return BackendConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static BackendConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading backend configuration from classpath: {}", resourceName);
    try (InputStream is = BackendConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file at the given path.
   *
   * @param path the path to the properties file
   * @return BackendConfig loaded from the file
   * @throws IOException if the file cannot be read
   */
  public static BackendConfig fromFile(Path path) throws IOException {
    log.info("Loading backend configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object. Missing keys keep their defaults.
   *
   * @param props the properties containing vigil.* configuration
   * @return BackendConfig built from the properties
   */
  public static BackendConfig fromProperties(Properties props) {
    Builder builder = builder();

    String prometheusUrl = props.getProperty(PROP_PROMETHEUS_URL);
    if (prometheusUrl != null && !prometheusUrl.isBlank()) {
      builder.prometheusUrl(prometheusUrl.trim());
    }

    String lokiUrl = props.getProperty(PROP_LOKI_URL);
    if (lokiUrl != null && !lokiUrl.isBlank()) {
      builder.lokiUrl(lokiUrl.trim());
    }

    String webhookUrl = props.getProperty(PROP_WEBHOOK_URL);
    if (webhookUrl != null && !webhookUrl.isBlank()) {
      builder.webhookUrl(webhookUrl.trim());
    }

    String requestTimeout = props.getProperty(PROP_REQUEST_TIMEOUT_MS);
    if (requestTimeout != null && !requestTimeout.isBlank()) {
      builder.requestTimeoutMs(Integer.parseInt(requestTimeout.trim()));
    }

    // vigil.alert.webhook.header.Authorization -> Authorization
    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(PROP_WEBHOOK_HEADER_PREFIX)) {
        builder.webhookHeader(name.substring(PROP_WEBHOOK_HEADER_PREFIX.length()), props.getProperty(name));
      }
    }

    log.info("Backend configuration loaded: prometheus={}, loki={}, webhook={}",
      builder.prometheusUrl, builder.lokiUrl, builder.webhookUrl != null ? "configured" : "none");
    return builder.build();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public static class Builder {

    private String prometheusUrl = DEFAULT_PROMETHEUS_URL;
    private String lokiUrl = DEFAULT_LOKI_URL;
    private String webhookUrl;
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private final Map<String, String> webhookHeaders = new HashMap<>();

    public Builder prometheusUrl(String prometheusUrl) {
      this.prometheusUrl = Objects.requireNonNull(prometheusUrl, "prometheusUrl cannot be null");
      return this;
    }

    public Builder lokiUrl(String lokiUrl) {
      this.lokiUrl = Objects.requireNonNull(lokiUrl, "lokiUrl cannot be null");
      return this;
    }

    public Builder webhookUrl(String webhookUrl) {
      this.webhookUrl = webhookUrl;
      return this;
    }

    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder webhookHeader(String name, String value) {
      this.webhookHeaders.put(name, value);
      return this;
    }

    public BackendConfig build() {
      return new BackendConfig(this);
    }
  }
}
