package io.github.themoah.vigil.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the optional text-insight provider.
 *
 * @param enabled whether log analyses with errors are sent for insights
 * @param modelId model identifier passed to the provider
 * @param endpoint provider URL; derived from region and model when not set
 * @param region provider region, used to derive the endpoint
 * @param timeoutMs request timeout in milliseconds
 */
public record InsightConfig(
  boolean enabled,
  String modelId,
  String endpoint,
  String region,
  long timeoutMs
) {

  private static final Logger log = LoggerFactory.getLogger(InsightConfig.class);

  static final String DEFAULT_MODEL_ID = "anthropic.claude-3-sonnet-20240229-v1:0";
  static final String DEFAULT_REGION = "us-east-1";
  static final long DEFAULT_TIMEOUT_MS = 30_000L;

  public static InsightConfig disabled() {
    return new InsightConfig(false, DEFAULT_MODEL_ID, null, DEFAULT_REGION, DEFAULT_TIMEOUT_MS);
  }

  /**
   * Returns the configured endpoint, or the regional model invocation URL when none is set.
   */
  public String resolvedEndpoint() {
    if (endpoint != null && !endpoint.isBlank()) {
      return endpoint;
    }
    return "https://bedrock-runtime." + region + ".amazonaws.com/model/" + modelId + "/invoke";
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>ENABLE_INSIGHTS - Enable the insight provider (default: false)</li>
   *   <li>INSIGHT_MODEL_ID - Model identifier (default: anthropic.claude-3-sonnet-20240229-v1:0)</li>
   *   <li>INSIGHT_ENDPOINT - Provider URL (default: derived from region and model)</li>
   *   <li>INSIGHT_REGION - Provider region (default: us-east-1)</li>
   *   <li>INSIGHT_TIMEOUT_MS - Request timeout (default: 30000)</li>
   * </ul>
   */
  public static InsightConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static InsightConfig fromMap(Map<String, String> environment) {
    Env env = new Env(environment);
    InsightConfig config = new InsightConfig(
      env.getBoolean("ENABLE_INSIGHTS", false),
      env.getString("INSIGHT_MODEL_ID", DEFAULT_MODEL_ID),
      env.getString("INSIGHT_ENDPOINT", null),
      env.getString("INSIGHT_REGION", DEFAULT_REGION),
      env.getLong("INSIGHT_TIMEOUT_MS", DEFAULT_TIMEOUT_MS)
    );
    if (config.enabled()) {
      log.info("Insight provider enabled: model={}, endpoint={}", config.modelId(), config.resolvedEndpoint());
    } else {
      log.info("Insight provider disabled");
    }
    return config;
  }
}
