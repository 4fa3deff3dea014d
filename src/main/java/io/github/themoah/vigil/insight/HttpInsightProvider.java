package io.github.themoah.vigil.insight;

import io.github.themoah.vigil.model.InsightResult;
import io.github.themoah.vigil.source.HttpJsonClient;
import io.github.themoah.vigil.source.TelemetryException;
import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Insight provider that invokes a messages-style model endpoint over HTTP.
 *
 * <p>The prompt carries at most the first {@value #PROMPT_LINE_LIMIT} lines and asks for
 * a JSON answer with {@code root_cause}, {@code recommendations} and {@code impact}.
 * A JSON answer is returned as is; any other text is wrapped as {@code {"insights": text}}.
 * The model identifier travels in the {@code x-model-id} header; endpoints that embed
 * the model in their path ignore it.
 */
public class HttpInsightProvider implements InsightProvider {

  private static final Logger log = LoggerFactory.getLogger(HttpInsightProvider.class);

  static final int PROMPT_LINE_LIMIT = 20;
  static final int MAX_TOKENS = 1000;
  static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

  private final HttpJsonClient http;
  private final String endpoint;

  public HttpInsightProvider(HttpJsonClient http, String endpoint) {
    this.http = Objects.requireNonNull(http, "http cannot be null");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
  }

  @Override
  public Future<InsightResult> insights(List<String> lines, String modelId) {
    JsonObject request = buildRequest(lines);
    log.debug("Requesting insights for {} lines from model {}", Math.min(lines.size(), PROMPT_LINE_LIMIT), modelId);

    return http.postJson(endpoint, request, Map.of("x-model-id", modelId))
      .map(HttpInsightProvider::toResult)
      .onFailure(err -> log.error("Error getting insights: {}", err.getMessage()));
  }

  @Override
  public Future<Void> close() {
    return http.close();
  }

  static JsonObject buildRequest(List<String> lines) {
    String sampleLogs = String.join("\n", lines.subList(0, Math.min(lines.size(), PROMPT_LINE_LIMIT)));
    String prompt = "Analyze these logs and provide insights:\n\n"
      + sampleLogs + "\n\n"
      + "Provide:\n"
      + "1. Root cause analysis\n"
      + "2. Recommended actions\n"
      + "3. Potential impact assessment\n\n"
      + "Format as JSON with keys: root_cause, recommendations, impact.";

    return new JsonObject()
      .put("anthropic_version", ANTHROPIC_VERSION)
      .put("max_tokens", MAX_TOKENS)
      .put("messages", new JsonArray().add(new JsonObject()
        .put("role", "user")
        .put("content", prompt)));
  }

  /**
   * Extracts {@code content[0].text} and parses it as JSON when possible.
   */
  static InsightResult toResult(JsonObject response) {
    JsonArray content = response.getJsonArray("content");
    if (content == null || content.isEmpty() || content.getJsonObject(0) == null) {
      throw new TelemetryException("Insight response has no content: " + response.encode());
    }
    String text = content.getJsonObject(0).getString("text", "");

    try {
      return InsightResult.of(new JsonObject(text));
    } catch (DecodeException | ClassCastException e) {
      return InsightResult.of(new JsonObject().put("insights", text));
    }
  }
}
