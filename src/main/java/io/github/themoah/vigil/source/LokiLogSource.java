package io.github.themoah.vigil.source;

import io.github.themoah.vigil.model.LogBatch;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches log lines from the Loki HTTP API ({@code /loki/api/v1/query_range}).
 * A log group is the value of the {@code log_group} stream label.
 */
public class LokiLogSource implements LogSource {

  private static final Logger log = LoggerFactory.getLogger(LokiLogSource.class);

  static final String QUERY_RANGE_API_PATH = "/loki/api/v1/query_range";
  static final String LOG_GROUP_LABEL = "log_group";
  static final int LINE_LIMIT = 10_000;

  private final HttpJsonClient http;
  private final String baseUrl;

  public LokiLogSource(HttpJsonClient http, String baseUrl) {
    this.http = Objects.requireNonNull(http, "http cannot be null");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
  }

  @Override
  public Future<LogBatch> fetchLogs(String logGroup, Instant start, Instant end) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("query", "{" + LOG_GROUP_LABEL + "=\"" + PromQlNames.escapeLabelValue(logGroup) + "\"}");
    params.put("start", String.valueOf(toEpochNanos(start)));
    params.put("end", String.valueOf(toEpochNanos(end)));
    params.put("limit", String.valueOf(LINE_LIMIT));
    params.put("direction", "forward");

    return http.getJson(HttpJsonClient.uri(baseUrl, QUERY_RANGE_API_PATH, params))
      .map(response -> new LogBatch(logGroup, start, end, toLines(response)))
      .onSuccess(batch -> log.debug("Fetched {} log lines from {}", batch.size(), logGroup))
      .onFailure(err -> log.warn("Failed to fetch logs for {}: {}", logGroup, err.getMessage()));
  }

  @Override
  public Future<Void> close() {
    return http.close();
  }

  /**
   * Flattens all streams of a streams response into lines ordered by timestamp.
   */
  static List<String> toLines(JsonObject response) {
    if (!"success".equals(response.getString("status"))) {
      throw new TelemetryException(String.format(
        "Loki query was not successful, response body = %s", response.encode()));
    }
    JsonObject data = response.getJsonObject("data");
    if (data == null || data.getJsonArray("result") == null) {
      throw new TelemetryException(String.format(
        "Response from Loki HTTP API is malformed, response body = %s", response.encode()));
    }

    List<LogEntry> entries = new ArrayList<>();
    JsonArray streams = data.getJsonArray("result");
    for (int i = 0; i < streams.size(); i++) {
      JsonArray values = streams.getJsonObject(i).getJsonArray("values", new JsonArray());
      for (int j = 0; j < values.size(); j++) {
        JsonArray value = values.getJsonArray(j);
        String line = value.getString(1);
        if (line != null) {
          entries.add(new LogEntry(Long.parseLong(value.getString(0)), line));
        }
      }
    }

    entries.sort(Comparator.comparingLong(LogEntry::timestampNanos));
    List<String> lines = new ArrayList<>(entries.size());
    for (LogEntry entry : entries) {
      lines.add(entry.line());
    }
    return lines;
  }

  static long toEpochNanos(Instant instant) {
    return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
  }

  private record LogEntry(long timestampNanos, String line) {}
}
