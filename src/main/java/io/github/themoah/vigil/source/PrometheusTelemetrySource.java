package io.github.themoah.vigil.source;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.MetricSeries;
import io.github.themoah.vigil.model.Sample;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches metric samples from the Prometheus HTTP API ({@code /api/v1/query_range}).
 */
public class PrometheusTelemetrySource implements TelemetrySource {

  private static final Logger log = LoggerFactory.getLogger(PrometheusTelemetrySource.class);

  static final String QUERY_RANGE_API_PATH = "/api/v1/query_range";
  static final String BUILD_INFO_API_PATH = "/api/v1/status/buildinfo";
  static final String SUCCESS = "success";

  private final HttpJsonClient http;
  private final String baseUrl;
  private final long stepSeconds;

  public PrometheusTelemetrySource(HttpJsonClient http, String baseUrl, long stepSeconds) {
    this.http = Objects.requireNonNull(http, "http cannot be null");
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
    this.stepSeconds = stepSeconds;
  }

  @Override
  public Future<MetricSeries> fetchSeries(MetricDescriptor descriptor, Instant start, Instant end) {
    String query = PromQlNames.selector(descriptor);

    // start, end and step are unix seconds and accept a decimal point
    Map<String, String> params = new LinkedHashMap<>();
    params.put("query", query);
    params.put("start", toUnixSeconds(start));
    params.put("end", toUnixSeconds(end));
    params.put("step", String.valueOf(stepSeconds));

    return http.getJson(HttpJsonClient.uri(baseUrl, QUERY_RANGE_API_PATH, params))
      .map(response -> toSeries(descriptor, query, response))
      .onSuccess(series -> log.debug("Fetched {} samples for {}", series.size(), query))
      .onFailure(err -> log.warn("Failed to fetch {}: {}", query, err.getMessage()));
  }

  @Override
  public Future<String> ping() {
    return http.getJson(baseUrl + BUILD_INFO_API_PATH)
      .map(response -> {
        JsonObject data = response.getJsonObject("data");
        return data != null ? data.getString("version", "unknown") : "unknown";
      });
  }

  @Override
  public Future<Void> close() {
    return http.close();
  }

  /**
   * Converts a matrix response into a series. Only the first matching series is used;
   * non-finite values are dropped.
   */
  static MetricSeries toSeries(MetricDescriptor descriptor, String query, JsonObject response) {
    if (!SUCCESS.equals(response.getString("status"))) {
      throw new TelemetryException(String.format(
        "Prometheus API query was not successful, response body = %s", response.encode()));
    }
    JsonObject data = response.getJsonObject("data");
    if (data == null || data.getJsonArray("result") == null) {
      throw new TelemetryException(String.format(
        "Response from Prometheus HTTP API is malformed, response body = %s", response.encode()));
    }

    JsonArray result = data.getJsonArray("result");
    if (result.isEmpty()) {
      return new MetricSeries(descriptor, List.of());
    }
    if (result.size() > 1) {
      log.warn("Query {} matched {} series, scoring the first one only", query, result.size());
    }

    JsonArray values = result.getJsonObject(0).getJsonArray("values", new JsonArray());
    List<Sample> samples = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      JsonArray point = values.getJsonArray(i);
      double seconds = ((Number) point.getValue(0)).doubleValue();
      double value = parseSampleValue(point.getString(1));
      if (!Double.isFinite(value)) {
        continue;
      }
      samples.add(new Sample(Instant.ofEpochMilli(Math.round(seconds * 1000.0)), value));
    }
    return new MetricSeries(descriptor, samples);
  }

  /**
   * Formats an instant as plain decimal unix seconds with millisecond precision.
   */
  static String toUnixSeconds(Instant instant) {
    return BigDecimal.valueOf(instant.toEpochMilli(), 3).toPlainString();
  }

  /**
   * Parses a sample value as encoded by Prometheus ("1.5", "NaN", "+Inf", "-Inf").
   */
  static double parseSampleValue(String raw) {
    switch (raw) {
      case "+Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.parseDouble(raw);
    }
  }
}
