package io.github.themoah.vigil.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-log-group outcome of a log analysis batch: an analysis or an error.
 */
public record LogGroupReport(
  String logGroup,
  Instant start,
  Instant end,
  Optional<LogAnalysis> analysis,
  Optional<String> error
) {

  public static LogGroupReport analyzed(String logGroup, Instant start, Instant end, LogAnalysis analysis) {
    return new LogGroupReport(logGroup, start, end, Optional.of(analysis), Optional.empty());
  }

  public static LogGroupReport failed(String logGroup, Instant start, Instant end, String error) {
    return new LogGroupReport(logGroup, start, end, Optional.empty(), Optional.of(error));
  }

  public boolean isError() {
    return error.isPresent();
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("log_group", logGroup);
    if (error.isPresent()) {
      return json.put("error", error.get());
    }
    LogAnalysis value = analysis.orElseGet(LogAnalysis::noEvents);
    json.mergeIn(value.toJson());
    if (value.hasEvents()) {
      json.put("time_range", new JsonObject()
        .put("start", start.toString())
        .put("end", end.toString()));
    }
    return json;
  }
}
