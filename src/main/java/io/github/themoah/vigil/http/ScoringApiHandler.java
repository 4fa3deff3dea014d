package io.github.themoah.vigil.http;

import io.github.themoah.vigil.model.LogGroupReport;
import io.github.themoah.vigil.model.MetricRequest;
import io.github.themoah.vigil.model.MetricScoreReport;
import io.github.themoah.vigil.service.LogAnalysisService;
import io.github.themoah.vigil.service.MetricScoringService;
import io.vertx.core.Future;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP entry points of the two batch pipelines.
 *
 * <p>Both routes answer 200 with one result per requested item, including items that
 * failed or were rejected. Only a body that is not a JSON object or has fields of the
 * wrong type is answered with 400.
 */
public class ScoringApiHandler {

  private static final Logger log = LoggerFactory.getLogger(ScoringApiHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  static final String METRICS_PATH = "/api/v1/metrics/score";
  static final String LOGS_PATH = "/api/v1/logs/analyze";

  private final MetricScoringService metricService;
  private final LogAnalysisService logService;
  private final Clock clock;

  public ScoringApiHandler(MetricScoringService metricService, LogAnalysisService logService, Clock clock) {
    this.metricService = metricService;
    this.logService = logService;
    this.clock = clock;
  }

  public void registerRoutes(Router router) {
    router.post("/api/v1/*").handler(BodyHandler.create());
    router.post(METRICS_PATH).handler(this::handleScoreMetrics);
    router.post(LOGS_PATH).handler(this::handleAnalyzeLogs);
    log.info("Scoring API routes registered: {}, {}", METRICS_PATH, LOGS_PATH);
  }

  private void handleScoreMetrics(RoutingContext ctx) {
    List<MetricRequest> requests;
    try {
      requests = parseMetrics(body(ctx));
    } catch (DecodeException | ClassCastException | IllegalArgumentException e) {
      badRequest(ctx, e);
      return;
    }
    respond(ctx, metricService.scoreRequests(requests), MetricScoreReport::toJson);
  }

  private void handleAnalyzeLogs(RoutingContext ctx) {
    List<String> logGroups;
    Integer hours;
    try {
      JsonObject body = body(ctx);
      logGroups = parseLogGroups(body);
      hours = parseHours(body);
    } catch (DecodeException | ClassCastException | IllegalArgumentException e) {
      badRequest(ctx, e);
      return;
    }
    respond(ctx, logService.analyzeAll(logGroups, hours), LogGroupReport::toJson);
  }

  /**
   * Parses {@code {"metrics": [{namespace, metric_name, dimensions?, statistic?}, ...]}}.
   * A missing or empty list selects the default metrics. Entries that are not objects, or
   * have fields of the wrong type, fail the whole request; other invalid entries are
   * reported per item.
   */
  static List<MetricRequest> parseMetrics(JsonObject body) {
    List<MetricRequest> requests = new ArrayList<>();
    JsonArray metrics = body.getJsonArray("metrics");
    if (metrics == null) {
      return requests;
    }
    for (int i = 0; i < metrics.size(); i++) {
      JsonObject item = metrics.getJsonObject(i);
      if (item == null) {
        throw new IllegalArgumentException("metrics entries must be objects");
      }
      requests.add(MetricRequest.fromJson(item));
    }
    return requests;
  }

  /**
   * Parses {@code "log_groups": ["name", ...]}. A missing or empty list selects the configured groups.
   */
  static List<String> parseLogGroups(JsonObject body) {
    List<String> logGroups = new ArrayList<>();
    JsonArray groups = body.getJsonArray("log_groups");
    if (groups == null) {
      return logGroups;
    }
    for (int i = 0; i < groups.size(); i++) {
      String group = groups.getString(i);
      if (group == null || group.isBlank()) {
        throw new IllegalArgumentException("log_groups entries must be non-empty strings");
      }
      logGroups.add(group);
    }
    return logGroups;
  }

  static Integer parseHours(JsonObject body) {
    Integer hours = body.getInteger("hours");
    if (hours != null && hours < 1) {
      throw new IllegalArgumentException("hours must be >= 1, got " + hours);
    }
    return hours;
  }

  private static JsonObject body(RoutingContext ctx) {
    if (ctx.body() == null || ctx.body().length() == 0) {
      return new JsonObject();
    }
    JsonObject json = ctx.body().asJsonObject();
    return json != null ? json : new JsonObject();
  }

  private <T> void respond(RoutingContext ctx, Future<List<T>> results, Function<T, JsonObject> toJson) {
    results
      .onSuccess(items -> {
        JsonArray array = new JsonArray();
        items.forEach(item -> array.add(toJson.apply(item)));
        JsonObject response = new JsonObject()
          .put("results", array)
          .put("timestamp", clock.instant().toString());
        ctx.response()
          .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
          .setStatusCode(200)
          .end(response.encode());
      })
      .onFailure(err -> {
        log.error("Batch request failed on {}", ctx.request().path(), err);
        ctx.response()
          .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
          .setStatusCode(500)
          .end(new JsonObject().put("error", "Internal Server Error").encode());
      });
  }

  private static void badRequest(RoutingContext ctx, Exception e) {
    log.debug("Rejected request on {}: {}", ctx.request().path(), e.getMessage());
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(400)
      .end(new JsonObject().put("error", "Bad Request").put("message", String.valueOf(e.getMessage())).encode());
  }
}
