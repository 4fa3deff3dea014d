package io.github.themoah.vigil.alert;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.source.HttpJsonClient;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for WebhookAlertPublisher.
 */
@ExtendWith(VertxExtension.class)
public class WebhookAlertPublisherTest {

  private static final Alert ALERT = Alert.forLogGroup("app",
    new LogAnalysis(10, 9, 0.9, Map.of(), 0, 5.0, 63.0, Severity.HIGH, Optional.empty()),
    Instant.parse("2024-01-15T10:30:00Z"));

  @Test
  void publish_postsSubjectAndMessage(Vertx vertx, VertxTestContext testContext) {
    vertx.createHttpServer().requestHandler(req -> req.body().onSuccess(body -> {
      testContext.verify(() -> {
        JsonObject json = body.toJsonObject();
        assertEquals("Vigil Alert: HIGH - app", json.getString("subject"));
        assertEquals("log_analysis", json.getJsonObject("message").getString("alert_type"));
        assertEquals("Bearer t", req.getHeader("Authorization"));
      });
      req.response().setStatusCode(204).end();
    })).listen(0)
      .compose(server -> new WebhookAlertPublisher(new HttpJsonClient(vertx, 5000),
        "http://localhost:" + server.actualPort() + "/hook", Map.of("Authorization", "Bearer t"))
        .publish(ALERT))
      .onComplete(testContext.succeedingThenComplete());
  }

  @Test
  void publish_rejectedByWebhook_fails(Vertx vertx, VertxTestContext testContext) {
    vertx.createHttpServer().requestHandler(req -> req.response().setStatusCode(500).end())
      .listen(0)
      .compose(server -> new WebhookAlertPublisher(new HttpJsonClient(vertx, 5000),
        "http://localhost:" + server.actualPort() + "/hook", Map.of())
        .publish(ALERT))
      .onComplete(testContext.failingThenComplete());
  }
}
