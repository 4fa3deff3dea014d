package io.github.themoah.vigil.alert;

import io.github.themoah.vigil.source.HttpJsonClient;
import io.vertx.core.Future;
import io.vertx.core.http.HttpMethod;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes alerts as JSON POSTs ({@code {"subject": ..., "message": {...}}}) to a webhook.
 */
public class WebhookAlertPublisher implements AlertPublisher {

  private static final Logger log = LoggerFactory.getLogger(WebhookAlertPublisher.class);

  private final HttpJsonClient http;
  private final String url;
  private final Map<String, String> headers;

  public WebhookAlertPublisher(HttpJsonClient http, String url, Map<String, String> headers) {
    this.http = Objects.requireNonNull(http, "http cannot be null");
    this.url = Objects.requireNonNull(url, "url cannot be null");
    this.headers = Map.copyOf(headers);
  }

  @Override
  public Future<Void> publish(Alert alert) {
    return http.send(HttpMethod.POST, url, alert.toJson().toBuffer(), headers)
      .onSuccess(body -> log.info("Alert published: {}", alert.subject()))
      .mapEmpty();
  }

  @Override
  public Future<Void> close() {
    return http.close();
  }
}
