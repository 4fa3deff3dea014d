package io.github.themoah.vigil.service;

import io.github.themoah.vigil.alert.Alert;
import io.github.themoah.vigil.alert.AlertPublisher;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers shared by the batch services.
 */
final class BatchSupport {

  private static final Logger log = LoggerFactory.getLogger(BatchSupport.class);

  private BatchSupport() {}

  /**
   * Publishes an alert. Publish failures are logged and never fail the returned future.
   */
  static Future<Void> publishQuietly(AlertPublisher publisher, Alert alert) {
    Future<Void> published;
    try {
      published = publisher.publish(alert);
    } catch (RuntimeException e) {
      published = Future.failedFuture(e);
    }
    return published.recover(err -> {
      log.error("Failed to publish alert '{}'", alert.subject(), err);
      return Future.succeededFuture();
    });
  }

  static String errorMessage(Throwable err) {
    return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
  }
}
