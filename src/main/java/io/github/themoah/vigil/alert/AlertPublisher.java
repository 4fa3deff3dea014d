package io.github.themoah.vigil.alert;

import io.vertx.core.Future;

/**
 * Delivers alerts to a notification channel.
 */
public interface AlertPublisher {

  /**
   * Publishes an alert.
   *
   * @param alert the alert to deliver
   * @return Future that completes when the channel accepted the alert
   */
  Future<Void> publish(Alert alert);

  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
