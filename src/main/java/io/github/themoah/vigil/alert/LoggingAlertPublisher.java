package io.github.themoah.vigil.alert;

import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alerts to the log. Used when no webhook is configured.
 */
public class LoggingAlertPublisher implements AlertPublisher {

  private static final Logger log = LoggerFactory.getLogger(LoggingAlertPublisher.class);

  @Override
  public Future<Void> publish(Alert alert) {
    log.warn("{}: {}", alert.subject(), alert.message().encode());
    return Future.succeededFuture();
  }
}
