package io.github.themoah.vigil.source;

import io.github.themoah.vigil.model.LogBatch;
import io.vertx.core.Future;
import java.time.Instant;

/**
 * Source of raw log lines.
 */
public interface LogSource {

  /**
   * Fetches the lines of a log group over a time window.
   *
   * @param logGroup the log group name
   * @param start window start, inclusive
   * @param end window end, exclusive
   * @return Future containing the batch, possibly empty
   */
  Future<LogBatch> fetchLogs(String logGroup, Instant start, Instant end);

  /**
   * Releases underlying connections.
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
