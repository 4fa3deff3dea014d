package io.github.themoah.vigil.source;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.MetricSeries;
import io.vertx.core.Future;
import java.time.Instant;

/**
 * Source of numeric metric samples.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface TelemetrySource {

  /**
   * Fetches the samples of a metric over a time window.
   *
   * @param descriptor the metric to fetch
   * @param start window start, inclusive
   * @param end window end
   * @return Future containing the series, possibly with no samples
   */
  Future<MetricSeries> fetchSeries(MetricDescriptor descriptor, Instant start, Instant end);

  /**
   * Lightweight reachability probe of the backend.
   *
   * @return Future containing a backend identifier, e.g. its version
   */
  Future<String> ping();

  /**
   * Releases underlying connections.
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
