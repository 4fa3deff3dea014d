package io.github.themoah.vigil.metrics;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.ScoreResult;
import io.vertx.core.Future;

/**
 * Interface for publishing scores to external monitoring systems as data points.
 */
public interface ScoreReporter {

  /**
   * Records the anomaly score of a metric.
   *
   * @param descriptor the scored metric
   * @param result the score result
   */
  void reportScore(MetricDescriptor descriptor, ScoreResult result);

  /**
   * Records the anomaly score and error count of a log group.
   *
   * @param logGroup the analyzed log group
   * @param analysis the analysis result
   */
  void reportLogAnalysis(String logGroup, LogAnalysis analysis);

  /**
   * Drops data points that were not reported recently. Called once per scheduled scan.
   */
  default void cleanupStale() {
    // Default no-op for reporters without per-series state
  }

  Future<Void> start();

  Future<Void> close();

  /**
   * Reporter that discards everything, used when reporting is disabled.
   */
  static ScoreReporter noop() {
    return new ScoreReporter() {
      @Override
      public void reportScore(MetricDescriptor descriptor, ScoreResult result) {
      }

      @Override
      public void reportLogAnalysis(String logGroup, LogAnalysis analysis) {
      }

      @Override
      public Future<Void> start() {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        return Future.succeededFuture();
      }
    };
  }
}
