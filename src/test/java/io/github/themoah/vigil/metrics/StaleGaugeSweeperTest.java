package io.github.themoah.vigil.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.model.Statistic;
import io.github.themoah.vigil.service.FakeCollaborators.RecordingReporter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for StaleGaugeSweeper.
 */
@ExtendWith(VertxExtension.class)
public class StaleGaugeSweeperTest {

  @Test
  void start_cleansUpPeriodically(Vertx vertx, VertxTestContext testContext) {
    RecordingReporter reporter = new RecordingReporter();
    StaleGaugeSweeper sweeper = new StaleGaugeSweeper(vertx, reporter, 10);

    sweeper.start();
    vertx.setTimer(200, id -> sweeper.stop().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
      assertTrue(reporter.cleanups >= 2, "cleanups: " + reporter.cleanups);
      testContext.completeNow();
    }))));
  }

  @Test
  void requestGauges_removedWithoutScans(Vertx vertx, VertxTestContext testContext) {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerReporter reporter = new MicrometerReporter(registry);
    for (int i = 0; i < 50; i++) {
      MetricDescriptor descriptor = new MetricDescriptor("Custom/App", "metric_" + i,
        Map.of("host", "h" + i), Statistic.AVERAGE);
      reporter.reportScore(descriptor, ScoreResult.insufficientData(0));
    }
    assertEquals(50, reporter.gaugeCount());

    StaleGaugeSweeper sweeper = new StaleGaugeSweeper(vertx, reporter, 10);
    sweeper.start();
    vertx.setTimer(200, id -> sweeper.stop().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
      assertEquals(0, reporter.gaugeCount());
      assertNull(registry.find("vigil.anomaly.score").gauge());
      testContext.completeNow();
    }))));
  }

  @Test
  void sweep_reporterFailure_doesNotPropagate(Vertx vertx) {
    RecordingReporter reporter = new RecordingReporter() {
      @Override
      public void cleanupStale() {
        throw new IllegalStateException("registry closed");
      }
    };

    new StaleGaugeSweeper(vertx, reporter, 1000).sweep();
  }
}
