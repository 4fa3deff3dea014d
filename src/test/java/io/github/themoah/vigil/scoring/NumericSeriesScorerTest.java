package io.github.themoah.vigil.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.MetricSeries;
import io.github.themoah.vigil.model.Sample;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.model.ScoreStatus;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.model.Statistic;
import io.github.themoah.vigil.model.Trend;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for NumericSeriesScorer.
 */
public class NumericSeriesScorerTest {

  private static final MetricDescriptor DESCRIPTOR =
    MetricDescriptor.of("AWS/Lambda", "Duration", Statistic.AVERAGE);
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final NumericSeriesScorer scorer = new NumericSeriesScorer();

  @Test
  void oneBelowMinimum_insufficientData() {
    ScoreResult result = scorer.score(series(9, i -> 10.0));

    assertEquals(ScoreStatus.INSUFFICIENT_DATA, result.status());
    assertEquals(9, result.sampleCount());
    assertEquals(0.0, result.score());
    assertFalse(result.isScored());
  }

  @Test
  void exactlyMinimum_scored() {
    ScoreResult result = scorer.score(series(10, i -> 10.0));

    assertEquals(ScoreStatus.SCORED, result.status());
    assertEquals(10, result.sampleCount());
  }

  @Test
  void flatSeries_scoresZero() {
    // Baseline is eight 10s, current value is 10
    ScoreResult result = scorer.score(series(10, i -> 10.0));

    assertEquals(10.0, result.baselineMean(), 1e-9);
    assertEquals(NumericSeriesScorer.STD_EPSILON, result.baselineStd(), 1e-12);
    assertEquals(0.0, result.zScore(), 1e-9);
    assertEquals(50.0, result.percentile(), 1e-9);
    assertEquals(Trend.STABLE, result.trend());
    assertEquals(0.0, result.score(), 1e-9);
    assertEquals(Severity.LOW, result.severity());
  }

  @Test
  void spikeAfterNoisyBaseline_critical() {
    ScoreResult result = scorer.score(series(10, i -> i == 9 ? 100.0 : (i % 2 == 0 ? 10.0 : 12.0)));

    assertEquals(11.0, result.baselineMean(), 1e-9);
    assertEquals(1.0, result.baselineStd(), 1e-9);
    assertEquals(89.0, result.zScore(), 1e-9);
    assertEquals(100.0, result.percentile(), 1e-9);
    // Only two recent values, so no trend
    assertEquals(Trend.STABLE, result.trend());
    assertEquals(0.8, result.score(), 1e-9);
    assertEquals(Severity.CRITICAL, result.severity());
    assertEquals(100.0, result.currentValue());
  }

  @Test
  void saturatedSignals_cappedAt086() {
    // 16 baseline values around 10, recent population rising steeply
    double[] recent = {50, 70, 90, 110};
    ScoreResult result = scorer.score(series(20, i -> i < 16 ? 10.0 + (i % 2) : recent[i - 16]));

    assertEquals(Trend.INCREASING, result.trend());
    assertEquals(0.86, result.score(), 1e-9);
  }

  @Test
  void unsortedSamples_sortedBeforeScoring() {
    List<Sample> samples = new ArrayList<>(series(10, i -> i == 9 ? 100.0 : 10.0).samples());
    Collections.reverse(samples);

    ScoreResult result = scorer.score(new MetricSeries(DESCRIPTOR, samples));

    assertEquals(100.0, result.currentValue());
    assertEquals(10.0, result.baselineMean(), 1e-9);
  }

  @Test
  void scoring_isIdempotent() {
    MetricSeries input = series(30, i -> Math.sin(i) * 5 + 20);

    assertEquals(scorer.score(input), scorer.score(input));
  }

  @Test
  void randomSeries_stayWithinBounds() {
    Random random = new Random(42);
    for (int run = 0; run < 200; run++) {
      int n = 10 + random.nextInt(50);
      double scale = Math.pow(10, random.nextInt(6) - 2);
      double[] values = new double[n];
      for (int i = 0; i < n; i++) {
        values[i] = (random.nextGaussian() * 3 + (random.nextBoolean() ? 10 : -10)) * scale;
      }
      ScoreResult result = scorer.score(series(n, i -> values[i]));

      assertTrue(Double.isFinite(result.zScore()));
      assertTrue(result.zScore() >= 0.0);
      assertTrue(result.score() >= 0.0 && result.score() <= 0.86 + 1e-9, "score out of range: " + result.score());
      assertTrue(result.percentile() >= 0.0 && result.percentile() <= 100.0);
    }
  }

  @Test
  void customMinimum_respected() {
    NumericSeriesScorer small = new NumericSeriesScorer(3);

    assertEquals(ScoreStatus.INSUFFICIENT_DATA, small.score(series(2, i -> 1.0)).status());
    assertEquals(ScoreStatus.SCORED, small.score(series(3, i -> 1.0)).status());
  }

  @Test
  void minimumBelowTwo_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new NumericSeriesScorer(1));
  }

  @Test
  void compositeScore_weights() {
    assertEquals(0.5, NumericSeriesScorer.compositeScore(3.0, 50.0, Trend.STABLE), 1e-9);
    assertEquals(0.3, NumericSeriesScorer.compositeScore(0.0, 0.0, Trend.STABLE), 1e-9);
    assertEquals(0.06, NumericSeriesScorer.compositeScore(0.0, 50.0, Trend.DECREASING), 1e-9);
    assertEquals(0.25, NumericSeriesScorer.compositeScore(1.5, 50.0, Trend.STABLE), 1e-9);
  }

  private static MetricSeries series(int n, java.util.function.IntToDoubleFunction valueAt) {
    List<Sample> samples = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      samples.add(new Sample(T0.plusSeconds(300L * i), valueAt.applyAsDouble(i)));
    }
    return new MetricSeries(DESCRIPTOR, samples);
  }
}
