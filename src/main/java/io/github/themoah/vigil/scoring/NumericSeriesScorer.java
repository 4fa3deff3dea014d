package io.github.themoah.vigil.scoring;

import io.github.themoah.vigil.model.MetricSeries;
import io.github.themoah.vigil.model.Sample;
import io.github.themoah.vigil.model.ScoreResult;
import io.github.themoah.vigil.model.ScoreStatus;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.model.Trend;
import io.github.themoah.vigil.scoring.StatisticalUtils.Stats;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores the most recent value of a metric series against its own history.
 *
 * <p>The sorted series is split at 80%: the leading part is the baseline population,
 * the trailing part the recent population. Three signals are combined:
 * <ul>
 *   <li>z-score of the current value against the baseline (weight 0.5, saturating at 3σ)</li>
 *   <li>distance of the current value's percentile rank from the median (weight 0.3)</li>
 *   <li>a fixed 0.3 trend signal when the recent population trends (weight 0.2)</li>
 * </ul>
 *
 * <p>The trend term contributes at most 0.06, so scores top out at 0.86. Severity
 * thresholds are calibrated against that range and the score is not renormalized.
 *
 * <p>Scoring is a pure function of the series: no state is kept between calls.
 */
public class NumericSeriesScorer {

  private static final Logger log = LoggerFactory.getLogger(NumericSeriesScorer.class);

  public static final int DEFAULT_MIN_DATA_POINTS = 10;

  static final double BASELINE_FRACTION = 0.8;
  static final double STD_EPSILON = 0.001;
  static final double Z_SCORE_SATURATION = 3.0;
  static final double TREND_SIGNAL = 0.3;

  static final double Z_SCORE_WEIGHT = 0.5;
  static final double PERCENTILE_WEIGHT = 0.3;
  static final double TREND_WEIGHT = 0.2;

  private final int minDataPoints;
  private final TrendEstimator trendEstimator;

  public NumericSeriesScorer() {
    this(DEFAULT_MIN_DATA_POINTS);
  }

  public NumericSeriesScorer(int minDataPoints) {
    this(minDataPoints, new TrendEstimator());
  }

  /**
   * Constructor for testing with injectable trend estimator.
   */
  NumericSeriesScorer(int minDataPoints, TrendEstimator trendEstimator) {
    if (minDataPoints < 2) {
      throw new IllegalArgumentException("minDataPoints must be >= 2, got " + minDataPoints);
    }
    this.minDataPoints = minDataPoints;
    this.trendEstimator = trendEstimator;
  }

  public int minDataPoints() {
    return minDataPoints;
  }

  /**
   * Scores a metric series.
   *
   * @param series the fetched series, in any order
   * @return the score, or an {@link ScoreStatus#INSUFFICIENT_DATA} result when the
   *     series has fewer than {@code minDataPoints} samples
   */
  public ScoreResult score(MetricSeries series) {
    if (series.size() < minDataPoints) {
      log.warn("Insufficient data points for {}: {} (minimum {})",
        series.descriptor().displayName(), series.size(), minDataPoints);
      return ScoreResult.insufficientData(series.size());
    }
    ScoreResult result = score(series.sortedSamples());
    log.debug("Scored {}: score={}, severity={}, zScore={}, percentile={}, trend={}",
      series.descriptor().displayName(), String.format("%.3f", result.score()), result.severity(),
      String.format("%.2f", result.zScore()), String.format("%.1f", result.percentile()),
      result.trend().toJsonValue());
    return result;
  }

  /**
   * Scores samples that are already sorted by timestamp ascending.
   */
  ScoreResult score(List<Sample> sorted) {
    int n = sorted.size();
    if (n < minDataPoints) {
      return ScoreResult.insufficientData(n);
    }

    double[] values = sorted.stream().mapToDouble(Sample::value).toArray();
    double currentValue = values[n - 1];

    int splitIndex = (int) Math.floor(n * BASELINE_FRACTION);
    double[] baseline = Arrays.copyOfRange(values, 0, splitIndex);
    double[] recent = Arrays.copyOfRange(values, splitIndex, n);

    Stats stats = StatisticalUtils.calculateStats(baseline);
    double baselineStd = stats.stdDev() == 0.0 ? STD_EPSILON : stats.stdDev();

    double zScore = StatisticalUtils.absoluteZScore(currentValue, stats.mean(), baselineStd);
    double percentile = StatisticalUtils.percentileOfScore(baseline, currentValue);
    Trend trend = trendEstimator.estimate(recent);

    double score = compositeScore(zScore, percentile, trend);
    Severity severity = SeverityClassifier.forMetricScore(score);

    return new ScoreResult(
      ScoreStatus.SCORED,
      score,
      severity,
      stats.mean(),
      baselineStd,
      zScore,
      percentile,
      trend,
      currentValue,
      n
    );
  }

  static double compositeScore(double zScore, double percentile, Trend trend) {
    double zScoreNormalized = Math.min(zScore / Z_SCORE_SATURATION, 1.0);
    double percentileScore = Math.abs(percentile - 50.0) / 50.0;
    double trendScore = trend.isDirectional() ? TREND_SIGNAL : 0.0;

    return (zScoreNormalized * Z_SCORE_WEIGHT)
      + (percentileScore * PERCENTILE_WEIGHT)
      + (trendScore * TREND_WEIGHT);
  }
}
