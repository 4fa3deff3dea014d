package io.github.themoah.vigil.scoring;

import io.github.themoah.vigil.model.Trend;

/**
 * Classifies the direction of a short run of values with a least squares slope.
 *
 * <p>The slope is measured per sample and compared to the mean level of the values:
 * a slope larger than 10% of the mean is a trend, anything smaller is stable.
 */
public class TrendEstimator {

  static final int MIN_VALUES = 3;
  static final double RELATIVE_CHANGE_THRESHOLD = 0.1;
  static final double MEAN_OFFSET = 0.001;

  /**
   * Estimates the trend of the given values, in order.
   *
   * @param values the values ordered oldest first
   * @return {@link Trend#STABLE} for fewer than three values or a small relative slope
   */
  public Trend estimate(double[] values) {
    if (values == null || values.length < MIN_VALUES) {
      return Trend.STABLE;
    }

    double slope = StatisticalUtils.slope(values);
    // A negative mean gives a negative ratio, which always classifies as stable.
    double relativeChange = Math.abs(slope) / (StatisticalUtils.mean(values) + MEAN_OFFSET);

    if (relativeChange > RELATIVE_CHANGE_THRESHOLD) {
      return slope > 0 ? Trend.INCREASING : Trend.DECREASING;
    }
    return Trend.STABLE;
  }
}
