package io.github.themoah.vigil.scoring;

/**
 * Utility methods for the statistical calculations used in anomaly scoring.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates mean and population standard deviation (divide by n, not n-1).
   * The baseline window is treated as the whole reference population, not a sample.
   *
   * @param values the values to analyze
   * @return statistics containing mean and standard deviation, zeros for an empty array
   */
  public static Stats calculateStats(double[] values) {
    if (values == null || values.length == 0) {
      return new Stats(0.0, 0.0);
    }

    double mean = mean(values);

    double sumSquaredDiffs = 0.0;
    for (double value : values) {
      double diff = value - mean;
      sumSquaredDiffs += diff * diff;
    }
    double variance = sumSquaredDiffs / values.length;

    return new Stats(mean, Math.sqrt(variance));
  }

  /**
   * Arithmetic mean, 0 for an empty array.
   */
  public static double mean(double[] values) {
    if (values == null || values.length == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  /**
   * Absolute z-score: how many standard deviations a value lies from the mean,
   * regardless of direction. The caller guarantees a non-zero stdDev.
   *
   * @param value the value
   * @param mean the mean
   * @param stdDev the standard deviation, must be positive
   * @return |value - mean| / stdDev
   */
  public static double absoluteZScore(double value, double mean, double stdDev) {
    return Math.abs(value - mean) / stdDev;
  }

  /**
   * Percentile rank of a score within a population, 0 to 100.
   *
   * <p>Ties are averaged: the result is the mean of the strict rank (values below)
   * and the weak rank (values below or equal), i.e.
   * {@code (below + belowOrEqual) * 50 / n}. A value equal to every member of the
   * population therefore ranks at 50.
   *
   * @param population the reference values
   * @param score the value to rank
   * @return percentile rank, or 0 for an empty population
   */
  public static double percentileOfScore(double[] population, double score) {
    if (population == null || population.length == 0) {
      return 0.0;
    }
    int below = 0;
    int belowOrEqual = 0;
    for (double value : population) {
      if (value < score) {
        below++;
      }
      if (value <= score) {
        belowOrEqual++;
      }
    }
    return (below + belowOrEqual) * 50.0 / population.length;
  }

  /**
   * Slope of the ordinary least squares line through (i, values[i]) for i = 0..n-1.
   *
   * <pre>
   *   m = Σ((xᵢ - mean_x) × (yᵢ - mean_y)) / Σ((xᵢ - mean_x)²)
   * </pre>
   *
   * @param values the y values, at least two
   * @return the fitted slope per index step, 0 when fewer than two values
   */
  public static double slope(double[] values) {
    int n = values.length;
    if (n < 2) {
      return 0.0;
    }

    double meanX = (n - 1) / 2.0;
    double meanY = mean(values);

    double numerator = 0.0;
    double denominator = 0.0;
    for (int i = 0; i < n; i++) {
      double dx = i - meanX;
      numerator += dx * (values[i] - meanY);
      denominator += dx * dx;
    }
    return numerator / denominator;
  }

  /**
   * Statistics result record containing mean and standard deviation.
   *
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}
