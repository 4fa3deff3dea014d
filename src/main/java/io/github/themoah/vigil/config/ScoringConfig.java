package io.github.themoah.vigil.config;

import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.Statistic;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for metric scoring and log analysis runs.
 *
 * @param windowHours hours of history fetched for each metric (default 24)
 * @param minDataPoints minimum samples required to score a metric (default 10, at least 2)
 * @param anomalyThreshold numeric score at or above which an alert is sent (default 0.7)
 * @param stepSeconds resolution of fetched metric samples (default 300)
 * @param defaultMetrics metrics scored when a request names none
 * @param logGroups log groups analyzed when a request names none
 * @param logLookbackHours hours of logs analyzed when a request gives none (default 1)
 * @param scanIntervalMs period of scheduled scans, 0 disables them (default 0)
 */
public record ScoringConfig(
  int windowHours,
  int minDataPoints,
  double anomalyThreshold,
  long stepSeconds,
  List<MetricDescriptor> defaultMetrics,
  List<String> logGroups,
  int logLookbackHours,
  long scanIntervalMs
) {

  private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

  private static final int DEFAULT_WINDOW_HOURS = 24;
  private static final int DEFAULT_MIN_DATA_POINTS = 10;
  private static final double DEFAULT_ANOMALY_THRESHOLD = 0.7;
  private static final long DEFAULT_STEP_SECONDS = 300;
  private static final int DEFAULT_LOG_LOOKBACK_HOURS = 1;
  private static final long DEFAULT_SCAN_INTERVAL_MS = 0;

  /**
   * Metrics scored when a request does not list any.
   */
  public static final List<MetricDescriptor> DEFAULT_METRICS = List.of(
    MetricDescriptor.of("AWS/Lambda", "Duration", Statistic.AVERAGE),
    MetricDescriptor.of("AWS/Lambda", "Errors", Statistic.SUM),
    MetricDescriptor.of("AWS/ApplicationELB", "TargetResponseTime", Statistic.AVERAGE)
  );

  public ScoringConfig {
    defaultMetrics = List.copyOf(defaultMetrics);
    logGroups = List.copyOf(logGroups);
  }

  public static ScoringConfig defaults() {
    return new ScoringConfig(DEFAULT_WINDOW_HOURS, DEFAULT_MIN_DATA_POINTS, DEFAULT_ANOMALY_THRESHOLD,
      DEFAULT_STEP_SECONDS, DEFAULT_METRICS, List.of(), DEFAULT_LOG_LOOKBACK_HOURS, DEFAULT_SCAN_INTERVAL_MS);
  }

  public boolean isScanEnabled() {
    return scanIntervalMs > 0;
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>SCORING_WINDOW_HOURS - History fetched per metric (default: 24)</li>
   *   <li>SCORING_MIN_DATA_POINTS - Minimum samples to score (default: 10)</li>
   *   <li>ANOMALY_THRESHOLD - Alert threshold for metric scores (default: 0.7)</li>
   *   <li>SCORING_STEP_SECONDS - Sample resolution (default: 300)</li>
   *   <li>LOG_GROUPS - Comma-separated default log groups (default: none)</li>
   *   <li>LOG_LOOKBACK_HOURS - Default log window (default: 1)</li>
   *   <li>SCAN_INTERVAL_MS - Scheduled scan period, 0 disables (default: 0)</li>
   * </ul>
   */
  public static ScoringConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  static ScoringConfig fromMap(Map<String, String> environment) {
    Env env = new Env(environment);

    int windowHours = env.getInt("SCORING_WINDOW_HOURS", DEFAULT_WINDOW_HOURS);
    if (windowHours < 1) {
      log.warn("SCORING_WINDOW_HOURS must be >= 1, using default: {}", DEFAULT_WINDOW_HOURS);
      windowHours = DEFAULT_WINDOW_HOURS;
    }

    int minDataPoints = env.getInt("SCORING_MIN_DATA_POINTS", DEFAULT_MIN_DATA_POINTS);
    if (minDataPoints < 2) {
      log.warn("SCORING_MIN_DATA_POINTS must be >= 2, using default: {}", DEFAULT_MIN_DATA_POINTS);
      minDataPoints = DEFAULT_MIN_DATA_POINTS;
    }

    double threshold = env.getDouble("ANOMALY_THRESHOLD", DEFAULT_ANOMALY_THRESHOLD);

    long stepSeconds = env.getLong("SCORING_STEP_SECONDS", DEFAULT_STEP_SECONDS);
    if (stepSeconds < 1) {
      log.warn("SCORING_STEP_SECONDS must be >= 1, using default: {}", DEFAULT_STEP_SECONDS);
      stepSeconds = DEFAULT_STEP_SECONDS;
    }

    List<String> logGroups = env.getList("LOG_GROUPS");
    int lookbackHours = env.getInt("LOG_LOOKBACK_HOURS", DEFAULT_LOG_LOOKBACK_HOURS);
    if (lookbackHours < 1) {
      log.warn("LOG_LOOKBACK_HOURS must be >= 1, using default: {}", DEFAULT_LOG_LOOKBACK_HOURS);
      lookbackHours = DEFAULT_LOG_LOOKBACK_HOURS;
    }
    long scanIntervalMs = env.getLong("SCAN_INTERVAL_MS", DEFAULT_SCAN_INTERVAL_MS);

    ScoringConfig config = new ScoringConfig(windowHours, minDataPoints, threshold, stepSeconds,
      DEFAULT_METRICS, logGroups, lookbackHours, scanIntervalMs);
    log.info("Scoring config: windowHours={}, minDataPoints={}, threshold={}, stepSeconds={}, "
        + "logGroups={}, lookbackHours={}, scanIntervalMs={}",
      windowHours, minDataPoints, threshold, stepSeconds, logGroups, lookbackHours, scanIntervalMs);
    return config;
  }
}
