package io.github.themoah.vigil.logs;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.LogBatch;
import io.github.themoah.vigil.model.Severity;
import io.github.themoah.vigil.scoring.SeverityClassifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives error-rate and pattern-diversity features from a batch of log lines.
 *
 * <p>Each line is tested against the error indicators in order. The first indicator
 * found anywhere in the line (case-insensitive) claims it: the line counts once toward
 * the error count and once in that indicator's histogram bucket.
 *
 * <p>Score: {@code min((errorRate * 0.7 + min(uniquePatterns / 10, 1) * 0.3) * 100, 100)}.
 */
public class LogBatchAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(LogBatchAnalyzer.class);

  static final List<String> ERROR_INDICATORS = List.of(
    "ERROR",
    "FATAL",
    "EXCEPTION",
    "CRITICAL",
    "FAILED",
    "TIMEOUT",
    "OUT OF MEMORY",
    "CONNECTION REFUSED",
    "503",
    "500",
    "502",
    "504"
  );

  static final double ERROR_RATE_WEIGHT = 0.7;
  static final double PATTERN_DIVERSITY_WEIGHT = 0.3;
  static final int PATTERN_DIVERSITY_SATURATION = 10;

  private final PatternExtractor patternExtractor;
  private final Map<String, Pattern> indicators;

  public LogBatchAnalyzer() {
    this(new PatternExtractor());
  }

  public LogBatchAnalyzer(PatternExtractor patternExtractor) {
    this.patternExtractor = patternExtractor;
    this.indicators = new LinkedHashMap<>();
    for (String indicator : ERROR_INDICATORS) {
      indicators.put(indicator, Pattern.compile(Pattern.quote(indicator), Pattern.CASE_INSENSITIVE));
    }
  }

  /**
   * Analyzes a log batch.
   *
   * @param batch the batch to analyze
   * @return the analysis, or {@link LogAnalysis#noEvents()} for an empty batch
   */
  public LogAnalysis analyze(LogBatch batch) {
    if (batch.isEmpty()) {
      log.info("No log events found in {}", batch.logGroup());
      return LogAnalysis.noEvents();
    }

    LogAnalysis analysis = analyze(batch.lines());
    log.debug("Analyzed {}: events={}, errors={}, uniquePatterns={}, score={}, severity={}",
      batch.logGroup(), analysis.totalEvents(), analysis.errorCount(), analysis.uniquePatterns(),
      String.format("%.1f", analysis.anomalyScore()), analysis.severity());
    return analysis;
  }

  LogAnalysis analyze(List<String> lines) {
    if (lines.isEmpty()) {
      return LogAnalysis.noEvents();
    }

    int errorCount = 0;
    Map<String, Integer> errorTypes = new LinkedHashMap<>();
    long totalLength = 0;

    for (String line : lines) {
      totalLength += line.length();

      String matched = firstMatchingIndicator(line);
      if (matched != null) {
        errorCount++;
        errorTypes.merge(matched, 1, Integer::sum);
      }
    }

    int total = lines.size();
    int uniquePatterns = patternExtractor.extract(lines).size();
    double errorRate = (double) errorCount / total;
    double avgMessageLength = (double) totalLength / total;
    double anomalyScore = anomalyScore(errorRate, uniquePatterns);
    Severity severity = SeverityClassifier.forLogScore(anomalyScore, errorCount);

    return new LogAnalysis(
      total,
      errorCount,
      errorRate,
      errorTypes,
      uniquePatterns,
      avgMessageLength,
      anomalyScore,
      severity,
      Optional.empty()
    );
  }

  static double anomalyScore(double errorRate, int uniquePatterns) {
    double patternDiversity = Math.min((double) uniquePatterns / PATTERN_DIVERSITY_SATURATION, 1.0);
    double score = (errorRate * ERROR_RATE_WEIGHT) + (patternDiversity * PATTERN_DIVERSITY_WEIGHT);
    return Math.min(score * 100.0, 100.0);
  }

  private String firstMatchingIndicator(String message) {
    for (Map.Entry<String, Pattern> entry : indicators.entrySet()) {
      if (entry.getValue().matcher(message).find()) {
        return entry.getKey();
      }
    }
    return null;
  }
}
