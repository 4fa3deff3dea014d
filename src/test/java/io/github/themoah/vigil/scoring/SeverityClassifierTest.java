package io.github.themoah.vigil.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.vigil.model.Severity;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SeverityClassifier threshold tables.
 */
public class SeverityClassifierTest {

  @Test
  void metricScore_thresholds() {
    assertEquals(Severity.LOW, SeverityClassifier.forMetricScore(0.0));
    assertEquals(Severity.LOW, SeverityClassifier.forMetricScore(0.29));
    assertEquals(Severity.MEDIUM, SeverityClassifier.forMetricScore(0.3));
    assertEquals(Severity.HIGH, SeverityClassifier.forMetricScore(0.5));
    assertEquals(Severity.CRITICAL, SeverityClassifier.forMetricScore(0.7));
    assertEquals(Severity.CRITICAL, SeverityClassifier.forMetricScore(0.86));
  }

  @Test
  void logScore_thresholds() {
    assertEquals(Severity.LOW, SeverityClassifier.forLogScore(19.9, 5));
    assertEquals(Severity.MEDIUM, SeverityClassifier.forLogScore(20, 0));
    assertEquals(Severity.HIGH, SeverityClassifier.forLogScore(40, 0));
    assertEquals(Severity.CRITICAL, SeverityClassifier.forLogScore(70, 0));
  }

  @Test
  void logScore_errorCountEscalates() {
    assertEquals(Severity.MEDIUM, SeverityClassifier.forLogScore(0, 6));
    assertEquals(Severity.HIGH, SeverityClassifier.forLogScore(0, 21));
    assertEquals(Severity.CRITICAL, SeverityClassifier.forLogScore(0, 101));
  }

  @Test
  void metricScore_monotonic() {
    Severity previous = Severity.LOW;
    for (int i = 0; i <= 100; i++) {
      Severity current = SeverityClassifier.forMetricScore(i / 100.0);
      assertTrue(current.isAtLeast(previous), "tier dropped at score " + i / 100.0);
      previous = current;
    }
  }

  @Test
  void logScore_monotonicInScoreAndErrorCount() {
    for (int errors = 0; errors <= 150; errors += 5) {
      Severity previous = Severity.LOW;
      for (int score = 0; score <= 100; score++) {
        Severity current = SeverityClassifier.forLogScore(score, errors);
        assertTrue(current.isAtLeast(previous));
        assertTrue(current.isAtLeast(SeverityClassifier.forLogScore(score, Math.max(0, errors - 5))));
        previous = current;
      }
    }
  }
}
