package io.github.themoah.vigil.metrics;

import io.github.themoah.vigil.model.LogAnalysis;
import io.github.themoah.vigil.model.MetricDescriptor;
import io.github.themoah.vigil.model.ScoreResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes scores as Micrometer gauges.
 * Works with any Micrometer-supported backend (Prometheus, Datadog, OTLP).
 *
 * <p>Gauges:
 * <ul>
 *   <li>{@code vigil.anomaly.score} and {@code vigil.anomaly.z_score}, tagged with
 *       namespace, metric_name, statistic and dimensions</li>
 *   <li>{@code vigil.log.anomaly_score} and {@code vigil.log.error_count}, tagged with log_group</li>
 * </ul>
 */
public class MicrometerReporter implements ScoreReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  // Gauge values are stored as raw double bits
  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Set<String> reportedKeys = ConcurrentHashMap.newKeySet();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportScore(MetricDescriptor descriptor, ScoreResult result) {
    Tags tags = Tags.of(
      "namespace", descriptor.namespace(),
      "metric_name", descriptor.metricName(),
      "statistic", descriptor.statistic().getValue(),
      "dimensions", dimensionsTag(descriptor.dimensions())
    );

    recordGauge("vigil.anomaly.score", tags, result.score());
    if (result.isScored()) {
      recordGauge("vigil.anomaly.z_score", tags, result.zScore());
    }
  }

  @Override
  public void reportLogAnalysis(String logGroup, LogAnalysis analysis) {
    Tags tags = Tags.of("log_group", logGroup);
    recordGauge("vigil.log.anomaly_score", tags, analysis.anomalyScore());
    recordGauge("vigil.log.error_count", tags, analysis.errorCount());
  }

  /**
   * Two-phase cleanup for stale gauges.
   * Phase 1: Mark gauges not reported since the previous cleanup
   * Phase 2: Delete gauges that were marked AND still not reported
   */
  @Override
  public void cleanupStale() {
    Set<String> active = new HashSet<>(reportedKeys);
    reportedKeys.removeAll(active);

    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(active);
    for (String key : toDelete) {
      removeGauge(key);
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Cleaned up {} stale gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>(gaugeValues.keySet());
    missing.removeAll(active);
    markedForDeletion.retainAll(missing);
    markedForDeletion.addAll(missing);
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  int gaugeCount() {
    return gaugeValues.size();
  }

  private void recordGauge(String name, Tags tags, double value) {
    String key = name + tags.toString();
    long bits = Double.doubleToLongBits(value);
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(bits);
      Gauge.builder(name, newValue, v -> Double.longBitsToDouble(v.get()))
        .tags(tags)
        .register(registry);
      return newValue;
    });
    holder.set(bits);
    reportedKeys.add(key);
  }

  private void removeGauge(String key) {
    if (gaugeValues.remove(key) != null) {
      registry.getMeters().stream()
        .filter(meter -> meterKey(meter).equals(key))
        .findFirst()
        .ifPresent(registry::remove);
      log.debug("Removed stale gauge: {}", key);
    }
  }

  /**
   * Dimensions folded into one tag ("k1=v1,k2=v2", sorted by key) so every score
   * gauge carries the same tag keys.
   */
  static String dimensionsTag(Map<String, String> dimensions) {
    return new TreeMap<>(dimensions).entrySet().stream()
      .map(e -> e.getKey() + "=" + e.getValue())
      .collect(Collectors.joining(","));
  }

  private static String meterKey(Meter meter) {
    return meter.getId().getName() + Tags.of(meter.getId().getTags()).toString();
  }
}
