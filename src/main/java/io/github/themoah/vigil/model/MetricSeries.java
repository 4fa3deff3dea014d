package io.github.themoah.vigil.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Samples fetched for a single metric descriptor.
 * Samples may arrive in any order; use {@link #sortedSamples()} before scoring.
 */
public record MetricSeries(
  MetricDescriptor descriptor,
  List<Sample> samples
) {

  public MetricSeries {
    Objects.requireNonNull(descriptor, "descriptor cannot be null");
    samples = samples == null ? List.of() : List.copyOf(samples);
  }

  public int size() {
    return samples.size();
  }

  /**
   * Returns the samples ordered by timestamp ascending.
   * Samples with equal timestamps keep their original relative order.
   */
  public List<Sample> sortedSamples() {
    List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(Comparator.comparing(Sample::timestamp));
    return sorted;
  }
}
