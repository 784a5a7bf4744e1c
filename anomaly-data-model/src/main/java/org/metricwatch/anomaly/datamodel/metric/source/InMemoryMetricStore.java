package org.metricwatch.anomaly.datamodel.metric.source;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.store.MetricStore;

public class InMemoryMetricStore implements MetricStore {

  private final Map<String, NavigableMap<Instant, MetricSample>> series = new ConcurrentHashMap<>();

  public void addSample(MetricSample sample) {
    series
        .computeIfAbsent(sample.getMetricName(), k -> new ConcurrentSkipListMap<>())
        .put(sample.getTimestamp(), sample);
  }

  public void addSamples(Collection<MetricSample> samples) {
    samples.forEach(this::addSample);
  }

  @Override
  public Optional<MetricSample> getLatestSample(String metricName) {
    NavigableMap<Instant, MetricSample> samples = series.get(metricName);
    if (samples == null || samples.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(samples.lastEntry().getValue());
  }

  @Override
  public List<MetricSample> getHistoricalWindow(String metricName, Instant from, Instant to) {
    NavigableMap<Instant, MetricSample> samples = series.get(metricName);
    if (samples == null || from.isAfter(to)) {
      return List.of();
    }
    return new ArrayList<>(samples.subMap(from, true, to, true).values());
  }
}
