package org.metricwatch.anomaly.detector.evaluator;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.Getter;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.MetricStore;

/**
 * Keeps the historical window of each metric between ticks so that only samples newer than the
 * previous fetch are requested from the metric store.
 */
public class MetricWindowCache {

  private static final int CACHE_EXPIRY_MINUTES = 30;
  private final Cache<String, MetricTimeSeries> metricCache;
  private final MetricStore metricStore;

  public MetricWindowCache(MetricStore metricStore) {
    this.metricStore = metricStore;
    this.metricCache =
        CacheBuilder.newBuilder()
            .expireAfterAccess(CACHE_EXPIRY_MINUTES, TimeUnit.MINUTES)
            .recordStats()
            .build();
  }

  /** Samples of the metric with {@code start <= timestamp <= end}, ordered by timestamp. */
  public List<MetricSample> getHistoricalWindow(String metricName, Instant start, Instant end) {
    MetricTimeSeries metricTimeSeries;
    try {
      metricTimeSeries = metricCache.get(metricName, () -> new MetricTimeSeries(metricName));
    } catch (ExecutionException e) {
      throw new MetricStoreUnavailableException(metricName, "Unable to load cached window", e);
    }
    synchronized (metricTimeSeries) {
      // nothing cached yet, or the requested range starts earlier than what we hold
      if (!metricTimeSeries.isLoaded() || start.isBefore(metricTimeSeries.getStartTime())) {
        List<MetricSample> dataList = metricStore.getHistoricalWindow(metricName, start, end);
        metricTimeSeries.replace(start, end, dataList);
        return new ArrayList<>(dataList);
      }

      // need to just get diff of the data
      if (end.isAfter(metricTimeSeries.getEndTime())) {
        Instant previousEnd = metricTimeSeries.getEndTime();
        List<MetricSample> delta =
            metricStore.getHistoricalWindow(metricName, previousEnd, end).stream()
                .filter(sample -> sample.getTimestamp().isAfter(previousEnd))
                .collect(Collectors.toList());
        metricTimeSeries.append(end, delta, Duration.between(start, end));
      }
      return filterData(metricTimeSeries.getDataList(), start, end);
    }
  }

  public void invalidate(String metricName) {
    metricCache.invalidate(metricName);
  }

  MetricTimeSeries getMetricTimeSeriesRecord(String metricName) {
    return metricCache.getIfPresent(metricName);
  }

  private List<MetricSample> filterData(List<MetricSample> dataList, Instant start, Instant end) {
    return dataList.stream()
        .filter(v -> !v.getTimestamp().isBefore(start) && !v.getTimestamp().isAfter(end))
        .collect(Collectors.toList());
  }

  @Getter
  static class MetricTimeSeries {
    private final String metricName;
    private boolean loaded;
    private Instant startTime;
    private Instant endTime;
    private List<MetricSample> dataList = new ArrayList<>();
    // the widest window requested for this metric so far
    private Duration maxRetentionPeriod = Duration.ZERO;

    MetricTimeSeries(String metricName) {
      this.metricName = metricName;
    }

    void replace(Instant startTime, Instant endTime, List<MetricSample> dataList) {
      this.loaded = true;
      this.startTime = startTime;
      this.endTime = endTime;
      this.dataList = new ArrayList<>(dataList);
      Duration requested = Duration.between(startTime, endTime);
      if (requested.compareTo(maxRetentionPeriod) > 0) {
        maxRetentionPeriod = requested;
      }
    }

    void append(Instant endTime, List<MetricSample> delta, Duration requested) {
      dataList.addAll(delta);
      this.endTime = endTime;
      if (requested.compareTo(maxRetentionPeriod) > 0) {
        maxRetentionPeriod = requested;
      }
      trimOlderData();
    }

    void trimOlderData() {
      Instant updatedStartTime = endTime.minus(maxRetentionPeriod);
      if (!updatedStartTime.isAfter(startTime)) {
        return;
      }
      dataList.removeIf(sample -> sample.getTimestamp().isBefore(updatedStartTime));
      startTime = updatedStartTime;
    }
  }
}
