package org.metricwatch.anomaly.detector.evaluator;

import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.metric.source.InMemoryMetricStore;
import org.metricwatch.anomaly.detector.evaluator.MetricWindowCache.MetricTimeSeries;

class MetricWindowCacheTest {

  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

  @Test
  void testMetricWindowCache() {
    InMemoryMetricStore metricStore = spy(new InMemoryMetricStore());
    for (int minute = 1; minute <= 5; minute++) {
      metricStore.addSample(MetricSample.of("latency", minute(minute), 100));
    }
    MetricWindowCache windowCache = new MetricWindowCache(metricStore);

    // loads data from the store
    List<MetricSample> window = windowCache.getHistoricalWindow("latency", minute(0), minute(5));
    Assertions.assertEquals(5, window.size());
    MetricTimeSeries metricTimeSeries = windowCache.getMetricTimeSeriesRecord("latency");
    Assertions.assertEquals(5, metricTimeSeries.getDataList().size());

    // returns data from cache
    window = windowCache.getHistoricalWindow("latency", minute(2), minute(5));
    Assertions.assertEquals(4, window.size());
    verify(metricStore, times(1)).getHistoricalWindow("latency", minute(0), minute(5));

    // fetches only the delta and trims data older than the widest window
    metricStore.addSample(MetricSample.of("latency", minute(6), 130));
    window = windowCache.getHistoricalWindow("latency", minute(4), minute(7));
    Assertions.assertEquals(3, window.size()); // [4, 6]
    verify(metricStore).getHistoricalWindow("latency", minute(5), minute(7));
    metricTimeSeries = windowCache.getMetricTimeSeriesRecord("latency");
    Assertions.assertEquals(5, metricTimeSeries.getDataList().size()); // [2, 6]
    Assertions.assertEquals(minute(2), metricTimeSeries.getStartTime());
  }

  @Test
  void testEarlierStartReloads() {
    InMemoryMetricStore metricStore = spy(new InMemoryMetricStore());
    metricStore.addSample(MetricSample.of("latency", minute(1), 100));
    metricStore.addSample(MetricSample.of("latency", minute(3), 100));
    MetricWindowCache windowCache = new MetricWindowCache(metricStore);

    Assertions.assertEquals(
        1, windowCache.getHistoricalWindow("latency", minute(2), minute(4)).size());
    Assertions.assertEquals(
        2, windowCache.getHistoricalWindow("latency", minute(0), minute(4)).size());
    verify(metricStore).getHistoricalWindow("latency", minute(0), minute(4));
  }

  @Test
  void testInvalidate() {
    InMemoryMetricStore metricStore = new InMemoryMetricStore();
    metricStore.addSample(MetricSample.of("latency", minute(1), 100));
    MetricWindowCache windowCache = new MetricWindowCache(metricStore);
    windowCache.getHistoricalWindow("latency", minute(0), minute(2));

    windowCache.invalidate("latency");

    Assertions.assertNull(windowCache.getMetricTimeSeriesRecord("latency"));
  }

  private static Instant minute(int minute) {
    return T0.plus(Duration.ofMinutes(minute));
  }
}
