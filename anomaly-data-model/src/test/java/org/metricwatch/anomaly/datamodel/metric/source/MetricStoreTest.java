package org.metricwatch.anomaly.datamodel.metric.source;

import com.typesafe.config.ConfigFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.MetricStore;

class MetricStoreTest {

  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

  @Test
  void testFileStore(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("metrics.json");
    Files.writeString(
        file,
        "{\"revenue\": ["
            + "{\"timestamp\": \"2024-03-01T00:02:00Z\", \"value\": 12.5},"
            + "{\"timestamp\": \"2024-03-01T00:00:00Z\", \"value\": 10.0},"
            + "{\"timestamp\": \"2024-03-01T00:01:00Z\", \"value\": 11.0}],"
            + "\"latency\": [{\"timestamp\": \"2024-03-01T00:05:00Z\", \"value\": 250}]}");
    MetricStore store =
        MetricStoreProvider.getProvider(
            ConfigFactory.parseMap(Map.of("type", "fs", "fs.path", file.toString())));

    Assertions.assertEquals(
        MetricSample.of("revenue", T0.plusSeconds(120), 12.5),
        store.getLatestSample("revenue").orElseThrow());
    List<MetricSample> window =
        store.getHistoricalWindow("revenue", T0, T0.plusSeconds(60));
    Assertions.assertEquals(2, window.size());
    Assertions.assertEquals(10.0, window.get(0).getValue());
    Assertions.assertTrue(store.getLatestSample("throughput").isEmpty());
  }

  @Test
  void testMissingFileIsUnavailable(@TempDir Path tempDir) {
    MetricStore store =
        MetricStoreProvider.getProvider(
            ConfigFactory.parseMap(
                Map.of("type", "fs", "fs.path", tempDir.resolve("absent.json").toString())));

    MetricStoreUnavailableException e =
        Assertions.assertThrows(
            MetricStoreUnavailableException.class, () -> store.getLatestSample("revenue"));
    Assertions.assertEquals("revenue", e.getMetricName());
  }

  @Test
  void testInMemoryStoreBoundsAreInclusive() {
    InMemoryMetricStore store =
        (InMemoryMetricStore)
            MetricStoreProvider.getProvider(ConfigFactory.parseMap(Map.of("type", "memory")));
    for (int i = 0; i < 5; i++) {
      store.addSample(MetricSample.of("revenue", T0.plusSeconds(60L * i), i));
    }

    Assertions.assertEquals(
        3, store.getHistoricalWindow("revenue", T0.plusSeconds(60), T0.plusSeconds(180)).size());
    Assertions.assertEquals(4.0, store.getLatestSample("revenue").orElseThrow().getValue());
    Assertions.assertTrue(
        store.getHistoricalWindow("revenue", T0.plusSeconds(180), T0).isEmpty());
    Assertions.assertTrue(store.getHistoricalWindow("latency", T0, T0).isEmpty());
  }
}
