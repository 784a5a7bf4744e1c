package org.metricwatch.anomaly.datamodel.config.source;

import com.typesafe.config.ConfigFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.exception.ConfigStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;

class DetectionConfigStoreTest {

  @Test
  void testReadsClasspathDefaults() {
    DetectionConfigStore store = fsStore("default-detection-configs.json");

    List<DetectionConfig> enabled = store.listEnabledConfigs();
    Assertions.assertEquals(1, enabled.size());
    DetectionConfig revenue = enabled.get(0);
    Assertions.assertEquals("revenue", revenue.getMetricName());
    Assertions.assertTrue(revenue.isEnabled());
    Assertions.assertEquals(DetectionConfig.DEFAULT_COOLDOWN_SECONDS, revenue.getCooldownSeconds());
    Assertions.assertEquals(
        Set.of(Algorithm.ZSCORE, Algorithm.ISOLATION), revenue.getAlgorithms());
    Assertions.assertEquals(0.0, revenue.getThresholds().getMin());
    Assertions.assertNull(revenue.getThresholds().getMax());

    DetectionConfig errorRate = store.getConfig("error_rate").orElseThrow();
    Assertions.assertFalse(errorRate.isEnabled());
    Assertions.assertEquals(600, errorRate.getCooldownSeconds());
  }

  @Test
  void testUpsertWritesFile(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("configs.json");
    Files.writeString(
        file, "[{\"metricName\": \"latency\", \"sensitivity\": 3, \"algorithms\": [\"mad\"]}]");
    DetectionConfigStore store = fsStore(file.toString());

    store.upsertConfig(
        DetectionConfig.builder()
            .metricName("latency")
            .sensitivity(8)
            .algorithm(Algorithm.IQR)
            .build());
    store.upsertConfig(
        DetectionConfig.builder()
            .metricName("throughput")
            .sensitivity(5)
            .algorithm(Algorithm.ZSCORE)
            .build());

    DetectionConfigStore reopened = fsStore(file.toString());
    Assertions.assertEquals(2, reopened.listEnabledConfigs().size());
    Assertions.assertEquals(8, reopened.getConfig("latency").orElseThrow().getSensitivity());
  }

  @Test
  void testInvalidFileEntriesAreSkipped(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("configs.json");
    Files.writeString(
        file,
        "[{\"metricName\": \"latency\", \"sensitivity\": 3, \"algorithms\": [\"mad\"]},"
            + " {\"metricName\": \"no_sensitivity\", \"algorithms\": [\"zscore\"]},"
            + " {\"metricName\": \"no_algorithms\", \"sensitivity\": 5}]");
    DetectionConfigStore store = fsStore(file.toString());

    List<DetectionConfig> enabled = store.listEnabledConfigs();
    Assertions.assertEquals(1, enabled.size());
    Assertions.assertEquals("latency", enabled.get(0).getMetricName());
    Assertions.assertTrue(store.getConfig("no_sensitivity").isEmpty());
    Assertions.assertTrue(store.getConfig("no_algorithms").isEmpty());
  }

  @Test
  void testMissingSourceIsEmpty(@TempDir Path tempDir) {
    DetectionConfigStore store = fsStore(tempDir.resolve("absent.json").toString());

    Assertions.assertTrue(store.listEnabledConfigs().isEmpty());
    Assertions.assertTrue(store.getConfig("revenue").isEmpty());
  }

  @Test
  void testMalformedFileIsUnavailable(@TempDir Path tempDir) throws Exception {
    Path file = tempDir.resolve("configs.json");
    Files.writeString(file, "{\"metricName\": \"latency\"}");

    Assertions.assertThrows(
        ConfigStoreUnavailableException.class, () -> fsStore(file.toString()).listEnabledConfigs());
  }

  @Test
  void testInMemoryStore() {
    DetectionConfigStore store =
        DetectionConfigStoreProvider.getProvider(ConfigFactory.parseMap(Map.of("type", "memory")));
    store.upsertConfig(
        DetectionConfig.builder().metricName("b").sensitivity(5).algorithm(Algorithm.MAD).build());
    store.upsertConfig(
        DetectionConfig.builder().metricName("a").sensitivity(5).algorithm(Algorithm.MAD).build());
    store.upsertConfig(DetectionConfig.builder().metricName("c").enabled(false).build());

    List<DetectionConfig> enabled = store.listEnabledConfigs();
    Assertions.assertEquals(2, enabled.size());
    Assertions.assertEquals("a", enabled.get(0).getMetricName());
    Assertions.assertTrue(store.getConfig("c").isPresent());
  }

  @Test
  void testUnknownSourceType() {
    Assertions.assertThrows(
        RuntimeException.class,
        () ->
            DetectionConfigStoreProvider.getProvider(
                ConfigFactory.parseMap(Map.of("type", "dataStore"))));
  }

  private static DetectionConfigStore fsStore(String path) {
    return DetectionConfigStoreProvider.getProvider(
        ConfigFactory.parseMap(Map.of("type", "fs", "fs.path", path)));
  }
}
