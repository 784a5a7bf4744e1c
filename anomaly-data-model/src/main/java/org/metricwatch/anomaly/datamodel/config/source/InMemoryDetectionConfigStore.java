package org.metricwatch.anomaly.datamodel.config.source;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;

public class InMemoryDetectionConfigStore implements DetectionConfigStore {

  private final Map<String, DetectionConfig> configs = new ConcurrentHashMap<>();

  public InMemoryDetectionConfigStore() {}

  public InMemoryDetectionConfigStore(Collection<DetectionConfig> initialConfigs) {
    initialConfigs.forEach(this::upsertConfig);
  }

  @Override
  public List<DetectionConfig> listEnabledConfigs() {
    return configs.values().stream()
        .filter(DetectionConfig::isEnabled)
        .sorted(Comparator.comparing(DetectionConfig::getMetricName))
        .collect(Collectors.toList());
  }

  @Override
  public Optional<DetectionConfig> getConfig(String metricName) {
    return Optional.ofNullable(configs.get(metricName));
  }

  @Override
  public void upsertConfig(DetectionConfig config) {
    configs.put(config.getMetricName(), config);
  }
}
