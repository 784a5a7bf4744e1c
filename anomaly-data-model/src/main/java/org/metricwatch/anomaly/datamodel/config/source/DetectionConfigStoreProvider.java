package org.metricwatch.anomaly.datamodel.config.source;

import com.typesafe.config.Config;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;

public class DetectionConfigStoreProvider {
  private static final String CONFIG_SOURCE_TYPE = "type";
  private static final String CONFIG_SOURCE_TYPE_FS = "fs";
  private static final String CONFIG_SOURCE_TYPE_MEMORY = "memory";

  public static DetectionConfigStore getProvider(Config configSourceConfig) {
    DetectionConfigStore configStore;
    String sourceType = configSourceConfig.getString(CONFIG_SOURCE_TYPE);
    switch (sourceType) {
      case CONFIG_SOURCE_TYPE_FS:
        configStore =
            new FSDetectionConfigStore(configSourceConfig.getConfig(CONFIG_SOURCE_TYPE_FS));
        break;
      case CONFIG_SOURCE_TYPE_MEMORY:
        configStore = new InMemoryDetectionConfigStore();
        break;
      default:
        throw new RuntimeException(
            String.format("Invalid detection config source configuration: %s", sourceType));
    }
    return configStore;
  }
}
