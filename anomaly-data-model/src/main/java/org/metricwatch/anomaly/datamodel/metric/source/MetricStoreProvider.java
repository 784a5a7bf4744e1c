package org.metricwatch.anomaly.datamodel.metric.source;

import com.typesafe.config.Config;
import org.metricwatch.anomaly.datamodel.store.MetricStore;

public class MetricStoreProvider {
  private static final String METRIC_SOURCE_TYPE = "type";
  private static final String METRIC_SOURCE_TYPE_FS = "fs";
  private static final String METRIC_SOURCE_TYPE_MEMORY = "memory";

  public static MetricStore getProvider(Config metricSourceConfig) {
    MetricStore metricStore;
    String sourceType = metricSourceConfig.getString(METRIC_SOURCE_TYPE);
    switch (sourceType) {
      case METRIC_SOURCE_TYPE_FS:
        metricStore = new FSMetricStore(metricSourceConfig.getConfig(METRIC_SOURCE_TYPE_FS));
        break;
      case METRIC_SOURCE_TYPE_MEMORY:
        metricStore = new InMemoryMetricStore();
        break;
      default:
        throw new RuntimeException(
            String.format("Invalid metric source configuration: %s", sourceType));
    }
    return metricStore;
  }
}
