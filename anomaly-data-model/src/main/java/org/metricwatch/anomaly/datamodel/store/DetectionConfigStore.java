package org.metricwatch.anomaly.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.metricwatch.anomaly.datamodel.DetectionConfig;

public interface DetectionConfigStore {

  List<DetectionConfig> listEnabledConfigs();

  Optional<DetectionConfig> getConfig(String metricName);

  void upsertConfig(DetectionConfig config);
}
