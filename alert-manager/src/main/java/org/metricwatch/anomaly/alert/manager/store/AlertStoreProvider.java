package org.metricwatch.anomaly.alert.manager.store;

import com.typesafe.config.Config;
import org.metricwatch.anomaly.datamodel.store.AlertStore;

public class AlertStoreProvider {
  private static final String ALERT_STORE_TYPE = "type";
  private static final String ALERT_STORE_TYPE_MEMORY = "memory";

  public static AlertStore getProvider(Config alertStoreConfig) {
    AlertStore alertStore;
    String storeType = alertStoreConfig.getString(ALERT_STORE_TYPE);
    switch (storeType) {
      case ALERT_STORE_TYPE_MEMORY:
        alertStore = new InMemoryAlertStore();
        break;
      default:
        throw new RuntimeException(
            String.format("Invalid alert store configuration: %s", storeType));
    }
    return alertStore;
  }
}
