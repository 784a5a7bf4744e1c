package org.metricwatch.anomaly.alert.manager.store;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

class AlertStoreProviderTest {

  @Test
  void testMemoryType() {
    assertTrue(
        AlertStoreProvider.getProvider(ConfigFactory.parseString("type = memory"))
            instanceof InMemoryAlertStore);
  }

  @Test
  void testUnknownTypeIsRejected() {
    assertThrows(
        RuntimeException.class,
        () -> AlertStoreProvider.getProvider(ConfigFactory.parseString("type = mongo")));
  }
}
