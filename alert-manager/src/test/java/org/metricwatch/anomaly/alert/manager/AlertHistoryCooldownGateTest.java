package org.metricwatch.anomaly.alert.manager;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.alert.manager.store.InMemoryAlertStore;
import org.metricwatch.anomaly.datamodel.AlertStatus;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.Severity;
import org.metricwatch.anomaly.datamodel.exception.AlertStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.AlertStore;
import org.metricwatch.anomaly.detector.dedup.CooldownGate;

class AlertHistoryCooldownGateTest {

  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private CooldownGate localGate;
  private InMemoryAlertStore alertStore;
  private AlertHistoryCooldownGate gate;

  @BeforeEach
  void setUp() {
    localGate = mock(CooldownGate.class);
    when(localGate.tryAcquire(anyString(), any(), anyLong(), any())).thenReturn(true);
    alertStore = new InMemoryAlertStore();
    alertStore.insert(alert("a1", "revenue", AnomalyType.SPIKE, T0));
    gate = new AlertHistoryCooldownGate(localGate, alertStore);
  }

  @Test
  void testAlertRaisedElsewhereWithinCooldownSuppresses() {
    assertFalse(gate.tryAcquire("revenue", AnomalyType.SPIKE, 900, T0.plusSeconds(60)));
    assertFalse(gate.tryAcquire("revenue", AnomalyType.SPIKE, 900, T0.plusSeconds(899)));
    verify(localGate, times(2)).release("revenue", AnomalyType.SPIKE);
  }

  @Test
  void testCooldownElapsedOrOtherPairAdmits() {
    assertTrue(gate.tryAcquire("revenue", AnomalyType.SPIKE, 900, T0.plusSeconds(900)));
    assertTrue(gate.tryAcquire("revenue", AnomalyType.DROP, 900, T0.plusSeconds(60)));
    assertTrue(gate.tryAcquire("error_rate", AnomalyType.SPIKE, 900, T0.plusSeconds(60)));
    verify(localGate, never()).release(anyString(), any());
  }

  @Test
  void testLocalSuppressionSkipsStoreLookup() {
    AlertStore store = mock(AlertStore.class);
    CooldownGate suppressing = mock(CooldownGate.class);
    AlertHistoryCooldownGate localFirst = new AlertHistoryCooldownGate(suppressing, store);

    assertFalse(localFirst.tryAcquire("revenue", AnomalyType.SPIKE, 900, T0));
    verify(store, never()).query(any());
  }

  @Test
  void testStoreFailureReleasesLocalSlot() {
    AlertStore store = mock(AlertStore.class);
    when(store.query(any())).thenThrow(new AlertStoreUnavailableException("down"));
    AlertHistoryCooldownGate failing = new AlertHistoryCooldownGate(localGate, store);

    assertThrows(
        AlertStoreUnavailableException.class,
        () -> failing.tryAcquire("revenue", AnomalyType.SPIKE, 900, T0));
    verify(localGate).release("revenue", AnomalyType.SPIKE);
  }

  private static AnomalyAlert alert(
      String id, String metric, AnomalyType anomalyType, Instant createdAt) {
    return AnomalyAlert.builder()
        .id(id)
        .metricName(metric)
        .severity(Severity.HIGH)
        .anomalyType(anomalyType)
        .status(AlertStatus.ACTIVE)
        .createdAt(createdAt)
        .updatedAt(createdAt)
        .build();
  }
}
