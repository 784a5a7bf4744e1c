package org.metricwatch.anomaly.alert.manager;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.store.AlertStore;
import org.metricwatch.anomaly.detector.dedup.CooldownGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooldown gate backed by the alert store, so every engine sharing the store sees cooldowns
 * started by the others. The local gate answers first and only admitted candidates cost a store
 * lookup. Cluster-wide exclusivity of detection ticks keeps the lookup and the later insert free
 * of races between engines.
 */
public class AlertHistoryCooldownGate implements CooldownGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertHistoryCooldownGate.class);

  private final CooldownGate localGate;
  private final AlertStore alertStore;

  public AlertHistoryCooldownGate(CooldownGate localGate, AlertStore alertStore) {
    this.localGate = localGate;
    this.alertStore = alertStore;
  }

  @Override
  public boolean tryAcquire(
      String metricName, AnomalyType anomalyType, long cooldownSeconds, Instant now) {
    if (!localGate.tryAcquire(metricName, anomalyType, cooldownSeconds, now)) {
      return false;
    }
    Optional<AnomalyAlert> recent;
    try {
      recent = latestAlertWithinCooldown(metricName, anomalyType, cooldownSeconds, now);
    } catch (RuntimeException e) {
      localGate.release(metricName, anomalyType);
      throw e;
    }
    if (recent.isPresent()) {
      localGate.release(metricName, anomalyType);
      LOGGER.debug(
          "Suppressed {} anomaly for metric {}, alert {} raised at {} is within cooldown",
          anomalyType,
          metricName,
          recent.get().getId(),
          recent.get().getCreatedAt());
      return false;
    }
    return true;
  }

  @Override
  public void release(String metricName, AnomalyType anomalyType) {
    localGate.release(metricName, anomalyType);
  }

  private Optional<AnomalyAlert> latestAlertWithinCooldown(
      String metricName, AnomalyType anomalyType, long cooldownSeconds, Instant now) {
    List<AnomalyAlert> latest =
        alertStore.query(
            AlertQuery.builder()
                .metricName(metricName)
                .anomalyType(anomalyType)
                .createdFrom(now.minusSeconds(cooldownSeconds))
                .createdTo(now)
                .limit(1)
                .build());
    return latest.stream()
        .filter(alert -> now.isBefore(alert.getCreatedAt().plusSeconds(cooldownSeconds)))
        .findFirst();
  }
}
