package org.metricwatch.anomaly.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;

/** Durable alert history. Alerts are never deleted. */
public interface AlertStore {

  void insert(AnomalyAlert alert);

  Optional<AnomalyAlert> get(String alertId);

  /**
   * Atomically replaces the stored alert with {@code updated} if the stored version equals
   * {@code expectedVersion}.
   *
   * @return false when the alert is missing or its version moved on
   */
  boolean compareAndSet(AnomalyAlert updated, long expectedVersion);

  /** Matching alerts, newest first, with the query's offset and limit applied. */
  List<AnomalyAlert> query(AlertQuery query);
}
