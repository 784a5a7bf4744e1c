package org.metricwatch.anomaly.alert.manager.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.store.AlertStore;

/** Single-process alert store. Version checks happen inside the map's per-key compute. */
public class InMemoryAlertStore implements AlertStore {

  static final Comparator<AnomalyAlert> NEWEST_FIRST =
      Comparator.comparing(AnomalyAlert::getCreatedAt)
          .thenComparing(AnomalyAlert::getId)
          .reversed();

  private final ConcurrentMap<String, AnomalyAlert> alerts = new ConcurrentHashMap<>();

  @Override
  public void insert(AnomalyAlert alert) {
    AnomalyAlert existing = alerts.putIfAbsent(alert.getId(), alert);
    if (existing != null) {
      throw new IllegalArgumentException("Alert " + alert.getId() + " already exists");
    }
  }

  @Override
  public Optional<AnomalyAlert> get(String alertId) {
    return Optional.ofNullable(alerts.get(alertId));
  }

  @Override
  public boolean compareAndSet(AnomalyAlert updated, long expectedVersion) {
    AtomicBoolean swapped = new AtomicBoolean();
    alerts.computeIfPresent(
        updated.getId(),
        (id, current) -> {
          if (current.getVersion() != expectedVersion) {
            return current;
          }
          swapped.set(true);
          return updated;
        });
    return swapped.get();
  }

  @Override
  public List<AnomalyAlert> query(AlertQuery query) {
    return alerts.values().stream()
        .filter(query::matches)
        .sorted(NEWEST_FIRST)
        .skip(query.getOffset())
        .limit(query.getLimit())
        .collect(Collectors.toList());
  }
}
