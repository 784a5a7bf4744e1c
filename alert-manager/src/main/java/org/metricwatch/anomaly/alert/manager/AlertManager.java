package org.metricwatch.anomaly.alert.manager;

import com.google.common.base.Strings;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AlertStatistics;
import org.metricwatch.anomaly.datamodel.AlertStatus;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.AnomalyAlert.AnomalyAlertBuilder;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.Severity;
import org.metricwatch.anomaly.datamodel.StatusTransition;
import org.metricwatch.anomaly.datamodel.exception.AlertConflictException;
import org.metricwatch.anomaly.datamodel.exception.AlertNotFoundException;
import org.metricwatch.anomaly.datamodel.store.AlertStore;
import org.metricwatch.anomaly.detector.evaluator.AnomalyCandidate;
import org.metricwatch.anomaly.notification.service.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the alert lifecycle. Every create or transition is a single store operation; transitions
 * are guarded by the caller's expected version.
 */
public class AlertManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertManager.class);

  private static final String ALERT_LINK_BASE_URL_CONFIG = "alertLinkBaseUrl";
  static final String ALERTS_CREATED_COUNTER = "metricwatch.anomaly.alerts.created";

  private final AlertStore alertStore;
  private final NotificationDispatcher dispatcher;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final String alertLinkBaseUrl;
  private final ConcurrentMap<Severity, Counter> createdCounters = new ConcurrentHashMap<>();

  public AlertManager(
      Config notificationConfig,
      AlertStore alertStore,
      NotificationDispatcher dispatcher,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(
        alertStore,
        dispatcher,
        meterRegistry,
        clock,
        notificationConfig.hasPath(ALERT_LINK_BASE_URL_CONFIG)
            ? notificationConfig.getString(ALERT_LINK_BASE_URL_CONFIG)
            : null);
  }

  public AlertManager(
      AlertStore alertStore,
      NotificationDispatcher dispatcher,
      MeterRegistry meterRegistry,
      Clock clock,
      String alertLinkBaseUrl) {
    this.alertStore = alertStore;
    this.dispatcher = dispatcher;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.alertLinkBaseUrl = alertLinkBaseUrl;
  }

  /**
   * Persists a new active alert and schedules delivery to the given channels. Delivery is never
   * awaited.
   */
  public AnomalyAlert create(AnomalyCandidate candidate, Set<String> channelIds) {
    Instant now = clock.instant();
    AnomalyAlert alert =
        AnomalyAlert.builder()
            .id(UUID.randomUUID().toString())
            .metricName(candidate.getMetricName())
            .observedValue(candidate.getObservedValue())
            .expectedValue(candidate.getExpectedValue())
            .baseline(candidate.getBaseline())
            .deviationPercent(candidate.getDeviationPercent())
            .anomalyType(candidate.getAnomalyType())
            .severity(candidate.getSeverity())
            .firingAlgorithms(candidate.getFiringAlgorithms())
            .description(candidate.getDescription())
            .status(AlertStatus.ACTIVE)
            .createdAt(now)
            .updatedAt(now)
            .version(0)
            .transition(
                StatusTransition.builder()
                    .status(AlertStatus.ACTIVE)
                    .timestamp(now)
                    .notes(candidate.getDescription())
                    .build())
            .build();
    alertStore.insert(alert);
    createdCounters
        .computeIfAbsent(
            alert.getSeverity(),
            severity ->
                meterRegistry.counter(ALERTS_CREATED_COUNTER, "severity", severity.getWireName()))
        .increment();
    LOGGER.info(
        "Created {} {} alert {} for metric {} (deviation {}%)",
        alert.getSeverity().getWireName(),
        alert.getAnomalyType().getWireName(),
        alert.getId(),
        alert.getMetricName(),
        String.format("%.2f", alert.getDeviationPercent()));

    if (!channelIds.isEmpty()) {
      dispatcher.dispatch(channelIds, toPayload(alert));
    }
    return alert;
  }

  public AnomalyAlert acknowledge(String alertId, String actor, long expectedVersion) {
    return transition(
        alertId,
        expectedVersion,
        AlertStatus.ACKNOWLEDGED,
        actor,
        null,
        builder -> builder.acknowledgedBy(actor).acknowledgedAt(clock.instant()));
  }

  public AnomalyAlert resolve(String alertId, String notes, long expectedVersion) {
    return transition(
        alertId,
        expectedVersion,
        AlertStatus.RESOLVED,
        null,
        notes,
        builder -> builder.resolutionNotes(notes).resolvedAt(clock.instant()));
  }

  private AnomalyAlert transition(
      String alertId,
      long expectedVersion,
      AlertStatus target,
      String actor,
      String notes,
      UnaryOperator<AnomalyAlertBuilder> mutation) {
    AnomalyAlert current = getAlert(alertId);
    if (!current.getStatus().canTransitionTo(target)) {
      throw new AlertConflictException(
          alertId,
          current.getStatus(),
          current.getVersion(),
          expectedVersion,
          String.format(
              "cannot move from %s to %s",
              current.getStatus().getWireName(), target.getWireName()));
    }
    if (current.getVersion() != expectedVersion) {
      throw new AlertConflictException(
          alertId, current.getStatus(), current.getVersion(), expectedVersion, "stale version");
    }

    Instant now = clock.instant();
    AnomalyAlert updated =
        mutation
            .apply(current.toBuilder())
            .status(target)
            .updatedAt(now)
            .version(current.getVersion() + 1)
            .transition(
                StatusTransition.builder()
                    .status(target)
                    .timestamp(now)
                    .actor(actor)
                    .notes(notes)
                    .build())
            .build();
    if (!alertStore.compareAndSet(updated, expectedVersion)) {
      AnomalyAlert latest = getAlert(alertId);
      throw new AlertConflictException(
          alertId,
          latest.getStatus(),
          latest.getVersion(),
          expectedVersion,
          "concurrently modified");
    }
    LOGGER.info(
        "Alert {} moved to {} (version {})", alertId, target.getWireName(), updated.getVersion());
    return updated;
  }

  public AnomalyAlert getAlert(String alertId) {
    return alertStore.get(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
  }

  public Optional<AnomalyAlert> findAlert(String alertId) {
    return alertStore.get(alertId);
  }

  public List<AnomalyAlert> query(AlertQuery query) {
    return alertStore.query(query);
  }

  /** Alerts not yet resolved, newest first. A status filter in {@code filters} is ignored. */
  public List<AnomalyAlert> getActiveAlerts(AlertQuery filters) {
    return alertStore.query(
        filters.toBuilder()
            .clearStatuses()
            .status(AlertStatus.ACTIVE)
            .status(AlertStatus.ACKNOWLEDGED)
            .build());
  }

  public List<AnomalyAlert> getHistory(Instant from, Instant to, AlertQuery filters) {
    return alertStore.query(filters.toBuilder().createdFrom(from).createdTo(to).build());
  }

  public AlertStatistics getStatistics(Instant from, Instant to) {
    List<AnomalyAlert> alerts =
        alertStore.query(AlertQuery.all().toBuilder().createdFrom(from).createdTo(to).build());

    Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      bySeverity.put(severity, 0L);
    }
    Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
    for (AnomalyType type : AnomalyType.values()) {
      byType.put(type, 0L);
    }
    Map<String, Long> byMetric = new TreeMap<>();
    long resolved = 0;
    long resolutionMillis = 0;
    long timedResolutions = 0;
    for (AnomalyAlert alert : alerts) {
      bySeverity.merge(alert.getSeverity(), 1L, Long::sum);
      byType.merge(alert.getAnomalyType(), 1L, Long::sum);
      byMetric.merge(alert.getMetricName(), 1L, Long::sum);
      if (alert.getStatus() == AlertStatus.RESOLVED) {
        resolved++;
        if (alert.getResolvedAt() != null) {
          resolutionMillis +=
              Duration.between(alert.getCreatedAt(), alert.getResolvedAt()).toMillis();
          timedResolutions++;
        }
      }
    }
    double averageResolutionMinutes =
        timedResolutions == 0 ? 0.0 : resolutionMillis / (double) timedResolutions / 60_000.0;

    return AlertStatistics.builder()
        .total(alerts.size())
        .bySeverity(bySeverity)
        .byType(byType)
        .byMetric(byMetric)
        .resolved(resolved)
        .unresolved(alerts.size() - resolved)
        .averageResolutionMinutes(averageResolutionMinutes)
        .build();
  }

  AlertPayload toPayload(AnomalyAlert alert) {
    String reference =
        Strings.isNullOrEmpty(alertLinkBaseUrl)
            ? alert.getId()
            : alertLinkBaseUrl.replaceAll("/+$", "") + "/" + alert.getId();
    return AlertPayload.builder()
        .alertId(alert.getId())
        .metricName(alert.getMetricName())
        .observedValue(alert.getObservedValue())
        .deviationPercent(alert.getDeviationPercent())
        .severity(alert.getSeverity())
        .anomalyType(alert.getAnomalyType())
        .timestamp(alert.getCreatedAt())
        .description(alert.getDescription())
        .reference(reference)
        .build();
  }
}
