package org.metricwatch.anomaly.alert.manager.investigation;

import com.typesafe.config.Config;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.alert.manager.AlertManager;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.InvestigationReport;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.StatusTransition;
import org.metricwatch.anomaly.datamodel.TimelineEntry;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;
import org.metricwatch.anomaly.datamodel.store.MetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the context around one alert. Reports are derived on request and never stored. The
 * alert's {@code createdAt} anchors every time window.
 */
public class InvestigationService {
  private static final Logger LOGGER = LoggerFactory.getLogger(InvestigationService.class);

  private static final String RETENTION_CONFIG = "retention";
  private static final String SIMILAR_ALERTS_LIMIT_CONFIG = "similarAlertsLimit";
  private static final String SIMILAR_ALERTS_LOOKBACK_CONFIG = "similarAlertsLookback";
  private static final String CORRELATION_LOOKBACK_CONFIG = "correlationLookback";
  private static final Duration DEFAULT_RETENTION = Duration.ofDays(30);
  private static final int DEFAULT_SIMILAR_ALERTS_LIMIT = 5;
  private static final Duration DEFAULT_SIMILAR_ALERTS_LOOKBACK = Duration.ofDays(7);
  private static final Duration DEFAULT_CORRELATION_LOOKBACK = Duration.ofHours(1);

  static final String EVENT_DETECTED = "Anomaly Detected";
  static final String EVENT_ACKNOWLEDGED = "Acknowledged";
  static final String EVENT_RESOLVED = "Resolved";
  static final String NO_NOTES = "No notes provided";

  private final AlertManager alertManager;
  private final MetricStore metricStore;
  private final DetectionConfigStore configStore;
  private final Duration retention;
  private final int similarAlertsLimit;
  private final Duration similarAlertsLookback;
  private final Duration correlationLookback;

  public InvestigationService(
      Config investigationConfig,
      AlertManager alertManager,
      MetricStore metricStore,
      DetectionConfigStore configStore) {
    this.alertManager = alertManager;
    this.metricStore = metricStore;
    this.configStore = configStore;
    this.retention =
        investigationConfig.hasPath(RETENTION_CONFIG)
            ? investigationConfig.getDuration(RETENTION_CONFIG)
            : DEFAULT_RETENTION;
    this.similarAlertsLimit =
        investigationConfig.hasPath(SIMILAR_ALERTS_LIMIT_CONFIG)
            ? investigationConfig.getInt(SIMILAR_ALERTS_LIMIT_CONFIG)
            : DEFAULT_SIMILAR_ALERTS_LIMIT;
    this.similarAlertsLookback =
        investigationConfig.hasPath(SIMILAR_ALERTS_LOOKBACK_CONFIG)
            ? investigationConfig.getDuration(SIMILAR_ALERTS_LOOKBACK_CONFIG)
            : DEFAULT_SIMILAR_ALERTS_LOOKBACK;
    this.correlationLookback =
        investigationConfig.hasPath(CORRELATION_LOOKBACK_CONFIG)
            ? investigationConfig.getDuration(CORRELATION_LOOKBACK_CONFIG)
            : DEFAULT_CORRELATION_LOOKBACK;
  }

  public InvestigationReport investigate(String alertId) {
    AnomalyAlert alert = alertManager.getAlert(alertId);
    Instant windowEnd = alert.getCreatedAt();
    Instant windowStart = windowEnd.minus(retention);

    List<MetricSample> historicalSeries =
        metricStore.getHistoricalWindow(alert.getMetricName(), windowStart, windowEnd);

    return InvestigationReport.builder()
        .alert(alert)
        .windowStart(windowStart)
        .windowEnd(windowEnd)
        .historicalSeries(historicalSeries)
        .similarPastAlerts(findSimilarAlerts(alert))
        .correlatedMetricsSnapshot(snapshotOtherMetrics(alert))
        .statusTimeline(buildTimeline(alert))
        .build();
  }

  private List<AnomalyAlert> findSimilarAlerts(AnomalyAlert alert) {
    AlertQuery query =
        AlertQuery.builder()
            .metricName(alert.getMetricName())
            .anomalyType(alert.getAnomalyType())
            .createdFrom(alert.getCreatedAt().minus(similarAlertsLookback))
            .createdTo(alert.getCreatedAt())
            // one extra in case the alert itself is in the page
            .limit(similarAlertsLimit + 1)
            .build();
    return alertManager.query(query).stream()
        .filter(candidate -> !candidate.getId().equals(alert.getId()))
        .limit(similarAlertsLimit)
        .collect(Collectors.toList());
  }

  private Map<String, Double> snapshotOtherMetrics(AnomalyAlert alert) {
    Instant at = alert.getCreatedAt();
    Map<String, Double> snapshot = new TreeMap<>();
    for (DetectionConfig config : configStore.listEnabledConfigs()) {
      String metricName = config.getMetricName();
      if (metricName.equals(alert.getMetricName())) {
        continue;
      }
      try {
        List<MetricSample> samples =
            metricStore.getHistoricalWindow(metricName, at.minus(correlationLookback), at);
        if (!samples.isEmpty()) {
          snapshot.put(metricName, samples.get(samples.size() - 1).getValue());
        }
      } catch (MetricStoreUnavailableException e) {
        LOGGER.warn(
            "Leaving {} out of the correlation snapshot for alert {}: {}",
            metricName,
            alert.getId(),
            e.getMessage());
      }
    }
    return snapshot;
  }

  static List<TimelineEntry> buildTimeline(AnomalyAlert alert) {
    return alert.getTransitions().stream()
        .map(transition -> toTimelineEntry(alert, transition))
        .collect(Collectors.toList());
  }

  private static TimelineEntry toTimelineEntry(AnomalyAlert alert, StatusTransition transition) {
    switch (transition.getStatus()) {
      case ACKNOWLEDGED:
        return new TimelineEntry(
            transition.getTimestamp(), EVENT_ACKNOWLEDGED, "By " + transition.getActor());
      case RESOLVED:
        String notes = transition.getNotes();
        return new TimelineEntry(
            transition.getTimestamp(),
            EVENT_RESOLVED,
            notes == null || notes.isBlank() ? NO_NOTES : notes);
      case ACTIVE:
      default:
        return new TimelineEntry(
            transition.getTimestamp(), EVENT_DETECTED, alert.getDescription());
    }
  }
}
