package org.metricwatch.anomaly.engine;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.metricwatch.anomaly.alert.manager.AlertManager;
import org.metricwatch.anomaly.alert.manager.investigation.InvestigationService;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AlertStatistics;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.DetectionConfigValidator;
import org.metricwatch.anomaly.datamodel.InvestigationReport;
import org.metricwatch.anomaly.datamodel.exception.InvalidDetectionConfigException;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;
import org.metricwatch.anomaly.notification.service.NotificationDispatcher;
import org.metricwatch.anomaly.notification.service.channel.NotificationChannel;
import org.metricwatch.anomaly.notification.service.channel.PushStreamNotificationChannel;
import org.metricwatch.anomaly.scheduler.runner.DetectionRunner;
import org.metricwatch.anomaly.scheduler.runner.DetectionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations offered to an outer HTTP or CLI layer. Callers get {@code AlertNotFoundException},
 * {@code AlertConflictException} or {@link InvalidDetectionConfigException} for requests they
 * have to correct.
 */
public class AnomalyManagementService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyManagementService.class);

  private final AlertManager alertManager;
  private final InvestigationService investigationService;
  private final DetectionConfigStore configStore;
  private final NotificationDispatcher dispatcher;
  private final DetectionRunner runner;

  AnomalyManagementService(
      AlertManager alertManager,
      InvestigationService investigationService,
      DetectionConfigStore configStore,
      NotificationDispatcher dispatcher,
      DetectionRunner runner) {
    this.alertManager = alertManager;
    this.investigationService = investigationService;
    this.configStore = configStore;
    this.dispatcher = dispatcher;
    this.runner = runner;
  }

  public List<AnomalyAlert> getActiveAlerts(AlertQuery filters) {
    return alertManager.getActiveAlerts(filters);
  }

  public List<AnomalyAlert> getHistory(Instant from, Instant to, AlertQuery filters) {
    return alertManager.getHistory(from, to, filters);
  }

  public List<AnomalyAlert> query(AlertQuery query) {
    return alertManager.query(query);
  }

  public AlertStatistics getStatistics(Instant from, Instant to) {
    return alertManager.getStatistics(from, to);
  }

  public AnomalyAlert getAlert(String alertId) {
    return alertManager.getAlert(alertId);
  }

  public InvestigationReport investigate(String alertId) {
    return investigationService.investigate(alertId);
  }

  public AnomalyAlert acknowledge(String alertId, String actor, long expectedVersion) {
    return alertManager.acknowledge(alertId, actor, expectedVersion);
  }

  /** Acknowledges against the currently stored version. */
  public AnomalyAlert acknowledge(String alertId, String actor) {
    return acknowledge(alertId, actor, alertManager.getAlert(alertId).getVersion());
  }

  public AnomalyAlert resolve(String alertId, String notes, long expectedVersion) {
    return alertManager.resolve(alertId, notes, expectedVersion);
  }

  /** Resolves against the currently stored version. */
  public AnomalyAlert resolve(String alertId, String notes) {
    return resolve(alertId, notes, alertManager.getAlert(alertId).getVersion());
  }

  public Optional<DetectionConfig> getConfig(String metricName) {
    return configStore.getConfig(metricName);
  }

  /**
   * Validates and stores the config for {@code metricName}. A config without a metric name takes
   * the given one. The change is picked up by the next detection tick.
   */
  public DetectionConfig updateConfig(String metricName, DetectionConfig config) {
    DetectionConfig named =
        config.getMetricName() == null ? config.toBuilder().metricName(metricName).build() : config;
    if (!named.getMetricName().equals(metricName)) {
      throw new InvalidDetectionConfigException(
          metricName,
          List.of(
              String.format(
                  "metricName %s does not match the updated metric", named.getMetricName())));
    }
    DetectionConfigValidator.validate(named);
    configStore.upsertConfig(named);
    LOGGER.info("Updated detection config for metric {}", metricName);
    return named;
  }

  public Optional<DetectionSummary> getLastDetectionSummary() {
    return runner.getLastSummary();
  }

  /**
   * Registers a listener on a push-stream channel.
   *
   * @return a handle that removes the listener again
   * @throws IllegalArgumentException when no push-stream channel has the given id
   */
  public Runnable subscribe(String channelId, Consumer<AlertPayload> listener) {
    Optional<NotificationChannel> channel = dispatcher.getChannel(channelId);
    if (channel.isEmpty() || !(channel.get() instanceof PushStreamNotificationChannel)) {
      throw new IllegalArgumentException("No push-stream channel with id " + channelId);
    }
    return ((PushStreamNotificationChannel) channel.get()).subscribe(listener);
  }
}
