package org.metricwatch.anomaly.engine;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.metricwatch.anomaly.alert.manager.AlertHistoryCooldownGate;
import org.metricwatch.anomaly.alert.manager.AlertManager;
import org.metricwatch.anomaly.alert.manager.investigation.InvestigationService;
import org.metricwatch.anomaly.alert.manager.store.AlertStoreProvider;
import org.metricwatch.anomaly.datamodel.config.source.DetectionConfigStoreProvider;
import org.metricwatch.anomaly.datamodel.metric.source.MetricStoreProvider;
import org.metricwatch.anomaly.datamodel.store.AlertStore;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;
import org.metricwatch.anomaly.datamodel.store.MetricStore;
import org.metricwatch.anomaly.detector.baseline.BaselineCalculator;
import org.metricwatch.anomaly.detector.dedup.CooldownGate;
import org.metricwatch.anomaly.detector.dedup.DedupCache;
import org.metricwatch.anomaly.detector.evaluator.EnsembleEvaluator;
import org.metricwatch.anomaly.notification.service.NotificationChannelsReader;
import org.metricwatch.anomaly.notification.service.NotificationDispatcher;
import org.metricwatch.anomaly.notification.service.channel.NotificationChannel;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSender;
import org.metricwatch.anomaly.notification.transport.webhook.http.HttpWithJsonSender;
import org.metricwatch.anomaly.scheduler.DetectionScheduler;
import org.metricwatch.anomaly.scheduler.runner.DetectionRunner;
import org.metricwatch.anomaly.scheduler.runner.TimeLimitedMetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds every component of one engine instance and drives their lifecycle: {@link #init()} wires
 * the components from the application config, {@link #start()} begins detection and {@link
 * #stop()} halts it and releases the worker threads.
 */
public class AnomalyEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyEngine.class);

  static final String DETECTION_CONFIG = "detection";
  static final String DEDUP_CONFIG = "dedup";
  static final String ENSEMBLE_CONFIG = "ensemble";
  static final String INVESTIGATION_CONFIG = "investigation";
  static final String NOTIFICATION_CONFIG = "notification";
  static final String SCHEDULER_CONFIG = "scheduler";
  static final String DETECTION_CONFIG_SOURCE = "detectionConfigSource";
  static final String METRIC_SOURCE = "metricSource";
  static final String ALERT_STORE = "alertStore";
  private static final String CHANNELS_SOURCE_CONFIG = "channelsSource";
  private static final String NOTIFICATION_TIMEOUT_CONFIG = "timeout";
  private static final String METRIC_STORE_TIMEOUT_CONFIG = "metricStoreTimeout";
  private static final Duration DEFAULT_METRIC_STORE_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration DISPATCH_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final Config appConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private DetectionConfigStore configStore;
  private MetricStore metricStore;
  private TimeLimitedMetricStore timeLimitedMetricStore;
  private AlertStore alertStore;
  private NotificationDispatcher dispatcher;
  private AlertManager alertManager;
  private DetectionRunner runner;
  private DetectionScheduler scheduler;
  private AnomalyManagementService managementService;

  public AnomalyEngine(Config appConfig) {
    this(appConfig, new SimpleMeterRegistry(), Clock.systemUTC());
  }

  public AnomalyEngine(Config appConfig, MeterRegistry meterRegistry, Clock clock) {
    this.appConfig = appConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public void init() {
    Config detectionConfig = subConfig(DETECTION_CONFIG);
    Config notificationConfig = subConfig(NOTIFICATION_CONFIG);

    configStore =
        DetectionConfigStoreProvider.getProvider(appConfig.getConfig(DETECTION_CONFIG_SOURCE));
    metricStore = MetricStoreProvider.getProvider(appConfig.getConfig(METRIC_SOURCE));
    timeLimitedMetricStore =
        new TimeLimitedMetricStore(
            metricStore,
            detectionConfig.hasPath(METRIC_STORE_TIMEOUT_CONFIG)
                ? detectionConfig.getDuration(METRIC_STORE_TIMEOUT_CONFIG)
                : DEFAULT_METRIC_STORE_TIMEOUT);
    alertStore = AlertStoreProvider.getProvider(appConfig.getConfig(ALERT_STORE));

    dispatcher = new NotificationDispatcher(notificationConfig, meterRegistry);
    dispatcher.registerAll(readNotificationChannels(notificationConfig));

    alertManager =
        new AlertManager(notificationConfig, alertStore, dispatcher, meterRegistry, clock);
    InvestigationService investigationService =
        new InvestigationService(
            subConfig(INVESTIGATION_CONFIG), alertManager, timeLimitedMetricStore, configStore);

    CooldownGate cooldownGate =
        new AlertHistoryCooldownGate(new DedupCache(subConfig(DEDUP_CONFIG), clock), alertStore);
    runner =
        new DetectionRunner(
            detectionConfig,
            configStore,
            timeLimitedMetricStore,
            new BaselineCalculator(detectionConfig),
            new EnsembleEvaluator(subConfig(ENSEMBLE_CONFIG)),
            cooldownGate,
            alertManager,
            meterRegistry,
            clock);
    scheduler = new DetectionScheduler(detectionConfig, subConfig(SCHEDULER_CONFIG), runner);

    managementService =
        new AnomalyManagementService(
            alertManager, investigationService, configStore, dispatcher, runner);
    LOGGER.info("Anomaly engine initialized");
  }

  public void start() {
    scheduler.start();
  }

  public void stop() {
    if (!scheduler.stop()) {
      LOGGER.warn("Detection was stopped while a tick was still running");
    }
    dispatcher.shutdown(DISPATCH_SHUTDOWN_TIMEOUT);
    runner.close();
    timeLimitedMetricStore.close();
    LOGGER.info("Anomaly engine stopped");
  }

  public AnomalyManagementService getManagementService() {
    return managementService;
  }

  public DetectionScheduler.State getState() {
    return scheduler.getState();
  }

  /** The underlying metric source, without the per-call timeout. */
  public MetricStore getMetricStore() {
    return metricStore;
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }

  @VisibleForTesting
  DetectionRunner getRunner() {
    return runner;
  }

  private List<NotificationChannel> readNotificationChannels(Config notificationConfig) {
    if (!notificationConfig.hasPath(CHANNELS_SOURCE_CONFIG)) {
      LOGGER.warn("No notification channels source configured, alerts will not be delivered");
      return List.of();
    }
    Duration timeout =
        notificationConfig.hasPath(NOTIFICATION_TIMEOUT_CONFIG)
            ? notificationConfig.getDuration(NOTIFICATION_TIMEOUT_CONFIG)
            : HttpWithJsonSender.DEFAULT_TIMEOUT;
    WebhookSender webhookSender = new WebhookSender(new HttpWithJsonSender(timeout));
    try {
      return new NotificationChannelsReader(
              notificationConfig.getConfig(CHANNELS_SOURCE_CONFIG), webhookSender)
          .readNotificationChannels();
    } catch (IOException e) {
      throw new RuntimeException("Unable to read notification channels", e);
    }
  }

  private Config subConfig(String path) {
    return appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty();
  }
}
