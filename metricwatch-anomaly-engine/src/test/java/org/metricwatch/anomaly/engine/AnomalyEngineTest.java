package org.metricwatch.anomaly.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.AlertQuery;
import org.metricwatch.anomaly.datamodel.AlertStatistics;
import org.metricwatch.anomaly.datamodel.AlertStatus;
import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.AnomalyAlert;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.InvestigationReport;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.Severity;
import org.metricwatch.anomaly.datamodel.exception.AlertConflictException;
import org.metricwatch.anomaly.datamodel.exception.InvalidDetectionConfigException;
import org.metricwatch.anomaly.datamodel.metric.source.InMemoryMetricStore;
import org.metricwatch.anomaly.scheduler.DetectionScheduler;
import org.metricwatch.anomaly.scheduler.runner.DetectionSummary;

class AnomalyEngineTest {

  private static final String ENGINE_CONFIG =
      "detection { interval = 1h, minSamples = 30 }\n"
          + "notification.channelsSource { type = fs, fs.path = \"engine-channels.json\" }\n"
          + "detectionConfigSource.type = memory\n"
          + "metricSource.type = memory\n"
          + "alertStore.type = memory\n";

  private AnomalyEngine engine;
  private AnomalyManagementService service;

  @BeforeEach
  void setUp() {
    Config appConfig = ConfigFactory.parseString(ENGINE_CONFIG);
    engine = new AnomalyEngine(appConfig);
    engine.init();
    service = engine.getManagementService();
  }

  @AfterEach
  void tearDown() {
    engine.stop();
  }

  @Test
  void testDetectedAnomalyThroughManagementOperations() throws Exception {
    service.updateConfig(
        "revenue",
        DetectionConfig.builder()
            .sensitivity(9)
            .algorithm(Algorithm.ZSCORE)
            .alertChannel("dashboard")
            .build());
    seedSpike((InMemoryMetricStore) engine.getMetricStore(), "revenue");

    CountDownLatch delivered = new CountDownLatch(1);
    AtomicReference<AlertPayload> received = new AtomicReference<>();
    service.subscribe(
        "dashboard",
        payload -> {
          received.set(payload);
          delivered.countDown();
        });

    DetectionSummary summary = engine.getRunner().runTick().orElseThrow();
    assertEquals(1, summary.getAlertsCreated());
    assertEquals(summary, service.getLastDetectionSummary().orElseThrow());

    assertTrue(delivered.await(5, TimeUnit.SECONDS));
    assertEquals("revenue", received.get().getMetricName());
    assertEquals(Severity.CRITICAL, received.get().getSeverity());

    List<AnomalyAlert> active = service.getActiveAlerts(AlertQuery.builder().build());
    assertEquals(1, active.size());
    String alertId = active.get(0).getId();
    assertEquals(alertId, received.get().getAlertId());

    InvestigationReport report = service.investigate(alertId);
    assertEquals(61, report.getHistoricalSeries().size());
    assertTrue(report.getSimilarPastAlerts().isEmpty());

    assertEquals(AlertStatus.ACKNOWLEDGED, service.acknowledge(alertId, "oncall").getStatus());
    assertEquals(
        AlertStatus.RESOLVED, service.resolve(alertId, "bad deploy rolled back").getStatus());
    assertThrows(AlertConflictException.class, () -> service.resolve(alertId, "again"));
    assertTrue(service.getActiveAlerts(AlertQuery.builder().build()).isEmpty());

    Instant now = Instant.now();
    AlertStatistics statistics =
        service.getStatistics(now.minus(Duration.ofHours(1)), now.plus(Duration.ofHours(1)));
    assertEquals(1, statistics.getTotal());
    assertEquals(1, statistics.getResolved());
    assertEquals(1L, statistics.getBySeverity().get(Severity.CRITICAL));
  }

  @Test
  void testUpdateConfigValidation() {
    assertThrows(
        InvalidDetectionConfigException.class,
        () ->
            service.updateConfig(
                "revenue",
                DetectionConfig.builder().sensitivity(11).algorithm(Algorithm.ZSCORE).build()));
    assertThrows(
        InvalidDetectionConfigException.class,
        () -> service.updateConfig("revenue", DetectionConfig.builder().sensitivity(5).build()));
    assertThrows(
        InvalidDetectionConfigException.class,
        () ->
            service.updateConfig(
                "revenue",
                DetectionConfig.builder()
                    .metricName("latency")
                    .sensitivity(5)
                    .algorithm(Algorithm.MAD)
                    .build()));
    assertTrue(service.getConfig("revenue").isEmpty());

    DetectionConfig stored =
        service.updateConfig(
            "revenue",
            DetectionConfig.builder().enabled(false).sensitivity(5).build());
    assertEquals("revenue", stored.getMetricName());
    assertEquals(stored, service.getConfig("revenue").orElseThrow());
  }

  @Test
  void testSubscribeRequiresPushStreamChannel() {
    assertThrows(IllegalArgumentException.class, () -> service.subscribe("ops-slack", p -> {}));
  }

  @Test
  void testStartAndStop() {
    assertEquals(DetectionScheduler.State.STOPPED, engine.getState());
    engine.start();
    assertEquals(DetectionScheduler.State.RUNNING, engine.getState());
  }

  private static void seedSpike(InMemoryMetricStore metricStore, String metricName) {
    Instant latest = Instant.now().minusSeconds(1);
    List<MetricSample> samples = new ArrayList<>();
    for (int i = 60; i >= 1; i--) {
      samples.add(
          MetricSample.of(metricName, latest.minusSeconds(60L * i), i % 2 == 0 ? 0.8 : 1.2));
    }
    samples.add(MetricSample.of(metricName, latest, 3.0));
    metricStore.addSamples(samples);
  }
}
