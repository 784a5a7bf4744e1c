package org.metricwatch.anomaly.scheduler.runner;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.metricwatch.anomaly.alert.manager.AlertManager;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.exception.AlertStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.exception.ConfigStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;
import org.metricwatch.anomaly.datamodel.store.MetricStore;
import org.metricwatch.anomaly.detector.baseline.BaselineCalculator;
import org.metricwatch.anomaly.detector.dedup.CooldownGate;
import org.metricwatch.anomaly.detector.evaluator.EnsembleEvaluator;
import org.metricwatch.anomaly.detector.evaluator.MetricWindowCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes detection ticks. Metrics of one tick are evaluated in parallel on a bounded pool; a
 * tick never overlaps another. When the config store or the alert store is down the runner halts
 * and waits out an exponentially growing backoff before the next tick does any work.
 */
public class DetectionRunner implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionRunner.class);

  private static final String RETENTION_CONFIG = "retention";
  private static final String WORKER_POOL_SIZE_CONFIG = "workerPoolSize";
  private static final String TICK_TIMEOUT_CONFIG = "tickTimeout";
  private static final String BACKOFF_INITIAL_CONFIG = "backoff.initial";
  private static final String BACKOFF_MAX_CONFIG = "backoff.max";
  private static final Duration DEFAULT_RETENTION = Duration.ofDays(30);
  private static final int DEFAULT_WORKER_POOL_SIZE = 4;
  private static final Duration DEFAULT_TICK_TIMEOUT = Duration.ofSeconds(50);
  private static final Duration DEFAULT_BACKOFF_INITIAL = Duration.ofSeconds(5);
  private static final Duration DEFAULT_BACKOFF_MAX = Duration.ofMinutes(5);

  static final String TICK_TIMER = "metricwatch.anomaly.detection.tick";
  static final String SUPPRESSED_COUNTER = "metricwatch.anomaly.candidates.suppressed";
  static final String SKIPPED_COUNTER = "metricwatch.anomaly.metric.skipped";

  private final DetectionConfigStore configStore;
  private final MetricStore metricStore;
  private final MetricWindowCache windowCache;
  private final BaselineCalculator baselineCalculator;
  private final EnsembleEvaluator ensembleEvaluator;
  private final CooldownGate cooldownGate;
  private final AlertManager alertManager;
  private final Clock clock;
  private final Duration retention;
  private final Duration tickTimeout;
  private final Duration backoffInitial;
  private final Duration backoffMax;
  private final ExecutorService workerPool;

  private final Timer tickTimer;
  private final Counter suppressedCounter;
  private final ConcurrentMap<String, Counter> skippedCounters = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;

  private final Semaphore tickPermit = new Semaphore(1);
  private final AtomicReference<DetectionSummary> lastSummary = new AtomicReference<>();
  private final List<Future<MetricOutcome>> inFlight = new ArrayList<>();
  private Duration currentBackoff;
  private Instant resumeAt;

  public DetectionRunner(
      Config detectionConfig,
      DetectionConfigStore configStore,
      MetricStore metricStore,
      BaselineCalculator baselineCalculator,
      EnsembleEvaluator ensembleEvaluator,
      CooldownGate cooldownGate,
      AlertManager alertManager,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.configStore = configStore;
    this.metricStore = metricStore;
    this.windowCache = new MetricWindowCache(metricStore);
    this.baselineCalculator = baselineCalculator;
    this.ensembleEvaluator = ensembleEvaluator;
    this.cooldownGate = cooldownGate;
    this.alertManager = alertManager;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.retention =
        detectionConfig.hasPath(RETENTION_CONFIG)
            ? detectionConfig.getDuration(RETENTION_CONFIG)
            : DEFAULT_RETENTION;
    this.tickTimeout =
        detectionConfig.hasPath(TICK_TIMEOUT_CONFIG)
            ? detectionConfig.getDuration(TICK_TIMEOUT_CONFIG)
            : DEFAULT_TICK_TIMEOUT;
    this.backoffInitial =
        detectionConfig.hasPath(BACKOFF_INITIAL_CONFIG)
            ? detectionConfig.getDuration(BACKOFF_INITIAL_CONFIG)
            : DEFAULT_BACKOFF_INITIAL;
    this.backoffMax =
        detectionConfig.hasPath(BACKOFF_MAX_CONFIG)
            ? detectionConfig.getDuration(BACKOFF_MAX_CONFIG)
            : DEFAULT_BACKOFF_MAX;
    int workerPoolSize =
        detectionConfig.hasPath(WORKER_POOL_SIZE_CONFIG)
            ? detectionConfig.getInt(WORKER_POOL_SIZE_CONFIG)
            : DEFAULT_WORKER_POOL_SIZE;
    this.workerPool =
        Executors.newFixedThreadPool(
            workerPoolSize,
            new ThreadFactoryBuilder()
                .setNameFormat("detection-worker-%d")
                .setDaemon(true)
                .build());
    this.currentBackoff = backoffInitial;
    this.tickTimer = meterRegistry.timer(TICK_TIMER);
    this.suppressedCounter = meterRegistry.counter(SUPPRESSED_COUNTER);
  }

  /**
   * Runs one tick unless another one is in progress or the runner is backing off.
   *
   * @return the tick's summary, empty when the tick was skipped
   */
  public Optional<DetectionSummary> runTick() {
    if (!tickPermit.tryAcquire()) {
      LOGGER.warn("Previous detection tick still running, skipping this one");
      return Optional.empty();
    }
    try {
      Instant now = clock.instant();
      if (resumeAt != null && now.isBefore(resumeAt)) {
        LOGGER.debug("Detection halted until {}, skipping tick", resumeAt);
        return Optional.empty();
      }
      DetectionSummary summary = tickTimer.record(() -> evaluateAll(now));
      lastSummary.set(summary);
      return Optional.of(summary);
    } finally {
      tickPermit.release();
    }
  }

  private DetectionSummary evaluateAll(Instant now) {
    DetectionSummary.DetectionSummaryBuilder summary =
        DetectionSummary.builder().startedAt(now);

    List<DetectionConfig> configs;
    try {
      configs = configStore.listEnabledConfigs();
    } catch (ConfigStoreUnavailableException e) {
      return halt(summary, now, "config store unavailable: " + e.getMessage(), e);
    }
    summary.metricsConfigured(configs.size());
    LOGGER.debug("Evaluating {} metrics at {}", configs.size(), now);

    List<Future<MetricOutcome>> futures = new ArrayList<>();
    synchronized (inFlight) {
      for (DetectionConfig config : configs) {
        futures.add(workerPool.submit(newTask(config, now)));
      }
      inFlight.addAll(futures);
    }

    int evaluated = 0;
    int skipped = 0;
    int candidates = 0;
    int created = 0;
    int suppressed = 0;
    AlertStoreUnavailableException alertStoreFailure = null;
    long deadline = System.nanoTime() + tickTimeout.toNanos();
    try {
      for (int i = 0; i < futures.size(); i++) {
        String metricName = configs.get(i).getMetricName();
        MetricOutcome outcome;
        try {
          long remaining = Math.max(0, deadline - System.nanoTime());
          outcome = futures.get(i).get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException e) {
          futures.get(i).cancel(true);
          LOGGER.warn("Evaluation of metric {} did not finish within the tick", metricName);
          outcome = MetricOutcome.SKIPPED_TIMEOUT;
        } catch (ExecutionException e) {
          if (e.getCause() instanceof AlertStoreUnavailableException) {
            alertStoreFailure = (AlertStoreUnavailableException) e.getCause();
          } else {
            LOGGER.error("Evaluation of metric {} failed", metricName, e.getCause());
          }
          outcome = MetricOutcome.FAILED;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          futures.forEach(future -> future.cancel(true));
          return halt(summary, now, "interrupted", e);
        }

        switch (outcome) {
          case ALERT_CREATED:
            candidates++;
            created++;
            evaluated++;
            break;
          case SUPPRESSED:
            candidates++;
            suppressed++;
            evaluated++;
            suppressedCounter.increment();
            break;
          case NO_ANOMALY:
            evaluated++;
            break;
          default:
            skipped++;
            skippedCounter(outcome.getReason()).increment();
        }
      }
    } finally {
      synchronized (inFlight) {
        inFlight.removeAll(futures);
      }
    }

    summary
        .metricsEvaluated(evaluated)
        .metricsSkipped(skipped)
        .candidates(candidates)
        .alertsCreated(created)
        .suppressed(suppressed);
    if (alertStoreFailure != null) {
      return halt(
          summary,
          now,
          "alert store unavailable: " + alertStoreFailure.getMessage(),
          alertStoreFailure);
    }

    resetBackoff();
    DetectionSummary result = summary.finishedAt(clock.instant()).build();
    LOGGER.info(
        "Detection tick done: {} evaluated, {} skipped, {} alerts created, {} suppressed",
        evaluated,
        skipped,
        created,
        suppressed);
    return result;
  }

  private MetricEvaluationTask newTask(DetectionConfig config, Instant now) {
    return new MetricEvaluationTask(
        config,
        now,
        retention,
        metricStore,
        windowCache,
        baselineCalculator,
        ensembleEvaluator,
        cooldownGate,
        alertManager);
  }

  private DetectionSummary halt(
      DetectionSummary.DetectionSummaryBuilder summary,
      Instant now,
      String reason,
      Exception cause) {
    resumeAt = now.plus(currentBackoff);
    LOGGER.error("Detection halted, {}. Retrying after {}", reason, resumeAt, cause);
    currentBackoff = currentBackoff.multipliedBy(2);
    if (currentBackoff.compareTo(backoffMax) > 0) {
      currentBackoff = backoffMax;
    }
    return summary.halted(true).haltReason(reason).finishedAt(clock.instant()).build();
  }

  private void resetBackoff() {
    if (resumeAt != null) {
      LOGGER.info("Detection resumed");
    }
    resumeAt = null;
    currentBackoff = backoffInitial;
  }

  private Counter skippedCounter(String reason) {
    return skippedCounters.computeIfAbsent(
        reason, k -> meterRegistry.counter(SKIPPED_COUNTER, "reason", k));
  }

  public Optional<DetectionSummary> getLastSummary() {
    return Optional.ofNullable(lastSummary.get());
  }

  /** Waits until no tick is running. */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    if (!tickPermit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return false;
    }
    tickPermit.release();
    return true;
  }

  /** Interrupts metric evaluations of the running tick, if any. */
  public void cancelInFlight() {
    synchronized (inFlight) {
      inFlight.forEach(future -> future.cancel(true));
    }
  }

  @VisibleForTesting
  Instant getResumeAt() {
    return resumeAt;
  }

  @Override
  public void close() {
    workerPool.shutdownNow();
  }
}
