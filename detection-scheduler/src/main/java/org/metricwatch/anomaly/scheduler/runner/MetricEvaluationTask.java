package org.metricwatch.anomaly.scheduler.runner;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.alert.manager.AlertManager;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.AlertStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.exception.InsufficientDataException;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.MetricStore;
import org.metricwatch.anomaly.detector.baseline.BaselineCalculator;
import org.metricwatch.anomaly.detector.dedup.CooldownGate;
import org.metricwatch.anomaly.detector.evaluator.AnomalyCandidate;
import org.metricwatch.anomaly.detector.evaluator.EnsembleEvaluator;
import org.metricwatch.anomaly.detector.evaluator.MetricWindowCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full pipeline for one metric: latest sample, baseline window, ensemble, cooldown gate
 * and alert creation. Only alert store failures escape; everything else becomes an outcome.
 */
class MetricEvaluationTask implements Callable<MetricOutcome> {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricEvaluationTask.class);

  private final DetectionConfig config;
  private final Instant now;
  private final Duration retention;
  private final MetricStore metricStore;
  private final MetricWindowCache windowCache;
  private final BaselineCalculator baselineCalculator;
  private final EnsembleEvaluator ensembleEvaluator;
  private final CooldownGate cooldownGate;
  private final AlertManager alertManager;

  MetricEvaluationTask(
      DetectionConfig config,
      Instant now,
      Duration retention,
      MetricStore metricStore,
      MetricWindowCache windowCache,
      BaselineCalculator baselineCalculator,
      EnsembleEvaluator ensembleEvaluator,
      CooldownGate cooldownGate,
      AlertManager alertManager) {
    this.config = config;
    this.now = now;
    this.retention = retention;
    this.metricStore = metricStore;
    this.windowCache = windowCache;
    this.baselineCalculator = baselineCalculator;
    this.ensembleEvaluator = ensembleEvaluator;
    this.cooldownGate = cooldownGate;
    this.alertManager = alertManager;
  }

  @Override
  public MetricOutcome call() {
    String metricName = config.getMetricName();
    try {
      Optional<MetricSample> latest = metricStore.getLatestSample(metricName);
      if (latest.isEmpty()) {
        LOGGER.info("No samples for metric {}, skipping", metricName);
        return MetricOutcome.SKIPPED_NO_DATA;
      }
      MetricSample sample = latest.get();

      Instant windowStart = now.minus(retention);
      // the sample under evaluation must not be part of its own baseline
      List<MetricSample> window =
          windowCache.getHistoricalWindow(metricName, windowStart, now).stream()
              .filter(s -> s.getTimestamp().isBefore(sample.getTimestamp()))
              .collect(Collectors.toList());
      Baseline baseline = baselineCalculator.calculate(metricName, window, windowStart, now);

      Optional<AnomalyCandidate> candidate = ensembleEvaluator.evaluate(config, sample, baseline);
      if (candidate.isEmpty()) {
        return MetricOutcome.NO_ANOMALY;
      }
      return admit(candidate.get());
    } catch (InsufficientDataException e) {
      LOGGER.info("Skipping metric {}: {}", metricName, e.getMessage());
      return MetricOutcome.SKIPPED_INSUFFICIENT_DATA;
    } catch (MetricStoreUnavailableException e) {
      LOGGER.warn("Skipping metric {}, metric store unavailable: {}", metricName, e.getMessage());
      return MetricOutcome.SKIPPED_STORE_UNAVAILABLE;
    } catch (AlertStoreUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Evaluation of metric {} failed", metricName, e);
      return MetricOutcome.FAILED;
    }
  }

  private MetricOutcome admit(AnomalyCandidate candidate) {
    if (!cooldownGate.tryAcquire(
        candidate.getMetricName(),
        candidate.getAnomalyType(),
        config.getCooldownSeconds(),
        now)) {
      return MetricOutcome.SUPPRESSED;
    }
    try {
      alertManager.create(candidate, config.getAlertChannels());
    } catch (RuntimeException e) {
      // not persisted, free the cooldown slot
      cooldownGate.release(candidate.getMetricName(), candidate.getAnomalyType());
      throw e;
    }
    return MetricOutcome.ALERT_CREATED;
  }
}
