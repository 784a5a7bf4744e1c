package org.metricwatch.anomaly.detector.dedup;

import java.time.Instant;
import org.metricwatch.anomaly.datamodel.AnomalyType;

/** Admits at most one alert per (metric, anomaly type) within a cooldown. */
public interface CooldownGate {

  /**
   * Atomically checks the cooldown for the pair and, when it has elapsed (or never started),
   * starts a new one at {@code now}.
   *
   * @return true when the candidate may proceed
   */
  boolean tryAcquire(String metricName, AnomalyType anomalyType, long cooldownSeconds, Instant now);

  /** Forgets the pair, e.g. when the accepted candidate could not be persisted. */
  void release(String metricName, AnomalyType anomalyType);
}
