package org.metricwatch.anomaly.detector.dedup;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.lang3.tuple.Pair;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local cooldown gate. Every entry lives exactly as long as the cooldown it was accepted
 * with; expired entries are purged at most once per sweep interval.
 */
public class DedupCache implements CooldownGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(DedupCache.class);
  private static final String SWEEP_INTERVAL_CONFIG = "sweepInterval";
  private static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

  // key <metricName, anomalyType>, value is the end of the running cooldown
  private final ConcurrentMap<Pair<String, AnomalyType>, Instant> cooldownUntil =
      new ConcurrentHashMap<>();
  private final Duration sweepInterval;
  private final Clock clock;
  private final AtomicReference<Instant> nextSweep = new AtomicReference<>(Instant.MIN);

  public DedupCache(Config dedupConfig, Clock clock) {
    this(
        dedupConfig.hasPath(SWEEP_INTERVAL_CONFIG)
            ? dedupConfig.getDuration(SWEEP_INTERVAL_CONFIG)
            : DEFAULT_SWEEP_INTERVAL,
        clock);
  }

  public DedupCache(Duration sweepInterval, Clock clock) {
    this.sweepInterval = sweepInterval;
    this.clock = clock;
  }

  @Override
  public boolean tryAcquire(
      String metricName, AnomalyType anomalyType, long cooldownSeconds, Instant now) {
    purgeExpiredIfDue(now);
    AtomicBoolean accepted = new AtomicBoolean(false);
    cooldownUntil.compute(
        Pair.of(metricName, anomalyType),
        (key, until) -> {
          if (until != null && now.isBefore(until)) {
            return until;
          }
          accepted.set(true);
          return now.plusSeconds(cooldownSeconds);
        });
    if (!accepted.get()) {
      LOGGER.debug(
          "Suppressed {} anomaly for metric {} within cooldown of {}s",
          anomalyType,
          metricName,
          cooldownSeconds);
    }
    return accepted.get();
  }

  @Override
  public void release(String metricName, AnomalyType anomalyType) {
    cooldownUntil.remove(Pair.of(metricName, anomalyType));
  }

  private void purgeExpiredIfDue(Instant now) {
    Instant due = nextSweep.get();
    if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(sweepInterval))) {
      return;
    }
    purgeExpired(now);
  }

  // conditional removal, an entry refreshed concurrently keeps its new value
  private void purgeExpired(Instant now) {
    cooldownUntil.entrySet().removeIf(entry -> !now.isBefore(entry.getValue()));
  }

  @VisibleForTesting
  long size() {
    purgeExpired(clock.instant());
    return cooldownUntil.size();
  }
}
