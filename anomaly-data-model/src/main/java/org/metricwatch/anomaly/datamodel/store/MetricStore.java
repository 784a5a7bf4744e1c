package org.metricwatch.anomaly.datamodel.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.metricwatch.anomaly.datamodel.MetricSample;

/**
 * Read-only access to the time-series store. Implementations signal connectivity problems with
 * {@link org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException}.
 */
public interface MetricStore {

  Optional<MetricSample> getLatestSample(String metricName);

  /** Samples with {@code from <= timestamp <= to}, ordered by timestamp. */
  List<MetricSample> getHistoricalWindow(String metricName, Instant from, Instant to);
}
