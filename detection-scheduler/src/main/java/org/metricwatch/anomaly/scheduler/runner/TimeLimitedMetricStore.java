package org.metricwatch.anomaly.scheduler.runner;

import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.MetricStore;

/**
 * Bounds every metric store call. A timeout, an interrupt or any failure of the delegate surfaces
 * as {@link MetricStoreUnavailableException} for that metric only.
 */
public class TimeLimitedMetricStore implements MetricStore, AutoCloseable {

  private final MetricStore delegate;
  private final Duration timeout;
  private final ExecutorService executor;
  private final TimeLimiter timeLimiter;

  public TimeLimitedMetricStore(MetricStore delegate, Duration timeout) {
    this.delegate = delegate;
    this.timeout = timeout;
    this.executor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("metric-store-call-%d")
                .setDaemon(true)
                .build());
    this.timeLimiter = SimpleTimeLimiter.create(executor);
  }

  @Override
  public Optional<MetricSample> getLatestSample(String metricName) {
    return call(metricName, () -> delegate.getLatestSample(metricName));
  }

  @Override
  public List<MetricSample> getHistoricalWindow(String metricName, Instant from, Instant to) {
    return call(metricName, () -> delegate.getHistoricalWindow(metricName, from, to));
  }

  private <T> T call(String metricName, Callable<T> callable) {
    try {
      return timeLimiter.callWithTimeout(callable, timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new MetricStoreUnavailableException(
          metricName, String.format("metric store call timed out after %s", timeout), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MetricStoreUnavailableException(metricName, "interrupted", e);
    } catch (ExecutionException | UncheckedExecutionException e) {
      if (e.getCause() instanceof MetricStoreUnavailableException) {
        throw (MetricStoreUnavailableException) e.getCause();
      }
      throw new MetricStoreUnavailableException(
          metricName, "metric store call failed", e.getCause());
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
