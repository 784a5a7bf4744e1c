package org.metricwatch.anomaly.detector.baseline;

import com.typesafe.config.Config;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.InsufficientDataException;

/**
 * Summary statistics over a metric's historical window. Quartiles use linear interpolation
 * between closest ranks; the standard deviation is the population one.
 */
public class BaselineCalculator {
  public static final int DEFAULT_MIN_SAMPLES = 30;
  private static final String MIN_SAMPLES_CONFIG = "minSamples";

  private final int minSamples;

  public BaselineCalculator(int minSamples) {
    this.minSamples = minSamples;
  }

  public BaselineCalculator(Config detectionConfig) {
    this(
        detectionConfig.hasPath(MIN_SAMPLES_CONFIG)
            ? detectionConfig.getInt(MIN_SAMPLES_CONFIG)
            : DEFAULT_MIN_SAMPLES);
  }

  public int getMinSamples() {
    return minSamples;
  }

  public Baseline calculate(
      String metricName, List<MetricSample> samples, Instant windowStart, Instant windowEnd) {
    if (samples.size() < minSamples) {
      throw new InsufficientDataException(metricName, samples.size(), minSamples);
    }

    double[] sorted = samples.stream().mapToDouble(MetricSample::getValue).sorted().toArray();
    int n = sorted.length;
    Baseline.BaselineBuilder builder =
        Baseline.builder()
            .metricName(metricName)
            .sampleCount(n)
            .windowStart(windowStart)
            .windowEnd(windowEnd);

    // a constant window has no variance at all, skip the floating point noise of summation
    if (sorted[0] == sorted[n - 1]) {
      double constant = sorted[0];
      return builder
          .mean(constant)
          .stddev(0)
          .q1(constant)
          .q3(constant)
          .median(constant)
          .mad(0)
          .build();
    }

    double mean = Arrays.stream(sorted).sum() / n;
    double squaredDeviations = 0;
    for (double value : sorted) {
      squaredDeviations += (value - mean) * (value - mean);
    }
    double stddev = Math.sqrt(squaredDeviations / n);
    double median = percentile(sorted, 0.5);

    double[] absoluteDeviations =
        Arrays.stream(sorted).map(value -> Math.abs(value - median)).sorted().toArray();

    return builder
        .mean(mean)
        .stddev(stddev)
        .q1(percentile(sorted, 0.25))
        .q3(percentile(sorted, 0.75))
        .median(median)
        .mad(percentile(absoluteDeviations, 0.5))
        .build();
  }

  /** {@code sortedValues} must be ascending and non-empty. */
  static double percentile(double[] sortedValues, double fraction) {
    double rank = fraction * (sortedValues.length - 1);
    int lower = (int) Math.floor(rank);
    int upper = (int) Math.ceil(rank);
    if (lower == upper) {
      return sortedValues[lower];
    }
    return sortedValues[lower] + (rank - lower) * (sortedValues[upper] - sortedValues[lower]);
  }
}
