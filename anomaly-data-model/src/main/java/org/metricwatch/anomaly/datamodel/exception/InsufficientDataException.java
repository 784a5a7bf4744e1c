package org.metricwatch.anomaly.datamodel.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends AnomalyEngineException {
  private final String metricName;
  private final int sampleCount;
  private final int minSamples;

  public InsufficientDataException(String metricName, int sampleCount, int minSamples) {
    super(
        String.format(
            "Metric %s has %d samples in its window, %d required",
            metricName, sampleCount, minSamples));
    this.metricName = metricName;
    this.sampleCount = sampleCount;
    this.minSamples = minSamples;
  }
}
