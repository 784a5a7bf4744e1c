package org.metricwatch.anomaly.scheduler.runner;

/** What happened to one metric during a tick. */
public enum MetricOutcome {
  NO_ANOMALY(false),
  ALERT_CREATED(false),
  SUPPRESSED(false),
  SKIPPED_NO_DATA(true),
  SKIPPED_INSUFFICIENT_DATA(true),
  SKIPPED_STORE_UNAVAILABLE(true),
  SKIPPED_TIMEOUT(true),
  FAILED(true);

  private final boolean skipped;

  MetricOutcome(boolean skipped) {
    this.skipped = skipped;
  }

  public boolean isSkipped() {
    return skipped;
  }

  public String getReason() {
    return name().toLowerCase().replace("skipped_", "");
  }
}
