package org.metricwatch.anomaly.scheduler.job;

public class DetectionJobConstants {
  public static final String JOB_NAME = "metric-detection";
  public static final String JOB_GROUP = "anomaly-detection";
  public static final String JOB_TRIGGER_NAME = "metric-detection-trigger";

  public static final String SCHEDULER_CONTEXT_RUNNER = "detectionRunner";

  public static final String DETECTION_INTERVAL = "interval";
  public static final String DETECTION_CRON_EXPRESSION = "cronExpression";
  public static final long DEFAULT_INTERVAL_SECONDS = 60;

  private DetectionJobConstants() {}
}
