package org.metricwatch.anomaly.scheduler.job;

import com.typesafe.config.Config;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

/** Owns one Quartz job and its trigger for the lifetime of a scheduler. */
public interface JobManager {
  /** Builds the job and trigger from the detection config. Must run before {@link #startJob}. */
  void initJob(Config detectionConfig);

  void startJob(Scheduler scheduler) throws SchedulerException;

  void stopJob(Scheduler scheduler) throws SchedulerException;

  JobKey getJobKey();
}
