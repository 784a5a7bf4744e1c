package org.metricwatch.anomaly.scheduler.job;

import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.DEFAULT_INTERVAL_SECONDS;
import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.DETECTION_CRON_EXPRESSION;
import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.DETECTION_INTERVAL;
import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.JOB_GROUP;
import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.JOB_NAME;
import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.JOB_TRIGGER_NAME;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Set;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules the detection job on a fixed interval, or on a cron expression when one is
 * configured. Misfired ticks are dropped rather than replayed.
 */
public class DetectionJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionJobManager.class);

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  @Override
  public void initJob(Config detectionConfig) {
    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);
    jobDetail = JobBuilder.newJob(DetectionJob.class).withIdentity(jobKey).storeDurably().build();

    TriggerBuilder<Trigger> triggerBuilder =
        TriggerBuilder.newTrigger().withIdentity(JOB_TRIGGER_NAME, JOB_GROUP).forJob(jobKey);
    if (detectionConfig.hasPath(DETECTION_CRON_EXPRESSION)) {
      String cronExpression = detectionConfig.getString(DETECTION_CRON_EXPRESSION);
      jobTrigger =
          triggerBuilder
              .withSchedule(
                  CronScheduleBuilder.cronSchedule(cronExpression)
                      .withMisfireHandlingInstructionDoNothing())
              .startNow()
              .build();
    } else {
      Duration interval =
          detectionConfig.hasPath(DETECTION_INTERVAL)
              ? detectionConfig.getDuration(DETECTION_INTERVAL)
              : Duration.ofSeconds(DEFAULT_INTERVAL_SECONDS);
      jobTrigger =
          triggerBuilder
              .withSchedule(
                  SimpleScheduleBuilder.simpleSchedule()
                      .withIntervalInMilliseconds(interval.toMillis())
                      .repeatForever()
                      .withMisfireHandlingInstructionNextWithRemainingCount())
              .startNow()
              .build();
    }
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    // replace: with a clustered job store another replica may have scheduled it already
    scheduler.scheduleJob(jobDetail, Set.of(jobTrigger), true);
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    // a shared job store keeps the job for the remaining replicas
    if (scheduler.getMetaData().isJobStoreClustered()) {
      return;
    }
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
  }

  @Override
  public JobKey getJobKey() {
    return jobKey;
  }
}
