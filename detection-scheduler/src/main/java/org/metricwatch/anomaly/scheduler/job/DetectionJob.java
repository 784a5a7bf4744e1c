package org.metricwatch.anomaly.scheduler.job;

import static org.metricwatch.anomaly.scheduler.job.DetectionJobConstants.SCHEDULER_CONTEXT_RUNNER;

import java.util.Optional;
import org.metricwatch.anomaly.scheduler.runner.DetectionRunner;
import org.metricwatch.anomaly.scheduler.runner.DetectionSummary;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quartz entry point for one detection tick. The runner is looked up in the scheduler context,
 * which stays local to the process even with a clustered job store.
 */
@DisallowConcurrentExecution
public class DetectionJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) throws JobExecutionException {
    LOGGER.debug("Starting detection job: {}", jobExecutionContext.getJobDetail().getKey());
    DetectionRunner runner;
    try {
      runner =
          (DetectionRunner)
              jobExecutionContext.getScheduler().getContext().get(SCHEDULER_CONTEXT_RUNNER);
    } catch (SchedulerException e) {
      throw new JobExecutionException("Unable to read the scheduler context", e);
    }
    if (runner == null) {
      throw new JobExecutionException("No detection runner registered in the scheduler context");
    }

    Optional<DetectionSummary> summary = runner.runTick();
    summary.ifPresent(s -> LOGGER.debug("Detection job finished: {}", s));
  }
}
