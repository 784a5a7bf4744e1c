package org.metricwatch.anomaly.scheduler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.metricwatch.anomaly.scheduler.job.DetectionJobConstants;
import org.metricwatch.anomaly.scheduler.job.DetectionJobManager;
import org.metricwatch.anomaly.scheduler.job.JobManager;
import org.metricwatch.anomaly.scheduler.runner.DetectionRunner;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the detection loop: {@code STOPPED -> RUNNING -> STOPPED}. A fresh Quartz scheduler is
 * created on every start, so the scheduler can be restarted after a stop.
 */
public class DetectionScheduler {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionScheduler.class);

  private static final String STOP_TIMEOUT_CONFIG = "stopTimeout";
  private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);
  private static final String QUARTZ_CONFIG = "quartz";
  private static final String INSTANCE_NAME_PROPERTY = "org.quartz.scheduler.instanceName";
  private static final String THREAD_COUNT_PROPERTY = "org.quartz.threadPool.threadCount";
  private static final String JOB_STORE_CLASS_PROPERTY = "org.quartz.jobStore.class";
  private static final String SKIP_UPDATE_CHECK_PROPERTY = "org.quartz.scheduler.skipUpdateCheck";

  public enum State {
    STOPPED,
    RUNNING
  }

  private final Config detectionConfig;
  private final Properties quartzProperties;
  private final DetectionRunner runner;
  private final Duration stopTimeout;
  private Scheduler scheduler;
  private JobManager jobManager;
  private volatile State state = State.STOPPED;

  public DetectionScheduler(
      Config detectionConfig, Config schedulerConfig, DetectionRunner runner) {
    this.detectionConfig = detectionConfig;
    this.runner = runner;
    this.quartzProperties = toQuartzProperties(schedulerConfig);
    this.stopTimeout =
        detectionConfig.hasPath(STOP_TIMEOUT_CONFIG)
            ? detectionConfig.getDuration(STOP_TIMEOUT_CONFIG)
            : DEFAULT_STOP_TIMEOUT;
  }

  static Properties toQuartzProperties(Config schedulerConfig) {
    Properties properties = new Properties();
    properties.setProperty(INSTANCE_NAME_PROPERTY, "MetricwatchDetectionScheduler");
    properties.setProperty(THREAD_COUNT_PROPERTY, "1");
    properties.setProperty(JOB_STORE_CLASS_PROPERTY, "org.quartz.simpl.RAMJobStore");
    properties.setProperty(SKIP_UPDATE_CHECK_PROPERTY, "true");
    if (schedulerConfig.hasPath(QUARTZ_CONFIG)) {
      for (Map.Entry<String, ConfigValue> entry :
          schedulerConfig.getConfig(QUARTZ_CONFIG).entrySet()) {
        String key = String.join(".", ConfigUtil.splitPath(entry.getKey()));
        properties.setProperty(key, String.valueOf(entry.getValue().unwrapped()));
      }
    }
    return properties;
  }

  public synchronized void start() {
    if (state == State.RUNNING) {
      LOGGER.warn("Detection scheduler already running");
      return;
    }
    try {
      scheduler = new StdSchedulerFactory(quartzProperties).getScheduler();
      scheduler.getContext().put(DetectionJobConstants.SCHEDULER_CONTEXT_RUNNER, runner);
      jobManager = new DetectionJobManager();
      jobManager.initJob(detectionConfig);
      jobManager.startJob(scheduler);
      scheduler.start();
    } catch (SchedulerException e) {
      throw new RuntimeException("Unable to start the detection scheduler", e);
    }
    state = State.RUNNING;
    LOGGER.info("Detection scheduler started");
  }

  /**
   * Stops triggering new ticks and waits up to the stop timeout for the running one. Work still
   * running after the timeout is interrupted. Safe to call from any thread.
   *
   * @return false when the in-flight tick had to be abandoned
   */
  public synchronized boolean stop() {
    if (state == State.STOPPED) {
      return true;
    }
    boolean clean;
    try {
      scheduler.standby();
      clean = runner.awaitIdle(stopTimeout);
      if (!clean) {
        LOGGER.warn("Detection tick did not finish within {}, abandoning it", stopTimeout);
        runner.cancelInFlight();
      }
      jobManager.stopJob(scheduler);
    } catch (SchedulerException e) {
      LOGGER.error("Error while stopping the detection job", e);
      clean = false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      runner.cancelInFlight();
      clean = false;
    }
    try {
      scheduler.shutdown(false);
    } catch (SchedulerException e) {
      LOGGER.error("Error while shutting down the detection scheduler", e);
      clean = false;
    }
    state = State.STOPPED;
    LOGGER.info("Detection scheduler stopped");
    return clean;
  }

  public State getState() {
    return state;
  }
}
