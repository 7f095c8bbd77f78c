package org.mailpulse.alert.engine;

import static org.mailpulse.alert.engine.AlertEngineConstants.DEFAULT_SCHEDULER_INSTANCE_NAME;
import static org.mailpulse.alert.engine.AlertEngineConstants.DEFAULT_SCHEDULER_THREAD_COUNT;
import static org.mailpulse.alert.engine.AlertEngineConstants.SCHEDULER_CONFIG;
import static org.mailpulse.alert.engine.AlertEngineConstants.SCHEDULER_INSTANCE_NAME;
import static org.mailpulse.alert.engine.AlertEngineConstants.SCHEDULER_THREAD_COUNT;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.Properties;
import org.mailpulse.alert.engine.job.AlertEvaluationJobManager;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the Quartz scheduler that periodically runs a pass of the {@link AlertEngine}. One loop per
 * engine, built once and started explicitly.
 */
public class SchedulerLoop {
  private static final Logger LOGGER = LoggerFactory.getLogger(SchedulerLoop.class);

  private final Scheduler scheduler;
  private final AlertEvaluationJobManager jobManager;

  public SchedulerLoop(AlertEngine alertEngine, Config appConfig) {
    Config schedulerConfig =
        appConfig.hasPath(SCHEDULER_CONFIG)
            ? appConfig.getConfig(SCHEDULER_CONFIG)
            : ConfigFactory.empty();
    try {
      this.scheduler = new StdSchedulerFactory(quartzProperties(schedulerConfig)).getScheduler();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
    this.jobManager = new AlertEvaluationJobManager(alertEngine);
    jobManager.initJob(appConfig);
  }

  public void start() {
    try {
      jobManager.startJob(scheduler);
      scheduler.start();
      LOGGER.info("Scheduler loop {} started", scheduler.getSchedulerName());
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  /** Runs a pass right away, outside the schedule. Queued behind a pass already running. */
  public void triggerNow() {
    try {
      scheduler.triggerJob(jobManager.getJobKey());
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  /** Aborts the running pass between two definitions and shuts the scheduler down. */
  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown(true);
      LOGGER.info("Scheduler loop stopped");
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public boolean isRunning() {
    try {
      return scheduler.isStarted() && !scheduler.isShutdown();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  static Properties quartzProperties(Config schedulerConfig) {
    Properties properties = new Properties();
    properties.setProperty(
        StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME,
        schedulerConfig.hasPath(SCHEDULER_INSTANCE_NAME)
            ? schedulerConfig.getString(SCHEDULER_INSTANCE_NAME)
            : DEFAULT_SCHEDULER_INSTANCE_NAME);
    properties.setProperty(
        "org.quartz.threadPool.threadCount",
        String.valueOf(
            schedulerConfig.hasPath(SCHEDULER_THREAD_COUNT)
                ? schedulerConfig.getInt(SCHEDULER_THREAD_COUNT)
                : DEFAULT_SCHEDULER_THREAD_COUNT));
    properties.setProperty(
        StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
    properties.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
    return properties;
  }
}
