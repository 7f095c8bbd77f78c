package org.mailpulse.alert.engine.job;

import static org.mailpulse.alert.engine.AlertEngineConstants.DEFAULT_INTERVAL_MINUTES;
import static org.mailpulse.alert.engine.AlertEngineConstants.DEFAULT_JOB_SUFFIX;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_CONFIG;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_CONFIG_INTERVAL_MINUTES;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_CONFIG_JOB_SUFFIX;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_DATA_MAP_ALERT_ENGINE;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_GROUP;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_NAME;
import static org.mailpulse.alert.engine.AlertEngineConstants.JOB_TRIGGER_NAME;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.StringJoiner;
import org.mailpulse.alert.engine.AlertEngine;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
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
 * Schedules {@link AlertEvaluationJob}. A {@code cronExpression} in the job config wins over
 * {@code intervalMinutes}; without either the pass runs every {@value
 * org.mailpulse.alert.engine.AlertEngineConstants#DEFAULT_INTERVAL_MINUTES} minutes.
 */
public class AlertEvaluationJobManager implements JobManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEvaluationJobManager.class);

  private final AlertEngine alertEngine;
  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;

  public AlertEvaluationJobManager(AlertEngine alertEngine) {
    this.alertEngine = alertEngine;
  }

  @Override
  public void initJob(Config appConfig) {
    Config jobConfig =
        appConfig.hasPath(JOB_CONFIG) ? appConfig.getConfig(JOB_CONFIG) : ConfigFactory.empty();

    LOGGER.info("Alert evaluation job config {}", jobConfig);

    String jobSuffix =
        jobConfig.hasPath(JOB_CONFIG_JOB_SUFFIX)
            ? jobConfig.getString(JOB_CONFIG_JOB_SUFFIX)
            : DEFAULT_JOB_SUFFIX;
    String jobGroup = new StringJoiner(".").add(JOB_GROUP).add(jobSuffix).toString();

    jobKey = JobKey.jobKey(JOB_NAME, jobGroup);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ALERT_ENGINE, alertEngine);

    jobDetail =
        JobBuilder.newJob(AlertEvaluationJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    TriggerBuilder<Trigger> triggerBuilder =
        TriggerBuilder.newTrigger().withIdentity(JOB_TRIGGER_NAME, jobGroup).startNow();
    if (jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)) {
      jobTrigger =
          triggerBuilder
              .withSchedule(
                  CronScheduleBuilder.cronSchedule(jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)))
              .build();
    } else {
      int intervalMinutes =
          jobConfig.hasPath(JOB_CONFIG_INTERVAL_MINUTES)
              ? jobConfig.getInt(JOB_CONFIG_INTERVAL_MINUTES)
              : DEFAULT_INTERVAL_MINUTES;
      jobTrigger =
          triggerBuilder
              .withSchedule(
                  SimpleScheduleBuilder.simpleSchedule()
                      .withIntervalInMinutes(intervalMinutes)
                      .repeatForever()
                      .withMisfireHandlingInstructionNextWithRemainingCount())
              .build();
    }
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.interrupt(jobKey);
      scheduler.deleteJob(jobKey);
    }
  }

  public JobKey getJobKey() {
    return jobKey;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }
}
