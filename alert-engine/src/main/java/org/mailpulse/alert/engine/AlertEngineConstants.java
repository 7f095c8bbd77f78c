package org.mailpulse.alert.engine;

public class AlertEngineConstants {
  public static final String ALERT_DEFINITION_SOURCE = "alertDefinitionSource";
  public static final String NOTIFICATION_CHANNELS_SOURCE = "notificationChannelsSource";

  public static final String JOB_NAME = "alert-evaluation";
  public static final String JOB_GROUP = "alerting";
  public static final String JOB_TRIGGER_NAME = "alert-evaluation-trigger";
  public static final String JOB_DATA_MAP_ALERT_ENGINE = "alertEngine";

  public static final String JOB_CONFIG = "job.config";
  public static final String JOB_CONFIG_JOB_SUFFIX = "jobSuffix";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";
  public static final String JOB_CONFIG_INTERVAL_MINUTES = "intervalMinutes";
  public static final String DEFAULT_JOB_SUFFIX = "mailpulse";
  public static final int DEFAULT_INTERVAL_MINUTES = 5;

  public static final String SCHEDULER_CONFIG = "scheduler";
  public static final String SCHEDULER_INSTANCE_NAME = "instanceName";
  public static final String SCHEDULER_THREAD_COUNT = "threadCount";
  public static final String DEFAULT_SCHEDULER_INSTANCE_NAME = "mailpulse-alert-engine";
  public static final int DEFAULT_SCHEDULER_THREAD_COUNT = 1;
}
