package org.mailpulse.alert.engine.job;

import java.time.Duration;
import java.time.Instant;
import org.mailpulse.alert.engine.AlertEngine;
import org.mailpulse.alert.engine.AlertEngineConstants;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.InterruptableJob;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One scheduled pass over the enabled alert definitions. Passes never overlap. */
@DisallowConcurrentExecution
public class AlertEvaluationJob implements InterruptableJob {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEvaluationJob.class);

  private volatile boolean interrupted;

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting alert evaluation pass: {}", jobDetail.getKey());

    AlertEngine alertEngine =
        (AlertEngine) jobDetail.getJobDataMap().get(AlertEngineConstants.JOB_DATA_MAP_ALERT_ENGINE);

    Instant startTime = Instant.now();
    int evaluated = alertEngine.runScheduledPass(() -> interrupted);
    LOGGER.info(
        "Alert evaluation pass {} evaluated {} alert(s) in {} ms",
        jobDetail.getKey(),
        evaluated,
        Duration.between(startTime, Instant.now()).toMillis());
  }

  /** Stops the running pass before its next definition. */
  @Override
  public void interrupt() {
    interrupted = true;
  }
}
