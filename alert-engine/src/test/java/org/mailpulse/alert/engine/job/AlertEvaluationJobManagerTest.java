package org.mailpulse.alert.engine.job;

import static org.mockito.Mockito.mock;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mailpulse.alert.engine.AlertEngine;
import org.quartz.CronTrigger;
import org.quartz.SimpleTrigger;
import org.quartz.Trigger;

class AlertEvaluationJobManagerTest {

  @Test
  void testIntervalTriggerByDefault() {
    AlertEvaluationJobManager jobManager = new AlertEvaluationJobManager(mock(AlertEngine.class));
    jobManager.initJob(ConfigFactory.empty());

    Assertions.assertEquals("alert-evaluation", jobManager.getJobKey().getName());
    Assertions.assertEquals("alerting.mailpulse", jobManager.getJobKey().getGroup());
    Trigger trigger = jobManager.getJobTrigger();
    Assertions.assertTrue(trigger instanceof SimpleTrigger);
    Assertions.assertEquals(5 * 60 * 1000L, ((SimpleTrigger) trigger).getRepeatInterval());
    Assertions.assertEquals(
        SimpleTrigger.REPEAT_INDEFINITELY, ((SimpleTrigger) trigger).getRepeatCount());
  }

  @Test
  void testConfiguredInterval() {
    AlertEvaluationJobManager jobManager = new AlertEvaluationJobManager(mock(AlertEngine.class));
    jobManager.initJob(
        ConfigFactory.parseString("job.config { jobSuffix = nightly, intervalMinutes = 15 }"));

    Assertions.assertEquals("alerting.nightly", jobManager.getJobKey().getGroup());
    Assertions.assertEquals(
        15 * 60 * 1000L, ((SimpleTrigger) jobManager.getJobTrigger()).getRepeatInterval());
  }

  @Test
  void testCronExpressionWinsOverInterval() {
    AlertEvaluationJobManager jobManager = new AlertEvaluationJobManager(mock(AlertEngine.class));
    jobManager.initJob(
        ConfigFactory.parseString(
            "job.config { intervalMinutes = 15, cronExpression = \"0 0/10 * * * ?\" }"));

    Trigger trigger = jobManager.getJobTrigger();
    Assertions.assertTrue(trigger instanceof CronTrigger);
    Assertions.assertEquals("0 0/10 * * * ?", ((CronTrigger) trigger).getCronExpression());
  }
}
