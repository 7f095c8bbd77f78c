package org.mailpulse.alert.engine.datamodel.store;

import org.mailpulse.alert.engine.datamodel.AlertSummary;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;

public interface NotificationSink {
  /** @return whether the notification was handed off successfully */
  boolean onTrigger(AlertSummary alertSummary, EvaluationResult evaluationResult);
}
