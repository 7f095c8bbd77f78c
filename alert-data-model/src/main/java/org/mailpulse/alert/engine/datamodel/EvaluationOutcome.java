package org.mailpulse.alert.engine.datamodel;

public enum EvaluationOutcome {
  TRIGGERED,
  NOT_TRIGGERED,
  SUPPRESSED
}
