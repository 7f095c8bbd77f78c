package org.mailpulse.alert.engine.anomaly.detector.gate;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.EvaluationOutcome;

@Builder
@Getter
@ToString
public class GateDecision {
  private final EvaluationOutcome outcome;
  // set when the gate itself decided the outcome, null when it follows the detector
  private final String reason;
  private final boolean inCooldown;
  private final long cooldownRemainingMinutes;
  private final int alertsToday;
}
