package org.mailpulse.alert.engine.anomaly.detector.gate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.mailpulse.alert.engine.datamodel.AlertState;
import org.mailpulse.alert.engine.datamodel.CooldownSpec;
import org.mailpulse.alert.engine.datamodel.EvaluationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a detected anomaly may fire. Checks run in a fixed order and the first one that
 * objects wins: daily cap, cooldown, then the consecutive anomaly count. Only the last check moves
 * the consecutive counter; cap and cooldown suppressions leave it alone.
 *
 * <p>Callers must hold the alert's lock, the state is mutated in place.
 */
public class CooldownGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(CooldownGate.class);

  private final Clock clock;

  public CooldownGate(Clock clock) {
    this.clock = clock;
  }

  /**
   * Cap and cooldown suppress whatever the detector reported. A normal evaluation past both resets
   * the consecutive counter.
   */
  public GateDecision apply(AlertState state, CooldownSpec cooldown, boolean anomalous) {
    Instant now = clock.instant();
    resetDailyCount(state, LocalDate.ofInstant(now, ZoneOffset.UTC));
    long cooldownRemaining =
        cooldown.isEnabled() ? cooldownRemainingMinutes(state, cooldown, now) : -1;
    boolean inCooldown = cooldownRemaining >= 0;

    GateDecision.GateDecisionBuilder decision =
        GateDecision.builder()
            .inCooldown(inCooldown)
            .cooldownRemainingMinutes(Math.max(0, cooldownRemaining));

    if (cooldown.isEnabled() && state.getAlertsToday() >= cooldown.getMaxAlertsPerDay()) {
      return decision
          .outcome(EvaluationOutcome.SUPPRESSED)
          .reason(String.format("Max alerts per day reached (%d)", cooldown.getMaxAlertsPerDay()))
          .alertsToday(state.getAlertsToday())
          .build();
    }

    if (inCooldown) {
      return decision
          .outcome(EvaluationOutcome.SUPPRESSED)
          .reason(String.format("In cooldown for %d more minutes", cooldownRemaining))
          .alertsToday(state.getAlertsToday())
          .build();
    }

    if (!anomalous) {
      state.setConsecutiveAnomalyCount(0);
      return decision
          .outcome(EvaluationOutcome.NOT_TRIGGERED)
          .alertsToday(state.getAlertsToday())
          .build();
    }

    int observed = state.getConsecutiveAnomalyCount() + 1;
    if (observed < cooldown.getConsecutiveAnomalies()) {
      state.setConsecutiveAnomalyCount(observed);
      return decision
          .outcome(EvaluationOutcome.SUPPRESSED)
          .reason(
              String.format(
                  "Anomaly detected (%d/%d consecutive required)",
                  observed, cooldown.getConsecutiveAnomalies()))
          .alertsToday(state.getAlertsToday())
          .build();
    }

    state.setTriggerCount(state.getTriggerCount() + 1);
    state.setAlertsToday(state.getAlertsToday() + 1);
    state.setLastTriggeredAt(now);
    state.setConsecutiveAnomalyCount(0);
    LOGGER.debug("Trigger approved, {} alerts today", state.getAlertsToday());
    return decision
        .outcome(EvaluationOutcome.TRIGGERED)
        .inCooldown(false)
        .cooldownRemainingMinutes(0)
        .alertsToday(state.getAlertsToday())
        .build();
  }

  private static void resetDailyCount(AlertState state, LocalDate today) {
    if (!today.equals(state.getAlertsTodayDate())) {
      state.setAlertsToday(0);
      state.setAlertsTodayDate(today);
    }
  }

  /** Whole minutes left in the cooldown, or -1 when the alert is not cooling down. */
  private static long cooldownRemainingMinutes(
      AlertState state, CooldownSpec cooldown, Instant now) {
    if (state.getLastTriggeredAt() == null) {
      return -1;
    }
    Instant cooldownEnd =
        state.getLastTriggeredAt().plus(Duration.ofMinutes(cooldown.getCooldownMinutes()));
    if (!now.isBefore(cooldownEnd)) {
      return -1;
    }
    return Duration.between(now, cooldownEnd).toMinutes();
  }
}
