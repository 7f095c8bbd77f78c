package org.mailpulse.alert.engine.datamodel;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder(toBuilder = true)
@Getter
@ToString(exclude = "timeSeries")
public class EvaluationResult {
  private final String alertId;
  private final String alertName;
  private final AlertKind.KindCase kindCase;
  private final EvaluationOutcome outcome;
  private final String reason;
  // "now" of the evaluation, the latest known event timestamp
  private final Instant evaluatedAt;
  private final double currentValue;
  private final double baselineValue;
  // zscore, relative EWMA deviation, noise fraction or centroid distance depending on algorithm
  private final Double score;
  private final Double percentageChange;
  private final AnomalyType anomalyType;
  @Builder.Default private final List<TimeSeriesPoint> timeSeries = List.of();
  private final boolean inCooldown;
  private final long cooldownRemainingMinutes;
  private final int alertsToday;
  @Builder.Default private final List<Contributor> topContributors = List.of();
  // id of the history record written for a triggered evaluation
  private final String historyId;

  public boolean isTriggered() {
    return outcome == EvaluationOutcome.TRIGGERED;
  }
}
