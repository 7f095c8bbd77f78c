package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.AnomalyType;
import org.mailpulse.alert.engine.datamodel.Contributor;
import org.mailpulse.alert.engine.datamodel.TimeSeriesPoint;

/** What a rule evaluator saw, before the cooldown gate has had its say. */
@Builder
@Getter
@ToString(exclude = "timeSeries")
class Detection {
  private final boolean anomalous;
  private final double currentValue;
  private final double baselineValue;
  private final Double score;
  private final Double percentageChange;
  private final AnomalyType anomalyType;
  private final String reason;
  @Builder.Default private final List<Contributor> topContributors = List.of();
  // clustering evaluators already hold a series, others leave it to the caller
  private final List<TimeSeriesPoint> timeSeries;
}
