package org.mailpulse.alert.engine.anomaly.detector.statistics;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;

@Builder
@Getter
@ToString
public class StatisticalResult {
  private final DetectionAlgorithm algorithm;
  private final boolean triggered;
  private final boolean insufficientData;
  // expected value: the sample mean, or the EWMA for the EWMA algorithm
  private final double baseline;
  private final double standardDeviation;
  // zscore or relative EWMA deviation, null for percentage change
  private final Double score;
  private final Double percentageChange;
  private final String reason;
}
