package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Detector parameters for smart alerts. Statistical algorithms read the threshold, span and
 * percentage fields; clustering algorithms read eps, minSamples, clusters, percentile and
 * sensitivity.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class AnomalySpec {
  @Builder.Default private final DetectionAlgorithm algorithm = DetectionAlgorithm.ZSCORE;
  @Builder.Default private final double zscoreThreshold = 2.5;
  @Builder.Default private final int ewmaSpan = 7;
  // null falls back to the engine wide evaluator.ewmaThresholdScale
  private final Double ewmaThresholdScale;
  @Builder.Default private final double percentageThreshold = 50;
  @Builder.Default private final double eps = 0.5;
  @Builder.Default private final int minSamples = 3;
  @Builder.Default private final int clusters = 3;
  @Builder.Default private final double percentile = 95;
  @Builder.Default private final double sensitivity = 1.0;
}
