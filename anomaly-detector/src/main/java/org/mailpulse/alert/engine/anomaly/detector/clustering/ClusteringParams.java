package org.mailpulse.alert.engine.anomaly.detector.clustering;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;

@Builder
@Getter
@ToString
public class ClusteringParams {
  private static final double MAX_PERCENTILE = 100;
  // Percentile rejects 0
  private static final double MIN_PERCENTILE = 0.001;

  @Builder.Default private final double eps = 0.5;
  @Builder.Default private final int minSamples = 3;
  @Builder.Default private final int clusters = 3;
  @Builder.Default private final double percentile = 95;

  /**
   * Applies the alert's sensitivity: higher sensitivity shrinks the DBSCAN radius and lowers the
   * K-Means distance percentile, so more points become anomalies.
   */
  public static ClusteringParams fromSpec(AnomalySpec anomalySpec) {
    double sensitivity = anomalySpec.getSensitivity();
    double percentile =
        MAX_PERCENTILE - (MAX_PERCENTILE - anomalySpec.getPercentile()) * sensitivity;
    return ClusteringParams.builder()
        .eps(anomalySpec.getEps() / sensitivity)
        .minSamples(anomalySpec.getMinSamples())
        .clusters(anomalySpec.getClusters())
        .percentile(Math.min(MAX_PERCENTILE, Math.max(MIN_PERCENTILE, percentile)))
        .build();
  }
}
