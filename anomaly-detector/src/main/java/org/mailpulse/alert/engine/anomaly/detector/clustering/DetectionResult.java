package org.mailpulse.alert.engine.anomaly.detector.clustering;

import java.util.List;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;

@Getter
@ToString
public class DetectionResult {
  static final int NOISE = -1;

  private final DetectionAlgorithm algorithm;
  // cluster id per input point, NOISE for DBSCAN outliers
  private final int[] labels;
  private final List<Integer> anomalyIndices;
  private final double baseline;
  // distance of each point to its centroid, K-Means only
  private final double[] distances;

  DetectionResult(
      DetectionAlgorithm algorithm,
      int[] labels,
      List<Integer> anomalyIndices,
      double baseline,
      double[] distances) {
    this.algorithm = algorithm;
    this.labels = labels;
    this.anomalyIndices = List.copyOf(anomalyIndices);
    this.baseline = baseline;
    this.distances = distances;
  }

  public boolean isAnomalous(int index) {
    return anomalyIndices.contains(index);
  }

  public boolean hasAnomalyFrom(int fromIndex) {
    return anomalyIndices.stream().anyMatch(i -> i >= fromIndex);
  }

  /**
   * Score of the sub-range starting at {@code fromIndex}: the share of anomalous points for DBSCAN,
   * the mean centroid distance for K-Means.
   */
  public double scoreFrom(int fromIndex) {
    int size = labels.length - fromIndex;
    if (size <= 0) {
      return 0;
    }
    if (algorithm == DetectionAlgorithm.KMEANS && distances != null) {
      double total = 0;
      for (int i = fromIndex; i < distances.length; i++) {
        total += distances[i];
      }
      return total / size;
    }
    long anomalies = anomalyIndices.stream().filter(i -> i >= fromIndex).count();
    return (double) anomalies / size;
  }
}
