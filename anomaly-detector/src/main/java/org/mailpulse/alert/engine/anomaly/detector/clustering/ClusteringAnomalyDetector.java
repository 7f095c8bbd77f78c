package org.mailpulse.alert.engine.anomaly.detector.clustering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels each value of a one dimensional series as normal or anomalous. Values are standardized
 * with the population statistics of the input itself, so every call is independent and, with the
 * fixed K-Means seed, reproducible.
 */
public class ClusteringAnomalyDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClusteringAnomalyDetector.class);

  static final int KMEANS_MAX_ITERATIONS = 300;
  static final int KMEANS_TRIALS = 10;
  static final int KMEANS_SEED = 42;

  public DetectionResult detect(
      double[] values, DetectionAlgorithm algorithm, ClusteringParams params) {
    switch (algorithm) {
      case DBSCAN:
        return dbscan(values, params);
      case KMEANS:
        return kmeans(values, params);
      default:
        throw new UnsupportedOperationException("Unsupported clustering algorithm: " + algorithm);
    }
  }

  private DetectionResult dbscan(double[] values, ClusteringParams params) {
    if (values.length == 0 || values.length < params.getMinSamples()) {
      LOGGER.debug(
          "{} values below min samples {}, nothing is anomalous",
          values.length,
          params.getMinSamples());
      return allNormal(DetectionAlgorithm.DBSCAN, values, null);
    }

    // a point's own position counts towards min samples here, not in commons-math
    DBSCANClusterer<IndexedPoint> clusterer =
        new DBSCANClusterer<>(params.getEps(), params.getMinSamples() - 1);
    List<Cluster<IndexedPoint>> clusters = clusterer.cluster(toPoints(standardize(values)));

    int[] labels = new int[values.length];
    Arrays.fill(labels, DetectionResult.NOISE);
    for (int clusterId = 0; clusterId < clusters.size(); clusterId++) {
      for (IndexedPoint point : clusters.get(clusterId).getPoints()) {
        labels[point.getIndex()] = clusterId;
      }
    }

    List<Integer> anomalies = new ArrayList<>();
    for (int i = 0; i < labels.length; i++) {
      if (labels[i] == DetectionResult.NOISE) {
        anomalies.add(i);
      }
    }
    LOGGER.debug("DBSCAN found {} clusters and {} noise points", clusters.size(), anomalies.size());
    return new DetectionResult(
        DetectionAlgorithm.DBSCAN, labels, anomalies, baseline(values, anomalies), null);
  }

  private DetectionResult kmeans(double[] values, ClusteringParams params) {
    int distinct = (int) Arrays.stream(values).distinct().count();
    if (distinct <= 1) {
      return allNormal(DetectionAlgorithm.KMEANS, values, new double[values.length]);
    }

    // more clusters than distinct values would leave every point on its own centroid
    int k = Math.max(1, Math.min(params.getClusters(), distinct - 1));
    EuclideanDistance distance = new EuclideanDistance();
    KMeansPlusPlusClusterer<IndexedPoint> clusterer =
        new KMeansPlusPlusClusterer<>(
            k, KMEANS_MAX_ITERATIONS, distance, new JDKRandomGenerator(KMEANS_SEED));
    List<CentroidCluster<IndexedPoint>> clusters =
        new MultiKMeansPlusPlusClusterer<>(clusterer, KMEANS_TRIALS)
            .cluster(toPoints(standardize(values)));

    int[] labels = new int[values.length];
    double[] distances = new double[values.length];
    for (int clusterId = 0; clusterId < clusters.size(); clusterId++) {
      CentroidCluster<IndexedPoint> cluster = clusters.get(clusterId);
      double[] centroid = cluster.getCenter().getPoint();
      for (IndexedPoint point : cluster.getPoints()) {
        labels[point.getIndex()] = clusterId;
        distances[point.getIndex()] = distance.compute(point.getPoint(), centroid);
      }
    }

    double threshold =
        new Percentile()
            .withEstimationType(Percentile.EstimationType.R_7)
            .evaluate(distances, params.getPercentile());
    List<Integer> anomalies = new ArrayList<>();
    for (int i = 0; i < distances.length; i++) {
      if (distances[i] > threshold) {
        anomalies.add(i);
      }
    }
    LOGGER.debug(
        "K-Means with {} clusters, distance threshold {}, {} anomalies",
        k,
        threshold,
        anomalies.size());
    return new DetectionResult(
        DetectionAlgorithm.KMEANS, labels, anomalies, baseline(values, anomalies), distances);
  }

  static double[] standardize(double[] values) {
    double mean = new Mean().evaluate(values);
    double std = new StandardDeviation(false).evaluate(values);
    double[] standardized = new double[values.length];
    if (std == 0) {
      return standardized;
    }
    for (int i = 0; i < values.length; i++) {
      standardized[i] = (values[i] - mean) / std;
    }
    return standardized;
  }

  /** Mean of the normal points, or of all points when every point is anomalous. */
  static double baseline(double[] values, List<Integer> anomalies) {
    if (values.length == 0) {
      return 0;
    }
    if (anomalies.size() == values.length) {
      return new Mean().evaluate(values);
    }
    double total = 0;
    int count = 0;
    for (int i = 0; i < values.length; i++) {
      if (!anomalies.contains(i)) {
        total += values[i];
        count++;
      }
    }
    return total / count;
  }

  private static List<IndexedPoint> toPoints(double[] standardized) {
    List<IndexedPoint> points = new ArrayList<>(standardized.length);
    for (int i = 0; i < standardized.length; i++) {
      points.add(new IndexedPoint(i, standardized[i]));
    }
    return points;
  }

  private static DetectionResult allNormal(
      DetectionAlgorithm algorithm, double[] values, double[] distances) {
    return new DetectionResult(
        algorithm, new int[values.length], List.of(), baseline(values, List.of()), distances);
  }
}
