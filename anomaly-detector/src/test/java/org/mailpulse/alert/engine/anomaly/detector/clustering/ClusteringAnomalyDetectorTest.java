package org.mailpulse.alert.engine.anomaly.detector.clustering;

import java.util.List;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ClusteringAnomalyDetectorTest {
  private final ClusteringAnomalyDetector detector = new ClusteringAnomalyDetector();

  @Test
  void testKMeansFlagsSingleOutlier() {
    ClusteringParams params = ClusteringParams.builder().clusters(3).percentile(95).build();

    DetectionResult result =
        detector.detect(new double[] {5, 5, 5, 5, 100}, DetectionAlgorithm.KMEANS, params);

    Assertions.assertEquals(List.of(4), result.getAnomalyIndices());
    Assertions.assertEquals(5.0, result.getBaseline(), 1e-9);
    Assertions.assertTrue(result.isAnomalous(4));
    Assertions.assertFalse(result.isAnomalous(0));
    Assertions.assertEquals(5, result.getDistances().length);
  }

  @Test
  void testKMeansConstantSeriesHasNoAnomalies() {
    DetectionResult result =
        detector.detect(
            new double[] {7, 7, 7, 7}, DetectionAlgorithm.KMEANS, ClusteringParams.builder().build());

    Assertions.assertTrue(result.getAnomalyIndices().isEmpty());
    Assertions.assertEquals(7.0, result.getBaseline(), 1e-9);
  }

  @Test
  void testDbscanFlagsNoisePoint() {
    double[] values = {10, 10, 11, 10, 50, 10, 9, 10};

    DetectionResult result =
        detector.detect(values, DetectionAlgorithm.DBSCAN, ClusteringParams.builder().build());

    Assertions.assertEquals(List.of(4), result.getAnomalyIndices());
    Assertions.assertEquals(10.0, result.getBaseline(), 1e-9);
    Assertions.assertEquals(DetectionResult.NOISE, result.getLabels()[4]);
    Assertions.assertEquals(0.25, result.scoreFrom(4), 1e-9);
    Assertions.assertTrue(result.hasAnomalyFrom(4));
    Assertions.assertFalse(result.hasAnomalyFrom(5));
  }

  @Test
  void testDbscanWithTooFewValuesIsAllNormal() {
    ClusteringParams params = ClusteringParams.builder().minSamples(5).build();

    DetectionResult result =
        detector.detect(new double[] {1, 100, 1000}, DetectionAlgorithm.DBSCAN, params);

    Assertions.assertTrue(result.getAnomalyIndices().isEmpty());
    Assertions.assertEquals(367.0, result.getBaseline(), 1e-9);
  }

  @Test
  void testDetectionIsReproducible() {
    double[] values = {3, 4, 3, 5, 4, 30, 3, 4, 2, 4, 25, 3};
    ClusteringParams params = ClusteringParams.builder().build();

    DetectionResult first = detector.detect(values, DetectionAlgorithm.KMEANS, params);
    DetectionResult second = detector.detect(values, DetectionAlgorithm.KMEANS, params);

    Assertions.assertEquals(first.getAnomalyIndices(), second.getAnomalyIndices());
    Assertions.assertArrayEquals(first.getDistances(), second.getDistances(), 1e-12);
  }

  @Test
  void testStandardizeConstantSeries() {
    Assertions.assertArrayEquals(
        new double[] {0, 0, 0}, ClusteringAnomalyDetector.standardize(new double[] {4, 4, 4}));
  }

  @Test
  void testSensitivityAdjustsParams() {
    ClusteringParams params =
        ClusteringParams.fromSpec(
            AnomalySpec.builder().eps(0.5).percentile(95).sensitivity(2.0).build());

    Assertions.assertEquals(0.25, params.getEps(), 1e-9);
    Assertions.assertEquals(90.0, params.getPercentile(), 1e-9);

    ClusteringParams clamped =
        ClusteringParams.fromSpec(AnomalySpec.builder().percentile(50).sensitivity(3.0).build());
    Assertions.assertTrue(clamped.getPercentile() > 0);
  }
}
