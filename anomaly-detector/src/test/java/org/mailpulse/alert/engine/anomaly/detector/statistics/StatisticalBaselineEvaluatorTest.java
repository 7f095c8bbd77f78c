package org.mailpulse.alert.engine.anomaly.detector.statistics;

import java.util.List;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class StatisticalBaselineEvaluatorTest {
  private final StatisticalBaselineEvaluator evaluator = new StatisticalBaselineEvaluator(0.1);

  @Test
  void testZscoreAboveBaseline() {
    StatisticalResult result =
        evaluator.evaluate(20, List.of(10.0, 12.0, 11.0, 9.0, 10.0), zscore(2.5));

    Assertions.assertTrue(result.isTriggered());
    Assertions.assertEquals(8.42, result.getScore(), 0.01);
    Assertions.assertEquals(10.4, result.getBaseline(), 1e-9);
    Assertions.assertTrue(result.getReason().contains("above baseline"));
    Assertions.assertEquals(
        "Anomaly detected: Z-score 8.42 (above baseline). Current: 20, Expected: 10 ± 1",
        result.getReason());
  }

  @Test
  void testZscoreBelowBaseline() {
    StatisticalResult result =
        evaluator.evaluate(0, List.of(10.0, 12.0, 11.0, 9.0, 10.0), zscore(2.5));

    Assertions.assertTrue(result.isTriggered());
    Assertions.assertTrue(result.getScore() < 0);
    Assertions.assertTrue(result.getReason().contains("below baseline"));
  }

  @Test
  void testZscoreWithConstantBaseline() {
    StatisticalResult equal = evaluator.evaluate(5, List.of(5.0, 5.0, 5.0), zscore(2.5));
    Assertions.assertFalse(equal.isTriggered());
    Assertions.assertEquals(0.0, equal.getScore());
    Assertions.assertNull(equal.getReason());

    StatisticalResult higher = evaluator.evaluate(6, List.of(5.0, 5.0, 5.0), zscore(2.5));
    Assertions.assertTrue(higher.isTriggered());
    Assertions.assertEquals(Double.POSITIVE_INFINITY, higher.getScore());
  }

  @Test
  void testInsufficientBaseline() {
    StatisticalResult result = evaluator.evaluate(100, List.of(5.0), zscore(2.5));

    Assertions.assertFalse(result.isTriggered());
    Assertions.assertTrue(result.isInsufficientData());
    Assertions.assertEquals("Insufficient baseline data", result.getReason());
  }

  @Test
  void testEwma() {
    AnomalySpec ewma =
        AnomalySpec.builder().algorithm(DetectionAlgorithm.EWMA).zscoreThreshold(2.5).build();

    StatisticalResult result = evaluator.evaluate(20, List.of(10.0, 10.0, 10.0, 10.0), ewma);

    Assertions.assertTrue(result.isTriggered());
    Assertions.assertEquals(10.0, result.getBaseline(), 1e-9);
    Assertions.assertEquals(1.0, result.getScore(), 1e-9);
    Assertions.assertEquals(
        "EWMA anomaly: Current 20 vs EWMA 10 (deviation: 100.0%)", result.getReason());

    StatisticalResult rescaled =
        evaluator.evaluate(
            20, List.of(10.0, 10.0, 10.0, 10.0), ewma.toBuilder().ewmaThresholdScale(1.0).build());
    Assertions.assertFalse(rescaled.isTriggered());
    Assertions.assertEquals(1.0, rescaled.getScore(), 1e-9);
  }

  @Test
  void testEwmaFoldsInOrder() {
    Assertions.assertEquals(
        10.0, StatisticalBaselineEvaluator.ewma(List.of(10.0), 7), 1e-9);
    // alpha = 0.5 for span 3
    Assertions.assertEquals(
        15.0, StatisticalBaselineEvaluator.ewma(List.of(10.0, 20.0), 3), 1e-9);
    Assertions.assertEquals(
        17.5, StatisticalBaselineEvaluator.ewma(List.of(10.0, 20.0, 20.0), 3), 1e-9);
  }

  @Test
  void testPercentageChange() {
    AnomalySpec percentage =
        AnomalySpec.builder()
            .algorithm(DetectionAlgorithm.PERCENTAGE_CHANGE)
            .percentageThreshold(50)
            .build();

    StatisticalResult decrease = evaluator.evaluate(40, List.of(100.0, 100.0), percentage);
    Assertions.assertTrue(decrease.isTriggered());
    Assertions.assertEquals(-60.0, decrease.getPercentageChange(), 1e-9);
    Assertions.assertEquals(
        "60.0% decrease detected. Current: 40, Baseline avg: 100", decrease.getReason());

    StatisticalResult small = evaluator.evaluate(120, List.of(100.0, 100.0), percentage);
    Assertions.assertFalse(small.isTriggered());
    Assertions.assertEquals(20.0, small.getPercentageChange(), 1e-9);

    StatisticalResult zeroMean = evaluator.evaluate(10, List.of(0.0, 0.0), percentage);
    Assertions.assertFalse(zeroMean.isTriggered());
    Assertions.assertNull(zeroMean.getPercentageChange());
  }

  private static AnomalySpec zscore(double threshold) {
    return AnomalySpec.builder()
        .algorithm(DetectionAlgorithm.ZSCORE)
        .zscoreThreshold(threshold)
        .build();
  }
}
