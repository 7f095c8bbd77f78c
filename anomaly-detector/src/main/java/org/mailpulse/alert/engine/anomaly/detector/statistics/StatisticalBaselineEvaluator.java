package org.mailpulse.alert.engine.anomaly.detector.statistics;

import java.util.List;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares a current value with a historical sample. Results carry their numbers whether or not
 * the threshold is crossed.
 */
public class StatisticalBaselineEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(StatisticalBaselineEvaluator.class);

  static final int MIN_BASELINE_SAMPLES = 2;
  static final String INSUFFICIENT_BASELINE_DATA = "Insufficient baseline data";

  private final double defaultEwmaThresholdScale;

  public StatisticalBaselineEvaluator(double defaultEwmaThresholdScale) {
    this.defaultEwmaThresholdScale = defaultEwmaThresholdScale;
  }

  public StatisticalResult evaluate(
      double currentValue, List<Double> baselineSamples, AnomalySpec anomalySpec) {
    DetectionAlgorithm algorithm = anomalySpec.getAlgorithm();
    if (baselineSamples.size() < MIN_BASELINE_SAMPLES) {
      return StatisticalResult.builder()
          .algorithm(algorithm)
          .insufficientData(true)
          .reason(INSUFFICIENT_BASELINE_DATA)
          .build();
    }

    Pair<Double, Double> meanAndStd = meanAndStd(baselineSamples);
    LOGGER.debug(
        "Current {} against baseline {} (mean {}, std {})",
        currentValue,
        baselineSamples,
        meanAndStd.getLeft(),
        meanAndStd.getRight());

    switch (algorithm) {
      case ZSCORE:
        return zscore(currentValue, meanAndStd, anomalySpec);
      case EWMA:
        return ewma(currentValue, baselineSamples, meanAndStd, anomalySpec);
      case PERCENTAGE_CHANGE:
        return percentageChange(currentValue, meanAndStd, anomalySpec);
      default:
        throw new UnsupportedOperationException("Unsupported statistical algorithm: " + algorithm);
    }
  }

  private StatisticalResult zscore(
      double currentValue, Pair<Double, Double> meanAndStd, AnomalySpec anomalySpec) {
    double mean = meanAndStd.getLeft();
    double std = meanAndStd.getRight();
    double zscore = zscore(currentValue, mean, std);
    boolean triggered = Math.abs(zscore) >= anomalySpec.getZscoreThreshold();

    StatisticalResult.StatisticalResultBuilder builder =
        StatisticalResult.builder()
            .algorithm(DetectionAlgorithm.ZSCORE)
            .triggered(triggered)
            .baseline(mean)
            .standardDeviation(std)
            .score(zscore);
    if (triggered) {
      builder.reason(
          String.format(
              "Anomaly detected: Z-score %.2f (%s baseline). Current: %.0f, Expected: %.0f ± %.0f",
              zscore, zscore > 0 ? "above" : "below", currentValue, mean, std));
    }
    return builder.build();
  }

  private StatisticalResult ewma(
      double currentValue,
      List<Double> baselineSamples,
      Pair<Double, Double> meanAndStd,
      AnomalySpec anomalySpec) {
    double ewma = ewma(baselineSamples, anomalySpec.getEwmaSpan());
    double relativeDeviation = ewma > 0 ? Math.abs(currentValue - ewma) / ewma : 0;
    double scale =
        anomalySpec.getEwmaThresholdScale() != null
            ? anomalySpec.getEwmaThresholdScale()
            : defaultEwmaThresholdScale;
    boolean triggered = relativeDeviation > anomalySpec.getZscoreThreshold() * scale;

    StatisticalResult.StatisticalResultBuilder builder =
        StatisticalResult.builder()
            .algorithm(DetectionAlgorithm.EWMA)
            .triggered(triggered)
            .baseline(ewma)
            .standardDeviation(meanAndStd.getRight())
            .score(relativeDeviation);
    if (triggered) {
      builder.reason(
          String.format(
              "EWMA anomaly: Current %.0f vs EWMA %.0f (deviation: %.1f%%)",
              currentValue, ewma, relativeDeviation * 100));
    }
    return builder.build();
  }

  private StatisticalResult percentageChange(
      double currentValue, Pair<Double, Double> meanAndStd, AnomalySpec anomalySpec) {
    double mean = meanAndStd.getLeft();
    StatisticalResult.StatisticalResultBuilder builder =
        StatisticalResult.builder()
            .algorithm(DetectionAlgorithm.PERCENTAGE_CHANGE)
            .baseline(mean)
            .standardDeviation(meanAndStd.getRight());
    if (mean <= 0) {
      return builder.build();
    }

    double percentageChange = (currentValue - mean) / mean * 100;
    boolean triggered = Math.abs(percentageChange) >= anomalySpec.getPercentageThreshold();
    builder.triggered(triggered).percentageChange(percentageChange);
    if (triggered) {
      builder.reason(
          String.format(
              "%.1f%% %s detected. Current: %.0f, Baseline avg: %.0f",
              Math.abs(percentageChange),
              percentageChange > 0 ? "increase" : "decrease",
              currentValue,
              mean));
    }
    return builder.build();
  }

  /** Sample mean and standard deviation, the latter with the n - 1 correction. */
  static Pair<Double, Double> meanAndStd(List<Double> samples) {
    double[] values = samples.stream().mapToDouble(Double::doubleValue).toArray();
    return Pair.of(new Mean().evaluate(values), new StandardDeviation(true).evaluate(values));
  }

  static double zscore(double value, double mean, double std) {
    if (std == 0) {
      if (value == mean) {
        return 0;
      }
      return value > mean ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
    }
    return (value - mean) / std;
  }

  /** Seeded with the first sample, then folded in list order. */
  static double ewma(List<Double> samples, int span) {
    if (samples.isEmpty()) {
      return 0;
    }
    double alpha = 2.0 / (span + 1);
    double ewma = samples.get(0);
    for (int i = 1; i < samples.size(); i++) {
      ewma = alpha * samples.get(i) + (1 - alpha) * ewma;
    }
    return ewma;
  }
}
