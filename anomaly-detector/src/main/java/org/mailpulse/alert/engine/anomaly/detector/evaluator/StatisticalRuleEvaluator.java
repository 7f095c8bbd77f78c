package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.mailpulse.alert.engine.anomaly.detector.statistics.StatisticalBaselineEvaluator;
import org.mailpulse.alert.engine.anomaly.detector.statistics.StatisticalResult;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.AnomalyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Z-score, EWMA and percentage change alerts. The baseline holds one sample per prior day, each
 * over a window of the same size as the monitoring window and ending at the same time of day.
 */
class StatisticalRuleEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatisticalRuleEvaluator.class);
  private static final ConcurrentMap<String, Timer> statisticalRuleTimer =
      new ConcurrentHashMap<>();
  private static final String STATISTICAL_RULE_TIMER =
      "mailpulse.alert.engine.statistical.rule.latency";
  private final MetricCalculator metricCalculator;
  private final StatisticalBaselineEvaluator baselineEvaluator;
  private final EvaluatorConfig evaluatorConfig;

  StatisticalRuleEvaluator(MetricCalculator metricCalculator, EvaluatorConfig evaluatorConfig) {
    this.metricCalculator = metricCalculator;
    this.evaluatorConfig = evaluatorConfig;
    this.baselineEvaluator =
        new StatisticalBaselineEvaluator(evaluatorConfig.getEwmaThresholdScale());
  }

  Detection evaluateRule(AlertDefinition alertDefinition, Instant now) {
    Instant startTime = Instant.now();
    AnomalySpec anomalySpec = alertDefinition.getKind().getAnomaly();
    Duration window = alertDefinition.getTimeWindow().getDuration();
    Instant windowStart = now.minus(window);

    double currentValue =
        metricCalculator.compute(
            alertDefinition.getMetric(), windowStart, now, alertDefinition.getFilter());

    List<Double> baselineSamples = new ArrayList<>();
    int baselineDays = alertDefinition.getTimeWindow().getBaselineDays();
    for (int dayOffset = 1; dayOffset <= baselineDays; dayOffset++) {
      Instant sampleEnd = now.minus(Duration.ofDays(dayOffset));
      baselineSamples.add(
          metricCalculator.compute(
              alertDefinition.getMetric(),
              sampleEnd.minus(window),
              sampleEnd,
              alertDefinition.getFilter()));
    }

    StatisticalResult result =
        baselineEvaluator.evaluate(currentValue, baselineSamples, anomalySpec);

    statisticalRuleTimer
        .computeIfAbsent(
            anomalySpec.getAlgorithm().name(),
            k -> Metrics.timer(STATISTICAL_RULE_TIMER, "algorithm", k))
        .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);

    LOGGER.debug("Rule id {}, current {}, result {}", alertDefinition.getId(), currentValue, result);

    return Detection.builder()
        .anomalous(result.isTriggered())
        .currentValue(currentValue)
        .baselineValue(result.getBaseline())
        .score(result.getScore())
        .percentageChange(result.getPercentageChange())
        .anomalyType(
            result.isTriggered() ? AnomalyType.classify(currentValue, result.getBaseline()) : null)
        .reason(result.getReason())
        .topContributors(
            metricCalculator.topContributors(
                alertDefinition.getMetric(),
                windowStart,
                now,
                alertDefinition.getFilter(),
                evaluatorConfig.getTopContributorsLimit()))
        .build();
  }
}
