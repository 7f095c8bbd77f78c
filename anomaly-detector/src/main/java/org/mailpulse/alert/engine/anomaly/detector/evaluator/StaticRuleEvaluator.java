package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.ThresholdOperator;
import org.mailpulse.alert.engine.datamodel.ThresholdSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class StaticRuleEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(StaticRuleEvaluator.class);
  private static final ConcurrentMap<String, Timer> staticRuleTimer = new ConcurrentHashMap<>();
  private static final String STATIC_RULE_TIMER = "mailpulse.alert.engine.static.rule.latency";
  private final MetricCalculator metricCalculator;
  private final EvaluatorConfig evaluatorConfig;

  StaticRuleEvaluator(MetricCalculator metricCalculator, EvaluatorConfig evaluatorConfig) {
    this.metricCalculator = metricCalculator;
    this.evaluatorConfig = evaluatorConfig;
  }

  Detection evaluateRule(AlertDefinition alertDefinition, Instant now) {
    Instant startTime = Instant.now();
    ThresholdSpec threshold = alertDefinition.getKind().getThreshold();
    Instant windowStart = now.minus(alertDefinition.getTimeWindow().getDuration());

    double value =
        metricCalculator.compute(
            alertDefinition.getMetric(), windowStart, now, alertDefinition.getFilter());
    boolean violated = evalOperator(threshold.getOperator(), value, threshold.getValue());

    staticRuleTimer
        .computeIfAbsent(
            alertDefinition.getMetric().name(),
            k -> Metrics.timer(STATIC_RULE_TIMER, "metric", k))
        .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);

    LOGGER.debug(
        "Rule id {}, value {} {} threshold {}: {}",
        alertDefinition.getId(),
        value,
        threshold.getOperator(),
        threshold.getValue(),
        violated);

    Detection.DetectionBuilder detection =
        Detection.builder()
            .anomalous(violated)
            .currentValue(value)
            .baselineValue(threshold.getValue())
            .topContributors(
                metricCalculator.topContributors(
                    alertDefinition.getMetric(),
                    windowStart,
                    now,
                    alertDefinition.getFilter(),
                    evaluatorConfig.getTopContributorsLimit()));
    if (violated) {
      detection.reason(
          String.format(
              "Metric value %.0f is %s threshold %.0f",
              value, threshold.getOperator().displayName(), threshold.getValue()));
    }
    return detection.build();
  }

  static boolean evalOperator(ThresholdOperator operator, double lhs, double rhs) {
    switch (operator) {
      case GREATER_THAN:
        return lhs > rhs;
      case LESS_THAN:
        return lhs < rhs;
      case EQUALS:
        return lhs == rhs;
      case NOT_EQUALS:
        return lhs != rhs;
      default:
        throw new UnsupportedOperationException("Unsupported threshold operator: " + operator);
    }
  }
}
