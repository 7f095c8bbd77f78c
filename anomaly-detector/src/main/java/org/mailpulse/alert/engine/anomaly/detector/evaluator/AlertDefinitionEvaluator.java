package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.anomaly.detector.aggregator.AggregationResult;
import org.mailpulse.alert.engine.anomaly.detector.aggregator.TimeBucketAggregator;
import org.mailpulse.alert.engine.anomaly.detector.clustering.ClusteringAnomalyDetector;
import org.mailpulse.alert.engine.anomaly.detector.gate.CooldownGate;
import org.mailpulse.alert.engine.anomaly.detector.gate.GateDecision;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertDefinitionValidator;
import org.mailpulse.alert.engine.datamodel.AlertKind;
import org.mailpulse.alert.engine.datamodel.AlertState;
import org.mailpulse.alert.engine.datamodel.EvaluationOutcome;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;
import org.mailpulse.alert.engine.datamodel.StorageUnavailableException;
import org.mailpulse.alert.engine.datamodel.TimeSeriesPoint;
import org.mailpulse.alert.engine.datamodel.store.EventStore;
import org.mailpulse.alert.engine.datamodel.store.SemanticMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates one alert definition end to end: runs the detector its kind calls for, passes the
 * outcome through the {@link CooldownGate} and records the observation on the alert state.
 *
 * <p>Data windows end at the latest stored event, cooldowns and daily caps follow the clock. The
 * caller must hold the alert's lock. Writing the trigger history is left to the caller.
 */
public class AlertDefinitionEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertDefinitionEvaluator.class);
  private static final ConcurrentMap<String, Counter> evaluationCounter = new ConcurrentHashMap<>();
  private static final String EVALUATION_COUNTER = "mailpulse.alert.engine.rule.evaluation.count";
  private static final ConcurrentMap<String, Counter> outcomeCounter = new ConcurrentHashMap<>();
  private static final String OUTCOME_COUNTER = "mailpulse.alert.engine.rule.outcome.count";
  private static final ConcurrentMap<String, Counter> storageErrorCounter =
      new ConcurrentHashMap<>();
  private static final String STORAGE_ERROR_COUNTER =
      "mailpulse.alert.engine.rule.storage.error.count";
  static final String EVALUATOR_CONFIG = "evaluator";

  private final EventStore eventStore;
  private final TimeBucketAggregator aggregator;
  private final EvaluatorConfig evaluatorConfig;
  private final Clock clock;
  private final CooldownGate cooldownGate;
  private final StaticRuleEvaluator staticRuleEvaluator;
  private final StatisticalRuleEvaluator statisticalRuleEvaluator;
  private final ClusterRuleEvaluator clusterRuleEvaluator;
  private final SemanticMatchRuleEvaluator semanticMatchRuleEvaluator;

  public AlertDefinitionEvaluator(
      Config appConfig, EventStore eventStore, SemanticMatcher semanticMatcher) {
    this(appConfig, eventStore, semanticMatcher, Clock.systemUTC());
  }

  // used for testing with a fixed clock passed as parameter
  public AlertDefinitionEvaluator(
      Config appConfig, EventStore eventStore, SemanticMatcher semanticMatcher, Clock clock) {
    this.eventStore = eventStore;
    this.clock = clock;
    this.evaluatorConfig =
        new EvaluatorConfig(
            appConfig.hasPath(EVALUATOR_CONFIG)
                ? appConfig.getConfig(EVALUATOR_CONFIG)
                : ConfigFactory.empty());
    this.aggregator = new TimeBucketAggregator(eventStore);
    this.cooldownGate = new CooldownGate(clock);

    MetricCalculator metricCalculator = new MetricCalculator(eventStore);
    this.staticRuleEvaluator = new StaticRuleEvaluator(metricCalculator, evaluatorConfig);
    this.statisticalRuleEvaluator = new StatisticalRuleEvaluator(metricCalculator, evaluatorConfig);
    this.clusterRuleEvaluator =
        new ClusterRuleEvaluator(
            aggregator, new ClusteringAnomalyDetector(), eventStore, evaluatorConfig);
    this.semanticMatchRuleEvaluator =
        new SemanticMatchRuleEvaluator(semanticMatcher, clusterRuleEvaluator);
  }

  public EvaluatorConfig getEvaluatorConfig() {
    return evaluatorConfig;
  }

  /**
   * @throws org.mailpulse.alert.engine.datamodel.InvalidConfigurationException when the definition
   *     is malformed
   */
  public EvaluationResult evaluate(AlertDefinition alertDefinition) {
    AlertDefinitionValidator.validate(alertDefinition);
    AlertKind kind = alertDefinition.getKind();
    String kindTag = kindTag(kind);
    evaluationCounter
        .computeIfAbsent(kindTag, k -> Metrics.counter(EVALUATION_COUNTER, "kind", k))
        .increment();

    AlertState state = alertDefinition.getState();
    try {
      Instant now = eventStore.latestEventTimestamp().orElse(clock.instant());
      Detection detection = detect(alertDefinition, now);
      List<TimeSeriesPoint> timeSeries =
          detection.getTimeSeries() != null
              ? detection.getTimeSeries()
              : timeSeries(alertDefinition, now);

      GateDecision decision =
          cooldownGate.apply(state, alertDefinition.getCooldown(), detection.isAnomalous());
      recordObservation(state, detection);

      outcomeCounter
          .computeIfAbsent(
              decision.getOutcome().name(), k -> Metrics.counter(OUTCOME_COUNTER, "outcome", k))
          .increment();
      LOGGER.debug(
          "Alert {} evaluated at {}: {} ({}), gate {}",
          alertDefinition.getId(),
          now,
          detection.isAnomalous(),
          detection.getReason(),
          decision);

      return EvaluationResult.builder()
          .alertId(alertDefinition.getId())
          .alertName(alertDefinition.getName())
          .kindCase(kind.getKindCase())
          .outcome(decision.getOutcome())
          .reason(decision.getReason() != null ? decision.getReason() : detection.getReason())
          .evaluatedAt(now)
          .currentValue(detection.getCurrentValue())
          .baselineValue(detection.getBaselineValue())
          .score(detection.getScore())
          .percentageChange(detection.getPercentageChange())
          .anomalyType(detection.getAnomalyType())
          .timeSeries(timeSeries)
          .inCooldown(decision.isInCooldown())
          .cooldownRemainingMinutes(decision.getCooldownRemainingMinutes())
          .alertsToday(decision.getAlertsToday())
          .topContributors(detection.getTopContributors())
          .build();
    } catch (StorageUnavailableException e) {
      storageErrorCounter
          .computeIfAbsent(kindTag, k -> Metrics.counter(STORAGE_ERROR_COUNTER, "kind", k))
          .increment();
      LOGGER.error("Storage unavailable while evaluating alert {}", alertDefinition.getId(), e);
      state.setLastCheckedAt(clock.instant());
      return EvaluationResult.builder()
          .alertId(alertDefinition.getId())
          .alertName(alertDefinition.getName())
          .kindCase(kind.getKindCase())
          .outcome(EvaluationOutcome.NOT_TRIGGERED)
          .reason("Storage unavailable: " + e.getMessage())
          .evaluatedAt(clock.instant())
          .alertsToday(state.getAlertsToday())
          .build();
    }
  }

  private Detection detect(AlertDefinition alertDefinition, Instant now) {
    AlertKind kind = alertDefinition.getKind();
    switch (kind.getKindCase()) {
      case STATIC:
        return staticRuleEvaluator.evaluateRule(alertDefinition, now);
      case ANOMALY:
        return kind.getAnomaly().getAlgorithm().isClustering()
            ? clusterRuleEvaluator.evaluateRule(alertDefinition, now)
            : statisticalRuleEvaluator.evaluateRule(alertDefinition, now);
      case SEMANTIC_MATCH:
        return semanticMatchRuleEvaluator.evaluateRule(alertDefinition, now);
      default:
        throw new UnsupportedOperationException("Unsupported alert kind: " + kind.getKindCase());
    }
  }

  private List<TimeSeriesPoint> timeSeries(AlertDefinition alertDefinition, Instant now) {
    AggregationResult aggregation =
        aggregator.aggregate(
            now.minus(Duration.ofDays(evaluatorConfig.getTimeSeriesDays())),
            now,
            alertDefinition.getFilter());
    return aggregation.getBuckets().stream()
        .map(b -> new TimeSeriesPoint(b.getStart(), b.valueOf(alertDefinition.getMetric())))
        .collect(Collectors.toUnmodifiableList());
  }

  private void recordObservation(AlertState state, Detection detection) {
    state.setLastCheckedAt(clock.instant());
    state.setLastValue(detection.getCurrentValue());
    state.setLastBaseline(detection.getBaselineValue());
    state.setLastScore(detection.getScore());
  }

  static String kindTag(AlertKind kind) {
    return kind.getKindCase() == AlertKind.KindCase.STATIC
        ? kind.getKindCase().name()
        : kind.getKindCase().name() + "_" + kind.getAnomaly().getAlgorithm().name();
  }
}
