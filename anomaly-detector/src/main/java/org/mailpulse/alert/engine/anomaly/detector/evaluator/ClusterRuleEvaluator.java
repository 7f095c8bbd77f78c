package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.anomaly.detector.aggregator.AggregationResult;
import org.mailpulse.alert.engine.anomaly.detector.aggregator.TimeBucket;
import org.mailpulse.alert.engine.anomaly.detector.aggregator.TimeBucketAggregator;
import org.mailpulse.alert.engine.anomaly.detector.clustering.ClusteringAnomalyDetector;
import org.mailpulse.alert.engine.anomaly.detector.clustering.ClusteringParams;
import org.mailpulse.alert.engine.anomaly.detector.clustering.DetectionResult;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.AnomalyType;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.TimeSeriesPoint;
import org.mailpulse.alert.engine.datamodel.store.ContributorDimension;
import org.mailpulse.alert.engine.datamodel.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DBSCAN and K-Means alerts. Buckets the baseline period and the monitoring window as one series
 * and fires when any bucket of the monitoring window is anomalous.
 */
class ClusterRuleEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterRuleEvaluator.class);
  private static final ConcurrentMap<String, Timer> clusterRuleTimer = new ConcurrentHashMap<>();
  private static final String CLUSTER_RULE_TIMER = "mailpulse.alert.engine.cluster.rule.latency";
  static final int MIN_POINTS = 3;
  static final String INSUFFICIENT_DATA = "Insufficient data for analysis";

  private final TimeBucketAggregator aggregator;
  private final ClusteringAnomalyDetector detector;
  private final EventStore eventStore;
  private final EvaluatorConfig evaluatorConfig;

  ClusterRuleEvaluator(
      TimeBucketAggregator aggregator,
      ClusteringAnomalyDetector detector,
      EventStore eventStore,
      EvaluatorConfig evaluatorConfig) {
    this.aggregator = aggregator;
    this.detector = detector;
    this.eventStore = eventStore;
    this.evaluatorConfig = evaluatorConfig;
  }

  Detection evaluateRule(AlertDefinition alertDefinition, Instant now) {
    return evaluateRule(alertDefinition, alertDefinition.getFilter(), now);
  }

  Detection evaluateRule(AlertDefinition alertDefinition, EventFilter filter, Instant now) {
    Instant startTime = Instant.now();
    AnomalySpec anomalySpec = alertDefinition.getKind().getAnomaly();
    Instant windowStart = now.minus(alertDefinition.getTimeWindow().getDuration());
    Instant rangeStart =
        windowStart.minus(Duration.ofDays(alertDefinition.getTimeWindow().getBaselineDays()));

    AggregationResult aggregation = aggregator.aggregate(rangeStart, now, filter);
    List<TimeBucket> buckets = aggregation.getBuckets();
    List<TimeSeriesPoint> timeSeries =
        buckets.stream()
            .map(b -> new TimeSeriesPoint(b.getStart(), b.valueOf(alertDefinition.getMetric())))
            .collect(Collectors.toUnmodifiableList());

    if (buckets.size() < MIN_POINTS) {
      LOGGER.debug(
          "Rule id {}, only {} buckets, skipping detection", alertDefinition.getId(), buckets.size());
      return Detection.builder().reason(INSUFFICIENT_DATA).timeSeries(timeSeries).build();
    }

    double[] values = timeSeries.stream().mapToDouble(TimeSeriesPoint::getValue).toArray();
    DetectionResult result =
        detector.detect(values, anomalySpec.getAlgorithm(), ClusteringParams.fromSpec(anomalySpec));

    int currentStartIndex =
        currentStartIndex(buckets, aggregation.getResolution().truncate(windowStart));
    double currentValue = mean(values, currentStartIndex);
    double baseline = result.getBaseline();
    boolean anomalous = result.hasAnomalyFrom(currentStartIndex);

    clusterRuleTimer
        .computeIfAbsent(
            anomalySpec.getAlgorithm().name(),
            k -> Metrics.timer(CLUSTER_RULE_TIMER, "algorithm", k))
        .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);

    LOGGER.debug(
        "Rule id {}, {} buckets at {}, current from index {}, anomalies {}, baseline {}",
        alertDefinition.getId(),
        buckets.size(),
        aggregation.getResolution(),
        currentStartIndex,
        result.getAnomalyIndices(),
        baseline);

    Detection.DetectionBuilder detection =
        Detection.builder()
            .anomalous(anomalous)
            .currentValue(currentValue)
            .baselineValue(baseline)
            .score(result.scoreFrom(currentStartIndex))
            .timeSeries(timeSeries)
            .topContributors(
                eventStore.topContributors(
                    windowStart,
                    now,
                    filter,
                    ContributorDimension.ENTITY,
                    evaluatorConfig.getClusterTopContributorsLimit()));
    if (baseline > 0) {
      detection.percentageChange((currentValue - baseline) / baseline * 100);
    }
    if (anomalous) {
      AnomalyType anomalyType = AnomalyType.classify(currentValue, baseline);
      detection.anomalyType(anomalyType).reason(reason(anomalyType, currentValue, baseline));
    }
    return detection.build();
  }

  private static int currentStartIndex(List<TimeBucket> buckets, Instant firstCurrentBucket) {
    for (int i = 0; i < buckets.size(); i++) {
      if (!buckets.get(i).getStart().isBefore(firstCurrentBucket)) {
        return i;
      }
    }
    return buckets.size();
  }

  private static double mean(double[] values, int fromIndex) {
    if (fromIndex >= values.length) {
      return 0;
    }
    double total = 0;
    for (int i = fromIndex; i < values.length; i++) {
      total += values[i];
    }
    return total / (values.length - fromIndex);
  }

  static String reason(AnomalyType anomalyType, double currentValue, double baseline) {
    switch (anomalyType) {
      case SPIKE:
        return baseline > 0
            ? String.format(
                "Volume spiked by %.1f%% compared to baseline",
                (currentValue - baseline) / baseline * 100)
            : "Volume spiked compared to an empty baseline";
      case SILENCE:
        return String.format(
            "Volume dropped by %.1f%% (possible silence)",
            (baseline - currentValue) / baseline * 100);
      case UNUSUAL_PATTERN:
        return "Unusual pattern detected in activity distribution";
      default:
        throw new UnsupportedOperationException("Unsupported anomaly type: " + anomalyType);
    }
  }
}
