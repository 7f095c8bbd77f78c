package org.mailpulse.alert.engine.datamodel.rule.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertDefinitionValidator;
import org.mailpulse.alert.engine.datamodel.AlertKind;
import org.mailpulse.alert.engine.datamodel.AnomalySpec;
import org.mailpulse.alert.engine.datamodel.CooldownSpec;
import org.mailpulse.alert.engine.datamodel.DetectionAlgorithm;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.InvalidConfigurationException;
import org.mailpulse.alert.engine.datamodel.MetricType;
import org.mailpulse.alert.engine.datamodel.SemanticQuery;
import org.mailpulse.alert.engine.datamodel.Severity;
import org.mailpulse.alert.engine.datamodel.ThresholdOperator;
import org.mailpulse.alert.engine.datamodel.ThresholdSpec;
import org.mailpulse.alert.engine.datamodel.TimeWindow;
import org.mailpulse.alert.engine.datamodel.WindowUnit;

/**
 * Converts the JSON form of an alert definition. Enum values are matched case-insensitively, so
 * {@code "greater_than"} and {@code "GREATER_THAN"} are equivalent. Missing optional sections take
 * their defaults.
 */
public class AlertDefinitionParser {
  static final String ID = "id";
  static final String NAME = "name";
  static final String DESCRIPTION = "description";
  static final String SEVERITY = "severity";
  static final String ENABLED = "enabled";
  static final String CHANNEL_ID = "channelId";
  static final String METRIC = "metric";
  static final String FILTER = "filter";
  static final String ENTITY_TYPE = "entityType";
  static final String ENTITY_VALUE = "entityValue";
  static final String SENDER_DOMAINS = "senderDomains";
  static final String KEYWORDS = "keywords";
  static final String TIME_WINDOW = "timeWindow";
  static final String WINDOW_SIZE = "size";
  static final String WINDOW_UNIT = "unit";
  static final String CHECK_FREQUENCY_MINUTES = "checkFrequencyMinutes";
  static final String BASELINE_DAYS = "baselineDays";
  static final String KIND = "kind";
  static final String KIND_TYPE = "type";
  static final String THRESHOLD = "threshold";
  static final String OPERATOR = "operator";
  static final String VALUE = "value";
  static final String ANOMALY = "anomaly";
  static final String ALGORITHM = "algorithm";
  static final String ZSCORE_THRESHOLD = "zscoreThreshold";
  static final String EWMA_SPAN = "ewmaSpan";
  static final String EWMA_THRESHOLD_SCALE = "ewmaThresholdScale";
  static final String PERCENTAGE_THRESHOLD = "percentageThreshold";
  static final String EPS = "eps";
  static final String MIN_SAMPLES = "minSamples";
  static final String CLUSTERS = "clusters";
  static final String PERCENTILE = "percentile";
  static final String SENSITIVITY = "sensitivity";
  static final String QUERY = "query";
  static final String SIMILARITY_THRESHOLD = "similarityThreshold";
  static final String COOLDOWN = "cooldown";
  static final String COOLDOWN_ENABLED = "enabled";
  static final String COOLDOWN_MINUTES = "cooldownMinutes";
  static final String MAX_ALERTS_PER_DAY = "maxAlertsPerDay";
  static final String CONSECUTIVE_ANOMALIES = "consecutiveAnomalies";

  public AlertDefinition parse(JsonNode node) {
    String alertId = node.hasNonNull(ID) ? node.get(ID).asText() : null;
    if (alertId == null) {
      throw new InvalidConfigurationException(null, "Alert definition without id: " + node);
    }

    AlertDefinition.AlertDefinitionBuilder builder =
        AlertDefinition.builder()
            .id(alertId)
            .name(node.hasNonNull(NAME) ? node.get(NAME).asText() : alertId)
            .description(node.hasNonNull(DESCRIPTION) ? node.get(DESCRIPTION).asText() : null)
            .enabled(!node.hasNonNull(ENABLED) || node.get(ENABLED).asBoolean())
            .channelId(node.hasNonNull(CHANNEL_ID) ? node.get(CHANNEL_ID).asText() : null)
            .kind(parseKind(alertId, node.get(KIND)));

    if (node.hasNonNull(SEVERITY)) {
      builder.severity(parseEnum(Severity.class, alertId, SEVERITY, node.get(SEVERITY)));
    }
    if (node.hasNonNull(METRIC)) {
      builder.metric(parseEnum(MetricType.class, alertId, METRIC, node.get(METRIC)));
    }
    if (node.hasNonNull(FILTER)) {
      builder.filter(parseFilter(node.get(FILTER)));
    }
    if (node.hasNonNull(TIME_WINDOW)) {
      builder.timeWindow(parseTimeWindow(alertId, node.get(TIME_WINDOW)));
    }
    if (node.hasNonNull(COOLDOWN)) {
      builder.cooldown(parseCooldown(node.get(COOLDOWN)));
    }

    AlertDefinition alertDefinition = builder.build();
    AlertDefinitionValidator.validate(alertDefinition);
    return alertDefinition;
  }

  private AlertKind parseKind(String alertId, JsonNode kindNode) {
    if (kindNode == null || !kindNode.hasNonNull(KIND_TYPE)) {
      throw new InvalidConfigurationException(alertId, "Missing alert kind");
    }
    AlertKind.KindCase kindCase =
        parseEnum(AlertKind.KindCase.class, alertId, KIND_TYPE, kindNode.get(KIND_TYPE));
    switch (kindCase) {
      case STATIC:
        return AlertKind.staticThreshold(parseThreshold(alertId, kindNode.get(THRESHOLD)));
      case ANOMALY:
        return AlertKind.anomaly(
            parseAnomaly(alertId, kindNode.get(ANOMALY), DetectionAlgorithm.ZSCORE));
      case SEMANTIC_MATCH:
        if (!kindNode.hasNonNull(QUERY)) {
          throw new InvalidConfigurationException(alertId, "Missing semantic match query");
        }
        SemanticQuery.SemanticQueryBuilder query =
            SemanticQuery.builder().query(kindNode.get(QUERY).asText());
        if (kindNode.hasNonNull(SIMILARITY_THRESHOLD)) {
          query.similarityThreshold(kindNode.get(SIMILARITY_THRESHOLD).asDouble());
        }
        return AlertKind.semanticMatch(
            query.build(), parseAnomaly(alertId, kindNode.get(ANOMALY), DetectionAlgorithm.DBSCAN));
      default:
        throw new UnsupportedOperationException("Unsupported alert kind: " + kindCase);
    }
  }

  private ThresholdSpec parseThreshold(String alertId, JsonNode node) {
    if (node == null) {
      throw new InvalidConfigurationException(alertId, "Static alert without threshold");
    }
    ThresholdSpec.ThresholdSpecBuilder builder = ThresholdSpec.builder();
    if (node.hasNonNull(OPERATOR)) {
      builder.operator(parseEnum(ThresholdOperator.class, alertId, OPERATOR, node.get(OPERATOR)));
    }
    if (node.hasNonNull(VALUE)) {
      if (!node.get(VALUE).isNumber()) {
        throw new InvalidConfigurationException(
            alertId, "Threshold value is not a number: " + node.get(VALUE));
      }
      builder.value(node.get(VALUE).asDouble());
    }
    return builder.build();
  }

  private AnomalySpec parseAnomaly(
      String alertId, JsonNode node, DetectionAlgorithm defaultAlgorithm) {
    AnomalySpec.AnomalySpecBuilder builder = AnomalySpec.builder().algorithm(defaultAlgorithm);
    if (node == null) {
      return builder.build();
    }
    if (node.hasNonNull(ALGORITHM)) {
      builder.algorithm(
          parseEnum(DetectionAlgorithm.class, alertId, ALGORITHM, node.get(ALGORITHM)));
    }
    if (node.hasNonNull(ZSCORE_THRESHOLD)) {
      builder.zscoreThreshold(node.get(ZSCORE_THRESHOLD).asDouble());
    }
    if (node.hasNonNull(EWMA_SPAN)) {
      builder.ewmaSpan(node.get(EWMA_SPAN).asInt());
    }
    if (node.hasNonNull(EWMA_THRESHOLD_SCALE)) {
      builder.ewmaThresholdScale(node.get(EWMA_THRESHOLD_SCALE).asDouble());
    }
    if (node.hasNonNull(PERCENTAGE_THRESHOLD)) {
      builder.percentageThreshold(node.get(PERCENTAGE_THRESHOLD).asDouble());
    }
    if (node.hasNonNull(EPS)) {
      builder.eps(node.get(EPS).asDouble());
    }
    if (node.hasNonNull(MIN_SAMPLES)) {
      builder.minSamples(node.get(MIN_SAMPLES).asInt());
    }
    if (node.hasNonNull(CLUSTERS)) {
      builder.clusters(node.get(CLUSTERS).asInt());
    }
    if (node.hasNonNull(PERCENTILE)) {
      builder.percentile(node.get(PERCENTILE).asDouble());
    }
    if (node.hasNonNull(SENSITIVITY)) {
      builder.sensitivity(node.get(SENSITIVITY).asDouble());
    }
    return builder.build();
  }

  private EventFilter parseFilter(JsonNode node) {
    return EventFilter.builder()
        .entityType(node.hasNonNull(ENTITY_TYPE) ? node.get(ENTITY_TYPE).asText() : null)
        .entityValue(node.hasNonNull(ENTITY_VALUE) ? node.get(ENTITY_VALUE).asText() : null)
        .senderDomains(readStrings(node.get(SENDER_DOMAINS)))
        .keywords(readStrings(node.get(KEYWORDS)))
        .build();
  }

  private TimeWindow parseTimeWindow(String alertId, JsonNode node) {
    TimeWindow.TimeWindowBuilder builder = TimeWindow.builder();
    if (node.hasNonNull(WINDOW_SIZE)) {
      builder.size(node.get(WINDOW_SIZE).asInt());
    }
    if (node.hasNonNull(WINDOW_UNIT)) {
      builder.unit(parseEnum(WindowUnit.class, alertId, WINDOW_UNIT, node.get(WINDOW_UNIT)));
    }
    if (node.hasNonNull(CHECK_FREQUENCY_MINUTES)) {
      builder.checkFrequencyMinutes(node.get(CHECK_FREQUENCY_MINUTES).asInt());
    }
    if (node.hasNonNull(BASELINE_DAYS)) {
      builder.baselineDays(node.get(BASELINE_DAYS).asInt());
    }
    return builder.build();
  }

  private CooldownSpec parseCooldown(JsonNode node) {
    CooldownSpec.CooldownSpecBuilder builder = CooldownSpec.builder();
    if (node.hasNonNull(COOLDOWN_ENABLED)) {
      builder.enabled(node.get(COOLDOWN_ENABLED).asBoolean());
    }
    if (node.hasNonNull(COOLDOWN_MINUTES)) {
      builder.cooldownMinutes(node.get(COOLDOWN_MINUTES).asInt());
    }
    if (node.hasNonNull(MAX_ALERTS_PER_DAY)) {
      builder.maxAlertsPerDay(node.get(MAX_ALERTS_PER_DAY).asInt());
    }
    if (node.hasNonNull(CONSECUTIVE_ANOMALIES)) {
      builder.consecutiveAnomalies(node.get(CONSECUTIVE_ANOMALIES).asInt());
    }
    return builder.build();
  }

  private static List<String> readStrings(JsonNode node) {
    if (node == null || !node.isArray()) {
      return List.of();
    }
    return StreamSupport.stream(node.spliterator(), false)
        .map(JsonNode::asText)
        .collect(Collectors.toUnmodifiableList());
  }

  private static <E extends Enum<E>> E parseEnum(
      Class<E> enumClass, String alertId, String field, JsonNode value) {
    try {
      return Enum.valueOf(enumClass, value.asText().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidConfigurationException(
          alertId, String.format("Unknown %s: %s", field, value.asText()), e);
    }
  }
}
