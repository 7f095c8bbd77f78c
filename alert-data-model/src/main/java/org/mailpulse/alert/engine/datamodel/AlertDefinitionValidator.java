package org.mailpulse.alert.engine.datamodel;

import org.apache.commons.lang3.StringUtils;

/** Structural checks on a definition, run when it is read and again before each evaluation. */
public class AlertDefinitionValidator {

  public static void validate(AlertDefinition alertDefinition) {
    String alertId = alertDefinition.getId();
    if (StringUtils.isBlank(alertId)) {
      throw new InvalidConfigurationException(null, "Alert definition without id");
    }
    if (alertDefinition.getKind() == null) {
      throw new InvalidConfigurationException(alertId, "Missing alert kind");
    }
    TimeWindow timeWindow = alertDefinition.getTimeWindow();
    if (timeWindow == null || timeWindow.getSize() <= 0 || timeWindow.getUnit() == null) {
      throw new InvalidConfigurationException(alertId, "Window size must be positive");
    }
    if (timeWindow.getBaselineDays() <= 0) {
      throw new InvalidConfigurationException(alertId, "Baseline days must be positive");
    }
    validateCooldown(alertId, alertDefinition.getCooldown());

    AlertKind kind = alertDefinition.getKind();
    switch (kind.getKindCase()) {
      case STATIC:
        if (kind.getThreshold().getOperator() == null) {
          throw new InvalidConfigurationException(alertId, "Missing threshold operator");
        }
        break;
      case ANOMALY:
        validateAnomaly(alertId, kind.getAnomaly());
        break;
      case SEMANTIC_MATCH:
        validateAnomaly(alertId, kind.getAnomaly());
        if (!kind.getAnomaly().getAlgorithm().isClustering()) {
          throw new InvalidConfigurationException(
              alertId,
              "Semantic match alerts need a clustering algorithm, got "
                  + kind.getAnomaly().getAlgorithm());
        }
        SemanticQuery semanticQuery = kind.getSemanticQuery();
        if (StringUtils.isBlank(semanticQuery.getQuery())) {
          throw new InvalidConfigurationException(alertId, "Missing semantic match query");
        }
        if (semanticQuery.getSimilarityThreshold() < 0 || semanticQuery.getSimilarityThreshold() > 1) {
          throw new InvalidConfigurationException(
              alertId, "Similarity threshold must be within [0, 1]");
        }
        break;
      default:
        throw new UnsupportedOperationException("Unsupported alert kind: " + kind.getKindCase());
    }
  }

  private static void validateCooldown(String alertId, CooldownSpec cooldown) {
    if (cooldown == null) {
      throw new InvalidConfigurationException(alertId, "Missing cooldown spec");
    }
    if (cooldown.getCooldownMinutes() < 0
        || cooldown.getMaxAlertsPerDay() < 1
        || cooldown.getConsecutiveAnomalies() < 1) {
      throw new InvalidConfigurationException(alertId, "Invalid cooldown spec " + cooldown);
    }
  }

  private static void validateAnomaly(String alertId, AnomalySpec anomaly) {
    if (anomaly.getAlgorithm() == null) {
      throw new InvalidConfigurationException(alertId, "Missing anomaly algorithm");
    }
    if (anomaly.getEwmaSpan() < 1) {
      throw new InvalidConfigurationException(alertId, "EWMA span must be positive");
    }
    if (anomaly.getEps() <= 0 || anomaly.getMinSamples() < 1 || anomaly.getClusters() < 1) {
      throw new InvalidConfigurationException(alertId, "Invalid clustering parameters");
    }
    if (anomaly.getPercentile() <= 0 || anomaly.getPercentile() > 100) {
      throw new InvalidConfigurationException(alertId, "Percentile must be within (0, 100]");
    }
    if (anomaly.getSensitivity() <= 0) {
      throw new InvalidConfigurationException(alertId, "Sensitivity must be positive");
    }
  }
}
