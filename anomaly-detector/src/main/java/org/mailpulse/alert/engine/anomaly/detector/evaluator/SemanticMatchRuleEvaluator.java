package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import java.time.Instant;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.SemanticQuery;
import org.mailpulse.alert.engine.datamodel.store.SemanticMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Clusters the daily volume of the events matching a free text description. */
class SemanticMatchRuleEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SemanticMatchRuleEvaluator.class);
  static final String NO_MATCHES = "No events match the description";

  private final SemanticMatcher semanticMatcher;
  private final ClusterRuleEvaluator clusterRuleEvaluator;

  SemanticMatchRuleEvaluator(
      SemanticMatcher semanticMatcher, ClusterRuleEvaluator clusterRuleEvaluator) {
    this.semanticMatcher = semanticMatcher;
    this.clusterRuleEvaluator = clusterRuleEvaluator;
  }

  Detection evaluateRule(AlertDefinition alertDefinition, Instant now) {
    SemanticQuery semanticQuery = alertDefinition.getKind().getSemanticQuery();
    List<String> matchingIds =
        semanticMatcher.matchingIds(
            semanticQuery.getQuery(), semanticQuery.getSimilarityThreshold());
    LOGGER.debug(
        "Rule id {}, {} events match '{}' at similarity {}",
        alertDefinition.getId(),
        matchingIds.size(),
        semanticQuery.getQuery(),
        semanticQuery.getSimilarityThreshold());

    if (matchingIds.isEmpty()) {
      return Detection.builder().reason(NO_MATCHES).build();
    }

    EventFilter filter = alertDefinition.getFilter().toBuilder().emailIds(matchingIds).build();
    return clusterRuleEvaluator.evaluateRule(alertDefinition, filter, now);
  }
}
