package org.mailpulse.alert.engine.datamodel;

import com.google.common.base.Preconditions;
import lombok.ToString;

/**
 * Tagged union of the alert kinds the engine evaluates. Exactly one branch is populated, selected
 * by {@link #getKindCase()}; reading another branch is a programming error.
 */
@ToString
public final class AlertKind {

  public enum KindCase {
    STATIC,
    ANOMALY,
    SEMANTIC_MATCH
  }

  private final KindCase kindCase;
  private final ThresholdSpec threshold;
  private final AnomalySpec anomaly;
  private final SemanticQuery semanticQuery;

  private AlertKind(
      KindCase kindCase, ThresholdSpec threshold, AnomalySpec anomaly, SemanticQuery semanticQuery) {
    this.kindCase = kindCase;
    this.threshold = threshold;
    this.anomaly = anomaly;
    this.semanticQuery = semanticQuery;
  }

  public static AlertKind staticThreshold(ThresholdSpec threshold) {
    return new AlertKind(KindCase.STATIC, Preconditions.checkNotNull(threshold), null, null);
  }

  public static AlertKind anomaly(AnomalySpec anomaly) {
    return new AlertKind(KindCase.ANOMALY, null, Preconditions.checkNotNull(anomaly), null);
  }

  public static AlertKind semanticMatch(SemanticQuery semanticQuery, AnomalySpec anomaly) {
    return new AlertKind(
        KindCase.SEMANTIC_MATCH,
        null,
        Preconditions.checkNotNull(anomaly),
        Preconditions.checkNotNull(semanticQuery));
  }

  public KindCase getKindCase() {
    return kindCase;
  }

  public ThresholdSpec getThreshold() {
    Preconditions.checkState(kindCase == KindCase.STATIC, "No threshold on %s alert", kindCase);
    return threshold;
  }

  public AnomalySpec getAnomaly() {
    Preconditions.checkState(kindCase != KindCase.STATIC, "No anomaly spec on static alert");
    return anomaly;
  }

  public SemanticQuery getSemanticQuery() {
    Preconditions.checkState(
        kindCase == KindCase.SEMANTIC_MATCH, "No semantic query on %s alert", kindCase);
    return semanticQuery;
  }
}
