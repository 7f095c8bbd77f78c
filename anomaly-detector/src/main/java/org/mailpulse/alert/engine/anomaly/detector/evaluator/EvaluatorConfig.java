package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.Getter;
import lombok.ToString;

/** Engine wide evaluation settings, read from the {@code evaluator} config section. */
@Getter
@ToString
public class EvaluatorConfig {
  static final String TIME_SERIES_DAYS = "timeSeriesDays";
  static final String SNAPSHOT_POINTS = "snapshotPoints";
  static final String TOP_CONTRIBUTORS_LIMIT = "topContributorsLimit";
  static final String CLUSTER_TOP_CONTRIBUTORS_LIMIT = "clusterTopContributorsLimit";
  static final String EWMA_THRESHOLD_SCALE = "ewmaThresholdScale";

  static final int DEFAULT_TIME_SERIES_DAYS = 7;
  static final int DEFAULT_SNAPSHOT_POINTS = 24;
  static final int DEFAULT_TOP_CONTRIBUTORS_LIMIT = 5;
  static final int DEFAULT_CLUSTER_TOP_CONTRIBUTORS_LIMIT = 10;
  static final double DEFAULT_EWMA_THRESHOLD_SCALE = 0.1;

  private final int timeSeriesDays;
  private final int snapshotPoints;
  private final int topContributorsLimit;
  private final int clusterTopContributorsLimit;
  private final double ewmaThresholdScale;

  public EvaluatorConfig(Config evaluatorConfig) {
    this.timeSeriesDays =
        evaluatorConfig.hasPath(TIME_SERIES_DAYS)
            ? evaluatorConfig.getInt(TIME_SERIES_DAYS)
            : DEFAULT_TIME_SERIES_DAYS;
    this.snapshotPoints =
        evaluatorConfig.hasPath(SNAPSHOT_POINTS)
            ? evaluatorConfig.getInt(SNAPSHOT_POINTS)
            : DEFAULT_SNAPSHOT_POINTS;
    this.topContributorsLimit =
        evaluatorConfig.hasPath(TOP_CONTRIBUTORS_LIMIT)
            ? evaluatorConfig.getInt(TOP_CONTRIBUTORS_LIMIT)
            : DEFAULT_TOP_CONTRIBUTORS_LIMIT;
    this.clusterTopContributorsLimit =
        evaluatorConfig.hasPath(CLUSTER_TOP_CONTRIBUTORS_LIMIT)
            ? evaluatorConfig.getInt(CLUSTER_TOP_CONTRIBUTORS_LIMIT)
            : DEFAULT_CLUSTER_TOP_CONTRIBUTORS_LIMIT;
    this.ewmaThresholdScale =
        evaluatorConfig.hasPath(EWMA_THRESHOLD_SCALE)
            ? evaluatorConfig.getDouble(EWMA_THRESHOLD_SCALE)
            : DEFAULT_EWMA_THRESHOLD_SCALE;
  }

  public static EvaluatorConfig defaults() {
    return new EvaluatorConfig(ConfigFactory.empty());
  }
}
