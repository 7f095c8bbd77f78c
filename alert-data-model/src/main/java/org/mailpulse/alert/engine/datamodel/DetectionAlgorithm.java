package org.mailpulse.alert.engine.datamodel;

public enum DetectionAlgorithm {
  ZSCORE,
  EWMA,
  PERCENTAGE_CHANGE,
  DBSCAN,
  KMEANS;

  public boolean isClustering() {
    return this == DBSCAN || this == KMEANS;
  }
}
