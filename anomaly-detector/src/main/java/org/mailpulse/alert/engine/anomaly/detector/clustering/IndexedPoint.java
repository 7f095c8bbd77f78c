package org.mailpulse.alert.engine.anomaly.detector.clustering;

import org.apache.commons.math3.ml.clustering.Clusterable;

/** A standardized value remembering its position in the input series. */
class IndexedPoint implements Clusterable {
  private final int index;
  private final double[] point;

  IndexedPoint(int index, double value) {
    this.index = index;
    this.point = new double[] {value};
  }

  int getIndex() {
    return index;
  }

  @Override
  public double[] getPoint() {
    return point;
  }
}
