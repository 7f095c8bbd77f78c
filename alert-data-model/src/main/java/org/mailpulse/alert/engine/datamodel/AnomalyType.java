package org.mailpulse.alert.engine.datamodel;

public enum AnomalyType {
  SPIKE,
  SILENCE,
  UNUSUAL_PATTERN;

  private static final double SPIKE_FACTOR = 1.5;
  private static final double SILENCE_FACTOR = 0.3;

  public static AnomalyType classify(double value, double baseline) {
    if (value > SPIKE_FACTOR * baseline) {
      return SPIKE;
    }
    if (value < SILENCE_FACTOR * baseline) {
      return SILENCE;
    }
    return UNUSUAL_PATTERN;
  }
}
