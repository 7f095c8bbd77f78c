package org.mailpulse.alert.engine.datamodel;

public enum ThresholdOperator {
  GREATER_THAN,
  LESS_THAN,
  EQUALS,
  NOT_EQUALS;

  public String displayName() {
    return name().toLowerCase().replace('_', ' ');
  }
}
