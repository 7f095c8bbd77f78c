package org.mailpulse.alert.engine.datamodel;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
