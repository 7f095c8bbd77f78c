package org.mailpulse.alert.engine.datamodel;

public enum NotificationStatus {
  PENDING,
  SENT,
  FAILED
}
