package org.mailpulse.alert.engine.datamodel;

/** What an alert counts inside its monitoring window. */
public enum MetricType {
  EMAIL_VOLUME,
  UNIQUE_SENDERS,
  ENTITY_MENTIONS,
  KEYWORD_MATCHES
}
