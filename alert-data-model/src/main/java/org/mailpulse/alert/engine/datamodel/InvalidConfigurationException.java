package org.mailpulse.alert.engine.datamodel;

/** A malformed alert definition. Surfaced to the caller instead of being suppressed. */
public class InvalidConfigurationException extends RuntimeException {
  private final String alertId;

  public InvalidConfigurationException(String alertId, String message) {
    super(alertId == null ? message : String.format("Alert %s: %s", alertId, message));
    this.alertId = alertId;
  }

  public InvalidConfigurationException(String alertId, String message, Throwable cause) {
    super(alertId == null ? message : String.format("Alert %s: %s", alertId, message), cause);
    this.alertId = alertId;
  }

  public String getAlertId() {
    return alertId;
  }
}
