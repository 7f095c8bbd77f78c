package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** The part of an alert definition handed to the notification collaborator. */
@Builder
@Getter
@ToString
public class AlertSummary {
  private final String alertId;
  private final String alertName;
  private final Severity severity;
  private final AlertKind.KindCase kindCase;
  private final String channelId;
}
