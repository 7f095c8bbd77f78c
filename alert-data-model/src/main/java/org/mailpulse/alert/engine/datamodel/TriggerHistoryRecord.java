package org.mailpulse.alert.engine.datamodel;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Append-only record of an approved trigger. Only the notification fields change after the record
 * is written.
 */
@Builder
@Getter
@ToString(exclude = "timeSeriesSnapshot")
public class TriggerHistoryRecord {
  private final String id;
  private final String alertId;
  private final String alertName;
  private final AlertKind.KindCase kindCase;
  private final Severity severity;
  private final Instant triggeredAt;
  private final double metricValue;
  private final double baselineValue;
  private final Double score;
  private final Double percentageChange;
  private final String reason;
  @Builder.Default private final List<Contributor> topContributors = List.of();
  @Builder.Default private final List<TimeSeriesPoint> timeSeriesSnapshot = List.of();

  @Setter @Builder.Default private volatile NotificationStatus notificationStatus =
      NotificationStatus.PENDING;
  @Setter private volatile String notificationError;
}
