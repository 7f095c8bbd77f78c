package org.mailpulse.alert.engine.notification.service.notification;

import java.util.List;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.mailpulse.alert.engine.datamodel.Contributor;

/** Plain JSON payload of a triggered alert. Instants are ISO-8601 strings. */
@SuperBuilder
@Getter
public class AlertWebhookEvent {
  String eventTimestamp;
  String evaluatedAt;
  String alertId;
  String alertName;
  String severity;
  String alertKind;
  String reason;
  double currentValue;
  double baselineValue;
  Double score;
  Double percentageChange;
  String anomalyType;
  int alertsToday;
  List<Contributor> topContributors;
}
