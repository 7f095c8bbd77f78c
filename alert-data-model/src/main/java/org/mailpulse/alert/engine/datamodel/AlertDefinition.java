package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class AlertDefinition {
  private final String id;
  private final String name;
  private final String description;
  @Builder.Default private final MetricType metric = MetricType.EMAIL_VOLUME;
  @Builder.Default private final EventFilter filter = EventFilter.none();
  @Builder.Default private final TimeWindow timeWindow = TimeWindow.builder().build();
  private final AlertKind kind;
  @Builder.Default private final CooldownSpec cooldown = CooldownSpec.builder().build();
  @Builder.Default private final Severity severity = Severity.MEDIUM;
  @Builder.Default private final boolean enabled = true;
  // notification channel the sink delivers triggers to, optional
  private final String channelId;
  @Builder.Default private final AlertState state = new AlertState();

  public AlertSummary toSummary() {
    return AlertSummary.builder()
        .alertId(id)
        .alertName(name)
        .severity(severity)
        .kindCase(kind == null ? null : kind.getKindCase())
        .channelId(channelId)
        .build();
  }
}
