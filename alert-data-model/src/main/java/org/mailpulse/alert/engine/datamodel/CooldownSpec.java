package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class CooldownSpec {
  @Builder.Default private final boolean enabled = true;
  @Builder.Default private final int cooldownMinutes = 60;
  @Builder.Default private final int maxAlertsPerDay = 10;
  @Builder.Default private final int consecutiveAnomalies = 1;
}
