package org.mailpulse.alert.engine;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.Severity;

@Builder
@Getter
@ToString
public class AlertStats {
  private final long totalAlerts;
  private final long enabledAlerts;
  private final long triggeredLast24Hours;
  // every severity is present, enabled definitions only
  private final Map<Severity, Long> enabledBySeverity;
}
