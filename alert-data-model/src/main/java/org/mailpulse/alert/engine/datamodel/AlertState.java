package org.mailpulse.alert.engine.datamodel;

import java.time.Instant;
import java.time.LocalDate;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Mutable evaluation state of one alert definition. Guarded by the per-alert lock. */
@Getter
@Setter
@ToString
public class AlertState {
  private Instant lastCheckedAt;
  private Instant lastTriggeredAt;
  private long triggerCount;
  private int alertsToday;
  private LocalDate alertsTodayDate;
  private int consecutiveAnomalyCount;
  private Double lastValue;
  private Double lastBaseline;
  private Double lastScore;
}
