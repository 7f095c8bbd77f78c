package org.mailpulse.alert.engine.datamodel;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class TimeWindow {
  @Builder.Default private final int size = 1;
  @Builder.Default private final WindowUnit unit = WindowUnit.DAYS;
  @Builder.Default private final int checkFrequencyMinutes = 5;
  @Builder.Default private final int baselineDays = 7;

  public Duration getDuration() {
    return Duration.ofMinutes(unit.toMinutes(size));
  }
}
