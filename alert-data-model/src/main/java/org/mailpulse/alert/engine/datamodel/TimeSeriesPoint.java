package org.mailpulse.alert.engine.datamodel;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor
@Getter
@ToString
@EqualsAndHashCode
public class TimeSeriesPoint {
  private final Instant timestamp;
  private final double value;
}
