package org.mailpulse.alert.engine.anomaly.detector.aggregator;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.MetricType;

@AllArgsConstructor
@Getter
@ToString
@EqualsAndHashCode
public class TimeBucket {
  private final Instant start;
  private final long count;
  private final long distinctActors;
  private final long entityMentions;
  private final List<String> memberIds;

  static TimeBucket empty(Instant start) {
    return new TimeBucket(start, 0, 0, 0, List.of());
  }

  /** The value a clustering alert on this metric looks at. */
  public double valueOf(MetricType metric) {
    switch (metric) {
      case UNIQUE_SENDERS:
        return distinctActors;
      case ENTITY_MENTIONS:
        return entityMentions;
      default:
        return count;
    }
  }
}
