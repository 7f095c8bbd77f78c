package org.mailpulse.alert.engine.anomaly.detector.aggregator;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor
@Getter
@ToString
public class AggregationResult {
  private final List<TimeBucket> buckets;
  private final Resolution resolution;

  public boolean isEmpty() {
    return buckets.isEmpty();
  }

  public int size() {
    return buckets.size();
  }
}
