package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class ThresholdSpec {
  @Builder.Default private final ThresholdOperator operator = ThresholdOperator.GREATER_THAN;
  @Builder.Default private final double value = 100;
}
