package org.mailpulse.alert.engine.datamodel;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class SemanticQuery {
  private final String query;
  @Builder.Default private final double similarityThreshold = 0.7;
}
