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
public class EmailEvent {
  private final String id;
  private final Instant timestamp;
  private final String sender;
  // entity mentions of this event that match the query's entity filter
  private final long entityMentions;
}
