package org.mailpulse.alert.engine.datamodel;

import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Predicate handed to the storage collaborator. Empty lists and null values do not restrict the
 * query.
 */
@Builder(toBuilder = true)
@Getter
@ToString
@EqualsAndHashCode
public class EventFilter {
  private static final EventFilter NONE = EventFilter.builder().build();

  private final String entityType;
  private final String entityValue;
  @Builder.Default private final List<String> senderDomains = List.of();
  @Builder.Default private final List<String> keywords = List.of();
  // explicit allow-list of event ids, usually produced by a semantic match
  private final List<String> emailIds;

  public static EventFilter none() {
    return NONE;
  }

  public boolean hasEmailIds() {
    return emailIds != null;
  }
}
