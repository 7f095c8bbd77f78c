package org.mailpulse.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.mailpulse.alert.engine.datamodel.Contributor;
import org.mailpulse.alert.engine.datamodel.EmailEvent;
import org.mailpulse.alert.engine.datamodel.EventFilter;

/**
 * Read-only view over stored events. Ranges are closed, {@code [start, end]}, so the latest event
 * belongs to a window ending at it. Implementations signal read failures with {@link
 * org.mailpulse.alert.engine.datamodel.StorageUnavailableException}.
 */
public interface EventStore {

  long countEvents(Instant start, Instant end, EventFilter filter);

  long countDistinctActors(Instant start, Instant end, EventFilter filter);

  /** Number of entity mentions, restricted to the filter's entity type and value when set. */
  long countEntityMentions(Instant start, Instant end, EventFilter filter);

  List<Contributor> topContributors(
      Instant start, Instant end, EventFilter filter, ContributorDimension dimension, int limit);

  /** Events in range matching the filter. An allow-list in the filter ignores the range. */
  List<EmailEvent> findEvents(Instant start, Instant end, EventFilter filter);

  Optional<Instant> latestEventTimestamp();
}
