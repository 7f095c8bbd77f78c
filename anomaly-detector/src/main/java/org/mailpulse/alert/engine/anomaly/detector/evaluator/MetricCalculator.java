package org.mailpulse.alert.engine.anomaly.detector.evaluator;

import java.time.Instant;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.Contributor;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.MetricType;
import org.mailpulse.alert.engine.datamodel.store.ContributorDimension;
import org.mailpulse.alert.engine.datamodel.store.EventStore;

class MetricCalculator {
  private final EventStore eventStore;

  MetricCalculator(EventStore eventStore) {
    this.eventStore = eventStore;
  }

  double compute(MetricType metric, Instant start, Instant end, EventFilter filter) {
    switch (metric) {
      case EMAIL_VOLUME:
        return eventStore.countEvents(start, end, filter);
      case UNIQUE_SENDERS:
        return eventStore.countDistinctActors(start, end, filter);
      case ENTITY_MENTIONS:
        return eventStore.countEntityMentions(start, end, filter);
      case KEYWORD_MATCHES:
        // without keywords nothing can match
        return filter.getKeywords().isEmpty() ? 0 : eventStore.countEvents(start, end, filter);
      default:
        throw new UnsupportedOperationException("Unsupported metric type: " + metric);
    }
  }

  List<Contributor> topContributors(
      MetricType metric, Instant start, Instant end, EventFilter filter, int limit) {
    ContributorDimension dimension =
        metric == MetricType.ENTITY_MENTIONS
            ? ContributorDimension.ENTITY
            : ContributorDimension.SENDER;
    return eventStore.topContributors(start, end, filter, dimension, limit);
  }
}
