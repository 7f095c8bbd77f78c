package org.mailpulse.alert.engine.anomaly.detector.aggregator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.datamodel.EmailEvent;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups matching events into contiguous buckets whose width depends on the queried span.
 *
 * <p>Hourly and daily series are zero filled over the whole range, weekly and monthly series only
 * hold buckets with at least one event. An explicit id allow-list in the filter bypasses the
 * resolution choice and groups the listed events by calendar day. Series longer than {@link
 * #MAX_BUCKETS} are down-sampled with a fixed stride, keeping the first bucket of each stride.
 */
public class TimeBucketAggregator {
  private static final Logger LOGGER = LoggerFactory.getLogger(TimeBucketAggregator.class);

  public static final int MAX_BUCKETS = 3000;
  public static final int MAX_MEMBER_IDS = 50;

  private final EventStore eventStore;

  public TimeBucketAggregator(EventStore eventStore) {
    this.eventStore = eventStore;
  }

  /** Aggregates the closed range {@code [start, end]}. */
  public AggregationResult aggregate(Instant start, Instant end, EventFilter filter) {
    if (filter.hasEmailIds()) {
      return aggregateMembers(start, end, filter);
    }

    Resolution resolution = Resolution.fromSpan(Duration.between(start, end));
    List<EmailEvent> events = eventStore.findEvents(start, end, filter);
    if (events.isEmpty()) {
      LOGGER.debug("No events in [{}, {}] for filter {}", start, end, filter);
      return new AggregationResult(List.of(), resolution);
    }

    TreeMap<Instant, BucketAccumulator> grouped = group(events, resolution);
    List<TimeBucket> buckets =
        resolution.isZeroFilled()
            ? zeroFill(grouped, resolution.truncate(start), end, resolution)
            : toBuckets(grouped);

    List<TimeBucket> sampled = downSample(buckets);
    LOGGER.debug(
        "Aggregated {} events in [{}, {}] into {} {} buckets",
        events.size(),
        start,
        end,
        sampled.size(),
        resolution);
    return new AggregationResult(sampled, resolution);
  }

  private AggregationResult aggregateMembers(Instant start, Instant end, EventFilter filter) {
    if (filter.getEmailIds().isEmpty()) {
      return new AggregationResult(List.of(), Resolution.DAILY);
    }
    List<EmailEvent> events = eventStore.findEvents(start, end, filter);
    LOGGER.debug(
        "Found {} events for {} allow-listed ids", events.size(), filter.getEmailIds().size());
    List<TimeBucket> buckets = toBuckets(group(events, Resolution.DAILY));
    return new AggregationResult(downSample(buckets), Resolution.DAILY);
  }

  private TreeMap<Instant, BucketAccumulator> group(
      List<EmailEvent> events, Resolution resolution) {
    TreeMap<Instant, BucketAccumulator> grouped = new TreeMap<>();
    events.stream()
        .filter(event -> event.getTimestamp() != null)
        .sorted(Comparator.comparing(EmailEvent::getTimestamp))
        .forEach(
            event ->
                grouped
                    .computeIfAbsent(
                        resolution.truncate(event.getTimestamp()), k -> new BucketAccumulator())
                    .add(event));
    return grouped;
  }

  private List<TimeBucket> zeroFill(
      Map<Instant, BucketAccumulator> grouped,
      Instant firstBucket,
      Instant end,
      Resolution resolution) {
    List<TimeBucket> buckets = new ArrayList<>();
    for (Instant current = firstBucket; !current.isAfter(end); current = resolution.next(current)) {
      BucketAccumulator accumulator = grouped.get(current);
      buckets.add(accumulator == null ? TimeBucket.empty(current) : accumulator.toBucket(current));
    }
    return buckets;
  }

  private List<TimeBucket> toBuckets(TreeMap<Instant, BucketAccumulator> grouped) {
    return grouped.entrySet().stream()
        .map(entry -> entry.getValue().toBucket(entry.getKey()))
        .collect(Collectors.toList());
  }

  static List<TimeBucket> downSample(List<TimeBucket> buckets) {
    if (buckets.size() <= MAX_BUCKETS) {
      return List.copyOf(buckets);
    }
    int stride = (buckets.size() + MAX_BUCKETS - 1) / MAX_BUCKETS;
    LOGGER.warn(
        "{} buckets exceed the maximum of {}, keeping every {}th",
        buckets.size(),
        MAX_BUCKETS,
        stride);
    List<TimeBucket> sampled = new ArrayList<>();
    for (int i = 0; i < buckets.size(); i += stride) {
      sampled.add(buckets.get(i));
    }
    return List.copyOf(sampled);
  }

  private static class BucketAccumulator {
    private long count;
    private long entityMentions;
    private final Set<String> actors = new HashSet<>();
    private final List<String> memberIds = new ArrayList<>();

    void add(EmailEvent event) {
      count++;
      entityMentions += event.getEntityMentions();
      if (event.getSender() != null) {
        actors.add(event.getSender());
      }
      if (memberIds.size() < MAX_MEMBER_IDS) {
        memberIds.add(event.getId());
      }
    }

    TimeBucket toBucket(Instant start) {
      return new TimeBucket(
          start, count, actors.size(), entityMentions, List.copyOf(memberIds));
    }
  }
}
