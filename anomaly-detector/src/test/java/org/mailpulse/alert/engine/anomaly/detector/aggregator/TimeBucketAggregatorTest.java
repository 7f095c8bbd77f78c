package org.mailpulse.alert.engine.anomaly.detector.aggregator;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.EventFilter;
import org.mailpulse.alert.engine.datamodel.MetricType;
import org.mailpulse.alert.engine.datamodel.store.InMemoryEventStore;
import org.mailpulse.alert.engine.datamodel.store.InMemoryEventStore.Mention;
import org.mailpulse.alert.engine.datamodel.store.InMemoryEventStore.StoredEmail;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TimeBucketAggregatorTest {

  @Test
  void testHourlyBucketsAreZeroFilled() {
    InMemoryEventStore eventStore =
        new InMemoryEventStore()
            .add(email("e1", "2001-05-01T00:15:00Z", "kenneth.lay@enron.com"))
            .add(email("e2", "2001-05-01T03:30:00Z", "jeff.skilling@enron.com"))
            .add(email("e3", "2001-05-01T03:45:00Z", "kenneth.lay@enron.com"));
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2001-05-01T00:00:00Z"),
            Instant.parse("2001-05-02T00:00:00Z"),
            EventFilter.none());

    Assertions.assertEquals(Resolution.HOURLY, result.getResolution());
    List<TimeBucket> buckets = result.getBuckets();
    Assertions.assertEquals(25, buckets.size());
    for (int i = 1; i < buckets.size(); i++) {
      Assertions.assertEquals(
          Duration.ofHours(1),
          Duration.between(buckets.get(i - 1).getStart(), buckets.get(i).getStart()));
    }
    Assertions.assertEquals(1, buckets.get(0).getCount());
    Assertions.assertEquals(0, buckets.get(1).getCount());
    Assertions.assertEquals(2, buckets.get(3).getCount());
    Assertions.assertEquals(2, buckets.get(3).getDistinctActors());
    Assertions.assertEquals(List.of("e2", "e3"), buckets.get(3).getMemberIds());
  }

  @Test
  void testMonthlyBucketsOnlyForMonthsWithData() {
    InMemoryEventStore eventStore =
        new InMemoryEventStore()
            .add(email("e1", "1995-03-10T10:00:00Z", "a@enron.com"))
            .add(email("e2", "1995-03-20T10:00:00Z", "b@enron.com"))
            .add(email("e3", "2001-07-04T10:00:00Z", "a@enron.com"));
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("1990-01-01T00:00:00Z"),
            Instant.parse("2001-12-31T00:00:00Z"),
            EventFilter.none());

    Assertions.assertEquals(Resolution.MONTHLY, result.getResolution());
    Assertions.assertEquals(2, result.size());
    Assertions.assertEquals(
        Instant.parse("1995-03-01T00:00:00Z"), result.getBuckets().get(0).getStart());
    Assertions.assertEquals(2, result.getBuckets().get(0).getCount());
    Assertions.assertEquals(
        Instant.parse("2001-07-01T00:00:00Z"), result.getBuckets().get(1).getStart());
    Assertions.assertTrue(result.getBuckets().stream().allMatch(b -> b.getCount() >= 1));
  }

  @Test
  void testWeeklyBucketsStartOnMonday() {
    InMemoryEventStore eventStore =
        new InMemoryEventStore().add(email("e1", "2001-05-02T10:00:00Z", "a@enron.com"));
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2000-01-01T00:00:00Z"),
            Instant.parse("2002-01-01T00:00:00Z"),
            EventFilter.none());

    Assertions.assertEquals(Resolution.WEEKLY, result.getResolution());
    Assertions.assertEquals(1, result.size());
    Assertions.assertEquals(
        Instant.parse("2001-04-30T00:00:00Z"), result.getBuckets().get(0).getStart());
  }

  @Test
  void testAggregateIsIdempotent() {
    InMemoryEventStore eventStore = new InMemoryEventStore();
    for (int i = 0; i < 200; i++) {
      eventStore.add(
          email(
              "e" + i,
              Instant.parse("2001-06-01T00:00:00Z").plus(Duration.ofMinutes(37L * i)).toString(),
              "user" + (i % 7) + "@enron.com"));
    }
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);
    Instant start = Instant.parse("2001-06-01T00:00:00Z");
    Instant end = Instant.parse("2001-06-10T00:00:00Z");

    AggregationResult first = aggregator.aggregate(start, end, EventFilter.none());
    AggregationResult second = aggregator.aggregate(start, end, EventFilter.none());

    Assertions.assertEquals(first.getResolution(), second.getResolution());
    Assertions.assertEquals(first.getBuckets(), second.getBuckets());
  }

  @Test
  void testBucketCountIsCapped() {
    InMemoryEventStore eventStore = new InMemoryEventStore();
    LocalDate month = LocalDate.parse("1700-01-15");
    for (int i = 0; i < 3601; i++) {
      eventStore.add(
          email(
              "e" + i,
              month.plusMonths(i).atStartOfDay(ZoneOffset.UTC).toInstant().toString(),
              "a@enron.com"));
    }
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("1700-01-01T00:00:00Z"),
            Instant.parse("2001-01-01T00:00:00Z"),
            EventFilter.none());

    Assertions.assertEquals(Resolution.MONTHLY, result.getResolution());
    Assertions.assertTrue(result.size() <= TimeBucketAggregator.MAX_BUCKETS);
    Assertions.assertEquals(1801, result.size());
    Assertions.assertEquals(
        Instant.parse("1700-01-01T00:00:00Z"), result.getBuckets().get(0).getStart());
    Assertions.assertEquals(
        Instant.parse("1700-03-01T00:00:00Z"), result.getBuckets().get(1).getStart());
  }

  @Test
  void testMemberIdsAreCapped() {
    InMemoryEventStore eventStore = new InMemoryEventStore();
    for (int i = 0; i < 60; i++) {
      eventStore.add(
          email(
              "e" + i,
              Instant.parse("2001-05-01T10:00:00Z").plusSeconds(i).toString(),
              "a@enron.com"));
    }
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2001-05-01T10:00:00Z"),
            Instant.parse("2001-05-01T11:00:00Z"),
            EventFilter.none());

    TimeBucket bucket = result.getBuckets().get(0);
    Assertions.assertEquals(60, bucket.getCount());
    Assertions.assertEquals(TimeBucketAggregator.MAX_MEMBER_IDS, bucket.getMemberIds().size());
    Assertions.assertEquals("e0", bucket.getMemberIds().get(0));
  }

  @Test
  void testAllowListedIdsGroupedByDay() {
    InMemoryEventStore eventStore =
        new InMemoryEventStore()
            .add(email("e1", "1999-01-01T10:00:00Z", "a@enron.com"))
            .add(email("e2", "1999-01-01T18:00:00Z", "b@enron.com"))
            .add(email("e3", "2001-05-03T08:00:00Z", "a@enron.com"))
            .add(email("e4", "2001-05-03T09:00:00Z", "c@enron.com"));
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);
    EventFilter filter = EventFilter.builder().emailIds(List.of("e1", "e2", "e3")).build();

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2001-05-01T00:00:00Z"), Instant.parse("2001-05-04T00:00:00Z"), filter);

    Assertions.assertEquals(Resolution.DAILY, result.getResolution());
    Assertions.assertEquals(2, result.size());
    Assertions.assertEquals(
        Instant.parse("1999-01-01T00:00:00Z"), result.getBuckets().get(0).getStart());
    Assertions.assertEquals(2, result.getBuckets().get(0).getCount());
    Assertions.assertEquals(1, result.getBuckets().get(1).getCount());
  }

  @Test
  void testEntityMentionsAreCountedPerMention() {
    InMemoryEventStore eventStore =
        new InMemoryEventStore()
            .add(
                StoredEmail.builder()
                    .id("e1")
                    .timestamp(Instant.parse("2001-05-01T10:05:00Z"))
                    .sender("a@enron.com")
                    .entities(
                        List.of(
                            new Mention("ORG", "Enron"),
                            new Mention("ORG", "Arthur Andersen"),
                            new Mention("ORG", "LJM"),
                            new Mention("PERSON", "Andrew Fastow")))
                    .build())
            .add(
                StoredEmail.builder()
                    .id("e2")
                    .timestamp(Instant.parse("2001-05-01T10:40:00Z"))
                    .sender("b@enron.com")
                    .entities(List.of(new Mention("ORG", "Dynegy")))
                    .build())
            .add(
                StoredEmail.builder()
                    .id("e3")
                    .timestamp(Instant.parse("2001-05-01T11:10:00Z"))
                    .sender("c@enron.com")
                    .entities(List.of(new Mention("PERSON", "Sherron Watkins")))
                    .build());
    TimeBucketAggregator aggregator = new TimeBucketAggregator(eventStore);

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2001-05-01T10:00:00Z"),
            Instant.parse("2001-05-01T11:30:00Z"),
            EventFilter.builder().entityType("ORG").build());

    Assertions.assertEquals(2, result.size());
    TimeBucket first = result.getBuckets().get(0);
    Assertions.assertEquals(2, first.getCount());
    Assertions.assertEquals(4, first.getEntityMentions());
    Assertions.assertEquals(4.0, first.valueOf(MetricType.ENTITY_MENTIONS));
    Assertions.assertEquals(2.0, first.valueOf(MetricType.EMAIL_VOLUME));
    Assertions.assertEquals(0.0, result.getBuckets().get(1).valueOf(MetricType.ENTITY_MENTIONS));

    // matches the scalar count of the same window
    Assertions.assertEquals(
        4,
        eventStore.countEntityMentions(
            Instant.parse("2001-05-01T10:00:00Z"),
            Instant.parse("2001-05-01T10:59:59Z"),
            EventFilter.builder().entityType("ORG").build()));
  }

  @Test
  void testNoEventsGivesEmptyResult() {
    TimeBucketAggregator aggregator = new TimeBucketAggregator(new InMemoryEventStore());

    AggregationResult result =
        aggregator.aggregate(
            Instant.parse("2001-05-01T00:00:00Z"),
            Instant.parse("2001-05-02T00:00:00Z"),
            EventFilter.builder().senderDomains(List.of("enron.com")).build());

    Assertions.assertTrue(result.isEmpty());
    Assertions.assertTrue(
        aggregator
            .aggregate(
                Instant.parse("2001-05-01T00:00:00Z"),
                Instant.parse("2001-05-02T00:00:00Z"),
                EventFilter.builder().emailIds(new ArrayList<>()).build())
            .isEmpty());
  }

  @Test
  void testResolutionFromSpan() {
    Assertions.assertEquals(Resolution.HOURLY, Resolution.fromSpan(Duration.ofDays(29)));
    Assertions.assertEquals(Resolution.DAILY, Resolution.fromSpan(Duration.ofDays(30)));
    Assertions.assertEquals(Resolution.DAILY, Resolution.fromSpan(Duration.ofDays(365)));
    Assertions.assertEquals(Resolution.WEEKLY, Resolution.fromSpan(Duration.ofDays(366)));
    Assertions.assertEquals(Resolution.WEEKLY, Resolution.fromSpan(Duration.ofDays(3650)));
    Assertions.assertEquals(Resolution.MONTHLY, Resolution.fromSpan(Duration.ofDays(3651)));
  }

  private static StoredEmail email(String id, String timestamp, String sender) {
    return StoredEmail.builder().id(id).timestamp(Instant.parse(timestamp)).sender(sender).build();
  }
}
