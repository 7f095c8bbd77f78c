package org.mailpulse.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.mailpulse.alert.engine.datamodel.Contributor;
import org.mailpulse.alert.engine.datamodel.EmailEvent;
import org.mailpulse.alert.engine.datamodel.EventFilter;

/** Event store over a list held in memory, for embedding and tests. */
public class InMemoryEventStore implements EventStore {
  private static final String ALL_ENTITY_TYPES = "ALL";

  private final List<StoredEmail> emails = new CopyOnWriteArrayList<>();

  public InMemoryEventStore add(StoredEmail email) {
    emails.add(email);
    return this;
  }

  public InMemoryEventStore addAll(List<StoredEmail> storedEmails) {
    emails.addAll(storedEmails);
    return this;
  }

  @Override
  public long countEvents(Instant start, Instant end, EventFilter filter) {
    return matching(start, end, filter).count();
  }

  @Override
  public long countDistinctActors(Instant start, Instant end, EventFilter filter) {
    return matching(start, end, filter)
        .map(StoredEmail::getSender)
        .filter(sender -> sender != null)
        .distinct()
        .count();
  }

  @Override
  public long countEntityMentions(Instant start, Instant end, EventFilter filter) {
    return matching(start, end, filter)
        .flatMap(email -> email.getEntities().stream())
        .filter(mention -> mentionMatches(mention, filter))
        .count();
  }

  @Override
  public List<Contributor> topContributors(
      Instant start, Instant end, EventFilter filter, ContributorDimension dimension, int limit) {
    Stream<String> keys;
    switch (dimension) {
      case SENDER:
        keys = matching(start, end, filter).map(StoredEmail::getSender);
        break;
      case ENTITY:
        keys =
            matching(start, end, filter)
                .flatMap(email -> email.getEntities().stream())
                .filter(mention -> mentionMatches(mention, filter))
                .map(Mention::getText);
        break;
      default:
        throw new UnsupportedOperationException("Unsupported contributor dimension: " + dimension);
    }
    Map<String, Long> counts =
        keys.filter(key -> key != null)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.<String, Long>comparingByKey()))
        .limit(limit)
        .map(entry -> new Contributor(entry.getKey(), entry.getValue()))
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<EmailEvent> findEvents(Instant start, Instant end, EventFilter filter) {
    return matching(start, end, filter)
        .sorted(Comparator.comparing(StoredEmail::getTimestamp))
        .map(
            email ->
                new EmailEvent(
                    email.getId(),
                    email.getTimestamp(),
                    email.getSender(),
                    email.getEntities().stream()
                        .filter(mention -> mentionMatches(mention, filter))
                        .count()))
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public Optional<Instant> latestEventTimestamp() {
    return emails.stream().map(StoredEmail::getTimestamp).max(Comparator.naturalOrder());
  }

  private Stream<StoredEmail> matching(Instant start, Instant end, EventFilter filter) {
    return emails.stream()
        .filter(email -> inScope(email, start, end, filter))
        .filter(email -> entityMatches(email, filter))
        .filter(email -> senderMatches(email, filter))
        .filter(email -> keywordMatches(email, filter));
  }

  private static boolean inScope(
      StoredEmail email, Instant start, Instant end, EventFilter filter) {
    if (filter.hasEmailIds()) {
      return filter.getEmailIds().contains(email.getId());
    }
    return !email.getTimestamp().isBefore(start) && !email.getTimestamp().isAfter(end);
  }

  private static boolean entityMatches(StoredEmail email, EventFilter filter) {
    if (!restrictsEntities(filter)) {
      return true;
    }
    return email.getEntities().stream().anyMatch(mention -> mentionMatches(mention, filter));
  }

  private static boolean mentionMatches(Mention mention, EventFilter filter) {
    if (!restrictsEntities(filter)) {
      return true;
    }
    return mention.getType().equalsIgnoreCase(filter.getEntityType())
        && (filter.getEntityValue() == null
            || mention.getText().equalsIgnoreCase(filter.getEntityValue()));
  }

  private static boolean restrictsEntities(EventFilter filter) {
    return filter.getEntityType() != null && !ALL_ENTITY_TYPES.equals(filter.getEntityType());
  }

  private static boolean senderMatches(StoredEmail email, EventFilter filter) {
    if (filter.getSenderDomains().isEmpty()) {
      return true;
    }
    if (email.getSender() == null) {
      return false;
    }
    String sender = email.getSender().toLowerCase(Locale.ROOT);
    return filter.getSenderDomains().stream()
        .anyMatch(domain -> sender.endsWith("@" + domain.toLowerCase(Locale.ROOT)));
  }

  private static boolean keywordMatches(StoredEmail email, EventFilter filter) {
    if (filter.getKeywords().isEmpty()) {
      return true;
    }
    String text =
        (Optional.ofNullable(email.getSubject()).orElse("")
                + " "
                + Optional.ofNullable(email.getBody()).orElse(""))
            .toLowerCase(Locale.ROOT);
    return filter.getKeywords().stream()
        .anyMatch(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)));
  }

  @Builder
  @Getter
  @ToString
  public static class StoredEmail {
    private final String id;
    private final Instant timestamp;
    private final String sender;
    private final String subject;
    private final String body;
    @Builder.Default private final List<Mention> entities = List.of();
  }

  @AllArgsConstructor
  @Getter
  @ToString
  public static class Mention {
    private final String type;
    private final String text;
  }
}
