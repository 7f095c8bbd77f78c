package org.mailpulse.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.List;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertKind;
import org.mailpulse.alert.engine.datamodel.NotificationStatus;
import org.mailpulse.alert.engine.datamodel.ThresholdSpec;
import org.mailpulse.alert.engine.datamodel.TriggerHistoryRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class InMemoryAlertRepositoryTest {

  @Test
  void testHistoryOrderingAndCascadeDelete() {
    InMemoryAlertRepository repository =
        new InMemoryAlertRepository(List.of(definition("a1", true), definition("a2", false)));

    Instant base = Instant.parse("2001-10-01T00:00:00Z");
    repository.appendHistory(record("h1", "a1", base));
    repository.appendHistory(record("h2", "a2", base.plusSeconds(60)));
    repository.appendHistory(record("h3", "a1", base.plusSeconds(120)));

    Assertions.assertEquals(1, repository.findEnabled().size());
    Assertions.assertEquals(
        List.of("h3", "h1"), ids(repository.findHistory("a1", 10)));
    Assertions.assertEquals(
        List.of("h3", "h2", "h1"), ids(repository.findRecentHistory(10)));
    Assertions.assertEquals(List.of("h3", "h2"), ids(repository.findRecentHistory(2)));
    Assertions.assertEquals(2, repository.countHistorySince(base.plusSeconds(60)));

    Assertions.assertTrue(repository.delete("a1"));
    Assertions.assertEquals(List.of("h2"), ids(repository.findRecentHistory(10)));
    Assertions.assertTrue(repository.findHistoryById("h1").isEmpty());
  }

  @Test
  void testUpdateNotificationStatus() {
    InMemoryAlertRepository repository = new InMemoryAlertRepository();
    TriggerHistoryRecord record = record("h1", "a1", Instant.EPOCH);
    repository.appendHistory(record);

    record.setNotificationStatus(NotificationStatus.FAILED);
    repository.updateHistory(record);

    Assertions.assertEquals(
        List.of("h1"),
        ids(repository.findHistoryByNotificationStatus(NotificationStatus.FAILED)));
    Assertions.assertTrue(
        repository.findHistoryByNotificationStatus(NotificationStatus.PENDING).isEmpty());
  }

  private static AlertDefinition definition(String id, boolean enabled) {
    return AlertDefinition.builder()
        .id(id)
        .enabled(enabled)
        .kind(AlertKind.staticThreshold(ThresholdSpec.builder().build()))
        .build();
  }

  private static TriggerHistoryRecord record(String id, String alertId, Instant triggeredAt) {
    return TriggerHistoryRecord.builder().id(id).alertId(alertId).triggeredAt(triggeredAt).build();
  }

  private static List<String> ids(List<TriggerHistoryRecord> records) {
    return records.stream().map(TriggerHistoryRecord::getId).collect(java.util.stream.Collectors.toList());
  }
}
