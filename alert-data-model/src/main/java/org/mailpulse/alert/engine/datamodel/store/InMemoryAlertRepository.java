package org.mailpulse.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertState;
import org.mailpulse.alert.engine.datamodel.NotificationStatus;
import org.mailpulse.alert.engine.datamodel.TriggerHistoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryAlertRepository implements AlertRepository {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAlertRepository.class);
  private static final Comparator<TriggerHistoryRecord> NEWEST_FIRST =
      Comparator.comparing(TriggerHistoryRecord::getTriggeredAt).reversed();

  private final Map<String, AlertDefinition> definitions = new ConcurrentHashMap<>();
  private final Map<String, List<TriggerHistoryRecord>> historyByAlert = new ConcurrentHashMap<>();

  public InMemoryAlertRepository() {}

  public InMemoryAlertRepository(List<AlertDefinition> alertDefinitions) {
    alertDefinitions.forEach(this::save);
  }

  @Override
  public List<AlertDefinition> findAll() {
    return definitions.values().stream()
        .sorted(Comparator.comparing(AlertDefinition::getId))
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<AlertDefinition> findEnabled() {
    return findAll().stream()
        .filter(AlertDefinition::isEnabled)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public Optional<AlertDefinition> findById(String alertId) {
    return Optional.ofNullable(definitions.get(alertId));
  }

  @Override
  public void save(AlertDefinition alertDefinition) {
    definitions.put(alertDefinition.getId(), alertDefinition);
  }

  @Override
  public void saveState(String alertId, AlertState state) {
    // state objects are shared with the stored definition, nothing to copy
    LOGGER.debug("Alert {} state {}", alertId, state);
  }

  @Override
  public boolean delete(String alertId) {
    historyByAlert.remove(alertId);
    return definitions.remove(alertId) != null;
  }

  @Override
  public void appendHistory(TriggerHistoryRecord record) {
    historyByAlert
        .computeIfAbsent(record.getAlertId(), k -> new CopyOnWriteArrayList<>())
        .add(record);
  }

  @Override
  public void updateHistory(TriggerHistoryRecord record) {
    List<TriggerHistoryRecord> records = historyByAlert.get(record.getAlertId());
    if (records == null) {
      return;
    }
    for (int i = 0; i < records.size(); i++) {
      if (records.get(i).getId().equals(record.getId())) {
        records.set(i, record);
        return;
      }
    }
  }

  @Override
  public Optional<TriggerHistoryRecord> findHistoryById(String historyId) {
    return allHistory().stream().filter(r -> r.getId().equals(historyId)).findFirst();
  }

  @Override
  public List<TriggerHistoryRecord> findHistory(String alertId, int limit) {
    return historyByAlert.getOrDefault(alertId, List.of()).stream()
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<TriggerHistoryRecord> findRecentHistory(int limit) {
    return allHistory().stream()
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public List<TriggerHistoryRecord> findHistoryByNotificationStatus(NotificationStatus status) {
    return allHistory().stream()
        .filter(r -> r.getNotificationStatus() == status)
        .sorted(Comparator.comparing(TriggerHistoryRecord::getTriggeredAt))
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public long countHistorySince(Instant since) {
    return allHistory().stream().filter(r -> !r.getTriggeredAt().isBefore(since)).count();
  }

  private List<TriggerHistoryRecord> allHistory() {
    List<TriggerHistoryRecord> all = new ArrayList<>();
    historyByAlert.values().forEach(all::addAll);
    return all;
  }
}
