package org.mailpulse.alert.engine.datamodel.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertState;
import org.mailpulse.alert.engine.datamodel.NotificationStatus;
import org.mailpulse.alert.engine.datamodel.TriggerHistoryRecord;

/** Durable alert state and trigger history. */
public interface AlertRepository {

  List<AlertDefinition> findAll();

  List<AlertDefinition> findEnabled();

  Optional<AlertDefinition> findById(String alertId);

  void save(AlertDefinition alertDefinition);

  void saveState(String alertId, AlertState state);

  /** Deletes the definition together with its trigger history. */
  boolean delete(String alertId);

  void appendHistory(TriggerHistoryRecord record);

  void updateHistory(TriggerHistoryRecord record);

  Optional<TriggerHistoryRecord> findHistoryById(String historyId);

  /** Newest first. */
  List<TriggerHistoryRecord> findHistory(String alertId, int limit);

  /** Newest first, across all alerts. */
  List<TriggerHistoryRecord> findRecentHistory(int limit);

  List<TriggerHistoryRecord> findHistoryByNotificationStatus(NotificationStatus status);

  long countHistorySince(Instant since);
}
