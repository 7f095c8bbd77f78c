package org.mailpulse.alert.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.BooleanSupplier;
import org.mailpulse.alert.engine.anomaly.detector.evaluator.AlertDefinitionEvaluator;
import org.mailpulse.alert.engine.datamodel.AlertDefinition;
import org.mailpulse.alert.engine.datamodel.AlertKind;
import org.mailpulse.alert.engine.datamodel.EvaluationOutcome;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;
import org.mailpulse.alert.engine.datamodel.InvalidConfigurationException;
import org.mailpulse.alert.engine.datamodel.NotificationStatus;
import org.mailpulse.alert.engine.datamodel.Severity;
import org.mailpulse.alert.engine.datamodel.TimeSeriesPoint;
import org.mailpulse.alert.engine.datamodel.TriggerHistoryRecord;
import org.mailpulse.alert.engine.datamodel.store.AlertRepository;
import org.mailpulse.alert.engine.datamodel.store.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine. Evaluates definitions under a per-alert lock, writes a history record
 * for every approved trigger and hands it to the notification sink.
 *
 * <p>Dispatch happens after the record is written and never rolls it back: a failed delivery
 * leaves the record {@link NotificationStatus#FAILED} for {@link #retryFailed()}.
 */
public class AlertEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngine.class);
  private static final ConcurrentMap<String, Counter> triggerCounter = new ConcurrentHashMap<>();
  private static final String TRIGGER_COUNTER = "mailpulse.alert.engine.trigger.count";
  private static final ConcurrentMap<String, Counter> alertProcessingErrorCounter =
      new ConcurrentHashMap<>();
  private static final String ALERT_PROCESS_ERROR_COUNTER =
      "mailpulse.alert.engine.alert.processing.error";
  private static final ConcurrentMap<String, Timer> alertProcessingTimer =
      new ConcurrentHashMap<>();
  private static final String ALERT_PROCESSING_TIMER =
      "mailpulse.alert.engine.alert.processing.time";
  private static final int LOCK_STRIPES = 64;
  static final String NOT_DELIVERED = "Notification sink did not accept the trigger";

  private final AlertRepository alertRepository;
  private final AlertDefinitionEvaluator alertDefinitionEvaluator;
  private final NotificationSink notificationSink;
  private final Clock clock;
  private final Striped<Lock> alertLocks = Striped.lazyWeakLock(LOCK_STRIPES);

  public AlertEngine(
      AlertRepository alertRepository,
      AlertDefinitionEvaluator alertDefinitionEvaluator,
      NotificationSink notificationSink) {
    this(alertRepository, alertDefinitionEvaluator, notificationSink, Clock.systemUTC());
  }

  // used for testing with a fixed clock passed as parameter
  @VisibleForTesting
  AlertEngine(
      AlertRepository alertRepository,
      AlertDefinitionEvaluator alertDefinitionEvaluator,
      NotificationSink notificationSink,
      Clock clock) {
    this.alertRepository = alertRepository;
    this.alertDefinitionEvaluator = alertDefinitionEvaluator;
    this.notificationSink = notificationSink;
    this.clock = clock;
  }

  /**
   * Evaluates one definition, enabled or not.
   *
   * @throws IllegalArgumentException when no definition has this id
   * @throws InvalidConfigurationException when the definition is malformed
   */
  public EvaluationResult evaluate(String alertId) {
    Lock lock = alertLocks.get(alertId);
    lock.lock();
    try {
      AlertDefinition alertDefinition =
          alertRepository
              .findById(alertId)
              .orElseThrow(() -> new IllegalArgumentException("Unknown alert: " + alertId));
      EvaluationResult result = alertDefinitionEvaluator.evaluate(alertDefinition);
      if (result.getOutcome() == EvaluationOutcome.TRIGGERED) {
        result = recordTrigger(alertDefinition, result);
      }
      alertRepository.saveState(alertId, alertDefinition.getState());
      return result;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Evaluates every enabled definition. Malformed definitions do not stop the others; they are
   * reported together once all definitions were attempted.
   *
   * @throws AlertBatchEvaluationException when at least one definition is malformed
   */
  public List<EvaluationResult> evaluateAll() {
    List<EvaluationResult> results = new ArrayList<>();
    List<InvalidConfigurationException> failures = new ArrayList<>();
    for (AlertDefinition alertDefinition : alertRepository.findEnabled()) {
      try {
        results.add(evaluate(alertDefinition.getId()));
      } catch (InvalidConfigurationException e) {
        LOGGER.error("Invalid alert definition {}", alertDefinition.getId(), e);
        failures.add(e);
      }
    }
    if (!failures.isEmpty()) {
      throw new AlertBatchEvaluationException(results, failures);
    }
    return results;
  }

  /**
   * One scheduled pass over the enabled definitions. Errors are logged and counted per alert kind,
   * never propagated. The pass stops between two definitions once {@code aborted} answers true.
   *
   * @return the number of definitions evaluated
   */
  public int runScheduledPass(BooleanSupplier aborted) {
    int evaluated = 0;
    for (AlertDefinition alertDefinition : alertRepository.findEnabled()) {
      if (aborted.getAsBoolean()) {
        LOGGER.info("Scheduled pass aborted after {} alert(s)", evaluated);
        break;
      }
      Instant startTime = Instant.now();
      String kindTag = kindTag(alertDefinition.getKind());
      try {
        EvaluationResult result = evaluate(alertDefinition.getId());
        evaluated++;
        LOGGER.debug(
            "Alert {} {}: {}", alertDefinition.getId(), result.getOutcome(), result.getReason());
      } catch (RuntimeException e) {
        alertProcessingErrorCounter
            .computeIfAbsent(kindTag, k -> Metrics.counter(ALERT_PROCESS_ERROR_COUNTER, "kind", k))
            .increment();
        LOGGER.error("Exception processing alert {}", alertDefinition.getId(), e);
      }
      alertProcessingTimer
          .computeIfAbsent(kindTag, k -> Metrics.timer(ALERT_PROCESSING_TIMER, "kind", k))
          .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    }
    return evaluated;
  }

  /** Newest first. */
  public List<TriggerHistoryRecord> getHistory(String alertId, int limit) {
    return alertRepository.findHistory(alertId, limit);
  }

  /** Newest first, across every alert kind. */
  public List<TriggerHistoryRecord> getRecentTriggers(int limit) {
    return alertRepository.findRecentHistory(limit);
  }

  public Optional<NotificationStatus> getNotificationStatus(String historyId) {
    return alertRepository
        .findHistoryById(historyId)
        .map(TriggerHistoryRecord::getNotificationStatus);
  }

  /**
   * Dispatches every failed history record again, oldest first. Records of deleted alerts are
   * skipped.
   *
   * @return the number of records delivered by this call
   */
  public int retryFailed() {
    int delivered = 0;
    for (TriggerHistoryRecord record :
        alertRepository.findHistoryByNotificationStatus(NotificationStatus.FAILED)) {
      Optional<AlertDefinition> alertDefinition = alertRepository.findById(record.getAlertId());
      if (alertDefinition.isEmpty()) {
        LOGGER.debug("Alert {} is gone, not retrying {}", record.getAlertId(), record.getId());
        continue;
      }
      Lock lock = alertLocks.get(record.getAlertId());
      lock.lock();
      try {
        if (dispatch(alertDefinition.get(), record, toEvaluationResult(record))) {
          delivered++;
        }
      } finally {
        lock.unlock();
      }
    }
    LOGGER.info("Retried failed notifications, {} delivered", delivered);
    return delivered;
  }

  public AlertStats getStats() {
    List<AlertDefinition> alertDefinitions = alertRepository.findAll();
    Map<Severity, Long> enabledBySeverity = new EnumMap<>(Severity.class);
    for (Severity severity : Severity.values()) {
      enabledBySeverity.put(severity, 0L);
    }
    long enabled = 0;
    for (AlertDefinition alertDefinition : alertDefinitions) {
      if (alertDefinition.isEnabled()) {
        enabled++;
        enabledBySeverity.merge(alertDefinition.getSeverity(), 1L, Long::sum);
      }
    }
    return AlertStats.builder()
        .totalAlerts(alertDefinitions.size())
        .enabledAlerts(enabled)
        .triggeredLast24Hours(
            alertRepository.countHistorySince(clock.instant().minus(Duration.ofHours(24))))
        .enabledBySeverity(enabledBySeverity)
        .build();
  }

  private EvaluationResult recordTrigger(AlertDefinition alertDefinition, EvaluationResult result) {
    TriggerHistoryRecord record =
        TriggerHistoryRecord.builder()
            .id(UUID.randomUUID().toString())
            .alertId(alertDefinition.getId())
            .alertName(alertDefinition.getName())
            .kindCase(alertDefinition.getKind().getKindCase())
            .severity(alertDefinition.getSeverity())
            .triggeredAt(clock.instant())
            .metricValue(result.getCurrentValue())
            .baselineValue(result.getBaselineValue())
            .score(result.getScore())
            .percentageChange(result.getPercentageChange())
            .reason(result.getReason())
            .topContributors(result.getTopContributors())
            .timeSeriesSnapshot(
                snapshot(
                    result.getTimeSeries(),
                    alertDefinitionEvaluator.getEvaluatorConfig().getSnapshotPoints()))
            .build();
    alertRepository.appendHistory(record);
    triggerCounter
        .computeIfAbsent(
            alertDefinition.getSeverity().name(),
            k -> Metrics.counter(TRIGGER_COUNTER, "severity", k))
        .increment();
    LOGGER.info(
        "Alert {} triggered, history {}: {}",
        alertDefinition.getId(),
        record.getId(),
        result.getReason());

    EvaluationResult recorded = result.toBuilder().historyId(record.getId()).build();
    dispatch(alertDefinition, record, recorded);
    return recorded;
  }

  private boolean dispatch(
      AlertDefinition alertDefinition, TriggerHistoryRecord record, EvaluationResult result) {
    boolean delivered;
    String error = null;
    try {
      delivered = notificationSink.onTrigger(alertDefinition.toSummary(), result);
      if (!delivered) {
        error = NOT_DELIVERED;
      }
    } catch (RuntimeException e) {
      LOGGER.warn("Notification for alert {} failed", alertDefinition.getId(), e);
      delivered = false;
      error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
    record.setNotificationStatus(delivered ? NotificationStatus.SENT : NotificationStatus.FAILED);
    record.setNotificationError(error);
    alertRepository.updateHistory(record);
    return delivered;
  }

  private static EvaluationResult toEvaluationResult(TriggerHistoryRecord record) {
    return EvaluationResult.builder()
        .alertId(record.getAlertId())
        .alertName(record.getAlertName())
        .kindCase(record.getKindCase())
        .outcome(EvaluationOutcome.TRIGGERED)
        .reason(record.getReason())
        .evaluatedAt(record.getTriggeredAt())
        .currentValue(record.getMetricValue())
        .baselineValue(record.getBaselineValue())
        .score(record.getScore())
        .percentageChange(record.getPercentageChange())
        .timeSeries(record.getTimeSeriesSnapshot())
        .topContributors(record.getTopContributors())
        .historyId(record.getId())
        .build();
  }

  static List<TimeSeriesPoint> snapshot(List<TimeSeriesPoint> timeSeries, int points) {
    if (timeSeries.size() <= points) {
      return timeSeries;
    }
    return List.copyOf(timeSeries.subList(timeSeries.size() - points, timeSeries.size()));
  }

  private static String kindTag(AlertKind kind) {
    return kind == null ? "UNKNOWN" : kind.getKindCase().name();
  }
}
