package org.mailpulse.alert.engine.notification.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.mailpulse.alert.engine.datamodel.AlertSummary;
import org.mailpulse.alert.engine.datamodel.EvaluationResult;
import org.mailpulse.alert.engine.datamodel.store.NotificationSink;
import org.mailpulse.alert.engine.notification.service.notification.WebhookNotifier;
import org.mailpulse.alert.engine.notification.transport.webhook.WebhookSender;
import org.mailpulse.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers triggered alerts to the webhooks of the alert's notification channel. Channels are
 * read from the channel source and cached for {@value #CACHE_EXPIRY_MINUTES} minutes.
 */
public class WebhookNotificationSink implements NotificationSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookNotificationSink.class);
  private static final ConcurrentMap<String, Counter> notificationFailureCounter =
      new ConcurrentHashMap<>();
  private static final String NOTIFICATION_FAILURE_COUNTER =
      "mailpulse.alert.engine.notification.failure.count";
  private static final String CALL_TIMEOUT_SECONDS = "callTimeoutSeconds";
  private static final int DEFAULT_CALL_TIMEOUT_SECONDS = 10;
  static final String ALL_CHANNELS = "all";
  static final int CACHE_EXPIRY_MINUTES = 10;

  private final WebhookNotifier webhookNotifier;
  private final LoadingCache<String, Map<String, NotificationChannel>> notificationChannelsCache;

  public WebhookNotificationSink(Config channelsSourceConfig) {
    this(
        new NotificationChannelsReader(channelsSourceConfig),
        new WebhookSender(
            HttpWithJsonSender.create(
                Duration.ofSeconds(
                    channelsSourceConfig.hasPath(CALL_TIMEOUT_SECONDS)
                        ? channelsSourceConfig.getInt(CALL_TIMEOUT_SECONDS)
                        : DEFAULT_CALL_TIMEOUT_SECONDS))));
  }

  // used for testing with reader and sender passed as parameters
  @VisibleForTesting
  WebhookNotificationSink(
      NotificationChannelsReader notificationChannelsReader, WebhookSender webhookSender) {
    this.webhookNotifier = new WebhookNotifier(webhookSender);
    this.notificationChannelsCache =
        CacheBuilder.newBuilder()
            .maximumSize(1)
            .expireAfterWrite(CACHE_EXPIRY_MINUTES, TimeUnit.MINUTES)
            .build(
                new CacheLoader<>() {
                  @Override
                  public Map<String, NotificationChannel> load(String key) throws Exception {
                    return notificationChannelsReader.readAllNotificationChannels().stream()
                        .collect(
                            Collectors.toUnmodifiableMap(
                                NotificationChannel::getChannelId,
                                Function.identity(),
                                (first, second) -> first));
                  }
                });
  }

  @Override
  public boolean onTrigger(AlertSummary alertSummary, EvaluationResult evaluationResult) {
    LOGGER.debug("Processing notification for alert {}", alertSummary.getAlertId());
    if (alertSummary.getChannelId() == null) {
      LOGGER.warn("Alert {} has no notification channel", alertSummary.getAlertId());
      return false;
    }

    NotificationChannel notificationChannel = getNotificationChannel(alertSummary.getChannelId());
    if (notificationChannel == null) {
      countFailure(alertSummary.getChannelId());
      return false;
    }

    boolean delivered =
        webhookNotifier.notify(alertSummary, evaluationResult, notificationChannel);
    if (!delivered) {
      countFailure(alertSummary.getChannelId());
      LOGGER.warn(
          "Notification for alert {} not delivered to channel {}",
          alertSummary.getAlertId(),
          alertSummary.getChannelId());
    }
    return delivered;
  }

  NotificationChannel getNotificationChannel(String channelId) {
    try {
      NotificationChannel notificationChannel =
          notificationChannelsCache.get(ALL_CHANNELS).get(channelId);
      if (notificationChannel == null) {
        LOGGER.warn("Unknown notification channel {}", channelId);
      }
      return notificationChannel;
    } catch (ExecutionException | UncheckedExecutionException e) {
      LOGGER.error(
          String.format("Error loading notification channels for channelId %s", channelId), e);
      return null;
    }
  }

  private static void countFailure(String channelId) {
    notificationFailureCounter
        .computeIfAbsent(
            channelId, k -> Metrics.counter(NOTIFICATION_FAILURE_COUNTER, "channel", k))
        .increment();
  }
}
