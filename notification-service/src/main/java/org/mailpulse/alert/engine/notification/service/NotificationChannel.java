package org.mailpulse.alert.engine.notification.service;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** A named delivery target of alert triggers, referenced by {@code channelId} in definitions. */
@SuperBuilder
@Getter
@ToString
public class NotificationChannel {

  private final String channelName;
  private final String channelId;
  private final List<NotificationChannelConfig> notificationChannelConfig;

  public List<WebFormatNotificationChannelConfig> getWebhookConfigs() {
    return notificationChannelConfig.stream()
        .filter(
            config ->
                NotificationChannelsReader.CHANNEL_CONFIG_TYPE_WEBHOOK.equals(
                    config.getChannelConfigType()))
        .map(WebFormatNotificationChannelConfig.class::cast)
        .collect(Collectors.toUnmodifiableList());
  }

  @SuperBuilder
  @Getter
  @ToString
  public abstract static class NotificationChannelConfig {
    private final String channelConfigType;
  }

  @SuperBuilder
  @Getter
  @ToString(callSuper = true)
  public static class WebFormatNotificationChannelConfig extends NotificationChannelConfig {
    private final String url;
    private final String webhookFormat;

    /** Slack incoming webhooks get attachment blocks, everything else the plain JSON event. */
    public boolean isSlack() {
      return NotificationChannelsReader.WEBHOOK_FORMAT_SLACK.equals(webhookFormat);
    }
  }
}
