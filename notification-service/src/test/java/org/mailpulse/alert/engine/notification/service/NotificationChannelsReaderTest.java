package org.mailpulse.alert.engine.notification.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.List;
import org.mailpulse.alert.engine.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import org.junit.jupiter.api.Test;

class NotificationChannelsReaderTest {

  @Test
  void testReadNotificationChannels() throws IOException {
    Config config = ConfigFactory.load();

    List<NotificationChannel> notificationChannels =
        new NotificationChannelsReader(
                config.getConfig(NotificationChannelsReader.NOTIFICATION_CHANNELS_SOURCE))
            .readAllNotificationChannels();

    assertEquals(2, notificationChannels.size());
    assertEquals("compliance-team", notificationChannels.get(0).getChannelName());
    assertEquals("channel-id-1", notificationChannels.get(0).getChannelId());
    // the email config is skipped
    assertEquals(1, notificationChannels.get(0).getNotificationChannelConfig().size());
    WebFormatNotificationChannelConfig slackConfig =
        (WebFormatNotificationChannelConfig)
            notificationChannels.get(0).getNotificationChannelConfig().get(0);
    assertEquals(
        NotificationChannelsReader.CHANNEL_CONFIG_TYPE_WEBHOOK, slackConfig.getChannelConfigType());
    assertEquals(NotificationChannelsReader.WEBHOOK_FORMAT_SLACK, slackConfig.getWebhookFormat());
    assertEquals("https://hooks.slack.com/services/abc", slackConfig.getUrl());

    WebFormatNotificationChannelConfig jsonConfig =
        (WebFormatNotificationChannelConfig)
            notificationChannels.get(1).getNotificationChannelConfig().get(0);
    assertEquals(NotificationChannelsReader.WEBHOOK_FORMAT_JSON, jsonConfig.getWebhookFormat());
    assertFalse(jsonConfig.isSlack());
    assertTrue(notificationChannels.get(0).getWebhookConfigs().get(0).isSlack());
  }

  @Test
  void testUnknownSourceType() {
    assertThrows(
        RuntimeException.class,
        () -> new NotificationChannelsReader(ConfigFactory.parseString("type = dataStore")));
  }
}
