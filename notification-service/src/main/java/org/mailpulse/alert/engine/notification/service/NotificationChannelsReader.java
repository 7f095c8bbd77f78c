package org.mailpulse.alert.engine.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.mailpulse.alert.engine.notification.service.NotificationChannel.NotificationChannelConfig;
import org.mailpulse.alert.engine.notification.service.NotificationChannel.WebFormatNotificationChannelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads notification channels from a JSON file holding an array of channels. Channel configs of a
 * type other than {@value #CHANNEL_CONFIG_TYPE_WEBHOOK} are skipped.
 */
public class NotificationChannelsReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationChannelsReader.class);
  public static final String NOTIFICATION_CHANNELS_SOURCE = "notificationChannelsSource";
  private static final String CHANNEL_ID = "channelId";
  private static final String CHANNEL_NAME = "channelName";
  private static final String CHANNEL_CONFIG = "channelConfig";
  private static final String CHANNEL_CONFIG_TYPE = "channelConfigType";
  private static final String WEBFORMAT_CHANNEL_CONFIG_URL = "url";
  private static final String WEBFORMAT_CHANNEL_CONFIG_WEBHOOK_FORMAT = "webhookFormat";
  public static final String CHANNEL_CONFIG_TYPE_WEBHOOK = "WEBHOOK";
  public static final String WEBHOOK_FORMAT_SLACK = "WEBHOOK_FORMAT_SLACK";
  public static final String WEBHOOK_FORMAT_JSON = "WEBHOOK_FORMAT_JSON";
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";
  private static final String PATH_CONFIG = "path";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final String fsPath;

  public NotificationChannelsReader(Config channelsSourceConfig) {
    String sourceType = channelsSourceConfig.getString(SOURCE_TYPE);
    switch (sourceType) {
      case SOURCE_TYPE_FS:
        this.fsPath = channelsSourceConfig.getConfig(SOURCE_TYPE_FS).getString(PATH_CONFIG);
        break;
      default:
        throw new RuntimeException(
            String.format("Invalid notification channels source type:%s", sourceType));
    }
  }

  public List<NotificationChannel> readAllNotificationChannels() throws IOException {
    LOGGER.debug("Reading notification channels from file path:{}", fsPath);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of notification channels");
    }
    return StreamSupport.stream(jsonNode.spliterator(), false)
        .map(
            node ->
                NotificationChannel.builder()
                    .channelId(node.get(CHANNEL_ID).asText())
                    .channelName(node.path(CHANNEL_NAME).asText(null))
                    .notificationChannelConfig(getChannelConfigs(node))
                    .build())
        .collect(Collectors.toUnmodifiableList());
  }

  private List<NotificationChannelConfig> getChannelConfigs(JsonNode node) {
    return StreamSupport.stream(node.path(CHANNEL_CONFIG).spliterator(), false)
        .filter(
            channelConfigNode ->
                CHANNEL_CONFIG_TYPE_WEBHOOK.equals(
                    channelConfigNode.path(CHANNEL_CONFIG_TYPE).asText()))
        .map(
            webFormatChannelConfig ->
                WebFormatNotificationChannelConfig.builder()
                    .url(webFormatChannelConfig.get(WEBFORMAT_CHANNEL_CONFIG_URL).asText())
                    .webhookFormat(
                        webFormatChannelConfig
                            .path(WEBFORMAT_CHANNEL_CONFIG_WEBHOOK_FORMAT)
                            .asText(WEBHOOK_FORMAT_JSON))
                    .channelConfigType(CHANNEL_CONFIG_TYPE_WEBHOOK)
                    .build())
        .collect(Collectors.toUnmodifiableList());
  }
}
