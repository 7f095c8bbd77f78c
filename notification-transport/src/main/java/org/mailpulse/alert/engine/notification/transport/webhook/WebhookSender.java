package org.mailpulse.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.util.Optional;
import okhttp3.Response;
import org.mailpulse.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a payload to JSON and posts it to a webhook. Any 2xx answer counts as delivered;
 * Slack incoming webhooks answer 200 with a plain "ok" body.
 */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  /** @return whether the webhook accepted the payload */
  public boolean send(String url, Object payload) {
    Preconditions.checkArgument(url != null, "webhook url is required");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      LOGGER.error("Failed to serialize webhook payload: {}", payload, e);
      // nothing sensible to post
      return false;
    }

    Optional<Response> responseOptional = sender.send(url, jsonString);
    if (responseOptional.isEmpty()) {
      LOGGER.error("Failed posting webhook payload to {}", url);
      return false;
    }
    Response response = responseOptional.get();
    if (!response.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook {}. Response Code: {}, Response Message: {}",
          url,
          response.code(),
          response.message());
      return false;
    }
    LOGGER.debug("Webhook {} answered {}", url, response.code());
    return true;
  }
}
