package org.mailpulse.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.mailpulse.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Attachment;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.DividerBlock;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Text;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookSenderTest {

  private MockWebServer mockWebServer;
  private WebhookSender webhookSender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    webhookSender = new WebhookSender(HttpWithJsonSender.getInstance());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testSlackAttachmentIsSerialized() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
    Attachment attachment =
        new Attachment(
            Attachment.RED,
            List.of(
                SectionBlock.ofText(Text.markdown("*High volume*")),
                new DividerBlock(),
                SectionBlock.ofFields(List.of(Text.field("Severity", "high")))));

    Assertions.assertTrue(
        webhookSender.send(mockWebServer.url("/slack").toString(), Payload.of(attachment)));

    JsonNode body =
        ObjectMapperProvider.get().readTree(mockWebServer.takeRequest().getBody().readUtf8());
    JsonNode sentAttachment = body.get("attachments").get(0);
    Assertions.assertEquals("#d41729", sentAttachment.get("color").asText());
    Assertions.assertEquals("section", sentAttachment.get("blocks").get(0).get("type").asText());
    Assertions.assertEquals(
        "*High volume*", sentAttachment.get("blocks").get(0).get("text").get("text").asText());
    // unset fields are not sent
    Assertions.assertFalse(sentAttachment.get("blocks").get(0).has("block_id"));
    Assertions.assertEquals("divider", sentAttachment.get("blocks").get(1).get("type").asText());
    Assertions.assertEquals(
        "*Severity:*\nhigh",
        sentAttachment.get("blocks").get(2).get("fields").get(0).get("text").asText());
  }

  @Test
  void testErrorResponseIsNotDelivered() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    Assertions.assertFalse(
        webhookSender.send(mockWebServer.url("/hook").toString(), Payload.of(new Attachment())));
    Assertions.assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testUrlIsRequired() {
    Assertions.assertThrows(
        IllegalArgumentException.class, () -> webhookSender.send(null, new Attachment()));
  }

  static class Payload {
    private final List<Attachment> attachments;

    private Payload(List<Attachment> attachments) {
      this.attachments = attachments;
    }

    static Payload of(Attachment attachment) {
      return new Payload(List.of(attachment));
    }

    public List<Attachment> getAttachments() {
      return attachments;
    }
  }
}
