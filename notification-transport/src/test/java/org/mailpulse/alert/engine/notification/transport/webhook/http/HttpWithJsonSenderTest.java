package org.mailpulse.alert.engine.notification.transport.webhook.http;

import java.io.IOException;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWithJsonSenderTest {

  private MockWebServer mockWebServer;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsJsonBody() throws InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202));
    HttpWithJsonSender sender = new HttpWithJsonSender(new OkHttpClient());

    Optional<Response> response =
        sender.send(mockWebServer.url("/hooks/alerts").toString(), "{\"alertId\":\"a-1\"}");

    Assertions.assertTrue(response.isPresent());
    Assertions.assertEquals(202, response.get().code());
    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    Assertions.assertEquals("/hooks/alerts", request.getPath());
    Assertions.assertEquals("{\"alertId\":\"a-1\"}", request.getBody().readUtf8());
    Assertions.assertTrue(request.getHeader("Content-Type").startsWith("application/json"));
  }

  @Test
  void testUnreachableUrlGivesEmptyResponse() throws IOException {
    String url = mockWebServer.url("/gone").toString();
    mockWebServer.shutdown();

    Assertions.assertTrue(HttpWithJsonSender.getInstance().send(url, "{}").isEmpty());
  }
}
