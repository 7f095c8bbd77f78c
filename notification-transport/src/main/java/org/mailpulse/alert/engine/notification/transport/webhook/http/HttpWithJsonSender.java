package org.mailpulse.alert.engine.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts a JSON string to a URL. Stateless apart from the shared HTTP client, so one instance serves
 * every channel. The returned response is already closed, only its status line can be read.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(10);
  private static final HttpWithJsonSender INSTANCE = create(DEFAULT_CALL_TIMEOUT);

  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  public static HttpWithJsonSender create(Duration callTimeout) {
    return new HttpWithJsonSender(new OkHttpClient.Builder().callTimeout(callTimeout).build());
  }

  public Optional<Response> send(String url, String jsonString) {
    LOGGER.debug("Posting to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return Optional.of(response);
    } catch (IOException ioe) {
      LOGGER.error("Unable to post json to URL: {}, payload: {}", url, jsonString, ioe);
    }
    return Optional.empty();
  }
}
