package org.mailpulse.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Shared mapper for webhook payloads. Null fields are left out of the JSON. */
public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .setSerializationInclusion(Include.NON_NULL)
                  .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        }
      }
    }
    return objectMapper;
  }
}
