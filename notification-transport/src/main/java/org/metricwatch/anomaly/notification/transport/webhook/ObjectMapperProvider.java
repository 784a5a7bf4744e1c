package org.metricwatch.anomaly.notification.transport.webhook;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared mapper for webhook bodies. Timestamps are written as ISO-8601 strings. */
public final class ObjectMapperProvider {
  private static final ObjectMapper WEBHOOK_MAPPER =
      new ObjectMapper()
          .setSerializationInclusion(Include.NON_NULL)
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private ObjectMapperProvider() {}

  public static ObjectMapper get() {
    return WEBHOOK_MAPPER;
  }
}
