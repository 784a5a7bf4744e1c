package org.metricwatch.anomaly.notification.transport.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Optional;
import org.metricwatch.anomaly.notification.transport.webhook.http.HttpWithJsonSender;
import org.metricwatch.anomaly.notification.transport.webhook.http.HttpWithJsonSender.HttpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a message to JSON and posts it, translating the HTTP outcome into a result. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public WebhookSendResult send(String url, Object obj) {
    Preconditions.checkArgument(url != null, "webhook url must be set");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(obj);
    } catch (IOException e) {
      LOGGER.error("Failed to serialize webhook message: {}", obj, e);
      // don't even bother sending
      return WebhookSendResult.failed("serialization failure: " + e.getMessage());
    }

    Optional<HttpResult> resultOptional = sender.send(url, jsonString);
    if (resultOptional.isEmpty()) {
      return WebhookSendResult.failed("request to " + url + " could not be performed");
    }
    HttpResult result = resultOptional.get();
    if (!result.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook {}. Response Code: {}, Response Message: {}",
          url,
          result.getCode(),
          result.getMessage());
      return WebhookSendResult.failed(
          String.format("HTTP %d %s", result.getCode(), result.getMessage()));
    }
    return WebhookSendResult.delivered();
  }
}
