package org.metricwatch.anomaly.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import lombok.Value;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts a JSON string to a URL. Stateless apart from the shared client; every call is bounded by
 * the client's call timeout.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  private final OkHttpClient client;

  public HttpWithJsonSender(Duration timeout) {
    this(new OkHttpClient.Builder().callTimeout(timeout).connectTimeout(timeout).build());
  }

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  /** Empty when the request could not be performed at all. */
  public Optional<HttpResult> send(String url, String jsonString) {
    LOGGER.debug("Sending the following json string: {}", jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return Optional.of(new HttpResult(response.code(), response.message()));
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}, with message: {}", url, jsonString, ioe);
    }
    return Optional.empty();
  }

  @Value
  public static class HttpResult {
    int code;
    String message;

    public boolean isSuccessful() {
      return code >= 200 && code < 300;
    }
  }
}
