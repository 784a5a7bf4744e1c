package org.metricwatch.anomaly.notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import com.typesafe.config.Config;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.metricwatch.anomaly.notification.service.channel.NotificationChannel;
import org.metricwatch.anomaly.notification.service.channel.PushStreamNotificationChannel;
import org.metricwatch.anomaly.notification.service.channel.SlackNotificationChannel;
import org.metricwatch.anomaly.notification.service.channel.WebhookNotificationChannel;
import org.metricwatch.anomaly.notification.transport.webhook.WebhookSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads channel definitions from a JSON array. The {@code fs.path} is looked up on the file system
 * first and then on the classpath.
 */
public class NotificationChannelsReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationChannelsReader.class);
  private static final String CHANNELS_SOURCE_TYPE = "type";
  private static final String CHANNELS_SOURCE_TYPE_FS = "fs";
  private static final String PATH_CONFIG = "path";
  private static final String CHANNEL_ID = "channelId";
  private static final String CHANNEL_CONFIG_TYPE = "channelConfigType";
  private static final String WEBHOOK_URL = "url";
  private static final String WEBHOOK_FORMAT = "webhookFormat";
  public static final String CHANNEL_CONFIG_TYPE_WEBHOOK = "WEBHOOK";
  public static final String CHANNEL_CONFIG_TYPE_PUSH_STREAM = "PUSH_STREAM";
  public static final String WEBHOOK_FORMAT_SLACK = "WEBHOOK_FORMAT_SLACK";
  public static final String WEBHOOK_FORMAT_JSON = "WEBHOOK_FORMAT_JSON";
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final String path;
  private final WebhookSender webhookSender;

  public NotificationChannelsReader(Config channelsSourceConfig, WebhookSender webhookSender) {
    String sourceType = channelsSourceConfig.getString(CHANNELS_SOURCE_TYPE);
    if (!CHANNELS_SOURCE_TYPE_FS.equals(sourceType)) {
      throw new RuntimeException(
          String.format("Invalid notification channels source type:%s", sourceType));
    }
    this.path = channelsSourceConfig.getConfig(CHANNELS_SOURCE_TYPE_FS).getString(PATH_CONFIG);
    this.webhookSender = webhookSender;
  }

  public List<NotificationChannel> readNotificationChannels() throws IOException {
    JsonNode root = readTree();
    if (!root.isArray()) {
      throw new IOException("File should contain an array of notification channels: " + path);
    }
    List<NotificationChannel> channels = new ArrayList<>();
    for (JsonNode node : root) {
      toChannel(node).ifPresent(channels::add);
    }
    LOGGER.info("Loaded {} notification channels from {}", channels.size(), path);
    return channels;
  }

  private JsonNode readTree() throws IOException {
    File file = new File(path);
    if (file.exists()) {
      return OBJECT_MAPPER.readTree(file);
    }
    URL resource;
    try {
      resource = Resources.getResource(path);
    } catch (IllegalArgumentException e) {
      throw new FileNotFoundException("Notification channels file not found: " + path);
    }
    return OBJECT_MAPPER.readTree(resource);
  }

  private Optional<NotificationChannel> toChannel(JsonNode node) {
    String channelId = node.path(CHANNEL_ID).asText(null);
    String configType = node.path(CHANNEL_CONFIG_TYPE).asText(null);
    if (channelId == null || configType == null) {
      LOGGER.warn("Skipping notification channel without id or type: {}", node);
      return Optional.empty();
    }
    switch (configType) {
      case CHANNEL_CONFIG_TYPE_WEBHOOK:
        String url = node.path(WEBHOOK_URL).asText(null);
        if (url == null) {
          LOGGER.warn("Skipping webhook channel {} without url", channelId);
          return Optional.empty();
        }
        if (WEBHOOK_FORMAT_SLACK.equals(node.path(WEBHOOK_FORMAT).asText(WEBHOOK_FORMAT_JSON))) {
          return Optional.of(new SlackNotificationChannel(channelId, url, webhookSender));
        }
        return Optional.of(new WebhookNotificationChannel(channelId, url, webhookSender));
      case CHANNEL_CONFIG_TYPE_PUSH_STREAM:
        return Optional.of(new PushStreamNotificationChannel(channelId));
      default:
        LOGGER.warn("Skipping channel {} with unsupported type {}", channelId, configType);
        return Optional.empty();
    }
  }
}
