package org.metricwatch.anomaly.notification.transport.webhook.slack;

import lombok.Value;

@Value
public class Text {
  public static final String MARKDOWN_TYPE = "mrkdwn";
  public static final String PLAINTEXT_TYPE = "plain_text";

  String type;
  String text;

  public static Text markdown(String text) {
    return new Text(MARKDOWN_TYPE, text);
  }

  public static Text plain(String text) {
    return new Text(PLAINTEXT_TYPE, text);
  }
}
