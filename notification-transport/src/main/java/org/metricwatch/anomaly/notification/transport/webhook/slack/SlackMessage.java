package org.metricwatch.anomaly.notification.transport.webhook.slack;

import java.util.List;
import lombok.Value;

/** Body of a Slack incoming-webhook post. */
@Value
public class SlackMessage {
  String text;
  List<Attachment> attachments;
}
