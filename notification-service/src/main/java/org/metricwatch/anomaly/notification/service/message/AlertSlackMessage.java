package org.metricwatch.anomaly.notification.service.message;

import com.google.common.base.Strings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.Severity;
import org.metricwatch.anomaly.notification.transport.webhook.slack.ActionBlock;
import org.metricwatch.anomaly.notification.transport.webhook.slack.Attachment;
import org.metricwatch.anomaly.notification.transport.webhook.slack.Block;
import org.metricwatch.anomaly.notification.transport.webhook.slack.Button;
import org.metricwatch.anomaly.notification.transport.webhook.slack.SectionBlock;
import org.metricwatch.anomaly.notification.transport.webhook.slack.SlackMessage;
import org.metricwatch.anomaly.notification.transport.webhook.slack.Text;

/** Builds the chat message for an alert: title, a field grid and an optional investigate link. */
public final class AlertSlackMessage {

  public static final String METRIC = "Metric";
  public static final String SEVERITY = "Severity";
  public static final String ANOMALY_TYPE = "Anomaly Type";
  public static final String OBSERVED_VALUE = "Observed Value";
  public static final String DEVIATION = "Deviation";
  public static final String DETECTED_AT = "Detected At";
  public static final String DETAILS = "Details";

  private AlertSlackMessage() {}

  public static SlackMessage from(AlertPayload payload) {
    String title =
        String.format(
            ":rotating_light: *%s anomaly on `%s`*",
            payload.getSeverity().getWireName().toUpperCase(),
            payload.getMetricName());

    List<Text> fields = new ArrayList<>();
    addIfNotEmpty(fields, payload.getMetricName(), METRIC);
    addIfNotEmpty(fields, payload.getSeverity().getWireName(), SEVERITY);
    addIfNotEmpty(fields, payload.getAnomalyType().getWireName(), ANOMALY_TYPE);
    addIfNotEmpty(fields, String.format("%.4f", payload.getObservedValue()), OBSERVED_VALUE);
    addIfNotEmpty(fields, String.format("%.2f%%", payload.getDeviationPercent()), DEVIATION);
    addTimestamp(fields, payload.getTimestamp(), DETECTED_AT);

    List<Block> blocks = new ArrayList<>();
    blocks.add(SectionBlock.withText(Text.markdown(title)));
    blocks.add(SectionBlock.withFields(fields));
    if (!Strings.isNullOrEmpty(payload.getDescription())) {
      blocks.add(
          SectionBlock.withText(Text.markdown("*" + DETAILS + ":*\n" + payload.getDescription())));
    }
    if (isLink(payload.getReference())) {
      Button button =
          Button.builder()
              .text(Text.plain("Investigate"))
              .actionId("investigate-" + payload.getAlertId())
              .value(payload.getAlertId())
              .url(payload.getReference())
              .style(Button.PRIMARY_STYLE)
              .build();
      blocks.add(new ActionBlock(List.of(button)));
    }

    Attachment attachment = new Attachment(colorOf(payload.getSeverity()), blocks);
    // top-level text is what shows up in push notifications
    return new SlackMessage(
        String.format("%s anomaly detected on %s", payload.getSeverity(), payload.getMetricName()),
        List.of(attachment));
  }

  static String colorOf(Severity severity) {
    switch (severity) {
      case CRITICAL:
        return Attachment.RED;
      case HIGH:
        return Attachment.ORANGE;
      case MEDIUM:
        return Attachment.YELLOW;
      default:
        return Attachment.GREY;
    }
  }

  private static boolean isLink(String reference) {
    return reference != null
        && (reference.startsWith("http://") || reference.startsWith("https://"));
  }

  private static void addIfNotEmpty(List<Text> fields, String value, String label) {
    if (!Strings.isNullOrEmpty(value)) {
      fields.add(Text.markdown("*" + label + ":*\n" + value));
    }
  }

  private static void addTimestamp(List<Text> fields, Instant value, String label) {
    if (value != null) {
      fields.add(
          Text.markdown(
              "*"
                  + label
                  + ":*\n"
                  + "<!date^"
                  + value.getEpochSecond()
                  + "^{date_num} {time_secs}|"
                  + value
                  + ">"));
    }
  }
}
