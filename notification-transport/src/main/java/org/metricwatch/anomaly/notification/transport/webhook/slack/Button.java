package org.metricwatch.anomaly.notification.transport.webhook.slack;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

/** A link button. Slack requires the url to be absolute. */
@Getter
@Builder
public class Button implements Element {
  public static final String TYPE = "button";
  public static final String PRIMARY_STYLE = "primary";

  private final Text text;

  @JsonProperty("action_id")
  private final String actionId;

  private final String value;
  private final String url;
  private final String style;

  @Override
  public String getType() {
    return TYPE;
  }
}
