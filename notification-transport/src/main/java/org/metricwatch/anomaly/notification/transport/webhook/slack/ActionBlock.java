package org.metricwatch.anomaly.notification.transport.webhook.slack;

import java.util.List;
import lombok.Getter;

@Getter
public class ActionBlock implements Block {
  public static final String TYPE = "actions";

  private final String type = TYPE;
  private final List<Element> elements;

  public ActionBlock(List<Element> elements) {
    this.elements = elements;
  }
}
