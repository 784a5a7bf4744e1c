package org.metricwatch.anomaly.notification.transport.webhook.slack;

import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SectionBlock implements Block {
  public static final String TYPE = "section";

  private final String type = TYPE;
  private Text text;
  private List<Text> fields;

  public static SectionBlock withText(Text text) {
    SectionBlock block = new SectionBlock();
    block.setText(text);
    return block;
  }

  public static SectionBlock withFields(List<Text> fields) {
    SectionBlock block = new SectionBlock();
    block.setFields(fields);
    return block;
  }
}
