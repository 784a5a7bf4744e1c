package org.metricwatch.anomaly.notification.transport.webhook.slack;

import java.util.List;
import lombok.Value;

/** Colored container for blocks; the color bar reflects alert severity. */
@Value
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#f2761d";
  public static final String YELLOW = "#f2c744";
  public static final String GREY = "#9aa0a6";

  String color;
  List<Block> blocks;
}
