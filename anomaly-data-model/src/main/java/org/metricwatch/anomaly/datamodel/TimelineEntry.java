package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Value;

@Value
public class TimelineEntry {
  Instant timestamp;
  String event;
  String details;
}
