package org.metricwatch.anomaly.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** One recorded lifecycle change of an alert. */
@Value
@Builder
@Jacksonized
public class StatusTransition {
  AlertStatus status;
  Instant timestamp;
  String actor;
  String notes;
}
