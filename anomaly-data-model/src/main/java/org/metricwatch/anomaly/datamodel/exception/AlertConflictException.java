package org.metricwatch.anomaly.datamodel.exception;

import lombok.Getter;
import org.metricwatch.anomaly.datamodel.AlertStatus;

/**
 * Raised when a lifecycle transition cannot be applied: the caller's version is stale or the
 * alert's current status does not allow the transition. Callers may re-read and retry.
 */
@Getter
public class AlertConflictException extends AnomalyEngineException {
  private final String alertId;
  private final AlertStatus currentStatus;
  private final long currentVersion;
  private final long expectedVersion;

  public AlertConflictException(
      String alertId,
      AlertStatus currentStatus,
      long currentVersion,
      long expectedVersion,
      String reason) {
    super(
        String.format(
            "Conflict on alert %s: %s (status %s, version %d, expected version %d)",
            alertId, reason, currentStatus, currentVersion, expectedVersion));
    this.alertId = alertId;
    this.currentStatus = currentStatus;
    this.currentVersion = currentVersion;
    this.expectedVersion = expectedVersion;
  }
}
