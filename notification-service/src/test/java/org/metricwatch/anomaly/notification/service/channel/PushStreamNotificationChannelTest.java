package org.metricwatch.anomaly.notification.service.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.AlertPayload;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.DeliveryResult;
import org.metricwatch.anomaly.datamodel.Severity;

class PushStreamNotificationChannelTest {

  @Test
  void testSubscribersReceiveUntilUnsubscribed() {
    PushStreamNotificationChannel channel = new PushStreamNotificationChannel("dashboard");
    List<String> received = new ArrayList<>();
    Runnable unsubscribe = channel.subscribe(payload -> received.add(payload.getAlertId()));

    assertTrue(channel.dispatch(payload("a1")).isDelivered());
    unsubscribe.run();
    assertTrue(channel.dispatch(payload("a2")).isDelivered());

    assertEquals(List.of("a1"), received);
    assertEquals(0, channel.getSubscriberCount());
  }

  @Test
  void testFailingSubscriberIsReportedButOthersStillReceive() {
    PushStreamNotificationChannel channel = new PushStreamNotificationChannel("dashboard");
    List<String> received = new ArrayList<>();
    channel.subscribe(
        payload -> {
          throw new IllegalStateException("socket closed");
        });
    channel.subscribe(payload -> received.add(payload.getAlertId()));

    DeliveryResult result = channel.dispatch(payload("a1"));

    assertFalse(result.isDelivered());
    assertEquals("1 of 2 subscribers failed", result.getError());
    assertEquals(List.of("a1"), received);
  }

  private static AlertPayload payload(String alertId) {
    return AlertPayload.builder()
        .alertId(alertId)
        .metricName("active_users")
        .observedValue(10)
        .deviationPercent(-80)
        .severity(Severity.HIGH)
        .anomalyType(AnomalyType.DROP)
        .timestamp(Instant.parse("2024-03-01T10:15:30Z"))
        .reference(alertId)
        .build();
  }
}
