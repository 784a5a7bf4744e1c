package org.metricwatch.anomaly.datamodel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.exception.InvalidDetectionConfigException;

class DetectionConfigValidatorTest {

  @Test
  void testValidConfig() {
    Assertions.assertDoesNotThrow(
        () ->
            DetectionConfigValidator.validate(
                DetectionConfig.builder()
                    .metricName("revenue")
                    .sensitivity(10)
                    .algorithm(Algorithm.ZSCORE)
                    .thresholds(Thresholds.builder().min(0.0).max(0.0).build())
                    .build()));
  }

  @Test
  void testSensitivityOutOfRange() {
    for (int sensitivity : new int[] {0, 11}) {
      InvalidDetectionConfigException e =
          Assertions.assertThrows(
              InvalidDetectionConfigException.class,
              () ->
                  DetectionConfigValidator.validate(
                      DetectionConfig.builder()
                          .metricName("revenue")
                          .sensitivity(sensitivity)
                          .algorithm(Algorithm.IQR)
                          .build()));
      Assertions.assertEquals(1, e.getViolations().size());
      Assertions.assertEquals("revenue", e.getMetricName());
    }
  }

  @Test
  void testEnabledConfigNeedsAlgorithms() {
    DetectionConfig noAlgorithms =
        DetectionConfig.builder().metricName("revenue").sensitivity(5).build();

    Assertions.assertThrows(
        InvalidDetectionConfigException.class,
        () -> DetectionConfigValidator.validate(noAlgorithms));
    Assertions.assertDoesNotThrow(
        () -> DetectionConfigValidator.validate(noAlgorithms.toBuilder().enabled(false).build()));
  }

  @Test
  void testAllViolationsAreReported() {
    InvalidDetectionConfigException e =
        Assertions.assertThrows(
            InvalidDetectionConfigException.class,
            () ->
                DetectionConfigValidator.validate(
                    DetectionConfig.builder()
                        .metricName(" ")
                        .sensitivity(0)
                        .cooldownSeconds(-1)
                        .thresholds(Thresholds.builder().min(10.0).max(1.0).build())
                        .build()));

    Assertions.assertEquals(5, e.getViolations().size());
  }
}
