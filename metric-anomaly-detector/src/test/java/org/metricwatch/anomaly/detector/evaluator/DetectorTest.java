package org.metricwatch.anomaly.detector.evaluator;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.Thresholds;

class DetectorTest {

  @Test
  void testSensitivityScale() {
    Assertions.assertEquals(3.0, SensitivityScale.interpolate(1, 3.0, 1.5), 1e-9);
    Assertions.assertEquals(1.5, SensitivityScale.interpolate(10, 3.0, 1.5), 1e-9);
    Assertions.assertEquals(5.0 / 3, SensitivityScale.interpolate(9, 3.0, 1.5), 1e-9);
    Assertions.assertEquals(1.5, SensitivityScale.interpolate(42, 3.0, 1.5), 1e-9);
  }

  @Test
  void testZScore() {
    ZScoreDetector detector = new ZScoreDetector();
    Baseline baseline = baseline(1.0, 0.2, 1.0, 0.8, 1.2, 0.2);

    Verdict spike = detector.evaluate(3.0, baseline, 9);
    Assertions.assertTrue(spike.isFired());
    Assertions.assertEquals(10.0, spike.getScore(), 1e-9);
    Assertions.assertEquals(1.0, spike.getExpectedValue());
    Assertions.assertEquals("Z-score: 10.00, threshold: 1.67", spike.getDescription());

    Verdict drop = detector.evaluate(0.0, baseline, 9);
    Assertions.assertTrue(drop.isFired());
    Assertions.assertEquals(-5.0, drop.getScore(), 1e-9);

    Assertions.assertFalse(detector.evaluate(1.3, baseline, 9).isFired());
    Assertions.assertFalse(detector.evaluate(1.5, baseline, 1).isFired());
  }

  @Test
  void testZScoreFiresExactlyAtThreshold() {
    ZScoreDetector detector = new ZScoreDetector();
    Baseline baseline = baseline(0.0, 1.0, 0.0, -1.0, 1.0, 1.0);

    Assertions.assertTrue(detector.evaluate(3.0, baseline, 1).isFired());
    Assertions.assertTrue(detector.evaluate(-3.0, baseline, 1).isFired());
    Assertions.assertFalse(detector.evaluate(2.999, baseline, 1).isFired());
  }

  @Test
  void testIqrFences() {
    IqrDetector detector = new IqrDetector();
    Baseline baseline = baseline(15.0, 5.0, 15.0, 10.0, 20.0, 5.0);

    // multiplier 3 at sensitivity 1, fences at [-20, 50]
    Assertions.assertFalse(detector.evaluate(50.0, baseline, 1).isFired());
    Assertions.assertTrue(detector.evaluate(50.5, baseline, 1).isFired());
    Assertions.assertTrue(detector.evaluate(-20.5, baseline, 1).isFired());
    Assertions.assertEquals(15.0, detector.evaluate(50.5, baseline, 1).getExpectedValue());
    Assertions.assertTrue(detector.evaluate(40.0, baseline, 10).isFired());
  }

  @Test
  void testMadModifiedZScore() {
    MadDetector detector = new MadDetector();
    Baseline baseline = baseline(10.0, 3.0, 10.0, 8.0, 12.0, 2.0);

    Verdict outlier = detector.evaluate(21.0, baseline, 1);
    Assertions.assertTrue(outlier.isFired());
    Assertions.assertEquals(0.6745 * 11 / 2, outlier.getScore(), 1e-9);
    Assertions.assertFalse(detector.evaluate(19.0, baseline, 1).isFired());
  }

  @Test
  void testIsolationScore() {
    IsolationScoreDetector detector = new IsolationScoreDetector();
    Baseline baseline = baseline(0.0, 1.0, 0.0, -1.0, 1.0, 1.0);

    Assertions.assertTrue(detector.evaluate(1.5, baseline, 10).isFired());
    Assertions.assertFalse(detector.evaluate(0.9, baseline, 10).isFired());
    Assertions.assertEquals(1.0, detector.evaluate(100.0, baseline, 1).getScore());
  }

  @Test
  void testZeroSpreadNeverFires() {
    Baseline constant = baseline(5.0, 0.0, 5.0, 5.0, 5.0, 0.0);

    for (int sensitivity = 1; sensitivity <= 10; sensitivity++) {
      Assertions.assertFalse(new ZScoreDetector().evaluate(5.0, constant, sensitivity).isFired());
      Assertions.assertFalse(new IqrDetector().evaluate(5.0, constant, sensitivity).isFired());
      Assertions.assertFalse(new MadDetector().evaluate(5.0, constant, sensitivity).isFired());
      Assertions.assertFalse(
          new IsolationScoreDetector().evaluate(5.0, constant, sensitivity).isFired());
      Assertions.assertFalse(new ZScoreDetector().evaluate(9.0, constant, sensitivity).isFired());
    }
  }

  @Test
  void testThresholdBreach() {
    Baseline baseline = baseline(50.0, 5.0, 50.0, 45.0, 55.0, 5.0);
    ThresholdBreachDetector detector =
        new ThresholdBreachDetector(Thresholds.builder().min(0.0).max(100.0).build());

    Verdict above = detector.evaluate(120.0, baseline, 5);
    Assertions.assertTrue(above.isFired());
    Assertions.assertEquals(100.0, above.getExpectedValue());
    Assertions.assertTrue(above.getDescription().contains("above maximum"));

    Verdict below = detector.evaluate(-5.0, baseline, 5);
    Assertions.assertTrue(below.isFired());
    Assertions.assertEquals(0.0, below.getExpectedValue());

    Assertions.assertFalse(detector.evaluate(100.0, baseline, 5).isFired());
  }

  static Baseline baseline(
      double mean, double stddev, double median, double q1, double q3, double mad) {
    return Baseline.builder()
        .metricName("latency")
        .mean(mean)
        .stddev(stddev)
        .median(median)
        .q1(q1)
        .q3(q3)
        .mad(mad)
        .sampleCount(60)
        .build();
  }
}
