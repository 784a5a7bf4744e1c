package org.metricwatch.anomaly.detector.evaluator;

import static org.metricwatch.anomaly.detector.evaluator.DetectorTest.baseline;

import com.typesafe.config.ConfigFactory;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.Severity;
import org.metricwatch.anomaly.datamodel.Thresholds;

class EnsembleEvaluatorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private static final Baseline NOISY = baseline(1.0, 0.2, 1.0, 0.5, 1.5, 0.2);
  private static final Baseline CONSTANT = baseline(5.0, 0.0, 5.0, 5.0, 5.0, 0.0);

  private final EnsembleEvaluator evaluator = new EnsembleEvaluator();

  @Test
  void testSpikeIsCritical() {
    DetectionConfig config = config(9, Algorithm.ZSCORE);

    AnomalyCandidate candidate = evaluator.evaluate(config, sample(3.0), NOISY).orElseThrow();

    Assertions.assertEquals(AnomalyType.SPIKE, candidate.getAnomalyType());
    Assertions.assertEquals(Severity.CRITICAL, candidate.getSeverity());
    Assertions.assertEquals(200.0, candidate.getDeviationPercent(), 1e-9);
    Assertions.assertEquals(1.0, candidate.getExpectedValue());
    Assertions.assertEquals(Set.of(Algorithm.ZSCORE), candidate.getFiringAlgorithms());
    Assertions.assertEquals("Z-score: 10.00, threshold: 1.67", candidate.getDescription());
    Assertions.assertEquals(NOW, candidate.getTimestamp());
  }

  @Test
  void testDropIsHigh() {
    AnomalyCandidate candidate =
        evaluator.evaluate(config(9, Algorithm.ZSCORE), sample(0.2), NOISY).orElseThrow();

    Assertions.assertEquals(AnomalyType.DROP, candidate.getAnomalyType());
    Assertions.assertEquals(Severity.HIGH, candidate.getSeverity());
    Assertions.assertEquals(80.0, candidate.getDeviationPercent(), 1e-9);
  }

  @Test
  void testAnyConfiguredDetectorFires() {
    // iqr fences at sensitivity 9 reach 3.17, only the z-score fires for 3.0
    DetectionConfig config = config(9, Algorithm.ZSCORE, Algorithm.IQR);

    AnomalyCandidate candidate = evaluator.evaluate(config, sample(3.0), NOISY).orElseThrow();
    Assertions.assertEquals(Set.of(Algorithm.ZSCORE), candidate.getFiringAlgorithms());
    Assertions.assertEquals(2, candidate.getVerdicts().size());

    EnsembleEvaluator quorum = new EnsembleEvaluator(2);
    Assertions.assertTrue(quorum.evaluate(config, sample(3.0), NOISY).isEmpty());
    Assertions.assertTrue(quorum.evaluate(config, sample(4.0), NOISY).isPresent());
  }

  @Test
  void testQuorumFromConfig() {
    EnsembleEvaluator quorum =
        new EnsembleEvaluator(ConfigFactory.parseMap(Map.of("minFiringDetectors", 2)));

    Assertions.assertTrue(
        quorum.evaluate(config(9, Algorithm.ZSCORE, Algorithm.IQR), sample(3.0), NOISY).isEmpty());
  }

  @Test
  void testUnconfiguredDetectorsAreNotRun() {
    Optional<AnomalyCandidate> candidate =
        evaluator.evaluate(config(9, Algorithm.MAD), sample(1.1), NOISY);

    Assertions.assertTrue(candidate.isEmpty());
  }

  @Test
  void testConstantBaselineOnlyBreachesThresholds() {
    DetectionConfig statisticalOnly =
        config(10, Algorithm.ZSCORE, Algorithm.IQR, Algorithm.MAD, Algorithm.ISOLATION);
    Assertions.assertTrue(evaluator.evaluate(statisticalOnly, sample(5.0), CONSTANT).isEmpty());
    Assertions.assertTrue(evaluator.evaluate(statisticalOnly, sample(7.0), CONSTANT).isEmpty());

    DetectionConfig bounded =
        statisticalOnly.toBuilder().thresholds(Thresholds.builder().max(6.0).build()).build();
    Assertions.assertTrue(evaluator.evaluate(bounded, sample(5.0), CONSTANT).isEmpty());
    AnomalyCandidate breach = evaluator.evaluate(bounded, sample(7.0), CONSTANT).orElseThrow();
    Assertions.assertEquals(AnomalyType.THRESHOLD_BREACH, breach.getAnomalyType());
    Assertions.assertEquals(Set.of(Algorithm.THRESHOLD), breach.getFiringAlgorithms());
    Assertions.assertEquals(6.0, breach.getExpectedValue());
    Assertions.assertEquals(40.0, breach.getDeviationPercent(), 1e-9);
  }

  @Test
  void testThresholdBreachIgnoresQuorum() {
    DetectionConfig config =
        config(1, Algorithm.ZSCORE).toBuilder()
            .thresholds(Thresholds.builder().min(0.5).build())
            .build();

    AnomalyCandidate candidate =
        new EnsembleEvaluator(3).evaluate(config, sample(0.4), NOISY).orElseThrow();

    Assertions.assertEquals(AnomalyType.THRESHOLD_BREACH, candidate.getAnomalyType());
  }

  @Test
  void testSeverityBands() {
    Assertions.assertEquals(Severity.CRITICAL, EnsembleEvaluator.severityOf(95.0));
    Assertions.assertEquals(Severity.HIGH, EnsembleEvaluator.severityOf(94.9999));
    Assertions.assertEquals(Severity.HIGH, EnsembleEvaluator.severityOf(50.0));
    Assertions.assertEquals(Severity.MEDIUM, EnsembleEvaluator.severityOf(49.9999));
    Assertions.assertEquals(Severity.MEDIUM, EnsembleEvaluator.severityOf(20.0));
    Assertions.assertEquals(Severity.LOW, EnsembleEvaluator.severityOf(19.9999));
    Assertions.assertEquals(Severity.LOW, EnsembleEvaluator.severityOf(0.0));
  }

  @Test
  void testDeviationAgainstZeroMean() {
    Assertions.assertEquals(0.0, EnsembleEvaluator.deviationPercent(0.0, 0.0));
    Assertions.assertTrue(EnsembleEvaluator.deviationPercent(1.0, 0.0) > 95.0);
  }

  private static DetectionConfig config(int sensitivity, Algorithm... algorithms) {
    DetectionConfig.DetectionConfigBuilder builder =
        DetectionConfig.builder().metricName("latency").sensitivity(sensitivity);
    for (Algorithm algorithm : algorithms) {
      builder.algorithm(algorithm);
    }
    return builder.build();
  }

  private static MetricSample sample(double value) {
    return MetricSample.of("latency", NOW, value);
  }
}
