package org.metricwatch.anomaly.detector.evaluator;

import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.AnomalyType;
import org.metricwatch.anomaly.datamodel.Baseline;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the detectors configured for a metric and combines their verdicts. By default any firing
 * detector raises a candidate; {@code minFiringDetectors} can demand agreement between several
 * statistical detectors. A threshold breach always raises a candidate on its own.
 */
public class EnsembleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(EnsembleEvaluator.class);

  static final double EPSILON = 1e-9;
  static final double CRITICAL_DEVIATION_PERCENT = 95.0;
  static final double HIGH_DEVIATION_PERCENT = 50.0;
  static final double MEDIUM_DEVIATION_PERCENT = 20.0;
  private static final String MIN_FIRING_DETECTORS_CONFIG = "minFiringDetectors";
  private static final int DEFAULT_MIN_FIRING_DETECTORS = 1;

  private final Map<Algorithm, Detector> statisticalDetectors = new EnumMap<>(Algorithm.class);
  private final int minFiringDetectors;

  public EnsembleEvaluator() {
    this(DEFAULT_MIN_FIRING_DETECTORS);
  }

  public EnsembleEvaluator(Config ensembleConfig) {
    this(
        ensembleConfig.hasPath(MIN_FIRING_DETECTORS_CONFIG)
            ? ensembleConfig.getInt(MIN_FIRING_DETECTORS_CONFIG)
            : DEFAULT_MIN_FIRING_DETECTORS);
  }

  public EnsembleEvaluator(int minFiringDetectors) {
    this.minFiringDetectors = Math.max(1, minFiringDetectors);
    register(new ZScoreDetector());
    register(new IqrDetector());
    register(new MadDetector());
    register(new IsolationScoreDetector());
  }

  private void register(Detector detector) {
    statisticalDetectors.put(detector.getAlgorithm(), detector);
  }

  public Optional<AnomalyCandidate> evaluate(
      DetectionConfig config, MetricSample sample, Baseline baseline) {
    double value = sample.getValue();
    List<Verdict> verdicts = new ArrayList<>();
    for (Algorithm algorithm : config.getAlgorithms()) {
      Detector detector = statisticalDetectors.get(algorithm);
      if (detector != null) {
        verdicts.add(detector.evaluate(value, baseline, config.getSensitivity()));
      }
    }
    Optional<Verdict> thresholdVerdict = Optional.empty();
    if (config.hasThresholds()) {
      Verdict verdict =
          new ThresholdBreachDetector(config.getThresholds())
              .evaluate(value, baseline, config.getSensitivity());
      verdicts.add(verdict);
      thresholdVerdict = Optional.of(verdict).filter(Verdict::isFired);
    }

    List<Verdict> fired = verdicts.stream().filter(Verdict::isFired).collect(Collectors.toList());
    long firedStatistical =
        fired.stream().filter(verdict -> verdict.getAlgorithm() != Algorithm.THRESHOLD).count();

    LOGGER.debug(
        "Metric {}, value {}, verdicts {}", config.getMetricName(), value, verdicts);

    if (thresholdVerdict.isEmpty() && firedStatistical < minFiringDetectors) {
      return Optional.empty();
    }

    Verdict primary =
        thresholdVerdict.orElseGet(
            () ->
                fired.stream()
                    .max(Comparator.comparingDouble(Verdict::getNormalizedDeviation))
                    .orElseThrow());
    double deviationPercent = deviationPercent(value, baseline.getMean());
    Set<Algorithm> firingAlgorithms = EnumSet.noneOf(Algorithm.class);
    fired.forEach(verdict -> firingAlgorithms.add(verdict.getAlgorithm()));

    return Optional.of(
        AnomalyCandidate.builder()
            .metricName(config.getMetricName())
            .timestamp(sample.getTimestamp())
            .observedValue(value)
            .expectedValue(primary.getExpectedValue())
            .baseline(baseline)
            .deviationPercent(deviationPercent)
            .anomalyType(classify(value, baseline, thresholdVerdict.isPresent()))
            .severity(severityOf(deviationPercent))
            .firingAlgorithms(firingAlgorithms)
            .verdicts(List.copyOf(verdicts))
            .description(primary.getDescription())
            .build());
  }

  static double deviationPercent(double observedValue, double mean) {
    return Math.abs(observedValue - mean) / Math.max(Math.abs(mean), EPSILON) * 100;
  }

  /** Bands have inclusive lower bounds. */
  public static Severity severityOf(double deviationPercent) {
    if (deviationPercent >= CRITICAL_DEVIATION_PERCENT) {
      return Severity.CRITICAL;
    }
    if (deviationPercent >= HIGH_DEVIATION_PERCENT) {
      return Severity.HIGH;
    }
    if (deviationPercent >= MEDIUM_DEVIATION_PERCENT) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  static AnomalyType classify(double value, Baseline baseline, boolean thresholdBreached) {
    if (thresholdBreached) {
      return AnomalyType.THRESHOLD_BREACH;
    }
    if (value > baseline.getMean()) {
      return AnomalyType.SPIKE;
    }
    if (value < baseline.getMean()) {
      return AnomalyType.DROP;
    }
    return AnomalyType.OUTLIER;
  }
}
