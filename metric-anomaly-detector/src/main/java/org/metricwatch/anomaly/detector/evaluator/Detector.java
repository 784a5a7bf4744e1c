package org.metricwatch.anomaly.detector.evaluator;

import org.metricwatch.anomaly.datamodel.Algorithm;
import org.metricwatch.anomaly.datamodel.Baseline;

/** A stateless detection strategy. */
public interface Detector {

  Algorithm getAlgorithm();

  Verdict evaluate(double value, Baseline baseline, int sensitivity);
}
