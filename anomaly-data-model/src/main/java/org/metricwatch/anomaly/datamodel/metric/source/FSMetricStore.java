package org.metricwatch.anomaly.datamodel.metric.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.datamodel.MetricSample;
import org.metricwatch.anomaly.datamodel.exception.MetricStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.store.MetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metric store backed by a JSON file of the form {@code {"metric": [{"timestamp": "...",
 * "value": 1.0}, ...]}}. The file is re-read on every call.
 */
class FSMetricStore implements MetricStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSMetricStore.class);
  private static final String PATH_CONFIG = "path";
  private static final String TIMESTAMP = "timestamp";
  private static final String VALUE = "value";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final String fsPath;

  FSMetricStore(Config fsConfig) {
    this.fsPath = fsConfig.getString(PATH_CONFIG);
  }

  @Override
  public Optional<MetricSample> getLatestSample(String metricName) {
    return readSeries(metricName).stream().max(Comparator.comparing(MetricSample::getTimestamp));
  }

  @Override
  public List<MetricSample> getHistoricalWindow(String metricName, Instant from, Instant to) {
    return readSeries(metricName).stream()
        .filter(sample -> !sample.getTimestamp().isBefore(from))
        .filter(sample -> !sample.getTimestamp().isAfter(to))
        .sorted(Comparator.comparing(MetricSample::getTimestamp))
        .collect(Collectors.toList());
  }

  private List<MetricSample> readSeries(String metricName) {
    LOGGER.debug("Reading samples of metric {} from file path:{}", metricName, fsPath);
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(new File(fsPath));
    } catch (IOException e) {
      throw new MetricStoreUnavailableException(
          metricName, "Unable to read metric file " + fsPath, e);
    }
    if (!root.isObject()) {
      throw new MetricStoreUnavailableException(
          metricName, "Metric file should contain an object keyed by metric name");
    }

    List<MetricSample> samples = new ArrayList<>();
    Iterator<Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Entry<String, JsonNode> field = fields.next();
      if (!field.getKey().equals(metricName)) {
        continue;
      }
      for (JsonNode point : field.getValue()) {
        samples.add(
            MetricSample.of(
                metricName,
                Instant.parse(point.get(TIMESTAMP).asText()),
                point.get(VALUE).asDouble()));
      }
    }
    return samples;
  }
}
