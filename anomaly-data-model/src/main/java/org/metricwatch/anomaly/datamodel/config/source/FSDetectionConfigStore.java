package org.metricwatch.anomaly.datamodel.config.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.Resources;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.metricwatch.anomaly.datamodel.DetectionConfig;
import org.metricwatch.anomaly.datamodel.DetectionConfigValidator;
import org.metricwatch.anomaly.datamodel.exception.ConfigStoreUnavailableException;
import org.metricwatch.anomaly.datamodel.exception.InvalidDetectionConfigException;
import org.metricwatch.anomaly.datamodel.store.DetectionConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detection configs kept as a JSON array in a file. Updates rewrite the whole file. Until the
 * first update a missing file is looked up on the classpath, which lets a packaged default set of
 * configs seed the store.
 */
class FSDetectionConfigStore implements DetectionConfigStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSDetectionConfigStore.class);
  private static final String PATH_CONFIG = "path";

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final TypeReference<List<DetectionConfig>> CONFIG_LIST =
      new TypeReference<>() {};

  private final File file;

  FSDetectionConfigStore(Config fsConfig) {
    this.file = new File(fsConfig.getString(PATH_CONFIG));
  }

  @Override
  public List<DetectionConfig> listEnabledConfigs() {
    return readValid().stream().filter(DetectionConfig::isEnabled).collect(Collectors.toList());
  }

  @Override
  public Optional<DetectionConfig> getConfig(String metricName) {
    return readValid().stream()
        .filter(config -> config.getMetricName().equals(metricName))
        .findFirst();
  }

  @Override
  public synchronized void upsertConfig(DetectionConfig config) {
    List<DetectionConfig> configs = new ArrayList<>(readAll());
    configs.removeIf(existing -> existing.getMetricName().equals(config.getMetricName()));
    configs.add(config);
    try {
      OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, configs);
    } catch (IOException e) {
      throw new ConfigStoreUnavailableException(
          "Unable to write detection configs to " + file.getPath(), e);
    }
    LOGGER.info("Stored detection config for metric {}", config.getMetricName());
  }

  // entries failing validation stay in the file but are never evaluated
  private List<DetectionConfig> readValid() {
    List<DetectionConfig> valid = new ArrayList<>();
    for (DetectionConfig config : readAll()) {
      try {
        DetectionConfigValidator.validate(config);
        valid.add(config);
      } catch (InvalidDetectionConfigException e) {
        LOGGER.warn("Ignoring detection config in {}: {}", file.getPath(), e.getMessage());
      }
    }
    return valid;
  }

  private synchronized List<DetectionConfig> readAll() {
    LOGGER.debug("Reading detection configs from file path:{}", file.getPath());
    try {
      JsonNode jsonNode;
      if (file.exists()) {
        jsonNode = OBJECT_MAPPER.readTree(file);
      } else {
        Optional<URL> resource = classpathResource();
        if (resource.isEmpty()) {
          return List.of();
        }
        jsonNode = OBJECT_MAPPER.readTree(resource.get());
      }
      if (!jsonNode.isArray()) {
        throw new ConfigStoreUnavailableException(
            "File should contain an array of detection configs");
      }
      return OBJECT_MAPPER.convertValue(jsonNode, CONFIG_LIST);
    } catch (IOException e) {
      throw new ConfigStoreUnavailableException(
          "Unable to read detection configs from " + file.getPath(), e);
    }
  }

  private Optional<URL> classpathResource() {
    try {
      return Optional.of(Resources.getResource(file.getPath()));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("No detection configs found at {}", file.getPath());
      return Optional.empty();
    }
  }
}
