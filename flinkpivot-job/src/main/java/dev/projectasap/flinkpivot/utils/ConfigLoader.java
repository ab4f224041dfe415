/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for loading job configuration from YAML files. Parses the pivot and input
 * sections; missing entries keep their defaults.
 */
public class ConfigLoader {
  /**
   * Loads job configuration from a YAML file.
   *
   * @param configFilePath path to the YAML configuration file
   * @return parsed job configuration
   * @throws IOException if file reading or parsing fails
   */
  public static JobConfig loadConfig(String configFilePath) throws IOException {
    String yamlContent =
        new String(Files.readAllBytes(Paths.get(configFilePath)), StandardCharsets.UTF_8);
    return parseConfig(yamlContent);
  }

  /**
   * Parses job configuration from YAML text.
   *
   * @param yamlContent the YAML document
   * @return parsed job configuration
   * @throws IOException if the YAML cannot be parsed
   * @throws IllegalArgumentException if a value has the wrong shape
   */
  public static JobConfig parseConfig(String yamlContent) throws IOException {
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    ObjectNode rootNode = mapper.readValue(yamlContent, ObjectNode.class);

    JobConfig jobConfig = new JobConfig();

    JsonNode pivotNode = rootNode.get("pivot");
    if (pivotNode != null && !pivotNode.isNull()) {
      PivotConfig config = jobConfig.pivotConfig;
      if (pivotNode.hasNonNull("mode")) {
        config.mode = pivotNode.get("mode").asText().trim().toLowerCase();
      }
      if (pivotNode.hasNonNull("combiner")) {
        config.combiner = pivotNode.get("combiner").asText();
      }
      if (pivotNode.hasNonNull("indexColumn")) {
        config.indexColumn = pivotNode.get("indexColumn").asText();
      }
      if (pivotNode.hasNonNull("keyUniverse")) {
        JsonNode keysNode = pivotNode.get("keyUniverse");
        if (!keysNode.isArray()) {
          throw new IllegalArgumentException("pivot.keyUniverse must be a list of keys");
        }
        List<String> keys = new ArrayList<>();
        keysNode.forEach(key -> keys.add(key.asText()));
        config.keyUniverse = keys;
      }
    }

    JsonNode inputNode = rootNode.get("input");
    if (inputNode != null && !inputNode.isNull()) {
      InputConfig config = jobConfig.inputConfig;
      if (inputNode.hasNonNull("delimiter")) {
        String delimiter = inputNode.get("delimiter").asText();
        if (delimiter.length() != 1) {
          throw new IllegalArgumentException(
              "input.delimiter must be a single character, got '" + delimiter + "'");
        }
        config.delimiter = delimiter.charAt(0);
      }
      if (inputNode.hasNonNull("header")) {
        config.header = inputNode.get("header").asBoolean();
      }
    }

    return jobConfig;
  }
}
