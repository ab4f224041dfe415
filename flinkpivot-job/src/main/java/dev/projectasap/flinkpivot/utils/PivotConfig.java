/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkpivot.pivot.AggregatingPivoter;
import dev.projectasap.flinkpivot.pivot.BasicPivoter;
import dev.projectasap.flinkpivot.pivot.Combiner;
import dev.projectasap.flinkpivot.pivot.Pivoter;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the pivot itself: which engine to run, how duplicates are combined, the index
 * column name and the output keys.
 */
public class PivotConfig implements Serializable {
  public static final String MODE_BASIC = "basic";
  public static final String MODE_AGGREGATING = "aggregating";

  public String mode = MODE_AGGREGATING;
  public String combiner = "sum";
  public String indexColumn;
  public List<String> keyUniverse = new ArrayList<>();

  /**
   * Serializes the pivot configuration to JSON.
   *
   * @return JsonNode containing the configuration details
   */
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();

    jsonNode.put("mode", this.mode);
    jsonNode.put("combiner", this.combiner);
    jsonNode.put("indexColumn", this.indexColumn);
    ArrayNode keys = jsonNode.putArray("keyUniverse");
    for (String key : this.keyUniverse) {
      keys.add(key);
    }
    return jsonNode;
  }

  /**
   * Instantiates the pivot engine based on configuration.
   *
   * @return the pivoter for {@link #mode}
   * @throws IllegalArgumentException if the mode or combiner is unknown
   */
  public Pivoter createPivoter() {
    if (MODE_BASIC.equals(mode)) {
      return new BasicPivoter();
    }
    if (MODE_AGGREGATING.equals(mode)) {
      return new AggregatingPivoter(Combiner.named(combiner));
    }
    throw new IllegalArgumentException(
        "Unknown pivot mode '" + mode + "'; expected basic or aggregating");
  }
}
