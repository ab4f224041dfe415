/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.flinkpivot.table.PivotSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.types.Row;

/**
 * Writes each pivoted row as one JSON object per line, keyed by column name. Missing cells are
 * written as JSON null.
 */
public class JsonRowEncoder implements Encoder<Row> {
  private final List<String> columnNames;
  private transient ObjectMapper objectMapper;

  public JsonRowEncoder(PivotSchema schema) {
    this.columnNames = schema.getColumnNames();
  }

  /**
   * Builds the JSON object for one row.
   *
   * @param row the pivoted row
   * @return an object with one field per column
   */
  public ObjectNode toJson(Row row) {
    ObjectNode jsonNode = objectMapper().createObjectNode();
    jsonNode.put(columnNames.get(0), (String) row.getField(0));
    for (int i = 1; i < columnNames.size(); i++) {
      jsonNode.put(columnNames.get(i), (Double) row.getField(i));
    }
    return jsonNode;
  }

  @Override
  public void encode(Row row, OutputStream stream) throws IOException {
    stream.write(objectMapper().writeValueAsBytes(toJson(row)));
    stream.write("\n".getBytes(StandardCharsets.UTF_8));
  }

  private ObjectMapper objectMapper() {
    if (objectMapper == null) {
      objectMapper = new ObjectMapper();
    }
    return objectMapper;
  }
}
