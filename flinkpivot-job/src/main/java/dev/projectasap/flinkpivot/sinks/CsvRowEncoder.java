/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sinks;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.projectasap.flinkpivot.table.PivotSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.types.Row;

/**
 * Writes each pivoted row as one CSV line in schema column order. Every row has one cell per
 * column; missing cells are empty.
 */
public class CsvRowEncoder implements Encoder<Row> {
  private final char delimiter;
  private final List<String> columnNames;
  private transient ObjectWriter writer;

  public CsvRowEncoder(PivotSchema schema, char delimiter) {
    this.delimiter = delimiter;
    this.columnNames = new ArrayList<>(schema.getColumnNames());
  }

  /**
   * Formats one row as a CSV line, including the trailing line separator.
   *
   * @param row the pivoted row
   * @return the CSV line
   * @throws IOException if the row cannot be written
   */
  public String toCsv(Row row) throws IOException {
    if (writer == null) {
      CsvSchema.Builder builder =
          CsvSchema.builder()
              .setColumnSeparator(delimiter)
              .setLineSeparator("\n")
              .setNullValue("")
              .setUseHeader(false);
      for (String name : columnNames) {
        builder.addColumn(name);
      }
      writer = new CsvMapper().writer(builder.build());
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < columnNames.size(); i++) {
      fields.put(columnNames.get(i), row.getField(i));
    }
    return writer.writeValueAsString(fields);
  }

  @Override
  public void encode(Row row, OutputStream stream) throws IOException {
    stream.write(toCsv(row).getBytes(StandardCharsets.UTF_8));
  }
}
