/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sources;

import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.datamodel.Values;
import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import java.io.IOException;
import org.apache.flink.api.common.functions.MapFunction;

/** Parses one CSV line of the form {@code index,key,value} into a {@link PivotRecord}. */
public class CsvLineParser implements MapFunction<String, PivotRecord> {
  private final char delimiter;
  private transient ObjectReader reader;

  public CsvLineParser(char delimiter) {
    this.delimiter = delimiter;
  }

  /**
   * Splits a line into its CSV fields, honouring quotes.
   *
   * @param line one line of input
   * @return the fields of the line
   * @throws SchemaViolationException if the line is not valid CSV
   */
  public String[] split(String line) {
    if (reader == null) {
      CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
      reader = new CsvMapper().readerFor(String[].class).with(schema);
    }
    String[] fields;
    try {
      fields = reader.readValue(line);
    } catch (IOException e) {
      throw new SchemaViolationException("Malformed CSV line: " + line, e);
    }
    if (fields == null) {
      throw new SchemaViolationException("Empty CSV line");
    }
    return fields;
  }

  @Override
  public PivotRecord map(String line) {
    String[] fields = split(line);
    if (fields.length != 3) {
      throw new SchemaViolationException(
          "Expected 3 CSV fields (index, key, value) but got " + fields.length + ": " + line);
    }
    return new PivotRecord(fields[0], fields[1], Values.toDouble(fields[2])).validate();
  }
}
