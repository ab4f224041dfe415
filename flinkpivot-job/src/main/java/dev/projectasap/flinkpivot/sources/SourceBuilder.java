/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sources;

import dev.projectasap.flinkpivot.datamodel.PivotRecord;
import dev.projectasap.flinkpivot.errors.SchemaViolationException;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.utils.InputConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.datagen.source.DataGeneratorSource;
import org.apache.flink.connector.datagen.source.GeneratorFunction;
import org.apache.flink.connector.file.src.FileSource;
import org.apache.flink.connector.file.src.reader.TextLineInputFormat;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the bounded pivot input, either from CSV files or from a deterministic generator. */
public class SourceBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SourceBuilder.class);

  /**
   * Reads CSV files of {@code index,key,value} lines. When the input has a header, the header of
   * the first file is read here to name the columns and header lines are dropped from the stream.
   *
   * @param env the execution environment
   * @param inputPath a CSV file or a directory of CSV files
   * @param inputConfig delimiter and header settings
   * @return the input relation
   * @throws IOException if the header cannot be read
   */
  public static PivotInput buildCsvInput(
      StreamExecutionEnvironment env, String inputPath, InputConfig inputConfig)
      throws IOException {
    CsvLineParser parser = new CsvLineParser(inputConfig.delimiter);
    String headerLine = null;
    if (inputConfig.header) {
      headerLine = readFirstLine(Paths.get(inputPath));
      logger.info("Using CSV header: {}", headerLine);
    }

    FileSource<String> source =
        FileSource.forRecordStreamFormat(
                new TextLineInputFormat(), new org.apache.flink.core.fs.Path(inputPath))
            .build();

    DataStream<PivotRecord> records =
        env.fromSource(source, WatermarkStrategy.noWatermarks(), "CSV Source")
            .filter(new DataLineFilter(headerLine))
            .name("drop-header")
            .map(parser)
            .name("parse-csv");

    if (headerLine == null) {
      return PivotInput.fromRecords(records);
    }
    String[] columnNames = parser.split(headerLine);
    if (columnNames.length != 3) {
      throw new SchemaViolationException(
          "CSV header must name exactly 3 columns (index, key, value): " + headerLine);
    }
    return PivotInput.fromRecords(records, Arrays.asList(columnNames));
  }

  /**
   * Generates {@code recordCount} records cycling over {@code indexCardinality} indexes and
   * {@code keyCardinality} keys. Each (index, key) pair repeats once every {@code indexCardinality
   * * keyCardinality} records.
   *
   * @return the input relation, with columns named index, key and value
   */
  public static PivotInput buildDatagenInput(
      StreamExecutionEnvironment env, int indexCardinality, int keyCardinality, long recordCount) {
    if (indexCardinality <= 0 || keyCardinality <= 0) {
      throw new IllegalArgumentException(
          "Index cardinality ("
              + indexCardinality
              + ") and key cardinality ("
              + keyCardinality
              + ") must be positive");
    }
    GeneratorFunction<Long, PivotRecord> generatorFunction =
        index -> generateRecord(index, indexCardinality, keyCardinality);

    DataGeneratorSource<PivotRecord> source =
        new DataGeneratorSource<>(
            generatorFunction, recordCount, TypeInformation.of(PivotRecord.class));

    DataStream<PivotRecord> records =
        env.fromSource(source, WatermarkStrategy.noWatermarks(), "Generator Source");
    return PivotInput.fromRecords(records, Arrays.asList("index", "key", "value"));
  }

  /**
   * Helper method to generate the record at position {@code index} of the generated input.
   *
   * @param index the position of the record
   * @param indexCardinality number of distinct indexes
   * @param keyCardinality number of distinct keys
   * @return a new PivotRecord
   */
  static PivotRecord generateRecord(long index, int indexCardinality, int keyCardinality) {
    String rowIndex = "idx" + (index % indexCardinality);
    String key = "key" + ((index / indexCardinality) % keyCardinality);
    double value = (index * 31 % 1000) / 10.0;
    return new PivotRecord(rowIndex, key, value);
  }

  private static String readFirstLine(Path path) throws IOException {
    Path file = path;
    if (Files.isDirectory(path)) {
      Optional<Path> first;
      try (Stream<Path> files = Files.list(path)) {
        first =
            files
                .filter(Files::isRegularFile)
                .filter(SourceBuilder::isDataFile)
                .sorted()
                .findFirst();
      }
      if (!first.isPresent()) {
        throw new IOException("No input files found in " + path);
      }
      file = first.get();
    }
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line = reader.readLine();
      if (line == null) {
        throw new IOException("Cannot read CSV header from empty file " + file);
      }
      return line;
    }
  }

  // Same rule as the FileSource default filter: hidden and underscore files are not data.
  private static boolean isDataFile(Path file) {
    String name = file.getFileName().toString();
    return !name.startsWith(".") && !name.startsWith("_");
  }
}
