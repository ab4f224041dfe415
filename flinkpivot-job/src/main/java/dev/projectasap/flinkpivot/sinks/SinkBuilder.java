/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot.sinks;

import dev.projectasap.flinkpivot.table.PivotSchema;
import java.time.Duration;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.connector.file.sink.FileSink;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.functions.sink.filesystem.rollingpolicies.DefaultRollingPolicy;
import org.apache.flink.types.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder for creating Flink sinks from command-line arguments. Supports file sinks with JSON and
 * CSV output formats.
 */
public class SinkBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SinkBuilder.class);

  /**
   * Creates the row encoder for an output format.
   *
   * @param outputFormat {@code json} or {@code csv}
   * @param schema the schema of the rows to encode
   * @return the encoder
   * @throws IllegalArgumentException if the format is unknown
   */
  public static Encoder<Row> buildEncoder(String outputFormat, PivotSchema schema) {
    if ("json".equals(outputFormat)) {
      return new JsonRowEncoder(schema);
    } else if ("csv".equals(outputFormat)) {
      return new CsvRowEncoder(schema, ',');
    }
    throw new IllegalArgumentException("Invalid output format: " + outputFormat);
  }

  /**
   * Builds a Flink sink based on parsed command-line arguments.
   *
   * @param parsedArgs the parsed command-line arguments
   * @param schema the schema of the pivoted rows
   * @return the configured Flink sink
   */
  public static Sink<Row> buildSink(Namespace parsedArgs, PivotSchema schema) {
    String outputFormat = parsedArgs.getString("outputFormat");
    String outputPath = parsedArgs.getString("outputFilePath");

    logger.info("Building sink with output format: {}", outputFormat);
    logger.info("Using file sink with path: {}", outputPath);

    return FileSink.forRowFormat(new Path(outputPath), buildEncoder(outputFormat, schema))
        .withRollingPolicy(
            DefaultRollingPolicy.builder()
                .withRolloverInterval(Duration.ofMinutes(15))
                .withInactivityInterval(Duration.ofMinutes(1))
                .withMaxPartSize(1024L * 1024 * 1024)
                .build())
        .build();
  }
}
