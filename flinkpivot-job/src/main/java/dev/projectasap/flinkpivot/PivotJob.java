/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkpivot;

import dev.projectasap.flinkpivot.pivot.Pivoter;
import dev.projectasap.flinkpivot.sinks.SinkBuilder;
import dev.projectasap.flinkpivot.sources.SourceBuilder;
import dev.projectasap.flinkpivot.table.PivotInput;
import dev.projectasap.flinkpivot.table.PivotTable;
import dev.projectasap.flinkpivot.utils.ConfigLoader;
import dev.projectasap.flinkpivot.utils.JobConfig;
import dev.projectasap.flinkpivot.utils.PivotConfig;
import dev.projectasap.flinkpivot.utils.StreamCollector;
import java.io.IOException;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink batch job that pivots a narrow (index, key, value) dataset into a wide table. Reads CSV
 * files or generated records, runs the configured pivot and writes the rows to files or stdout.
 */
public class PivotJob {
  private static final Logger LOG = LoggerFactory.getLogger(PivotJob.class);

  static ArgumentParser buildParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("PivotJob")
            .build()
            .defaultHelp(true)
            .description("Wide pivot of (index, key, value) data");

    parser
        .addArgument("--configFilePath")
        .type(String.class)
        .required(true)
        .help("Configuration file path");

    parser
        .addArgument("--source")
        .type(String.class)
        .choices("file", "datagen")
        .setDefault("file")
        .help("Input source: CSV files or generated records (default: file)");

    parser.addArgument("--inputPath").type(String.class).help("CSV input file or directory");

    parser.addArgument("--outputFilePath").type(String.class).help("Output file path");

    parser
        .addArgument("--outputFormat")
        .type(String.class)
        .choices("json", "csv")
        .help("Output format: json or csv");

    parser
        .addArgument("--verbose")
        .type(Boolean.class)
        .setDefault(false)
        .help("Write rows to the output file sink instead of stdout (default: false)");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Parallelism for the Flink job (default: 1)");

    parser
        .addArgument("--datagenIndexCardinality")
        .type(Integer.class)
        .setDefault(1000)
        .help("DataGen number of distinct indexes (default: 1000)");

    parser
        .addArgument("--datagenKeyCardinality")
        .type(Integer.class)
        .setDefault(100)
        .help("DataGen number of distinct keys (default: 100)");

    parser
        .addArgument("--datagenRecords")
        .type(Long.class)
        .setDefault(100000L)
        .help("DataGen number of records to generate (default: 100000)");

    return parser;
  }

  static Namespace parseArgs(String[] args) throws ArgumentParserException {
    return buildParser().parseArgs(args);
  }

  static void checkArgs(Namespace parsedArgs) {
    boolean verbose = parsedArgs.getBoolean("verbose");
    if (verbose && parsedArgs.getString("outputFilePath") == null) {
      throw new IllegalArgumentException(
          "Output file path is required when verbose mode is enabled");
    }
    if (verbose && parsedArgs.getString("outputFormat") == null) {
      throw new IllegalArgumentException("Output format is required when verbose mode is enabled");
    }
    if ("file".equals(parsedArgs.getString("source"))
        && parsedArgs.getString("inputPath") == null) {
      throw new IllegalArgumentException("Input path is required for the file source");
    }
    if (parsedArgs.getInt("parallelism") <= 0) {
      throw new IllegalArgumentException("Parallelism must be positive");
    }
  }

  /**
   * Builds the input and the pivot on {@code env} without executing it.
   *
   * @param env the execution environment, in BATCH mode
   * @param parsedArgs the parsed command-line arguments
   * @param jobConfig the loaded configuration
   * @return the pivoted table
   * @throws IOException if the CSV header cannot be read
   */
  static PivotTable buildPivot(
      StreamExecutionEnvironment env, Namespace parsedArgs, JobConfig jobConfig)
      throws IOException {
    PivotInput input;
    if ("datagen".equals(parsedArgs.getString("source"))) {
      input =
          SourceBuilder.buildDatagenInput(
              env,
              parsedArgs.getInt("datagenIndexCardinality"),
              parsedArgs.getInt("datagenKeyCardinality"),
              parsedArgs.getLong("datagenRecords"));
    } else {
      input =
          SourceBuilder.buildCsvInput(
              env, parsedArgs.getString("inputPath"), jobConfig.inputConfig);
    }

    PivotConfig pivotConfig = jobConfig.pivotConfig;
    Pivoter pivoter = pivotConfig.createPivoter();
    return pivoter.pivot(input, pivotConfig.indexColumn, pivotConfig.keyUniverse);
  }

  /**
   * Main entry point for the pivot job.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the job fails to execute
   */
  public static void main(String[] args) throws Exception {
    Namespace parsedArgs = buildParser().parseArgsOrFail(args);

    // Set log level based on command line argument
    if (parsedArgs.getString("logLevel") != null) {
      System.setProperty("log.level", parsedArgs.getString("logLevel"));
    }

    LOG.info("Starting with log level: {}", System.getProperty("log.level", "INFO"));

    checkArgs(parsedArgs);

    JobConfig jobConfig = ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));
    LOG.info("Pivot configuration: {}", jobConfig.pivotConfig.serializeToJson());

    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    env.setRuntimeMode(RuntimeExecutionMode.BATCH);
    env.setParallelism(parsedArgs.getInt("parallelism"));

    PivotTable table = buildPivot(env, parsedArgs, jobConfig);
    LOG.info("Output schema: {}", table.getSchema());

    if (parsedArgs.getBoolean("verbose")) {
      table.getRows().sinkTo(SinkBuilder.buildSink(parsedArgs, table.getSchema()));
    } else {
      table.getRows().print();
    }

    try {
      env.execute("Pivot");
    } catch (Exception e) {
      LOG.error("Pivot job failed", e);
      throw StreamCollector.rethrow("Pivot", e);
    }
  }
}
