/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.linkedin.network.probewatch.config.ProbeWatchConfig;
import com.linkedin.network.probewatch.config.ProbeWatchConfigLoader;
import com.linkedin.network.probewatch.config.constants.PathConfig;
import com.linkedin.network.probewatch.detector.BatchResult;
import com.linkedin.network.probewatch.detector.ProbeAnomalyDetector;
import com.linkedin.network.probewatch.report.AnomalyReportSummarizer;
import com.linkedin.network.probewatch.report.MeasurementAlerts;
import com.linkedin.probewatch.common.config.ConfigException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The main class to run ProbeWatch.
 * <pre>
 *   probewatch [--config FILE] detect [--results-dir DIR] [--events-dir DIR] [--baseline-dir DIR]
 *   probewatch [--config FILE] alerts [--measurement-id ID] [--details]
 * </pre>
 */
public final class ProbeWatchMain {
  private static final Logger LOG = LoggerFactory.getLogger(ProbeWatchMain.class);
  public static final String PROGRAM_NAME = "probewatch";
  public static final String DETECT = "detect";
  public static final String ALERTS = "alerts";
  static final int SUCCESS = 0;
  static final int USAGE_ERROR = 1;

  private ProbeWatchMain() { }

  static class MainArguments {
    @Parameter(names = {"--config", "-c"}, description = "Configuration file (JSON sections or flat properties)", order = 0)
    String _configFile;

    @Parameter(names = {"--help", "-h"}, description = "Show help message", help = true, order = 1)
    boolean _help;
  }

  @Parameters(commandDescription = "Analyze all fetched measurement results and save their anomaly reports")
  static class DetectArguments {
    @Parameter(names = {"--results-dir"}, description = "Directory of the measurement_*_result.json files", order = 0)
    String _resultsDir;

    @Parameter(names = {"--events-dir"}, description = "Directory to save anomaly reports in", order = 1)
    String _eventsDir;

    @Parameter(names = {"--baseline-dir"}, description = "Directory of the latency and traceroute baselines", order = 2)
    String _baselineDir;
  }

  @Parameters(commandDescription = "Summarize the saved anomaly reports")
  static class AlertsArguments {
    @Parameter(names = {"--measurement-id"}, description = "Only summarize the report of this measurement", order = 0)
    String _measurementId;

    @Parameter(names = {"--details"}, description = "Show one line per anomaly", order = 1)
    boolean _details;
  }

  /**
   * The main function to run ProbeWatch.
   * @param args Command line arguments.
   */
  public static void main(String[] args) {
    Thread.setDefaultUncaughtExceptionHandler((t, e) -> LOG.error("Uncaught exception on thread {}", t, e));
    int exitCode = run(args);
    if (exitCode != SUCCESS) {
      System.exit(exitCode);
    }
  }

  /**
   * Package private for testing.
   *
   * @param args Command line arguments.
   * @return The exit code.
   */
  static int run(String[] args) {
    MainArguments mainArguments = new MainArguments();
    DetectArguments detectArguments = new DetectArguments();
    AlertsArguments alertsArguments = new AlertsArguments();
    JCommander commander = JCommander.newBuilder()
                                     .addObject(mainArguments)
                                     .addCommand(DETECT, detectArguments)
                                     .addCommand(ALERTS, alertsArguments)
                                     .programName(PROGRAM_NAME)
                                     .build();
    try {
      commander.parse(args);
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      commander.usage();
      return USAGE_ERROR;
    }
    if (mainArguments._help) {
      commander.usage();
      return SUCCESS;
    }
    String command = commander.getParsedCommand();
    if (command == null) {
      System.err.println("A command is required.");
      commander.usage();
      return USAGE_ERROR;
    }

    ProbeWatchConfig config = ProbeWatchConfigLoader.load(mainArguments._configFile);
    switch (command) {
      case DETECT:
        ProbeWatchConfig detectConfig;
        try {
          detectConfig = withDirectories(config, detectArguments);
        } catch (ConfigException e) {
          System.err.println(e.getMessage());
          commander.usage();
          return USAGE_ERROR;
        }
        detect(detectConfig);
        return SUCCESS;
      case ALERTS:
        alerts(config, alertsArguments);
        return SUCCESS;
      default:
        commander.usage();
        return USAGE_ERROR;
    }
  }

  static ProbeWatchConfig withDirectories(ProbeWatchConfig config, DetectArguments arguments) {
    Map<String, Object> originals = config.originals();
    putIfSet(originals, PathConfig.RESULTS_DIR_CONFIG, arguments._resultsDir);
    putIfSet(originals, PathConfig.EVENTS_DIR_CONFIG, arguments._eventsDir);
    putIfSet(originals, PathConfig.BASELINE_DIR_CONFIG, arguments._baselineDir);
    return new ProbeWatchConfig(originals);
  }

  private static void putIfSet(Map<String, Object> originals, String name, String value) {
    if (value != null) {
      originals.put(name, value);
    }
  }

  private static BatchResult detect(ProbeWatchConfig config) {
    ProbeAnomalyDetector detector = new ProbeAnomalyDetector(config);
    BatchResult result = detector.analyzeAll();
    LOG.info("Detection finished: {} measurements processed, {} failed.", result.processed(), result.errored());
    return result;
  }

  private static List<MeasurementAlerts> alerts(ProbeWatchConfig config, AlertsArguments arguments) {
    AnomalyReportSummarizer summarizer = new AnomalyReportSummarizer(Path.of(config.getString(PathConfig.EVENTS_DIR_CONFIG)));
    return summarizer.summarize(arguments._measurementId, arguments._details);
  }
}
