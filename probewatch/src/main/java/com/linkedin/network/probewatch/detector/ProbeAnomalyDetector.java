/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonReader;
import com.linkedin.network.probewatch.config.ProbeWatchConfig;
import com.linkedin.network.probewatch.config.constants.DetectionConfig;
import com.linkedin.network.probewatch.config.constants.PathConfig;
import com.linkedin.network.probewatch.config.constants.ThresholdConfig;
import com.linkedin.network.probewatch.model.MeasurementResult;
import com.linkedin.network.probewatch.persisteddata.PersistedMapFactory;
import com.linkedin.network.probewatch.persisteddata.namespace.BaselinePersistedData;
import com.linkedin.network.probewatch.report.AnomalyReport;
import com.linkedin.probewatch.detector.AnomalyFinder;
import com.linkedin.probewatch.exception.ProbeWatchException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.probewatch.common.utils.Utils.validateNotNull;


/**
 * The anomaly detection engine. One analysis pass collects the metrics of a measurement result (exchanging latency and
 * hop baselines on the way), runs the configured anomaly finders and summarizes their anomalies in a report.
 * <p>
 * Baselines and the route history are updated by every pass, so analyzing the same result twice does not yield the
 * same report. The engine is single-writer: it must not be used by multiple threads, and two engines must not share
 * a route history.
 */
public class ProbeAnomalyDetector {
  private static final Logger LOG = LoggerFactory.getLogger(ProbeAnomalyDetector.class);
  public static final String RESULT_FILE_GLOB = "measurement_*_result.json";
  public static final String REPORT_FILE_SUFFIX = ".json";
  private static final Gson GSON = new Gson();

  private final ProbeDataCollector _collector;
  private final List<AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly>> _anomalyFinders;
  private final RouteHistory _routeHistory;
  private final Path _resultsDir;
  private final Path _eventsDir;
  private final LongSupplier _clock;

  /**
   * Create an engine keeping its baselines in the store selected by the given configuration.
   *
   * @param config The configuration.
   */
  public ProbeAnomalyDetector(ProbeWatchConfig config) {
    this(config, new BaselinePersistedData(new PersistedMapFactory(config).instance()), new RouteHistory(),
         System::currentTimeMillis);
  }

  /**
   * @param config The configuration.
   * @param baselines Latency and hop baselines.
   * @param routeHistory The route history used by {@link #analyze(MeasurementResult)}.
   * @param clock Source of the detection time in milliseconds.
   */
  public ProbeAnomalyDetector(ProbeWatchConfig config, BaselinePersistedData baselines, RouteHistory routeHistory,
                              LongSupplier clock) {
    validateNotNull(config, "Config cannot be null.");
    _collector = new ProbeDataCollector(baselines, config.getBoolean(DetectionConfig.ENABLE_ADAPTIVE_BASELINE_CONFIG));
    _anomalyFinders = anomalyFinders(config);
    _routeHistory = validateNotNull(routeHistory, "Route history cannot be null.");
    _resultsDir = Path.of(config.getString(PathConfig.RESULTS_DIR_CONFIG));
    _eventsDir = Path.of(config.getString(PathConfig.EVENTS_DIR_CONFIG));
    _clock = validateNotNull(clock, "Clock cannot be null.");
  }

  private static List<AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly>> anomalyFinders(ProbeWatchConfig config) {
    List<AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly>> finders = new ArrayList<>();
    if (config.getBoolean(DetectionConfig.ENABLE_OUTLIER_DETECTION_CONFIG)) {
      finders.add(new OutlierProbeFinder(config.getDouble(ThresholdConfig.OUTLIER_FACTOR_CONFIG)));
    }
    if (config.getBoolean(DetectionConfig.ENABLE_GEO_ANOMALY_DETECTION_CONFIG)) {
      finders.add(new GeoAnomalyFinder(config.getDouble(ThresholdConfig.GEO_ANOMALY_MARGIN_MS_CONFIG)));
    }
    finders.add(new ThresholdAnomalyFinder(config.getDouble(ThresholdConfig.LATENCY_SPIKE_MS_CONFIG),
                                           config.getDouble(ThresholdConfig.LATENCY_SPIKE_MULTIPLIER_CONFIG),
                                           config.getDouble(ThresholdConfig.PACKET_LOSS_PERCENTAGE_CONFIG),
                                           config.getDouble(ThresholdConfig.JITTER_SPIKE_MS_CONFIG)));
    finders.add(new RoutingAnomalyFinder(config.getInt(ThresholdConfig.PATH_FLAPPING_WINDOW_CONFIG)));
    return Collections.unmodifiableList(finders);
  }

  /**
   * Analyze the given measurement result using the route history of this engine.
   *
   * @param result Measurement result.
   * @return The anomaly report of the measurement.
   */
  public AnomalyReport analyze(MeasurementResult result) {
    return analyze(result, _routeHistory);
  }

  /**
   * Analyze the given measurement result using the given route history. Traceroute paths of the result are appended
   * to the history.
   *
   * @param result Measurement result.
   * @param routeHistory Route history to use for path flapping detection.
   * @return The anomaly report of the measurement.
   */
  public AnomalyReport analyze(MeasurementResult result, RouteHistory routeHistory) {
    validateNotNull(result, "Measurement result cannot be null.");
    validateNotNull(routeHistory, "Route history cannot be null.");
    ProbeAnomalyFactory anomalyFactory = new ProbeAnomalyFactory(_clock.getAsLong());
    ProbeMetricSet metrics = _collector.collect(result);
    ProbeAnalysisContext context = new ProbeAnalysisContext(metrics, anomalyFactory, routeHistory);
    List<ProbeAnomaly> anomalies = new ArrayList<>();
    for (AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly> finder : _anomalyFinders) {
      anomalies.addAll(finder.anomalies(context));
    }
    LOG.debug("Measurement {}: {} probes, {} anomalies.", result.measurementId(), metrics.size(), anomalies.size());
    return new AnomalyReport(result.measurementId(), anomalyFactory.timestamp(), anomalies);
  }

  /**
   * Analyze the measurement result in the given file and save its report in the events directory as
   * {@code <measurement_id>.json}, replacing an earlier report of the same measurement.
   *
   * @param resultFile A measurement result file.
   * @return The anomaly report of the measurement.
   * @throws ProbeWatchException If the file cannot be read or parsed, its measurement id does not name a report file,
   * or the report cannot be written. Baselines are left untouched unless the analysis ran.
   */
  public AnomalyReport analyzeFile(Path resultFile) throws ProbeWatchException {
    MeasurementResult result = readResult(resultFile);
    Path reportFile = reportFile(result.measurementId());
    AnomalyReport report = analyze(result);
    saveReport(report, reportFile);
    if (report.hasAnomalies()) {
      LOG.info("Events for measurement {} saved.", report.measurementId());
    } else {
      LOG.info("No anomalies found for measurement {}.", report.measurementId());
    }
    return report;
  }

  /**
   * Analyze every {@value #RESULT_FILE_GLOB} file in the results directory, one after another in directory listing
   * order. A file that fails is logged and skipped.
   *
   * @return The number of analyzed and failed files.
   */
  public BatchResult analyzeAll() {
    if (!Files.isDirectory(_resultsDir)) {
      LOG.warn("Results directory {} does not exist, nothing to analyze.", _resultsDir);
      return new BatchResult(0, 0);
    }
    int processed = 0;
    int errored = 0;
    try (DirectoryStream<Path> resultFiles = Files.newDirectoryStream(_resultsDir, RESULT_FILE_GLOB)) {
      for (Path resultFile : resultFiles) {
        try {
          analyzeFile(resultFile);
          processed++;
        } catch (ProbeWatchException | RuntimeException e) {
          LOG.error("Failed to analyze {}.", resultFile, e);
          errored++;
        }
      }
    } catch (IOException e) {
      LOG.error("Failed to list results directory {}.", _resultsDir, e);
    }
    BatchResult batchResult = new BatchResult(processed, errored);
    LOG.info("Analyzed measurement results in {}: {}.", _resultsDir, batchResult);
    return batchResult;
  }

  /**
   * @return The route history used by {@link #analyze(MeasurementResult)}.
   */
  public RouteHistory routeHistory() {
    return _routeHistory;
  }

  public Path resultsDir() {
    return _resultsDir;
  }

  public Path eventsDir() {
    return _eventsDir;
  }

  /**
   * @param measurementId Measurement id.
   * @return The file the report of the given measurement is saved in.
   * @throws ProbeWatchException If the measurement id does not name a file directly in the events directory.
   */
  public Path reportFile(String measurementId) throws ProbeWatchException {
    try {
      Path reportFile = _eventsDir.resolve(measurementId + REPORT_FILE_SUFFIX);
      if (!_eventsDir.equals(reportFile.getParent())) {
        throw new ProbeWatchException(String.format("Measurement id %s does not map to a report in %s.", measurementId,
                                                    _eventsDir));
      }
      return reportFile;
    } catch (InvalidPathException e) {
      throw new ProbeWatchException(String.format("Measurement id %s is not a valid file name.", measurementId), e);
    }
  }

  static MeasurementResult readResult(Path resultFile) throws ProbeWatchException {
    MeasurementResult result;
    try (JsonReader reader = new JsonReader(new InputStreamReader(Files.newInputStream(resultFile), StandardCharsets.UTF_8))) {
      result = GSON.fromJson(reader, MeasurementResult.class);
    } catch (IOException | JsonParseException e) {
      throw new ProbeWatchException(String.format("Failed to read measurement result %s.", resultFile), e);
    }
    if (result == null) {
      throw new ProbeWatchException(String.format("Measurement result %s is empty.", resultFile));
    }
    if (result.measurementId() == null || result.measurementId().isEmpty()) {
      throw new ProbeWatchException(String.format("Measurement result %s has no measurement_id.", resultFile));
    }
    return result;
  }

  private void saveReport(AnomalyReport report, Path reportFile) throws ProbeWatchException {
    try {
      Files.createDirectories(_eventsDir);
      Files.writeString(reportFile, report.toJson(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ProbeWatchException(String.format("Failed to save report %s.", reportFile), e);
    }
  }
}
