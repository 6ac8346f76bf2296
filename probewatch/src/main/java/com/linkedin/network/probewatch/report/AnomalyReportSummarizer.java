/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.report;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import com.linkedin.network.probewatch.detector.ProbeAnomaly;
import com.linkedin.network.probewatch.detector.ProbeAnomalyType;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Summarizes the anomaly reports saved in the events directory: the number of events of each measurement and the
 * number of events per anomaly type along with the description of the type.
 */
public class AnomalyReportSummarizer {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyReportSummarizer.class);
  private static final String REPORT_FILE_GLOB = "*.json";
  private static final String NONE = "-";
  private final Path _eventsDir;

  /**
   * @param eventsDir The directory holding the anomaly reports.
   */
  public AnomalyReportSummarizer(Path eventsDir) {
    _eventsDir = eventsDir;
  }

  /**
   * Log and return the alerts of the saved reports. Unreadable reports are logged and skipped.
   *
   * @param measurementIdFilter If not {@code null}, only the report of this measurement is summarized.
   * @param showDetails {@code true} to include one line per event.
   * @return Alerts of the summarized reports, in directory listing order.
   */
  public List<MeasurementAlerts> summarize(String measurementIdFilter, boolean showDetails) {
    if (!Files.isDirectory(_eventsDir)) {
      LOG.warn("Events directory {} does not exist, no alerts to show.", _eventsDir);
      return Collections.emptyList();
    }
    List<MeasurementAlerts> alerts = new ArrayList<>();
    try (DirectoryStream<Path> reportFiles = Files.newDirectoryStream(_eventsDir, REPORT_FILE_GLOB)) {
      for (Path reportFile : reportFiles) {
        JsonObject report = readReport(reportFile);
        if (report == null) {
          continue;
        }
        String measurementId = asString(report.get(AnomalyReport.MEASUREMENT_ID));
        if (measurementIdFilter != null && !measurementIdFilter.equals(measurementId)) {
          continue;
        }
        MeasurementAlerts measurementAlerts = alertsOf(measurementId, events(report), showDetails);
        log(measurementAlerts);
        alerts.add(measurementAlerts);
      }
    } catch (IOException e) {
      LOG.error("Failed to list events directory {}.", _eventsDir, e);
    }
    if (alerts.isEmpty() && measurementIdFilter != null) {
      LOG.info("No report found for measurement {}.", measurementIdFilter);
    }
    return alerts;
  }

  static MeasurementAlerts alertsOf(String measurementId, List<JsonObject> events, boolean showDetails) {
    Map<String, Integer> countByAnomalyType = new LinkedHashMap<>();
    List<String> eventDetails = new ArrayList<>();
    for (JsonObject event : events) {
      countByAnomalyType.merge(asString(event.get(ProbeAnomaly.ANOMALY)), 1, Integer::sum);
      if (showDetails) {
        eventDetails.add(String.format("%s probe=%s target=%s metric=%s value=%s threshold=%s severity=%s",
                                       asString(event.get(ProbeAnomaly.ANOMALY)),
                                       asString(event.get(ProbeAnomaly.PROBE_ID)),
                                       asString(event.get(ProbeAnomaly.TARGET)),
                                       asString(event.get(ProbeAnomaly.METRIC)),
                                       asString(event.get(ProbeAnomaly.VALUE)),
                                       asString(event.get(ProbeAnomaly.THRESHOLD)),
                                       asString(event.get(ProbeAnomaly.SEVERITY))));
      }
    }
    return new MeasurementAlerts(measurementId, events.size(), countByAnomalyType, eventDetails);
  }

  /**
   * @param anomalyType Anomaly type as it appears in reports.
   * @return The description of the anomaly type, empty if the type is unknown.
   */
  static String descriptionOf(String anomalyType) {
    ProbeAnomalyType type = ProbeAnomalyType.fromWireName(anomalyType);
    return type == null ? "" : type.description();
  }

  private static void log(MeasurementAlerts alerts) {
    LOG.info("Measurement {}: {} anomalies detected.", alerts.measurementId(), alerts.totalEvents());
    alerts.countByAnomalyType().forEach((anomalyType, count) ->
        LOG.info("  {}: {} events - {}", anomalyType, count, descriptionOf(anomalyType)));
    alerts.eventDetails().forEach(line -> LOG.info("    {}", line));
  }

  private static JsonObject readReport(Path reportFile) {
    try (JsonReader reader = new JsonReader(new InputStreamReader(Files.newInputStream(reportFile), StandardCharsets.UTF_8))) {
      JsonElement root = JsonParser.parseReader(reader);
      if (root.isJsonObject()) {
        return root.getAsJsonObject();
      }
      LOG.warn("Skipping report {}: not a JSON object.", reportFile);
    } catch (IOException | JsonParseException e) {
      LOG.warn("Skipping unreadable report {}.", reportFile, e);
    }
    return null;
  }

  private static List<JsonObject> events(JsonObject report) {
    JsonElement events = report.get(AnomalyReport.EVENTS);
    if (events == null || !events.isJsonArray()) {
      return Collections.emptyList();
    }
    List<JsonObject> eventObjects = new ArrayList<>();
    for (JsonElement event : events.getAsJsonArray()) {
      if (event.isJsonObject()) {
        eventObjects.add(event.getAsJsonObject());
      }
    }
    return eventObjects;
  }

  private static String asString(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return NONE;
    }
    return element.isJsonPrimitive() ? element.getAsString() : element.toString();
  }
}
