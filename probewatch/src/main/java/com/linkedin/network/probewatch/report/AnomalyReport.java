/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.network.probewatch.detector.ProbeAnomaly;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


/**
 * The anomalies detected in one measurement together with their summary. One report is persisted per measurement and
 * replaced when the measurement is analyzed again.
 */
public class AnomalyReport {
  public static final String MEASUREMENT_ID = "measurement_id";
  public static final String ANALYSIS_TIMESTAMP = "analysis_timestamp";
  public static final String EVENTS = "events";
  public static final String ANALYSIS = "analysis";
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  private final String _measurementId;
  private final String _analysisTimestamp;
  private final List<ProbeAnomaly> _anomalies;
  private final AnomalySummary _summary;

  /**
   * @param measurementId Measurement id.
   * @param analysisTimestamp Time of the analysis in ISO 8601 format.
   * @param anomalies Anomalies in detection order.
   */
  public AnomalyReport(String measurementId, String analysisTimestamp, List<ProbeAnomaly> anomalies) {
    _measurementId = measurementId;
    _analysisTimestamp = analysisTimestamp;
    _anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
    _summary = AnomalySummary.of(_anomalies);
  }

  public String measurementId() {
    return _measurementId;
  }

  public String analysisTimestamp() {
    return _analysisTimestamp;
  }

  public List<ProbeAnomaly> anomalies() {
    return _anomalies;
  }

  public AnomalySummary summary() {
    return _summary;
  }

  public boolean hasAnomalies() {
    return !_anomalies.isEmpty();
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put(MEASUREMENT_ID, _measurementId);
    structure.put(ANALYSIS_TIMESTAMP, _analysisTimestamp);
    structure.put(EVENTS, _anomalies.stream().map(ProbeAnomaly::getJsonStructure).collect(Collectors.toList()));
    structure.put(ANALYSIS, _summary.getJsonStructure());
    return structure;
  }

  /**
   * @return The pretty printed JSON representation of the report. {@code null} values are kept.
   */
  public String toJson() {
    return GSON.toJson(getJsonStructure());
  }
}
