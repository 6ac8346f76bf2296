/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.report;

import com.linkedin.network.probewatch.detector.ProbeAnomaly;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * The rollup of the anomalies of one measurement: the anomaly types seen per probe and the number of anomalies per
 * anomaly type.
 */
public final class AnomalySummary {
  public static final String PER_PROBE = "per_probe";
  public static final String ANOMALY_SUMMARY = "anomaly_summary";
  public static final String TOTAL_ANOMALIES = "total_anomalies";
  public static final String UNIQUE_PROBES_AFFECTED = "unique_probes_affected";
  public static final String TARGET = "target";
  public static final String ANOMALIES = "anomalies";

  private final Map<String, ProbeSummary> _perProbe;
  private final Map<String, Integer> _countByAnomalyType;
  private final int _totalAnomalies;

  private AnomalySummary(Map<String, ProbeSummary> perProbe, Map<String, Integer> countByAnomalyType, int totalAnomalies) {
    _perProbe = perProbe;
    _countByAnomalyType = countByAnomalyType;
    _totalAnomalies = totalAnomalies;
  }

  /**
   * Summarize the given anomalies. Probes and anomaly types appear in the order they are first seen.
   *
   * @param anomalies Anomalies of one measurement.
   * @return The summary.
   */
  public static AnomalySummary of(List<ProbeAnomaly> anomalies) {
    Map<String, ProbeSummary> perProbe = new LinkedHashMap<>();
    Map<String, Integer> countByAnomalyType = new LinkedHashMap<>();
    for (ProbeAnomaly anomaly : anomalies) {
      String anomalyType = anomaly.anomalyType().wireName();
      perProbe.computeIfAbsent(anomaly.probeId(), p -> new ProbeSummary(anomaly.target()))._anomalyTypes.add(anomalyType);
      countByAnomalyType.merge(anomalyType, 1, Integer::sum);
    }
    return new AnomalySummary(perProbe, countByAnomalyType, anomalies.size());
  }

  /**
   * @param probeId Probe id.
   * @return Anomaly types reported for the probe in report order, empty if none.
   */
  public List<String> anomalyTypesOf(String probeId) {
    ProbeSummary summary = _perProbe.get(probeId);
    return summary == null ? Collections.emptyList() : Collections.unmodifiableList(summary._anomalyTypes);
  }

  /**
   * @return Number of anomalies per anomaly type.
   */
  public Map<String, Integer> countByAnomalyType() {
    return Collections.unmodifiableMap(_countByAnomalyType);
  }

  public int totalAnomalies() {
    return _totalAnomalies;
  }

  public int uniqueProbesAffected() {
    return _perProbe.size();
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> perProbe = new LinkedHashMap<>();
    _perProbe.forEach((probeId, summary) -> {
      Map<String, Object> probeStructure = new LinkedHashMap<>();
      probeStructure.put(TARGET, summary._target);
      probeStructure.put(ANOMALIES, new ArrayList<>(summary._anomalyTypes));
      perProbe.put(probeId, probeStructure);
    });
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put(PER_PROBE, perProbe);
    structure.put(ANOMALY_SUMMARY, new LinkedHashMap<>(_countByAnomalyType));
    structure.put(TOTAL_ANOMALIES, _totalAnomalies);
    structure.put(UNIQUE_PROBES_AFFECTED, uniqueProbesAffected());
    return structure;
  }

  private static final class ProbeSummary {
    private final String _target;
    private final List<String> _anomalyTypes = new ArrayList<>();

    private ProbeSummary(String target) {
      _target = target;
    }
  }
}
