/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.Anomaly;
import com.linkedin.probewatch.detector.AnomalySeverity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;


/**
 * An anomaly detected for one probe and target in one analysis pass. Instances are immutable and created through
 * {@link ProbeAnomalyFactory}.
 * <p>
 * Quantified anomalies carry the observed value, the threshold it was compared against and its units. Route anomalies
 * are not quantified and carry their hop lists as details instead.
 */
public class ProbeAnomaly implements Anomaly {
  public static final String TIMESTAMP = "timestamp";
  public static final String ANOMALY = "anomaly";
  public static final String PROBE_ID = "probe_id";
  public static final String TARGET = "target";
  public static final String METRIC = "metric";
  public static final String VALUE = "value";
  public static final String THRESHOLD = "threshold";
  public static final String UNITS = "units";
  public static final String SEVERITY = "severity";
  public static final String PREVIOUS_HOPS = "previous_hops";
  public static final String CURRENT_HOPS = "current_hops";
  public static final String ROUTES = "routes";

  private final ProbeAnomalyType _anomalyType;
  private final AnomalySeverity _severity;
  private final long _detectionTimeMs;
  private final String _timestamp;
  private final String _probeId;
  private final String _target;
  private final String _metric;
  private final boolean _quantified;
  private final Number _value;
  private final Number _threshold;
  private final String _units;
  private final Map<String, Object> _details;

  ProbeAnomaly(ProbeAnomalyType anomalyType,
               AnomalySeverity severity,
               long detectionTimeMs,
               String timestamp,
               String probeId,
               String target,
               String metric,
               boolean quantified,
               Number value,
               Number threshold,
               String units,
               Map<String, Object> details) {
    _anomalyType = anomalyType;
    _severity = severity;
    _detectionTimeMs = detectionTimeMs;
    _timestamp = timestamp;
    _probeId = probeId;
    _target = target;
    _metric = metric;
    _quantified = quantified;
    _value = value;
    _threshold = threshold;
    _units = units;
    _details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  @Override
  public ProbeAnomalyType anomalyType() {
    return _anomalyType;
  }

  @Override
  public AnomalySeverity severity() {
    return _severity;
  }

  @Override
  public long detectionTimeMs() {
    return _detectionTimeMs;
  }

  /**
   * @return Detection time in ISO 8601 format with millisecond precision, shared by all anomalies of one pass.
   */
  public String timestamp() {
    return _timestamp;
  }

  public String probeId() {
    return _probeId;
  }

  public String target() {
    return _target;
  }

  public String metric() {
    return _metric;
  }

  /**
   * @return {@code true} if the anomaly carries a value, threshold and units.
   */
  public boolean isQuantified() {
    return _quantified;
  }

  public Number value() {
    return _value;
  }

  /**
   * @return The threshold the value was compared against, {@code null} for outliers and route anomalies.
   */
  public Number threshold() {
    return _threshold;
  }

  public String units() {
    return _units;
  }

  /**
   * @return Anomaly type specific details, e.g. the hop lists of a route change.
   */
  public Map<String, Object> details() {
    return _details;
  }

  @Override
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> structure = new LinkedHashMap<>();
    structure.put(TIMESTAMP, _timestamp);
    structure.put(ANOMALY, _anomalyType.wireName());
    structure.put(PROBE_ID, _probeId);
    structure.put(TARGET, _target);
    structure.put(METRIC, _metric);
    if (_quantified) {
      structure.put(VALUE, _value);
      structure.put(THRESHOLD, _threshold);
      structure.put(UNITS, _units);
    }
    structure.putAll(_details);
    structure.put(SEVERITY, _severity.wireName());
    return structure;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ProbeAnomaly that = (ProbeAnomaly) o;
    return _detectionTimeMs == that._detectionTimeMs && _quantified == that._quantified && _anomalyType == that._anomalyType
           && _severity == that._severity && Objects.equals(_probeId, that._probeId) && Objects.equals(_target, that._target)
           && Objects.equals(_metric, that._metric) && Objects.equals(_value, that._value)
           && Objects.equals(_threshold, that._threshold) && Objects.equals(_details, that._details);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_anomalyType, _severity, _detectionTimeMs, _probeId, _target, _metric, _value, _threshold);
  }

  @Override
  public String toString() {
    return String.format("{%s(%s) probe=%s, target=%s, metric=%s, value=%s, threshold=%s}", _anomalyType.wireName(),
                         _severity.wireName(), _probeId, _target, _metric, _value, _threshold);
  }
}
