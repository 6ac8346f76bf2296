/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.report;

import java.util.Collections;
import java.util.List;
import java.util.Map;


/**
 * The alerts of one persisted anomaly report.
 */
public class MeasurementAlerts {
  private final String _measurementId;
  private final Map<String, Integer> _countByAnomalyType;
  private final List<String> _eventDetails;
  private final int _totalEvents;

  /**
   * @param measurementId Measurement id.
   * @param totalEvents Number of events in the report.
   * @param countByAnomalyType Number of events per anomaly type, in the order the types first appear.
   * @param eventDetails One line per event, empty unless details were requested.
   */
  public MeasurementAlerts(String measurementId, int totalEvents, Map<String, Integer> countByAnomalyType,
                           List<String> eventDetails) {
    _measurementId = measurementId;
    _totalEvents = totalEvents;
    _countByAnomalyType = Collections.unmodifiableMap(countByAnomalyType);
    _eventDetails = Collections.unmodifiableList(eventDetails);
  }

  public String measurementId() {
    return _measurementId;
  }

  public int totalEvents() {
    return _totalEvents;
  }

  public Map<String, Integer> countByAnomalyType() {
    return _countByAnomalyType;
  }

  public List<String> eventDetails() {
    return _eventDetails;
  }
}
