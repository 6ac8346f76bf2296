/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;


/**
 * What the anomaly finders see of one analysis pass: the collected metrics, the factory stamping anomalies with the
 * detection time of the pass and the route history to record traceroute paths in.
 */
public class ProbeAnalysisContext {
  private final ProbeMetricSet _metrics;
  private final ProbeAnomalyFactory _anomalyFactory;
  private final RouteHistory _routeHistory;

  public ProbeAnalysisContext(ProbeMetricSet metrics, ProbeAnomalyFactory anomalyFactory, RouteHistory routeHistory) {
    _metrics = metrics;
    _anomalyFactory = anomalyFactory;
    _routeHistory = routeHistory;
  }

  public ProbeMetricSet metrics() {
    return _metrics;
  }

  public ProbeAnomalyFactory anomalyFactory() {
    return _anomalyFactory;
  }

  public RouteHistory routeHistory() {
    return _routeHistory;
  }
}
