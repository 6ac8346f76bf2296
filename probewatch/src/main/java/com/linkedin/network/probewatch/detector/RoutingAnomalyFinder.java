/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.AnomalyFinder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Inspects the path of every traceroute record, in record order.
 * <ul>
 *   <li>Route change: the path differs from the hop baseline. Both paths must be non-empty, the comparison is order
 *   and length sensitive.</li>
 *   <li>Path flapping: every path is recorded in the route history. Once the history of the probe and target holds at
 *   least {@code flappingWindow} paths, the most recent {@code flappingWindow} paths are inspected and more than one
 *   distinct path among them is reported.</li>
 *   <li>Unreachable host: the last hop is not exactly the target address.</li>
 * </ul>
 */
public class RoutingAnomalyFinder implements AnomalyFinder<ProbeAnalysisContext, ProbeAnomaly> {
  private static final Logger LOG = LoggerFactory.getLogger(RoutingAnomalyFinder.class);
  private final int _flappingWindow;

  /**
   * @param flappingWindow Number of recent paths inspected for path flapping, at least 1.
   */
  public RoutingAnomalyFinder(int flappingWindow) {
    if (flappingWindow < 1) {
      throw new IllegalArgumentException("Path flapping window must be at least 1, but was " + flappingWindow);
    }
    _flappingWindow = flappingWindow;
  }

  @Override
  public Collection<ProbeAnomaly> anomalies(ProbeAnalysisContext context) {
    ProbeAnomalyFactory factory = context.anomalyFactory();
    RouteHistory routeHistory = context.routeHistory();
    List<ProbeAnomaly> anomalies = new ArrayList<>();
    for (ProbeMetrics observation : context.metrics().tracerouteObservations()) {
      String probeId = observation.probeId();
      String target = observation.target();
      List<String> hopIps = observation.hopIps();

      List<String> previousHops = observation.hopBaseline();
      if (previousHops != null && !previousHops.isEmpty() && !hopIps.isEmpty() && !previousHops.equals(hopIps)) {
        anomalies.add(factory.routeChange(probeId, target, previousHops, hopIps));
      }

      int historySize = routeHistory.record(probeId, target, hopIps);
      if (historySize >= _flappingWindow) {
        List<List<String>> recentRoutes = routeHistory.recentRoutes(probeId, target, _flappingWindow);
        if (new HashSet<>(recentRoutes).size() > 1) {
          LOG.debug("Probe {} took {} distinct routes to {} in the last {} traceroutes.", probeId,
                    new HashSet<>(recentRoutes).size(), target, _flappingWindow);
          anomalies.add(factory.pathFlapping(probeId, target, recentRoutes));
        }
      }

      if (!hopIps.isEmpty() && !hopIps.get(hopIps.size() - 1).equals(target)) {
        anomalies.add(factory.unreachableHost(probeId, target));
      }
    }
    return anomalies;
  }
}
