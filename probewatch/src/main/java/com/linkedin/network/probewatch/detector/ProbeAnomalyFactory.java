/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.probewatch.detector.AnomalySeverity;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.linkedin.probewatch.ProbeWatchUtils.utcDateFor;


/**
 * Creates the anomalies of one analysis pass. All anomalies created by one factory share its detection time.
 */
public class ProbeAnomalyFactory {
  public static final String PING_RTT_MS = "ping_rtt_ms";
  public static final String PING_LOSS_PCT = "ping_loss_pct";
  public static final String PING_JITTER_MS = "ping_jitter_ms";
  public static final String REACHABILITY = "reachability";
  public static final String TRACEROUTE_HOPS = "traceroute_hops";
  public static final String MS = "ms";
  public static final String PERCENT = "%";
  public static final String REACHABLE_FLAG = "reachable_flag";
  private static final int UNREACHABLE = 0;
  private static final int REACHABLE = 1;

  private final long _detectionTimeMs;
  private final String _timestamp;

  /**
   * @param detectionTimeMs The detection time of the analysis pass.
   */
  public ProbeAnomalyFactory(long detectionTimeMs) {
    _detectionTimeMs = detectionTimeMs;
    _timestamp = utcDateFor(detectionTimeMs, 3, ChronoUnit.MILLIS);
  }

  public long detectionTimeMs() {
    return _detectionTimeMs;
  }

  public String timestamp() {
    return _timestamp;
  }

  public ProbeAnomaly latencyOutlier(String probeId, String target, double latencyMs) {
    return quantified(ProbeAnomalyType.OUTLIER_PROBE_LATENCY, AnomalySeverity.WARNING, probeId, target, PING_RTT_MS,
                      latencyMs, null, MS);
  }

  public ProbeAnomaly lossOutlier(String probeId, String target, double lossPct) {
    return quantified(ProbeAnomalyType.OUTLIER_PROBE_LOSS, AnomalySeverity.WARNING, probeId, target, PING_LOSS_PCT,
                      lossPct, null, PERCENT);
  }

  public ProbeAnomaly latencySpike(String probeId, String target, double latencyMs, double thresholdMs) {
    return quantified(ProbeAnomalyType.LATENCY_SPIKE, AnomalySeverity.WARNING, probeId, target, PING_RTT_MS,
                      latencyMs, thresholdMs, MS);
  }

  public ProbeAnomaly packetLoss(String probeId, String target, double lossPct, double thresholdPct) {
    return quantified(ProbeAnomalyType.PACKET_LOSS, AnomalySeverity.WARNING, probeId, target, PING_LOSS_PCT,
                      lossPct, thresholdPct, PERCENT);
  }

  public ProbeAnomaly jitterSpike(String probeId, String target, double jitterMs, double thresholdMs) {
    return quantified(ProbeAnomalyType.JITTER_SPIKE, AnomalySeverity.WARNING, probeId, target, PING_JITTER_MS,
                      jitterMs, thresholdMs, MS);
  }

  /**
   * @param probeId The farther probe reporting the lower latency.
   * @param target Target of the probe.
   * @param latencyMs Latency of the probe.
   * @param peerLatencyMs Latency of the nearer peer.
   * @return A geo anomaly attributed to the given probe, with the peer latency as threshold.
   */
  public ProbeAnomaly geoAnomaly(String probeId, String target, double latencyMs, double peerLatencyMs) {
    return quantified(ProbeAnomalyType.GEO_ANOMALY, AnomalySeverity.WARNING, probeId, target, PING_RTT_MS,
                      latencyMs, peerLatencyMs, MS);
  }

  /**
   * An unreachable target is reported the same way whether it was detected from ping or traceroute.
   *
   * @param probeId Probe id.
   * @param target Target of the probe.
   * @return A critical unreachable host anomaly.
   */
  public ProbeAnomaly unreachableHost(String probeId, String target) {
    return quantified(ProbeAnomalyType.UNREACHABLE_HOST, AnomalySeverity.CRITICAL, probeId, target, REACHABILITY,
                      UNREACHABLE, REACHABLE, REACHABLE_FLAG);
  }

  public ProbeAnomaly routeChange(String probeId, String target, List<String> previousHops, List<String> currentHops) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put(ProbeAnomaly.PREVIOUS_HOPS, copyOf(previousHops));
    details.put(ProbeAnomaly.CURRENT_HOPS, copyOf(currentHops));
    return route(ProbeAnomalyType.ROUTE_CHANGE, probeId, target, details);
  }

  public ProbeAnomaly pathFlapping(String probeId, String target, List<List<String>> routes) {
    List<List<String>> routesCopy = new ArrayList<>(routes.size());
    routes.forEach(route -> routesCopy.add(copyOf(route)));
    return route(ProbeAnomalyType.PATH_FLAPPING, probeId, target,
                 Collections.singletonMap(ProbeAnomaly.ROUTES, Collections.unmodifiableList(routesCopy)));
  }

  private ProbeAnomaly quantified(ProbeAnomalyType type, AnomalySeverity severity, String probeId, String target,
                                  String metric, Number value, Number threshold, String units) {
    return new ProbeAnomaly(type, severity, _detectionTimeMs, _timestamp, probeId, target, metric, true, value, threshold,
                            units, Collections.emptyMap());
  }

  private ProbeAnomaly route(ProbeAnomalyType type, String probeId, String target, Map<String, Object> details) {
    return new ProbeAnomaly(type, AnomalySeverity.WARNING, _detectionTimeMs, _timestamp, probeId, target, TRACEROUTE_HOPS,
                            false, null, null, null, details);
  }

  private static List<String> copyOf(List<String> hops) {
    return Collections.unmodifiableList(new ArrayList<>(hops));
  }
}
