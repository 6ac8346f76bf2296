/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * The traceroute paths observed for each (probe, target) pair, in observation order. Paths are only appended, the
 * history of a pair is never trimmed. It lives in memory as long as its owner keeps it.
 * <p>
 * This class is not thread-safe.
 */
public class RouteHistory {
  private static final String KEY_SEPARATOR = "_";
  private final Map<String, List<List<String>>> _routesByProbeAndTarget;

  public RouteHistory() {
    _routesByProbeAndTarget = new HashMap<>();
  }

  /**
   * Append the given path to the history of the given probe and target.
   *
   * @param probeId Probe id.
   * @param target Target address.
   * @param hopIps Observed hop IPs.
   * @return The number of paths in the history of the pair, including the appended one.
   */
  public int record(String probeId, String target, List<String> hopIps) {
    List<List<String>> routes = _routesByProbeAndTarget.computeIfAbsent(key(probeId, target), k -> new ArrayList<>());
    routes.add(Collections.unmodifiableList(new ArrayList<>(hopIps)));
    return routes.size();
  }

  /**
   * @param probeId Probe id.
   * @param target Target address.
   * @param window Maximum number of paths to return.
   * @return The most recent paths of the pair, at most {@code window} of them, oldest first.
   */
  public List<List<String>> recentRoutes(String probeId, String target, int window) {
    List<List<String>> routes = _routesByProbeAndTarget.getOrDefault(key(probeId, target), Collections.emptyList());
    return Collections.unmodifiableList(new ArrayList<>(routes.subList(Math.max(0, routes.size() - window), routes.size())));
  }

  /**
   * @param probeId Probe id.
   * @param target Target address.
   * @return The number of paths recorded for the pair.
   */
  public int size(String probeId, String target) {
    List<List<String>> routes = _routesByProbeAndTarget.get(key(probeId, target));
    return routes == null ? 0 : routes.size();
  }

  /**
   * Forget all recorded paths.
   */
  public void clear() {
    _routesByProbeAndTarget.clear();
  }

  private static String key(String probeId, String target) {
    return probeId + KEY_SEPARATOR + target;
  }
}
