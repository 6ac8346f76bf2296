/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.network.probewatch.persisteddata.namespace.BaselinePersistedData;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.network.probewatch.ProbeWatchTestUtils.TARGET;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.ofType;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.result;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.traceroute;
import static com.linkedin.network.probewatch.detector.DetectorTestUtils.context;
import static com.linkedin.network.probewatch.detector.DetectorTestUtils.memoryBaselines;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;


public class RoutingAnomalyFinderTest {
  private static final String A = "10.0.0.1";
  private static final String B = "10.0.0.2";
  private static final String C = "10.0.0.3";
  private static final String D = "10.0.0.4";

  private final RoutingAnomalyFinder _finder = new RoutingAnomalyFinder(3);
  private BaselinePersistedData _baselines;
  private RouteHistory _routeHistory;

  @Before
  public void setUp() {
    _baselines = memoryBaselines();
    _routeHistory = new RouteHistory();
  }

  private List<ProbeAnomaly> analyze(String... hops) {
    return new ArrayList<>(_finder.anomalies(context(result("1", traceroute("p1", hops)), _baselines, _routeHistory)));
  }

  /**
   * The first observed path has no baseline to compare against.
   */
  @Test
  public void testFirstPathIsNoRouteChange() {
    List<ProbeAnomaly> anomalies = analyze(A, B, TARGET);
    assertThat(anomalies.isEmpty(), is(true));
    assertThat(_routeHistory.size("p1", TARGET), is(1));
  }

  @Test
  public void testRouteChange() {
    analyze(A, B, TARGET);
    List<ProbeAnomaly> changes = ofType(analyze(A, C, TARGET), ProbeAnomalyType.ROUTE_CHANGE);

    assertThat(changes.size(), is(1));
    ProbeAnomaly change = changes.get(0);
    assertThat(change.isQuantified(), is(false));
    assertThat(change.metric(), is(ProbeAnomalyFactory.TRACEROUTE_HOPS));
    assertThat(change.details().get(ProbeAnomaly.PREVIOUS_HOPS), is((Object) Arrays.asList(A, B, TARGET)));
    assertThat(change.details().get(ProbeAnomaly.CURRENT_HOPS), is((Object) Arrays.asList(A, C, TARGET)));
  }

  /**
   * Paths [A,B,C], [A,B,D], [A,B,C] with window 3 flap on the third observation.
   */
  @Test
  public void testPathFlappingOnThirdObservation() {
    assertThat(ofType(analyze(A, B, C), ProbeAnomalyType.PATH_FLAPPING).isEmpty(), is(true));
    assertThat(ofType(analyze(A, B, D), ProbeAnomalyType.PATH_FLAPPING).isEmpty(), is(true));
    List<ProbeAnomaly> flapping = ofType(analyze(A, B, C), ProbeAnomalyType.PATH_FLAPPING);

    assertThat(flapping.size(), is(1));
    assertThat(flapping.get(0).details().get(ProbeAnomaly.ROUTES),
               is((Object) Arrays.asList(Arrays.asList(A, B, C), Arrays.asList(A, B, D), Arrays.asList(A, B, C))));
  }

  /**
   * Identical paths in the whole window do not flap.
   */
  @Test
  public void testStablePathDoesNotFlap() {
    for (int i = 0; i < 5; i++) {
      assertThat(ofType(analyze(A, B, TARGET), ProbeAnomalyType.PATH_FLAPPING).isEmpty(), is(true));
    }
    // an older different path drops out of the window
    setUp();
    analyze(A, C, TARGET);
    analyze(A, B, TARGET);
    analyze(A, B, TARGET);
    List<ProbeAnomaly> anomalies = analyze(A, B, TARGET);
    assertThat(ofType(anomalies, ProbeAnomalyType.PATH_FLAPPING).isEmpty(), is(true));
  }

  /**
   * A path whose last hop is not the target means the target was not reached.
   */
  @Test
  public void testTracerouteUnreachable() {
    List<ProbeAnomaly> unreachable = ofType(analyze(A, B), ProbeAnomalyType.UNREACHABLE_HOST);
    assertThat(unreachable.size(), is(1));
    assertThat(unreachable.get(0).target(), is(TARGET));

    assertThat(ofType(analyze(A, TARGET), ProbeAnomalyType.UNREACHABLE_HOST).isEmpty(), is(true));
    // no hops at all is not evidence of unreachability
    assertThat(ofType(analyze(), ProbeAnomalyType.UNREACHABLE_HOST).isEmpty(), is(true));
  }

  /**
   * An empty path neither triggers nor is compared in a route change, but it still replaces the hop baseline.
   */
  @Test
  public void testEmptyPathNoRouteChange() {
    analyze(A, B, TARGET);
    assertThat(ofType(analyze(), ProbeAnomalyType.ROUTE_CHANGE).isEmpty(), is(true));
    assertThat(ofType(analyze(A, C, TARGET), ProbeAnomalyType.ROUTE_CHANGE).isEmpty(), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidWindow() {
    new RoutingAnomalyFinder(0);
  }

  /**
   * Several traceroutes of one probe in one measurement are each compared with the path before them and each recorded
   * in the route history.
   */
  @Test
  public void testRepeatedTraceroutesInOneMeasurement() {
    List<ProbeAnomaly> anomalies = new ArrayList<>(_finder.anomalies(context(result("1",
        traceroute("p1", A, B, C), traceroute("p1", A, B, D), traceroute("p1", A, B, C)), _baselines, _routeHistory)));

    List<ProbeAnomaly> changes = ofType(anomalies, ProbeAnomalyType.ROUTE_CHANGE);
    assertThat(changes.size(), is(2));
    assertThat(changes.get(0).details().get(ProbeAnomaly.PREVIOUS_HOPS), is((Object) Arrays.asList(A, B, C)));
    assertThat(changes.get(0).details().get(ProbeAnomaly.CURRENT_HOPS), is((Object) Arrays.asList(A, B, D)));
    assertThat(changes.get(1).details().get(ProbeAnomaly.PREVIOUS_HOPS), is((Object) Arrays.asList(A, B, D)));
    assertThat(changes.get(1).details().get(ProbeAnomaly.CURRENT_HOPS), is((Object) Arrays.asList(A, B, C)));
    assertThat(_routeHistory.size("p1", TARGET), is(3));

    List<ProbeAnomaly> flapping = ofType(anomalies, ProbeAnomalyType.PATH_FLAPPING);
    assertThat(flapping.size(), is(1));
    assertThat(flapping.get(0).details().get(ProbeAnomaly.ROUTES),
               is((Object) Arrays.asList(Arrays.asList(A, B, C), Arrays.asList(A, B, D), Arrays.asList(A, B, C))));
    // none of the paths ends at the target
    assertThat(ofType(anomalies, ProbeAnomalyType.UNREACHABLE_HOST).size(), is(3));
  }
}
