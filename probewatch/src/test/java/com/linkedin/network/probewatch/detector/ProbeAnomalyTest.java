/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.network.probewatch.model.MeasurementType;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.linkedin.network.probewatch.ProbeWatchTestUtils.NOW_MS;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.TARGET;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;


public class ProbeAnomalyTest {
  private final ProbeAnomalyFactory _factory = new ProbeAnomalyFactory(NOW_MS);

  /**
   * Quantified anomalies carry value, threshold and units between metric and severity.
   */
  @Test
  public void testQuantifiedJsonStructure() {
    Map<String, Object> structure = _factory.lossOutlier("p1", TARGET, 40.0).getJsonStructure();

    assertThat(List.copyOf(structure.keySet()), is(List.of(ProbeAnomaly.TIMESTAMP, ProbeAnomaly.ANOMALY,
                                                           ProbeAnomaly.PROBE_ID, ProbeAnomaly.TARGET,
                                                           ProbeAnomaly.METRIC, ProbeAnomaly.VALUE,
                                                           ProbeAnomaly.THRESHOLD, ProbeAnomaly.UNITS,
                                                           ProbeAnomaly.SEVERITY)));
    assertThat(structure.get(ProbeAnomaly.TIMESTAMP), is("2023-11-14T22:13:20.123Z"));
    assertThat(structure.get(ProbeAnomaly.ANOMALY), is("outlier_probe_loss"));
    assertThat(structure.containsKey(ProbeAnomaly.THRESHOLD), is(true));
    assertThat(structure.get(ProbeAnomaly.THRESHOLD), nullValue());
    assertThat(structure.get(ProbeAnomaly.UNITS), is("%"));
    assertThat(structure.get(ProbeAnomaly.SEVERITY), is("warning"));
  }

  /**
   * Route anomalies carry their paths instead of value, threshold and units.
   */
  @Test
  public void testRouteJsonStructure() {
    List<String> previous = Arrays.asList("a", "b");
    List<String> current = Arrays.asList("a", "c");
    Map<String, Object> structure = _factory.routeChange("p1", TARGET, previous, current).getJsonStructure();

    assertThat(List.copyOf(structure.keySet()), is(List.of(ProbeAnomaly.TIMESTAMP, ProbeAnomaly.ANOMALY,
                                                           ProbeAnomaly.PROBE_ID, ProbeAnomaly.TARGET,
                                                           ProbeAnomaly.METRIC, ProbeAnomaly.PREVIOUS_HOPS,
                                                           ProbeAnomaly.CURRENT_HOPS, ProbeAnomaly.SEVERITY)));
    assertThat(structure.get(ProbeAnomaly.METRIC), is(ProbeAnomalyFactory.TRACEROUTE_HOPS));

    Map<String, Object> flapping = _factory.pathFlapping("p1", TARGET, List.of(previous, current)).getJsonStructure();
    assertThat(flapping.get(ProbeAnomaly.ROUTES), is(List.of(previous, current)));
  }

  @Test
  public void testEquality() {
    assertThat(_factory.unreachableHost("p1", TARGET), is(_factory.unreachableHost("p1", TARGET)));
    assertThat(_factory.unreachableHost("p1", TARGET), not(_factory.unreachableHost("p2", TARGET)));
    assertThat(_factory.unreachableHost("p1", TARGET), not(new ProbeAnomalyFactory(NOW_MS + 1).unreachableHost("p1", TARGET)));
  }

  @Test
  public void testAnomalyTypes() {
    assertThat(ProbeAnomalyType.cachedValues().size(), is(9));
    for (ProbeAnomalyType type : ProbeAnomalyType.cachedValues()) {
      assertThat(ProbeAnomalyType.fromWireName(type.wireName()), is(type));
    }
    assertThat(ProbeAnomalyType.fromWireName("bogus"), nullValue());
    assertThat(ProbeAnomalyType.JITTER_SPIKE.latencyRelated(), is(true));
    assertThat(ProbeAnomalyType.PACKET_LOSS.latencyRelated(), is(false));
    assertThat(ProbeAnomalyType.UNREACHABLE_HOST.appliesTo(MeasurementType.TRACEROUTE), is(true));
    assertThat(ProbeAnomalyType.UNREACHABLE_HOST.appliesTo(MeasurementType.PING), is(true));
    assertThat(ProbeAnomalyType.ROUTE_CHANGE.appliesTo(MeasurementType.PING), is(false));
  }
}
