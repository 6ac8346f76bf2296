/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.detector;

import com.linkedin.network.probewatch.persisteddata.namespace.BaselinePersistedData;
import com.linkedin.probewatch.detector.AnomalySeverity;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

import static com.linkedin.network.probewatch.ProbeWatchTestUtils.TARGET;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.ofType;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.ping;
import static com.linkedin.network.probewatch.ProbeWatchTestUtils.result;
import static com.linkedin.network.probewatch.detector.DetectorTestUtils.context;
import static com.linkedin.network.probewatch.detector.DetectorTestUtils.memoryBaselines;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;


public class ThresholdAnomalyFinderTest {
  private final ThresholdAnomalyFinder _finder = new ThresholdAnomalyFinder(250.0, 2.0, 10.0, 15.0);

  private List<ProbeAnomaly> anomalies(ProbeAnalysisContext context) {
    return new ArrayList<>(_finder.anomalies(context));
  }

  /**
   * Total packet loss yields exactly one critical unreachable host regardless of the latency.
   */
  @Test
  public void testTotalLossIsUnreachable() {
    List<ProbeAnomaly> anomalies = anomalies(context(result("1", ping("a", null, 100.0))));
    List<ProbeAnomaly> unreachable = ofType(anomalies, ProbeAnomalyType.UNREACHABLE_HOST);
    assertThat(unreachable.size(), is(1));
    ProbeAnomaly anomaly = unreachable.get(0);
    assertThat(anomaly.severity(), is(AnomalySeverity.CRITICAL));
    assertThat(anomaly.metric(), is(ProbeAnomalyFactory.REACHABILITY));
    assertThat(anomaly.value().intValue(), is(0));
    assertThat(anomaly.threshold().intValue(), is(1));
    assertThat(anomaly.units(), is(ProbeAnomalyFactory.REACHABLE_FLAG));
    assertThat(anomaly.target(), is(TARGET));
    // 100% is also above the packet loss threshold
    assertThat(ofType(anomalies, ProbeAnomalyType.PACKET_LOSS).size(), is(1));

    List<ProbeAnomaly> withLatency = anomalies(context(result("1", ping("a", 20.0, 100.0))));
    assertThat(ofType(withLatency, ProbeAnomalyType.UNREACHABLE_HOST).size(), is(1));
  }

  /**
   * Unreachable requires exactly 100% loss.
   */
  @Test
  public void testAlmostTotalLossIsNotUnreachable() {
    List<ProbeAnomaly> anomalies = anomalies(context(result("1", ping("a", 20.0, 99.9))));
    assertThat(ofType(anomalies, ProbeAnomalyType.UNREACHABLE_HOST).isEmpty(), is(true));
    assertThat(ofType(anomalies, ProbeAnomalyType.PACKET_LOSS).size(), is(1));
  }

  /**
   * A latency above both the static threshold and twice the baseline yields two latency spikes.
   */
  @Test
  public void testStaticAndAdaptiveSpikesBothReported() {
    BaselinePersistedData baselines = memoryBaselines();
    baselines.getAndUpdateLatency("a", TARGET, 100.0);

    List<ProbeAnomaly> spikes = ofType(anomalies(context(result("1", ping("a", 300.0, 0.0)), baselines,
                                                         new RouteHistory())), ProbeAnomalyType.LATENCY_SPIKE);
    assertThat(spikes.size(), is(2));
    assertThat(spikes.get(0).threshold().doubleValue(), is(250.0));
    assertThat(spikes.get(1).threshold().doubleValue(), is(200.0));
    assertThat(spikes.get(1).value().doubleValue(), is(300.0));
  }

  /**
   * The adaptive spike fires iff the latency is strictly above baseline times multiplier.
   */
  @Test
  public void testAdaptiveSpikeIsStrict() {
    BaselinePersistedData baselines = memoryBaselines();
    baselines.getAndUpdateLatency("a", TARGET, 50.0);
    List<ProbeAnomaly> atThreshold = anomalies(context(result("1", ping("a", 100.0, 0.0)), baselines, new RouteHistory()));
    assertThat(ofType(atThreshold, ProbeAnomalyType.LATENCY_SPIKE).isEmpty(), is(true));

    // the baseline is now 100
    List<ProbeAnomaly> above = anomalies(context(result("1", ping("a", 200.5, 0.0)), baselines, new RouteHistory()));
    List<ProbeAnomaly> spikes = ofType(above, ProbeAnomalyType.LATENCY_SPIKE);
    assertThat(spikes.size(), is(1));
    assertThat(spikes.get(0).threshold().doubleValue(), is(200.0));
  }

  /**
   * No baseline means no adaptive spike, and the static threshold is strict too.
   */
  @Test
  public void testNoBaselineNoAdaptiveSpike() {
    assertThat(anomalies(context(result("1", ping("a", 250.0, 0.0)))).isEmpty(), is(true));
  }

  @Test
  public void testJitterSpike() {
    List<ProbeAnomaly> anomalies = anomalies(context(result("1", ping("a", 30.0, 0.0, null, 10.0, 30.0, 50.0))));
    List<ProbeAnomaly> jitter = ofType(anomalies, ProbeAnomalyType.JITTER_SPIKE);
    assertThat(jitter.size(), is(1));
    assertThat(jitter.get(0).value().doubleValue(), is(20.0));
    assertThat(jitter.get(0).threshold().doubleValue(), is(15.0));
    assertThat(jitter.get(0).metric(), is(ProbeAnomalyFactory.PING_JITTER_MS));

    assertThat(anomalies(context(result("1", ping("a", 30.0, 0.0, null, 30.0)))).isEmpty(), is(true));
  }

  /**
   * Every ping record of a probe is checked against the latency baseline the record before it left behind.
   */
  @Test
  public void testRepeatedPingsInOneMeasurement() {
    List<ProbeAnomaly> anomalies = anomalies(context(result("1", ping("q", 300.0, 0.0), ping("q", 20.0, 100.0),
                                                             ping("q", 90.0, 0.0))));

    List<ProbeAnomaly> spikes = ofType(anomalies, ProbeAnomalyType.LATENCY_SPIKE);
    // 300 above the static threshold, then 90 above twice the baseline of 20
    assertThat(spikes.size(), is(2));
    assertThat(spikes.get(0).value().doubleValue(), is(300.0));
    assertThat(spikes.get(1).value().doubleValue(), is(90.0));
    assertThat(spikes.get(1).threshold().doubleValue(), is(40.0));
    assertThat(ofType(anomalies, ProbeAnomalyType.PACKET_LOSS).size(), is(1));
    assertThat(ofType(anomalies, ProbeAnomalyType.UNREACHABLE_HOST).size(), is(1));
  }

  /**
   * Jitter is checked once per probe, on its last ping record.
   */
  @Test
  public void testJitterUsesLastPingOfProbe() {
    List<ProbeAnomaly> anomalies = anomalies(context(result("1", ping("q", 30.0, 0.0, null, 10.0, 30.0, 50.0),
                                                             ping("q", 30.0, 0.0, null, 30.0, 31.0))));
    assertThat(ofType(anomalies, ProbeAnomalyType.JITTER_SPIKE).isEmpty(), is(true));

    anomalies = anomalies(context(result("1", ping("q", 30.0, 0.0, null, 30.0, 31.0),
                                          ping("q", 30.0, 0.0, null, 10.0, 30.0, 50.0))));
    assertThat(ofType(anomalies, ProbeAnomalyType.JITTER_SPIKE).size(), is(1));
  }
}
