/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata.namespace;

import com.linkedin.network.probewatch.persisteddata.file.FilePersistedMap;
import com.linkedin.network.probewatch.persisteddata.file.FilePersistedMapException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.easymock.EasyMock;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class BaselinePersistedDataTest {

    private static final String PROBE = "p1";
    private static final String TARGET = "8.8.8.8";

    @Rule
    public TemporaryFolder _folder = new TemporaryFolder();

    private Map<String, String> _backingMap;
    private BaselinePersistedData _baselines;

    /**
     * Set a common starting point.
     */
    @Before
    public void beforeTest() {
        this._backingMap = new HashMap<>();
        this._baselines = new BaselinePersistedData(this._backingMap);
    }

    /**
     * Ensure the latency baseline returns the previous value and stores the current one.
     */
    @Test
    public void getAndUpdateLatencyReturnsPreviousValue() {
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 10.0), is(nullValue()));
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 20.0), is(10.0));
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 30.0), is(20.0));
        assertThat(this._backingMap.get("ping_p1_8.8.8.8"), is("{\"avg_rtt\":30.0}"));
    }

    /**
     * Ensure a missing current latency leaves the stored baseline untouched.
     */
    @Test
    public void nullLatencyKeepsBaseline() {
        this._baselines.getAndUpdateLatency(PROBE, TARGET, 10.0);
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, null), is(10.0));
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 15.0), is(10.0));
    }

    /**
     * Ensure hop baselines are always replaced, an empty path included.
     */
    @Test
    public void getAndUpdateHopsAlwaysStores() {
        assertThat(this._baselines.getAndUpdateHops(PROBE, TARGET, List.of("10.0.0.1", TARGET)), is(nullValue()));
        assertThat(this._baselines.getAndUpdateHops(PROBE, TARGET, Collections.emptyList()),
                is(List.of("10.0.0.1", TARGET)));
        assertThat(this._backingMap.get("traceroute_p1_8.8.8.8"), is("{\"hop_ips\":[]}"));
        assertThat(this._baselines.getAndUpdateHops(PROBE, TARGET, List.of(TARGET)),
                is(Collections.<String>emptyList()));
    }

    /**
     * Ensure latency and hop baselines of the same probe and target do not collide.
     */
    @Test
    public void latencyAndHopBaselinesAreSeparate() {
        this._baselines.getAndUpdateLatency(PROBE, TARGET, 10.0);
        this._baselines.getAndUpdateHops(PROBE, TARGET, List.of(TARGET));
        assertThat(this._backingMap.size(), is(2));
        assertThat(this._baselines.getAndUpdateLatency("p2", TARGET, 10.0), is(nullValue()));
    }

    /**
     * Ensure unreadable stored baselines are treated as absent and replaced.
     */
    @Test
    public void corruptBaselineIsTreatedAsAbsent() {
        this._backingMap.put("ping_p1_8.8.8.8", "{not json");
        this._backingMap.put("traceroute_p1_8.8.8.8", "{\"hop_ips\": 5}");
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 10.0), is(nullValue()));
        assertThat(this._baselines.getAndUpdateHops(PROBE, TARGET, List.of(TARGET)), is(nullValue()));
        assertThat(this._baselines.getAndUpdateLatency(PROBE, TARGET, 11.0), is(10.0));
    }

    /**
     * Ensure the file store holds one file per baseline, named after namespace, probe and target.
     */
    @Test
    public void fileBaselinesAreNamedAfterProbeAndTarget() throws IOException {
        Path directory = this._folder.getRoot().toPath();
        BaselinePersistedData baselines = new BaselinePersistedData(new FilePersistedMap(directory));
        baselines.getAndUpdateLatency(PROBE, TARGET, 42.5);
        baselines.getAndUpdateHops(PROBE, TARGET, List.of("10.0.0.1"));

        assertThat(Files.readString(directory.resolve("ping_p1_8.8.8.8.json"), StandardCharsets.UTF_8),
                is("{\"avg_rtt\":42.5}"));
        assertThat(Files.readString(directory.resolve("traceroute_p1_8.8.8.8.json"), StandardCharsets.UTF_8),
                is("{\"hop_ips\":[\"10.0.0.1\"]}"));
        assertThat(new BaselinePersistedData(new FilePersistedMap(directory))
                .getAndUpdateLatency(PROBE, TARGET, 1.0), is(42.5));
    }

    /**
     * Ensure store failures do not fail the analysis: the baseline is treated as absent.
     */
    @Test
    public void storeFailureIsTreatedAsAbsent() {
        @SuppressWarnings("unchecked")
        Map<String, String> failing = EasyMock.createMock(Map.class);
        EasyMock.expect(failing.get("ping_p1_8.8.8.8")).andThrow(new FilePersistedMapException("read failed"));
        EasyMock.expect(failing.put("ping_p1_8.8.8.8", "{\"avg_rtt\":10.0}"))
                .andThrow(new FilePersistedMapException("write failed"));
        EasyMock.replay(failing);

        assertThat(new BaselinePersistedData(failing).getAndUpdateLatency(PROBE, TARGET, 10.0), is(nullValue()));
        EasyMock.verify(failing);
    }
}
