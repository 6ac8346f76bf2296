/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import com.linkedin.network.probewatch.config.ProbeWatchConfig;
import com.linkedin.network.probewatch.config.constants.PathConfig;
import com.linkedin.network.probewatch.config.constants.PersistedDataConfig;
import com.linkedin.network.probewatch.persisteddata.file.FilePersistedMap;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

import static org.easymock.EasyMock.mock;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.Is.isA;

public class PersistedMapFactoryTest {

    private static final String BASELINE_DIR = "/tmp/probewatch-baselines";

    /**
     * Ensure setting the persist method config results in the factory producing an instance of the
     * right type.
     */
    @Test
    public void instanceReturnsFilePersistedMapWhenConfiguredForFile() {
        final PersistedMapFactory factory = configureAndGetPersistedMapFactory("file");
        PersistedMap map = factory.instance();
        assertThat(map instanceof FilePersistedMap, is(true));
    }

    @Test
    public void instanceReturnsPersistedMapWhenConfiguredForMemory() {
        final PersistedMapFactory factory = configureAndGetPersistedMapFactory("memory");
        PersistedMap map = factory.instance();
        assertThat(map, isA(PersistedMap.class));
        assertThat(map instanceof FilePersistedMap, is(false));
    }

    /**
     * Ensure the file implementation stores its files in the baseline directory.
     */
    @Test
    public void fileInstanceUsesBaselineDirectory() {
        ProbeWatchConfig config = new ProbeWatchConfig(
                Map.of(PersistedDataConfig.PERSIST_METHOD_CONFIG, "file",
                        PathConfig.BASELINE_DIR_CONFIG, BASELINE_DIR));
        PersistedMap map = new PersistedMapFactory(config).instance();
        assertThat(((FilePersistedMap) map).directory(), is(Path.of(BASELINE_DIR)));
    }

    private static PersistedMapFactory configureAndGetPersistedMapFactory(String persistMethod) {
        ProbeWatchConfig config = new ProbeWatchConfig(
                Map.of(PersistedDataConfig.PERSIST_METHOD_CONFIG, persistMethod));
        return new PersistedMapFactory(config,
                () -> mock(FilePersistedMap.class),
                () -> new PersistedMap(new HashMap<>()));
    }
}
