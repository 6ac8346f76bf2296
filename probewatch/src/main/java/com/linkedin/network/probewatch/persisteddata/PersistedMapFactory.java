/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import com.linkedin.network.probewatch.config.ProbeWatchConfig;
import com.linkedin.network.probewatch.config.constants.PathConfig;
import com.linkedin.network.probewatch.config.constants.PersistedDataConfig;
import com.linkedin.network.probewatch.persisteddata.file.FilePersistedMap;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.linkedin.network.probewatch.persisteddata.PersistMethod.FILE;
import static com.linkedin.network.probewatch.persisteddata.PersistMethod.MEMORY;

/**
 * Constructs the {@link PersistedMap} implementation selected by
 * {@link PersistedDataConfig#PERSIST_METHOD_CONFIG}.
 */
public class PersistedMapFactory {

    private final ProbeWatchConfig _config;

    // Suppliers of the implementation-specific instances.
    private final Map<PersistMethod, Supplier<PersistedMap>> _suppliers;

    /**
     * @param config The program configuration. {@link PersistedDataConfig#PERSIST_METHOD_CONFIG}
     * selects the implementation and {@link PathConfig#BASELINE_DIR_CONFIG} is the directory of the
     * file implementation.
     */
    public PersistedMapFactory(ProbeWatchConfig config) {
        this(config,
                () -> new FilePersistedMap(Path.of(config.getString(PathConfig.BASELINE_DIR_CONFIG))),
                () -> new PersistedMap(new ConcurrentHashMap<>()));
    }

    /**
     * Package private for testing.
     *
     * @param config The program configuration.
     * @param fileSupplier The supplier for {@link FilePersistedMap}.
     * @param memorySupplier The supplier for the in-memory {@link PersistedMap}.
     */
    PersistedMapFactory(ProbeWatchConfig config, Supplier<PersistedMap> fileSupplier,
            Supplier<PersistedMap> memorySupplier) {
        this._config = config;
        this._suppliers = Map.of(
                FILE, fileSupplier,
                MEMORY, memorySupplier);
    }

    /**
     * @return A new instance of the configured {@link PersistedMap} implementation.
     */
    public PersistedMap instance() {
        PersistMethod persistMethod = PersistMethod.fromString(
                _config.getString(PersistedDataConfig.PERSIST_METHOD_CONFIG));
        return this._suppliers.getOrDefault(persistMethod, this._suppliers.get(FILE)).get();
    }
}
