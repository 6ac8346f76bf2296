/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Where latency and hop baselines are kept between analysis passes.
 */
public enum PersistMethod {
    // One JSON file per baseline in the baseline directory.
    FILE,
    // A map that lives as long as the process, for tests and dry runs.
    MEMORY;

    /**
     * @return The name of this method as it appears in configuration.
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param value A configured persist method, case and surrounding whitespace are ignored.
     * @return The matching persist method.
     * @throws IllegalArgumentException If no persist method has the given name.
     */
    public static PersistMethod fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @return The configuration names of all persist methods, sorted.
     */
    public static List<String> stringValues() {
        return Arrays.stream(values()).map(PersistMethod::configName).sorted().collect(Collectors.toList());
    }
}
