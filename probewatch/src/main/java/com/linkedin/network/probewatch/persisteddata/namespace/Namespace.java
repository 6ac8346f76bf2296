/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata.namespace;

import com.linkedin.network.probewatch.model.MeasurementType;
import com.linkedin.network.probewatch.persisteddata.KeyMappedMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Keeps the baselines of each measurement technique apart in one backing store. A key is prefixed
 * with the wire name of its technique and an underscore, which is also the file name prefix of
 * file persisted baselines, e.g. {@code ping_<probe>_<target>.json}.
 */
public enum Namespace {
    PING(MeasurementType.PING),
    TRACEROUTE(MeasurementType.TRACEROUTE);

    private static final String SEPARATOR = "_";
    private final String _prefix;

    Namespace(MeasurementType measurementType) {
        this._prefix = measurementType.wireName() + SEPARATOR;
    }

    /**
     * @param backingStore The store shared by all namespaces.
     * @param <V> The type of values stored in the map.
     * @return A view of the store that only sees, and only writes, keys of this namespace.
     */
    public <V> Map<String, V> embed(Map<String, V> backingStore) {
        return new KeyMappedMap<>(backingStore, this::keyToNamespaceMapper, this::namespaceToKeyMapper);
    }

    // Package private for testing.
    @Nonnull
    String keyToNamespaceMapper(Object key) {
        return this._prefix + key;
    }

    // Package private for testing. Keys of other namespaces map to null.
    String namespaceToKeyMapper(@Nonnull String storedKey) {
        if (!storedKey.startsWith(this._prefix)) {
            return null;
        }
        return storedKey.substring(this._prefix.length());
    }
}
