/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * A string to string map whose content outlives the map instance for as long as the backing store
 * keeps it. The in-memory flavor wraps a plain concurrent map and lives as long as the process.
 * Bulk operations are expressed through the single key operations of the backing store, so a store
 * only has to implement those.
 */
public class PersistedMap extends AbstractMap<String, String> {

    protected final Map<String, String> _child;

    /**
     * @param child The map that holds the data.
     */
    public PersistedMap(Map<String, String> child) {
        this._child = child;
    }

    @Override
    public String get(Object key) {
        return this._child.get(key);
    }

    @Override
    public String put(String key, String value) {
        return this._child.put(key, value);
    }

    @Override
    public boolean containsKey(Object key) {
        return this._child.containsKey(key);
    }

    @Override
    public String remove(Object key) {
        return this._child.remove(key);
    }

    @Override
    public void putAll(@Nonnull Map<? extends String, ? extends String> map) {
        map.forEach(this::put);
    }

    @Override
    public void clear() {
        // Only consistent if no other writer is active.
        new ArrayList<>(this.keySet()).forEach(this::remove);
    }

    @Nonnull
    @Override
    public Set<Entry<String, String>> entrySet() {
        return this._child.entrySet();
    }
}
