/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Map} view whose keys are translated before they reach the backing map. Keys of the
 * backing map that the back mapper does not recognize (it returns {@code null}) are invisible
 * through this view, so several views with distinct key spaces can share one backing map.
 *
 * @param <EXTERNALKEY> The key type seen by users of the view.
 * @param <INTERNALKEY> The key type of the backing map.
 * @param <V> The value type.
 */
public class KeyMappedMap<EXTERNALKEY, INTERNALKEY, V> extends AbstractMap<EXTERNALKEY, V> {

    private static final Logger LOG = LoggerFactory.getLogger(KeyMappedMap.class);

    private final Map<INTERNALKEY, V> _child;

    // External to internal key.
    private final Function<Object, INTERNALKEY> _keyMapper;

    // Internal to external key, null for keys outside of this view.
    private final Function<INTERNALKEY, EXTERNALKEY> _keyBackMapper;

    /**
     * @param child The map that stores all the actual data.
     * @param keyMapper Maps the keys of this view to keys of the backing map.
     * @param keyBackMapper Maps keys of the backing map back to keys of this view. Must return
     * {@code null} for keys that do not belong to this view.
     */
    public KeyMappedMap(@Nonnull Map<INTERNALKEY, V> child,
            Function<Object, INTERNALKEY> keyMapper,
            Function<INTERNALKEY, EXTERNALKEY> keyBackMapper) {
        this._child = child;
        this._keyMapper = keyMapper;
        this._keyBackMapper = keyBackMapper;
    }

    @Override
    public V get(Object externalKey) {
        INTERNALKEY internalKey = this._keyMapper.apply(externalKey);
        V value = this._child.get(internalKey);
        LOG.debug("Getting externalKey={}, internalKey={} value={}", externalKey, internalKey, value);
        return value;
    }

    @Override
    public V put(EXTERNALKEY externalKey, V value) {
        INTERNALKEY internalKey = this._keyMapper.apply(externalKey);
        LOG.debug("Putting externalKey={}, internalKey={} value={}", externalKey, internalKey, value);
        return this._child.put(internalKey, value);
    }

    @Override
    public boolean containsKey(Object externalKey) {
        return this._child.containsKey(this._keyMapper.apply(externalKey));
    }

    @Override
    public V remove(Object externalKey) {
        return this._child.remove(this._keyMapper.apply(externalKey));
    }

    @Override
    public void clear() {
        keySet().stream().map(this._keyMapper).collect(Collectors.toList()).forEach(this._child::remove);
    }

    /**
     * @return A snapshot of the entries visible through this view. Changes to the returned set are
     * not written through.
     */
    @Nonnull
    @Override
    public Set<Entry<EXTERNALKEY, V>> entrySet() {
        return this._child.entrySet().stream()
                .map(e -> Pair.of(this._keyBackMapper.apply(e.getKey()), e.getValue()))
                .filter(e -> Objects.nonNull(e.getKey()))
                .collect(Collectors.toSet());
    }
}
