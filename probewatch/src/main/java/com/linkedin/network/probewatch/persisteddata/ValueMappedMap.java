/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Map} view that stores its values in a serialized form in the backing map, e.g. a
 * baseline object stored as a JSON string. A value that cannot be deserialized reads as
 * {@code null}.
 *
 * @param <K> The key type.
 * @param <EXTERNALVALUE> The value type seen by users of the view.
 * @param <INTERNALVALUE> The value type of the backing map.
 */
public class ValueMappedMap<K, EXTERNALVALUE, INTERNALVALUE> extends AbstractMap<K, EXTERNALVALUE> {

    private static final Logger LOG = LoggerFactory.getLogger(ValueMappedMap.class);

    private final Map<K, INTERNALVALUE> _child;

    // Serializes a value of this view.
    private final Function<Object, INTERNALVALUE> _valueMapper;

    // Deserializes a stored value, null if it cannot be deserialized.
    private final Function<INTERNALVALUE, EXTERNALVALUE> _valueBackMapper;

    /**
     * @param child The map that stores all the actual data.
     * @param valueMapper Maps values of this view to the stored representation.
     * @param valueBackMapper Maps stored values back to values of this view.
     */
    public ValueMappedMap(@Nonnull Map<K, INTERNALVALUE> child,
            Function<Object, INTERNALVALUE> valueMapper,
            Function<INTERNALVALUE, EXTERNALVALUE> valueBackMapper) {
        this._child = child;
        this._valueMapper = valueMapper;
        this._valueBackMapper = valueBackMapper;
    }

    @Override
    public EXTERNALVALUE get(Object key) {
        return backMap(this._child.get(key));
    }

    @Override
    public EXTERNALVALUE put(K key, EXTERNALVALUE externalValue) {
        INTERNALVALUE internalValue = this._valueMapper.apply(externalValue);
        INTERNALVALUE previousInternalValue = this._child.put(key, internalValue);
        LOG.debug("Putting key={}, externalValue={}, internalValue={}, previousInternalValue={}",
                key, externalValue, internalValue, previousInternalValue);
        return backMap(previousInternalValue);
    }

    @Override
    public boolean containsKey(Object key) {
        return this._child.containsKey(key);
    }

    @Override
    public EXTERNALVALUE remove(Object key) {
        return backMap(this._child.remove(key));
    }

    @Override
    public void clear() {
        this._child.clear();
    }

    /**
     * @return A snapshot of the deserialized entries. Changes to the returned set are not written
     * through.
     */
    @Nonnull
    @Override
    public Set<Entry<K, EXTERNALVALUE>> entrySet() {
        return this._child.entrySet().stream()
                .map(e -> Pair.of(e.getKey(), backMap(e.getValue())))
                .collect(Collectors.toSet());
    }

    private EXTERNALVALUE backMap(INTERNALVALUE internalValue) {
        return internalValue == null ? null : this._valueBackMapper.apply(internalValue);
    }
}
