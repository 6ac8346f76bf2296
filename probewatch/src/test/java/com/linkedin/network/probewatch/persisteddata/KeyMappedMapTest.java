/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class KeyMappedMapTest {

    private static final String PREFIX = "ns_";
    private static final String KEY1 = "p1_8.8.8.8";
    private static final String KEY2 = "p2_8.8.8.8";
    private static final String VALUE1 = "v1";
    private static final String VALUE2 = "v2";

    private Map<String, String> _backingMap;
    private Map<String, String> _mappedKeys;

    /**
     * Set a common starting point.
     */
    @Before
    public void beforeTest() {
        this._backingMap = new HashMap<>();
        this._mappedKeys = new KeyMappedMap<>(this._backingMap,
                key -> PREFIX + key,
                key -> key.startsWith(PREFIX) ? key.substring(PREFIX.length()) : null);
    }

    /**
     * Ensure get(), put(), containsKey() and remove() map keys before passing calls to the child
     * map.
     */
    @Test
    public void singleKeyOperationsApplyMapperToKey() {
        assertThat(this._mappedKeys.get(KEY1), is(nullValue()));
        assertThat(this._mappedKeys.put(KEY1, VALUE1), is(nullValue()));
        assertThat(this._backingMap.get(PREFIX + KEY1), is(VALUE1));
        assertThat(this._mappedKeys.put(KEY1, VALUE2), is(VALUE1));
        assertThat(this._mappedKeys.get(KEY1), is(VALUE2));
        assertThat(this._mappedKeys.containsKey(KEY1), is(true));
        assertThat(this._mappedKeys.remove(KEY1), is(VALUE2));
        assertThat(this._backingMap.isEmpty(), is(true));
    }

    /**
     * Ensure entries of the child map outside of this view are neither listed nor cleared.
     */
    @Test
    public void viewOnlyIncludesMappableKeys() {
        this._backingMap.put(PREFIX + KEY1, VALUE1);
        this._backingMap.put(KEY2, VALUE2);
        assertThat(this._mappedKeys.size(), is(1));
        assertThat(this._mappedKeys.keySet(), is(Set.of(KEY1)));
        assertThat(this._mappedKeys.entrySet(), is(Set.of(Pair.of(KEY1, VALUE1))));
        assertThat(this._mappedKeys.containsValue(VALUE2), is(false));

        this._mappedKeys.clear();
        assertThat(this._backingMap, is(Map.of(KEY2, VALUE2)));
    }

    @Test
    public void putAllMapsAllKeys() {
        this._mappedKeys.putAll(Map.of(KEY1, VALUE1, KEY2, VALUE2));
        assertThat(this._backingMap, is(Map.of(PREFIX + KEY1, VALUE1, PREFIX + KEY2, VALUE2)));
    }
}
