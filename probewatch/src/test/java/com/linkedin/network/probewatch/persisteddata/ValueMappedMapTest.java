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

public class ValueMappedMapTest {

    private static final String KEY1 = "k1";
    private static final String KEY2 = "k2";

    private Map<String, String> _backingMap;
    private Map<String, Double> _mappedValues;

    /**
     * Set a common starting point.
     */
    @Before
    public void beforeTest() {
        this._backingMap = new HashMap<>();
        this._mappedValues = new ValueMappedMap<>(this._backingMap,
                ValueMappedMapTest::serialize, ValueMappedMapTest::deserialize);
    }

    private static String serialize(Object value) {
        return value instanceof Double ? value.toString() : null;
    }

    private static Double deserialize(String value) {
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Ensure put() stores the mapped value and back maps the previous one.
     */
    @Test
    public void putStoresInternalValueAndBackMapsPreviousValue() {
        assertThat(this._mappedValues.put(KEY1, 1.5), is(nullValue()));
        assertThat(this._backingMap.get(KEY1), is("1.5"));
        assertThat(this._mappedValues.put(KEY1, 2.5), is(1.5));
        assertThat(this._mappedValues.get(KEY1), is(2.5));
    }

    /**
     * Ensure values the back mapper cannot read are returned as null.
     */
    @Test
    public void getReturnsNullForUnreadableValue() {
        this._backingMap.put(KEY1, "not a number");
        assertThat(this._mappedValues.get(KEY1), is(nullValue()));
        assertThat(this._mappedValues.get(KEY2), is(nullValue()));
    }

    @Test
    public void removeAndEntrySetPassThrough() {
        this._backingMap.put(KEY1, "1.0");
        this._backingMap.put(KEY2, "2.0");
        assertThat(this._mappedValues.entrySet(), is(Set.of(Pair.of(KEY1, 1.0), Pair.of(KEY2, 2.0))));
        assertThat(this._mappedValues.remove(KEY1), is(1.0));
        assertThat(this._mappedValues.containsKey(KEY1), is(false));
        assertThat(this._mappedValues.size(), is(1));
    }
}
