/**
 * Phaedra II
 *
 * Copyright (C) 2016-2025 Open Analytics
 *
 * ===========================================================================
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the Apache License as published by
 * The Apache Software Foundation, either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Apache License for more details.
 *
 * You should have received a copy of the Apache License
 * along with this program.  If not, see <http://www.apache.org/licenses/>
 */
package eu.openanalytics.phaedra.featureengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;

/**
 * Immutable bag of feature options. Options take part in the identity of a feature.
 */
@EqualsAndHashCode
public class Options {

    private static final Options EMPTY = new Options(Collections.emptyMap());

    private final Map<String, Object> data;

    public Options(Map<String, ?> data) {
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Options empty() {
        return EMPTY;
    }

    public static Options of(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return new Options(map);
    }

    public static Options of(String key1, Object value1, String key2, Object value2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key1, value1);
        map.put(key2, value2);
        return new Options(map);
    }

    public Object get(String key) {
        return data.get(key);
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public Set<String> keySet() {
        return data.keySet();
    }

    public Map<String, Object> asMap() {
        return data;
    }

    public Options with(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>(data);
        map.put(key, value);
        return new Options(map);
    }

    @Override
    public String toString() {
        return data.toString();
    }
}
