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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eu.openanalytics.phaedra.featureengine.enumeration.FilterType;
import lombok.NonNull;
import lombok.Value;

/**
 * A row filter on one feature column.
 */
@Value
public class SingleFilter {

    public static final String VALUE = "value";
    public static final String MIN = "min";
    public static final String MAX = "max";
    public static final String MAX_EXCLUSIVE = "max_exclusive";
    public static final String VALUES = "values";

    @NonNull String featureName;
    @NonNull FilterType filterType;
    @NonNull Map<String, Object> parameters;

    public Object getParameter(String key) {
        return parameters.get(key);
    }

    public static SingleFilter min(String featureName, Number value) {
        return new SingleFilter(featureName, FilterType.MIN, Map.of(VALUE, value));
    }

    public static SingleFilter max(String featureName, Number value) {
        return new SingleFilter(featureName, FilterType.MAX, Map.of(VALUE, value));
    }

    public static SingleFilter equal(String featureName, Object value) {
        return new SingleFilter(featureName, FilterType.EQUAL, Map.of(VALUE, value));
    }

    public static SingleFilter range(String featureName, Number min, Number max, boolean maxExclusive) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(MIN, min);
        params.put(MAX, max);
        params.put(MAX_EXCLUSIVE, maxExclusive);
        return new SingleFilter(featureName, FilterType.RANGE, params);
    }

    public static SingleFilter regex(String featureName, String pattern) {
        return new SingleFilter(featureName, FilterType.REGEX, Map.of(VALUE, pattern));
    }

    public static SingleFilter categoricalInclusion(String featureName, Collection<?> values) {
        return new SingleFilter(featureName, FilterType.CATEGORICAL_INCLUSION, Map.of(VALUES, List.copyOf(values)));
    }
}
