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
package eu.openanalytics.phaedra.featureengine.framework.rowlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;

/**
 * Immutable list of row records, the native type of {@link RowListFramework}.
 */
@EqualsAndHashCode
public final class RowList implements Iterable<Map<String, Object>> {

    private final List<Map<String, Object>> rows;

    public RowList(List<? extends Map<String, ?>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public Map<String, Object> get(int index) {
        return rows.get(index);
    }

    public Set<String> getColumnNames() {
        Set<String> names = new LinkedHashSet<>();
        rows.forEach(r -> names.addAll(r.keySet()));
        return names;
    }

    public RowList select(Set<String> names) {
        List<Map<String, Object>> selected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((k, v) -> {
                if (names.contains(k)) copy.put(k, v);
            });
            selected.add(copy);
        }
        return new RowList(selected);
    }

    @Override
    public Iterator<Map<String, Object>> iterator() {
        return rows.iterator();
    }

    @Override
    public String toString() {
        return "RowList" + rows;
    }
}
