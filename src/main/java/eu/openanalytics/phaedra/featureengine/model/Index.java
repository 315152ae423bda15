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

import java.util.Arrays;
import java.util.List;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import lombok.Value;

/**
 * Ordered tuple of the key columns on one side of a join.
 */
@Value
public class Index {

    List<String> columns;

    public Index(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("An index needs at least one column");
        }
        this.columns = List.copyOf(columns);
    }

    public static Index of(String... columns) {
        return new Index(Arrays.asList(columns));
    }

    public boolean isComposite() {
        return columns.size() > 1;
    }

    public String getFirstColumn() {
        return columns.get(0);
    }
}
