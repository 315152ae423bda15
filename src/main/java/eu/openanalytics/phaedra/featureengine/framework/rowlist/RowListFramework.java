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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;

/**
 * Backend that keeps data as a list of row records. It has neither a merge nor a filter engine.
 */
public class RowListFramework extends ComputeFramework<RowList> {

    public RowListFramework(ParallelizationMode mode, Set<UUID> childrenIfRoot, Set<FunctionExtender> functionExtenders) {
        super(mode, childrenIfRoot, functionExtenders);
    }

    @Override
    public Class<RowList> expectedDataFramework() {
        return RowList.class;
    }

    @Override
    public ComputeFrameworkType getFrameworkType() {
        return ComputeFrameworkType.ROW_LIST;
    }

    @Override
    protected Function<Object, ?> frameworkTransformFunction(boolean fromOther, Class<?> other) {
        if (ColumnTable.class.equals(other)) {
            if (fromOther) return data -> new RowList(((ColumnTable) data).toRows());
            return data -> ColumnTable.fromRows(((RowList) data).getRows());
        }
        return null;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected RowList constructFrom(Object input, Set<String> featureNames) {
        if (input instanceof List<?> list && list.stream().allMatch(r -> r instanceof Map)) {
            return new RowList((List<? extends Map<String, ?>>) list);
        }
        if (input instanceof Map<?, ?> map && map.values().stream().allMatch(v -> v instanceof List)) {
            return new RowList(new ColumnTable((Map<String, ? extends List<?>>) map).toRows());
        }
        return null;
    }

    @Override
    protected Set<String> columnNamesOf(RowList data) {
        return data.getColumnNames();
    }

    @Override
    public RowList selectColumns(RowList input, Set<String> names) {
        return input.select(names);
    }
}
