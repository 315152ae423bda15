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
package eu.openanalytics.phaedra.featureengine.framework.columntable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.filter.FilterEngine;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.framework.rowlist.RowList;
import eu.openanalytics.phaedra.featureengine.merge.MergeEngine;

/**
 * Columnar in-memory backend. This is also the canonical form in which data crosses
 * the exchange service, so conversions from and to it are the identity.
 */
public class ColumnTableFramework extends ComputeFramework<ColumnTable> {

	public ColumnTableFramework(ParallelizationMode mode, Set<UUID> childrenIfRoot, Set<FunctionExtender> functionExtenders) {
		super(mode, childrenIfRoot, functionExtenders);
	}

	@Override
	public Class<ColumnTable> expectedDataFramework() {
		return ColumnTable.class;
	}

	@Override
	public ComputeFrameworkType getFrameworkType() {
		return ComputeFrameworkType.COLUMN_TABLE;
	}

	@Override
	protected Function<Object, ?> frameworkTransformFunction(boolean fromOther, Class<?> other) {
		if (RowList.class.equals(other)) {
			if (fromOther) return data -> ColumnTable.fromRows(((RowList) data).getRows());
			return data -> new RowList(((ColumnTable) data).toRows());
		}
		return null;
	}

	/**
	 * Supports a map of column name to values, or a single list of values that is added as a new
	 * column to the current data. The latter requires exactly one requested feature name.
	 */
	@Override
	protected ColumnTable constructFrom(Object input, Set<String> featureNames) {
		if (input instanceof Map<?, ?> map) {
			Map<String, List<?>> columns = new LinkedHashMap<>();
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getValue() instanceof List<?> values)) {
					throw new DataShapeException("Column %s must be a list, got %s", entry.getKey(),
							entry.getValue() == null ? "null" : entry.getValue().getClass().getName());
				}
				columns.put(String.valueOf(entry.getKey()), values);
			}
			return new ColumnTable(columns);
		}
		if (input instanceof List<?> values) {
			if (featureNames == null || featureNames.size() != 1) {
				throw new DataShapeException("A single list of values needs exactly one feature name, got %s", featureNames);
			}
			String name = featureNames.iterator().next();
			ColumnTable current = getData();
			if (current == null) {
				return ColumnTable.of(name, new ArrayList<>(values));
			}
			return current.withColumn(name, values);
		}
		return null;
	}

	@Override
	protected Set<String> columnNamesOf(ColumnTable data) {
		return new LinkedHashSet<>(data.getColumnNames());
	}

	@Override
	public ColumnTable selectColumns(ColumnTable input, Set<String> names) {
		return input.select(names);
	}

	@Override
	public MergeEngine<ColumnTable> mergeEngine() {
		return new ColumnTableMergeEngine();
	}

	@Override
	public FilterEngine<ColumnTable> filterEngine() {
		return new ColumnTableFilterEngine();
	}
}
