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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;

/**
 * Immutable in-memory table stored column by column.
 *
 * This is the native type of {@link ColumnTableFramework} and the canonical representation
 * used when a dataset crosses an execution unit boundary through the exchange service.
 * All columns have the same length; values may be null.
 */
public final class ColumnTable {

	private static final ColumnTable EMPTY = new ColumnTable(Collections.emptyMap());

	private final Map<String, List<Object>> columns;
	private final int rowCount;

	public ColumnTable(Map<String, ? extends List<?>> columns) {
		Map<String, List<Object>> copy = new LinkedHashMap<>();
		int size = -1;
		for (Map.Entry<String, ? extends List<?>> entry : columns.entrySet()) {
			List<Object> values = Collections.unmodifiableList(new ArrayList<>(entry.getValue()));
			if (size >= 0 && values.size() != size) {
				throw new DataShapeException("Column %s has %d rows, expected %d", entry.getKey(), values.size(), size);
			}
			size = values.size();
			copy.put(entry.getKey(), values);
		}
		this.columns = Collections.unmodifiableMap(copy);
		this.rowCount = Math.max(size, 0);
	}

	public static ColumnTable empty() {
		return EMPTY;
	}

	public static ColumnTable of(String column, List<?> values) {
		Map<String, List<?>> map = new LinkedHashMap<>();
		map.put(column, values);
		return new ColumnTable(map);
	}

	public static ColumnTable of(String column1, List<?> values1, String column2, List<?> values2) {
		Map<String, List<?>> map = new LinkedHashMap<>();
		map.put(column1, values1);
		map.put(column2, values2);
		return new ColumnTable(map);
	}

	/**
	 * Build a table from rows. The column order is the order in which column names are first seen.
	 */
	public static ColumnTable fromRows(List<? extends Map<String, ?>> rows) {
		List<String> names = new ArrayList<>();
		for (Map<String, ?> row : rows) {
			for (String name : row.keySet()) {
				if (!names.contains(name)) names.add(name);
			}
		}
		Map<String, List<Object>> map = new LinkedHashMap<>();
		for (String name : names) {
			List<Object> values = new ArrayList<>(rows.size());
			for (Map<String, ?> row : rows) values.add(row.get(name));
			map.put(name, values);
		}
		return new ColumnTable(map);
	}

	public Map<String, List<Object>> getColumns() {
		return columns;
	}

	public List<String> getColumnNames() {
		return new ArrayList<>(columns.keySet());
	}

	public int getRowCount() {
		return rowCount;
	}

	public boolean hasColumn(String name) {
		return columns.containsKey(name);
	}

	public List<Object> getColumn(String name) {
		List<Object> column = columns.get(name);
		if (column == null) {
			throw new DataShapeException("Column %s not found, available columns: %s", name, columns.keySet());
		}
		return column;
	}

	public Object getValue(String column, int row) {
		return getColumn(column).get(row);
	}

	public Map<String, Object> getRow(int row) {
		Map<String, Object> values = new LinkedHashMap<>();
		columns.forEach((name, column) -> values.put(name, column.get(row)));
		return values;
	}

	public List<Map<String, Object>> toRows() {
		List<Map<String, Object>> rows = new ArrayList<>(rowCount);
		for (int i = 0; i < rowCount; i++) rows.add(getRow(i));
		return rows;
	}

	/**
	 * Return a table with the given column appended, or replaced when a column with that name exists.
	 */
	public ColumnTable withColumn(String name, List<?> values) {
		if (!columns.isEmpty() && values.size() != rowCount) {
			throw new DataShapeException("Column %s has %d rows, table has %d", name, values.size(), rowCount);
		}
		Map<String, List<?>> map = new LinkedHashMap<>(columns);
		map.put(name, values);
		return new ColumnTable(map);
	}

	public ColumnTable select(Collection<String> names) {
		Map<String, List<?>> map = new LinkedHashMap<>();
		for (String name : columns.keySet()) {
			if (names.contains(name)) map.put(name, columns.get(name));
		}
		return new ColumnTable(map);
	}

	public ColumnTable selectRows(List<Integer> rowIndexes) {
		Map<String, List<?>> map = new LinkedHashMap<>();
		columns.forEach((name, column) -> {
			List<Object> values = new ArrayList<>(rowIndexes.size());
			for (Integer i : rowIndexes) values.add(column.get(i));
			map.put(name, values);
		});
		return new ColumnTable(map);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ColumnTable other)) return false;
		return getColumnNames().equals(other.getColumnNames()) && columns.equals(other.columns);
	}

	@Override
	public int hashCode() {
		return columns.hashCode();
	}

	@Override
	public String toString() {
		return "ColumnTable" + columns;
	}
}
