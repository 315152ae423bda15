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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.merge.MergeEngine;
import eu.openanalytics.phaedra.featureengine.model.Index;

/**
 * Hash join on a single key column.
 *
 * Output columns are the left columns followed by the right columns. The right key column is
 * dropped when it has the same name as the left key; other name clashes get a "_right" suffix.
 */
public class ColumnTableMergeEngine extends MergeEngine<ColumnTable> {

	static final String RIGHT_SUFFIX = "_right";

	@Override
	public ColumnTable mergeInner(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex) {
		return join(leftData, rightData, leftIndex, rightIndex, false, false);
	}

	@Override
	public ColumnTable mergeLeft(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex) {
		return join(leftData, rightData, leftIndex, rightIndex, true, false);
	}

	@Override
	public ColumnTable mergeRight(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex) {
		requireSimpleIndex(leftIndex, rightIndex);
		String leftKey = leftIndex.getFirstColumn();
		String rightKey = rightIndex.getFirstColumn();
		Map<Object, List<Integer>> leftLookup = buildLookup(leftData, leftKey);

		List<Integer> leftRows = new ArrayList<>();
		List<Integer> rightRows = new ArrayList<>();
		for (int r = 0; r < rightData.getRowCount(); r++) {
			List<Integer> matches = leftLookup.get(normalizeKey(rightData.getValue(rightKey, r)));
			if (matches == null) {
				leftRows.add(null);
				rightRows.add(r);
			} else {
				for (Integer l : matches) {
					leftRows.add(l);
					rightRows.add(r);
				}
			}
		}
		return assemble(leftData, rightData, leftKey, rightKey, leftRows, rightRows);
	}

	@Override
	public ColumnTable mergeFullOuter(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex) {
		return join(leftData, rightData, leftIndex, rightIndex, true, true);
	}

	@Override
	public ColumnTable mergeAppend(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex) {
		if (!leftData.getColumnNames().equals(rightData.getColumnNames())) {
			throw new DataShapeException("Cannot append tables with different columns: %s and %s", leftData.getColumnNames(), rightData.getColumnNames());
		}
		Map<String, List<Object>> columns = new LinkedHashMap<>();
		for (String name : leftData.getColumnNames()) {
			List<Object> values = new ArrayList<>(leftData.getRowCount() + rightData.getRowCount());
			values.addAll(leftData.getColumn(name));
			values.addAll(rightData.getColumn(name));
			columns.put(name, values);
		}
		return new ColumnTable(columns);
	}

	private ColumnTable join(ColumnTable leftData, ColumnTable rightData, Index leftIndex, Index rightIndex, boolean keepLeft, boolean keepRight) {
		requireSimpleIndex(leftIndex, rightIndex);
		String leftKey = leftIndex.getFirstColumn();
		String rightKey = rightIndex.getFirstColumn();
		Map<Object, List<Integer>> rightLookup = buildLookup(rightData, rightKey);

		List<Integer> leftRows = new ArrayList<>();
		List<Integer> rightRows = new ArrayList<>();
		boolean[] rightMatched = new boolean[rightData.getRowCount()];
		for (int l = 0; l < leftData.getRowCount(); l++) {
			List<Integer> matches = rightLookup.get(normalizeKey(leftData.getValue(leftKey, l)));
			if (matches == null) {
				if (keepLeft) {
					leftRows.add(l);
					rightRows.add(null);
				}
			} else {
				for (Integer r : matches) {
					leftRows.add(l);
					rightRows.add(r);
					rightMatched[r] = true;
				}
			}
		}
		if (keepRight) {
			for (int r = 0; r < rightMatched.length; r++) {
				if (!rightMatched[r]) {
					leftRows.add(null);
					rightRows.add(r);
				}
			}
		}
		return assemble(leftData, rightData, leftKey, rightKey, leftRows, rightRows);
	}

	private ColumnTable assemble(ColumnTable leftData, ColumnTable rightData, String leftKey, String rightKey, List<Integer> leftRows, List<Integer> rightRows) {
		boolean sharedKey = leftKey.equals(rightKey);
		Map<String, List<Object>> columns = new LinkedHashMap<>();

		for (String name : leftData.getColumnNames()) {
			List<Object> source = leftData.getColumn(name);
			List<Object> keySource = (sharedKey && name.equals(leftKey)) ? rightData.getColumn(rightKey) : null;
			List<Object> values = new ArrayList<>(leftRows.size());
			for (int i = 0; i < leftRows.size(); i++) {
				Integer l = leftRows.get(i);
				if (l != null) {
					values.add(source.get(l));
				} else if (keySource != null) {
					// Row only exists on the right side: the shared key still has a value.
					values.add(keySource.get(rightRows.get(i)));
				} else {
					values.add(null);
				}
			}
			columns.put(name, values);
		}

		for (String name : rightData.getColumnNames()) {
			if (sharedKey && name.equals(rightKey)) continue;
			List<Object> source = rightData.getColumn(name);
			List<Object> values = new ArrayList<>(rightRows.size());
			for (Integer r : rightRows) values.add(r == null ? null : source.get(r));
			String target = columns.containsKey(name) ? name + RIGHT_SUFFIX : name;
			columns.put(target, values);
		}
		return new ColumnTable(columns);
	}

	private static Map<Object, List<Integer>> buildLookup(ColumnTable data, String key) {
		Map<Object, List<Integer>> lookup = new HashMap<>();
		List<Object> column = data.getColumn(key);
		for (int i = 0; i < column.size(); i++) {
			Object normalized = normalizeKey(column.get(i));
			if (normalized == null) continue;
			lookup.computeIfAbsent(normalized, k -> new ArrayList<>()).add(i);
		}
		return lookup;
	}

	/**
	 * Numbers are compared by value, so that an Integer key matches a Long or Double key of the same value.
	 */
	static Object normalizeKey(Object key) {
		if (key instanceof Double || key instanceof Float) {
			double d = ((Number) key).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) return d;
		}
		if (key instanceof Number number) {
			return new BigDecimal(number.toString()).stripTrailingZeros();
		}
		return key;
	}
}
