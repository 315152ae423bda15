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
package eu.openanalytics.phaedra.featureengine.plugin.missingvalue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.plugin.ColumnStatistics;

/**
 * Imputes missing values on a {@link ColumnTable}.
 *
 * With group-by features, the fill value is calculated per group. When a group has no usable
 * value, the value over the whole column is used instead.
 */
@Component
public class ColumnTableMissingValueFeatureGroup extends MissingValueFeatureGroup {

	@Override
	public Set<ComputeFrameworkType> computeFrameworkRule() {
		return Set.of(ComputeFrameworkType.COLUMN_TABLE);
	}

	@Override
	public Object calculateFeature(Object data, FeatureSet features) {
		if (!(data instanceof ColumnTable table)) {
			throw DataShapeException.of(data, ColumnTable.class, getClass());
		}
		List<String> groupBy = getGroupByFeatures(features);
		for (String featureName : features.getAllNames()) {
			String source = getSourceFeature(featureName);
			if (!table.hasColumn(source)) {
				throw new ConfigurationException("Source feature %s not found in data", source);
			}
			String method = getImputationMethod(featureName);
			Object constant = "constant".equals(method) ? getConstantValue(features, featureName) : null;
			List<Object> imputed = impute(table, source, method, constant, groupBy);
			table = table.withColumn(featureName, imputed);
		}
		return table;
	}

	static List<Object> impute(ColumnTable table, String source, String method, Object constant, List<String> groupBy) {
		List<Object> values = table.getColumn(source);
		if (!values.contains(null)) return new ArrayList<>(values);

		if ("constant".equals(method)) return fill(values, constant);
		if (groupBy.isEmpty()) return imputeColumn(values, source, method);

		for (String groupColumn : groupBy) {
			if (!table.hasColumn(groupColumn)) {
				throw new ConfigurationException("Group by feature %s not found in data", groupColumn);
			}
		}

		Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
		for (int row = 0; row < table.getRowCount(); row++) {
			final int r = row;
			List<Object> key = groupBy.stream().map(c -> table.getValue(c, r)).collect(Collectors.toList());
			groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
		}

		Object overall = fillValue(values, source, method);
		List<Object> result = new ArrayList<>(values);
		for (List<Integer> rows : groups.values()) {
			List<Object> groupValues = rows.stream().map(values::get).collect(Collectors.toList());
			List<Object> groupResult = imputeColumn(groupValues, source, method);
			for (int i = 0; i < rows.size(); i++) {
				Object value = groupResult.get(i);
				result.set(rows.get(i), value == null ? overall : value);
			}
		}
		return result;
	}

	private static List<Object> imputeColumn(List<Object> values, String source, String method) {
		switch (method) {
		case "ffill":
			return forwardFill(values);
		case "bfill":
			List<Object> reversed = new ArrayList<>(values);
			Collections.reverse(reversed);
			List<Object> filled = forwardFill(reversed);
			Collections.reverse(filled);
			return filled;
		default:
			return fill(values, fillValue(values, source, method));
		}
	}

	private static Object fillValue(List<Object> values, String source, String method) {
		switch (method) {
		case "mean":
			return ColumnStatistics.mean(ColumnStatistics.numbers(source, values));
		case "median":
			return ColumnStatistics.median(ColumnStatistics.numbers(source, values));
		case "mode":
			return ColumnStatistics.mode(values);
		case "ffill":
		case "bfill":
			return null;
		default:
			throw new ConfigurationException("Unsupported imputation method: %s", method);
		}
	}

	private static List<Object> fill(List<Object> values, Object fillValue) {
		List<Object> result = new ArrayList<>(values.size());
		for (Object value : values) result.add(value == null ? fillValue : value);
		return result;
	}

	private static List<Object> forwardFill(List<Object> values) {
		List<Object> result = new ArrayList<>(values.size());
		Object last = null;
		for (Object value : values) {
			if (value != null) last = value;
			result.add(value == null ? last : value);
		}
		return result;
	}
}
