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
package eu.openanalytics.phaedra.featureengine.plugin.aggregation;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.plugin.ColumnStatistics;

/**
 * Aggregates on a {@link ColumnTable}. The aggregated value is repeated on every row.
 */
@Component
public class ColumnTableAggregatedFeatureGroup extends AggregatedFeatureGroup {

	@Override
	public Set<ComputeFrameworkType> computeFrameworkRule() {
		return Set.of(ComputeFrameworkType.COLUMN_TABLE);
	}

	@Override
	public Object calculateFeature(Object data, FeatureSet features) {
		if (!(data instanceof ColumnTable table)) {
			throw DataShapeException.of(data, ColumnTable.class, getClass());
		}
		for (String featureName : features.getAllNames()) {
			String source = getSourceFeature(featureName);
			if (!table.hasColumn(source)) {
				throw new ConfigurationException("Source feature %s not found in data", source);
			}
			Object result = aggregate(table.getColumn(source), getAggregationType(featureName), source);
			table = table.withColumn(featureName, Collections.nCopies(table.getRowCount(), result));
		}
		return table;
	}

	static Object aggregate(List<Object> values, String aggregationType, String source) {
		List<Double> numbers = ColumnStatistics.numbers(source, values);
		switch (aggregationType) {
		case "sum":
			return ColumnStatistics.sum(numbers);
		case "min":
			return numbers.stream().min(Double::compare).orElse(null);
		case "max":
			return numbers.stream().max(Double::compare).orElse(null);
		case "avg":
		case "mean":
			return ColumnStatistics.mean(numbers);
		case "count":
			return (long) numbers.size();
		case "std":
			return ColumnStatistics.std(numbers);
		case "var":
			return ColumnStatistics.variance(numbers);
		case "median":
			return ColumnStatistics.median(numbers);
		default:
			throw new ConfigurationException("Unsupported aggregation type: %s", aggregationType);
		}
	}
}
