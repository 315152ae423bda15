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
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.filter.FilterEngine;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;

/**
 * Row filters on a {@link ColumnTable}, applied to the final data of a feature set.
 * Rows with a null value in the filtered column are removed.
 */
public class ColumnTableFilterEngine extends FilterEngine<ColumnTable> {

	@Override
	public boolean finalFilters() {
		return true;
	}

	@Override
	protected ColumnTable doMinFilter(ColumnTable data, SingleFilter filter) {
		double min = number(filter, SingleFilter.VALUE);
		return keepRows(data, filter.getFeatureName(), v -> toDouble(filter, v) >= min);
	}

	@Override
	protected ColumnTable doMaxFilter(ColumnTable data, SingleFilter filter) {
		double max = number(filter, SingleFilter.VALUE);
		return keepRows(data, filter.getFeatureName(), v -> toDouble(filter, v) <= max);
	}

	@Override
	protected ColumnTable doEqualFilter(ColumnTable data, SingleFilter filter) {
		Object expected = ColumnTableMergeEngine.normalizeKey(parameter(filter, SingleFilter.VALUE));
		return keepRows(data, filter.getFeatureName(), v -> expected.equals(ColumnTableMergeEngine.normalizeKey(v)));
	}

	@Override
	protected ColumnTable doRangeFilter(ColumnTable data, SingleFilter filter) {
		double min = number(filter, SingleFilter.MIN);
		double max = number(filter, SingleFilter.MAX);
		boolean maxExclusive = Boolean.TRUE.equals(filter.getParameter(SingleFilter.MAX_EXCLUSIVE));
		return keepRows(data, filter.getFeatureName(), v -> {
			double d = toDouble(filter, v);
			return d >= min && (maxExclusive ? d < max : d <= max);
		});
	}

	@Override
	protected ColumnTable doRegexFilter(ColumnTable data, SingleFilter filter) {
		Pattern pattern = Pattern.compile(String.valueOf(parameter(filter, SingleFilter.VALUE)));
		return keepRows(data, filter.getFeatureName(), v -> pattern.matcher(String.valueOf(v)).matches());
	}

	@Override
	protected ColumnTable doCategoricalInclusionFilter(ColumnTable data, SingleFilter filter) {
		Object values = filter.getParameter(SingleFilter.VALUES);
		if (!(values instanceof Collection<?> categories)) {
			throw new ConfigurationException("Filter on %s needs a collection of values", filter.getFeatureName());
		}
		return keepRows(data, filter.getFeatureName(), categories::contains);
	}

	private ColumnTable keepRows(ColumnTable data, String column, Predicate<Object> predicate) {
		List<Object> values = data.getColumn(column);
		List<Integer> kept = new ArrayList<>();
		for (int i = 0; i < values.size(); i++) {
			Object value = values.get(i);
			if (value != null && predicate.test(value)) kept.add(i);
		}
		return data.selectRows(kept);
	}

	private static double number(SingleFilter filter, String key) {
		Object value = filter.getParameter(key);
		if (!(value instanceof Number n)) {
			throw new ConfigurationException("Filter %s on %s needs a numeric parameter '%s'", filter.getFilterType(), filter.getFeatureName(), key);
		}
		return n.doubleValue();
	}

	private static Object parameter(SingleFilter filter, String key) {
		Object value = filter.getParameter(key);
		if (value == null) {
			throw new ConfigurationException("Filter %s on %s needs a parameter '%s'", filter.getFilterType(), filter.getFeatureName(), key);
		}
		return value;
	}

	private static double toDouble(SingleFilter filter, Object value) {
		if (value instanceof Number n) return n.doubleValue();
		try {
			return Double.parseDouble(value.toString());
		} catch (NumberFormatException e) {
			throw new DataShapeException("Filter %s on %s needs numeric values, found '%s' of type %s",
					filter.getFilterType(), filter.getFeatureName(), value, value.getClass().getName());
		}
	}
}
