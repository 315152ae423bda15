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
package eu.openanalytics.phaedra.featureengine.filter;

import eu.openanalytics.phaedra.featureengine.exception.UnsupportedEngineOperationException;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;

/**
 * Applies the row filters of a feature set to the data of one compute framework.
 *
 * Filters can be applied at different moments: while reading (e.g. a database query), during the
 * calculation, or on the final data of a feature set. An engine that returns true from
 * {@link #finalFilters()} is applied by the framework after the calculation.
 *
 * @param <T> the physical data type of the backend
 */
public abstract class FilterEngine<T> {

	public boolean finalFilters() {
		return false;
	}

	public T applyFilters(T data, FeatureSet features) {
		T result = data;
		for (SingleFilter filter : features.getFilters()) {
			result = applyFilter(result, filter);
		}
		return result;
	}

	protected T applyFilter(T data, SingleFilter filter) {
		switch (filter.getFilterType()) {
		case MIN:
			return doMinFilter(data, filter);
		case MAX:
			return doMaxFilter(data, filter);
		case EQUAL:
			return doEqualFilter(data, filter);
		case RANGE:
			return doRangeFilter(data, filter);
		case REGEX:
			return doRegexFilter(data, filter);
		case CATEGORICAL_INCLUSION:
			return doCategoricalInclusionFilter(data, filter);
		default:
			throw notImplemented(filter);
		}
	}

	protected T doMinFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	protected T doMaxFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	protected T doEqualFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	protected T doRangeFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	protected T doRegexFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	protected T doCategoricalInclusionFilter(T data, SingleFilter filter) {
		throw notImplemented(filter);
	}

	private UnsupportedEngineOperationException notImplemented(SingleFilter filter) {
		return new UnsupportedEngineOperationException("Filter type %s is not implemented by %s", filter.getFilterType(), getClass().getSimpleName());
	}
}
