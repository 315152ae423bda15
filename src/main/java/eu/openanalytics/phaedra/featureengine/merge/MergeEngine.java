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
package eu.openanalytics.phaedra.featureengine.merge;

import eu.openanalytics.phaedra.featureengine.enumeration.JoinType;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.UnsupportedEngineOperationException;
import eu.openanalytics.phaedra.featureengine.model.Index;

/**
 * Joins two datasets of one compute framework.
 *
 * The dispatch on the join type is fixed. Backends override the join verbs they support,
 * the others fail with an error that names the join type and the backend.
 *
 * @param <T> the physical data type of the backend
 */
public abstract class MergeEngine<T> {

	public T mergeInner(T leftData, T rightData, Index leftIndex, Index rightIndex) {
		throw notImplemented(JoinType.INNER);
	}

	public T mergeLeft(T leftData, T rightData, Index leftIndex, Index rightIndex) {
		throw notImplemented(JoinType.LEFT);
	}

	public T mergeRight(T leftData, T rightData, Index leftIndex, Index rightIndex) {
		throw notImplemented(JoinType.RIGHT);
	}

	public T mergeFullOuter(T leftData, T rightData, Index leftIndex, Index rightIndex) {
		throw notImplemented(JoinType.OUTER);
	}

	/**
	 * Concatenate two datasets of the same shape: left rows first, then right rows.
	 */
	public T mergeAppend(T leftData, T rightData, Index leftIndex, Index rightIndex) {
		throw new UnsupportedEngineOperationException("Append is not implemented by %s", getClass().getSimpleName());
	}

	public final T merge(T leftData, T rightData, JoinType joinType, Index leftIndex, Index rightIndex) {
		if (joinType == null) {
			throw new ConfigurationException("Join type must be set to merge data in %s", getClass().getSimpleName());
		}
		switch (joinType) {
		case INNER:
			return mergeInner(leftData, rightData, leftIndex, rightIndex);
		case LEFT:
			return mergeLeft(leftData, rightData, leftIndex, rightIndex);
		case RIGHT:
			return mergeRight(leftData, rightData, leftIndex, rightIndex);
		case OUTER:
			return mergeFullOuter(leftData, rightData, leftIndex, rightIndex);
		default:
			throw notImplemented(joinType);
		}
	}

	/**
	 * Fail when either index has more than one column. Only single column keys are supported.
	 */
	protected void requireSimpleIndex(Index leftIndex, Index rightIndex) {
		if (leftIndex.isComposite() || rightIndex.isComposite()) {
			throw new UnsupportedEngineOperationException("Composite index %s / %s is not implemented by %s",
					leftIndex.getColumns(), rightIndex.getColumns(), getClass().getSimpleName());
		}
	}

	private UnsupportedEngineOperationException notImplemented(JoinType joinType) {
		return new UnsupportedEngineOperationException("Join type %s is not implemented by %s", joinType.getValue(), getClass().getSimpleName());
	}
}
