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
package eu.openanalytics.phaedra.featureengine.framework;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.enumeration.WrappedFunction;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.exception.FeatureValidationException;
import eu.openanalytics.phaedra.featureengine.exception.UnsupportedEngineOperationException;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.filter.FilterEngine;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;
import eu.openanalytics.phaedra.featureengine.merge.MergeEngine;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;

/**
 * One executing unit, bound to one physical backend.
 *
 * An instance is created per cluster of feature groups while planning a run, and keeps the
 * data of that cluster while its feature groups are calculated and joined. It declares the
 * children that depend on its data; once all of them have been calculated, the data is dropped.
 *
 * The scheduler guarantees that only one step works on an instance at any time, so the
 * running state is not synchronized.
 *
 * @param <T> the physical data type of the backend
 */
public abstract class ComputeFramework<T> {

	private final ParallelizationMode mode;
	private final Set<UUID> childrenIfRoot;
	private final Set<FunctionExtender> functionExtenders;
	private final UUID uuid = UUID.randomUUID();

	private final Set<UUID> alreadyCalculatedChildren = new HashSet<>();
	private final Set<String> columnNames = new LinkedHashSet<>();
	private final List<String> objectIds = new ArrayList<>();

	private T data;
	private ExchangeService exchangeService;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	protected ComputeFramework(ParallelizationMode mode, Set<UUID> childrenIfRoot, Set<FunctionExtender> functionExtenders) {
		this.mode = Objects.requireNonNull(mode, "Parallelization mode must be set");
		this.childrenIfRoot = Set.copyOf(childrenIfRoot);
		this.functionExtenders = (functionExtenders == null) ? Collections.emptySet() : Set.copyOf(functionExtenders);
	}

	/**
	 * The physical type this backend normalizes all data to.
	 */
	public abstract Class<T> expectedDataFramework();

	public abstract ComputeFrameworkType getFrameworkType();

	/**
	 * Return a conversion between this backend's type and another type, or null if there is none.
	 *
	 * @param fromOther true to convert from {@code other} to this backend's type, false for the opposite direction
	 * @param other the other type
	 */
	protected Function<Object, ?> frameworkTransformFunction(boolean fromOther, Class<?> other) {
		return null;
	}

	/**
	 * Build this backend's type directly from generic input such as a map of columns.
	 * Returns null if the input is not supported.
	 */
	protected T constructFrom(Object input, Set<String> featureNames) {
		return null;
	}

	protected Set<String> columnNamesOf(T data) {
		return Collections.emptySet();
	}

	/**
	 * Coerce data to {@link #expectedDataFramework()}. Data that already has the expected type is returned as is.
	 */
	public T transform(Object input, Set<String> featureNames) {
		Class<T> expected = expectedDataFramework();
		if (expected.isInstance(input)) {
			return expected.cast(input);
		}
		if (input != null) {
			Function<Object, ?> conversion = frameworkTransformFunction(true, input.getClass());
			if (conversion != null) {
				return expected.cast(conversion.apply(input));
			}
			T constructed = constructFrom(input, featureNames);
			if (constructed != null) {
				return constructed;
			}
		}
		throw DataShapeException.of(input, expected, getClass());
	}

	public T selectColumns(T input, Set<String> names) {
		return input;
	}

	public MergeEngine<T> mergeEngine() {
		throw UnsupportedEngineOperationException.of("Merge", getClass());
	}

	public FilterEngine<T> filterEngine() {
		throw UnsupportedEngineOperationException.of("Filtering", getClass());
	}

	/**
	 * Calculate a feature set of a feature group on this instance.
	 *
	 * @param featureGroup the feature group providing the calculation
	 * @param features the features to calculate
	 * @param location the exchange location, or null when all units share memory
	 * @param input new input data for this instance, or null to continue on the current data
	 * @return null when no location is given; the data itself when other children still need it in this unit;
	 * otherwise the object id under which the data was uploaded to the exchange service
	 */
	public final Object runCalculation(FeatureGroup featureGroup, FeatureSet features, String location, Object input) {
		if (input != null) {
			data = transform(input, features.getAllNames());
		}

		runValidateInputFeatures(featureGroup, features);
		bindFilterEngine(features);

		Object calculated = runCalculateFeature(featureGroup, features);
		calculated = runFinalFilter(calculated, features);

		setData(transform(calculated, features.getAllNames()));

		runValidateOutputFeatures(featureGroup, features);

		if (location == null) {
			return null;
		}
		if (childrenIfRoot.size() > alreadyCalculatedChildren.size() + features.getFeatures().size()) {
			return data;
		}
		return uploadFinishedData(location);
	}

	private void runValidateInputFeatures(FeatureGroup featureGroup, FeatureSet features) {
		if (data == null) return;
		Object result = invoke(WrappedFunction.VALIDATE_INPUT_FEATURES, featureGroup::validateInputFeatures, data, features);
		checkValidationResult(result);
	}

	private void runValidateOutputFeatures(FeatureGroup featureGroup, FeatureSet features) {
		if (data == null) return;
		Object result = invoke(WrappedFunction.VALIDATE_OUTPUT_FEATURES, featureGroup::validateOutputFeatures, data, features);
		checkValidationResult(result);
	}

	private static void checkValidationResult(Object result) {
		if (result == null || Boolean.TRUE.equals(result)) return;
		throw new FeatureValidationException(result);
	}

	private Object runCalculateFeature(FeatureGroup featureGroup, FeatureSet features) {
		return invoke(WrappedFunction.CALCULATE_FEATURE, featureGroup::calculateFeature, data, features);
	}

	private void bindFilterEngine(FeatureSet features) {
		if (!features.hasFilters()) return;
		try {
			features.setFilterEngine(filterEngine());
		} catch (UnsupportedEngineOperationException e) {
			logger.debug("No filter engine bound for {}: {}", features, e.getMessage());
		}
	}

	@SuppressWarnings("unchecked")
	private Object runFinalFilter(Object calculated, FeatureSet features) {
		FilterEngine<T> filterEngine = (FilterEngine<T>) features.getFilterEngine();
		if (filterEngine == null || !features.hasFilters() || !filterEngine.finalFilters()) {
			return calculated;
		}
		return filterEngine.applyFilters(transform(calculated, features.getAllNames()), features);
	}

	private Object invoke(WrappedFunction function, BiFunction<Object, FeatureSet, Object> call, Object input, FeatureSet features) {
		FunctionExtender extender = getFunctionExtender(function);
		if (extender == null) {
			return call.apply(input, features);
		}
		return extender.apply(function, call, input, features);
	}

	public final FunctionExtender getFunctionExtender(WrappedFunction function) {
		FunctionExtender found = null;
		for (FunctionExtender extender : functionExtenders) {
			if (!extender.wraps().contains(function)) continue;
			if (found != null) {
				throw new ConfigurationException("Multiple function extenders found for %s: %s, %s",
						function, found.getClass().getSimpleName(), extender.getClass().getSimpleName());
			}
			found = extender;
		}
		return found;
	}

	/**
	 * Mark children as calculated, and drop the data of this instance once all declared children are satisfied.
	 * Calling this again after the data was dropped has no further effect.
	 */
	public final DropOutcome addAlreadyCalculatedChildrenAndDropIfPossible(Set<UUID> children, String location) {
		alreadyCalculatedChildren.addAll(children);

		if (alreadyCalculatedChildren.containsAll(childrenIfRoot)) {
			dropLastData(location);
			return DropOutcome.dropped();
		}

		if (!objectIds.isEmpty()) {
			Set<UUID> pending = new HashSet<>(childrenIfRoot);
			pending.removeAll(alreadyCalculatedChildren);
			return DropOutcome.waiting(pending);
		}
		return DropOutcome.notReady();
	}

	/**
	 * Upload the current data under the uuid of this instance.
	 */
	public final String uploadFinishedData(String location) {
		return uploadTable(location, uuid);
	}

	public final String uploadTable(String location, UUID objectId) {
		String id = objectId.toString();
		if (!objectIds.isEmpty() && !objectIds.contains(id)) {
			throw new UnsupportedEngineOperationException("%s already uploaded %s, keeping several external objects per instance is not supported",
					getClass().getSimpleName(), objectIds);
		}
		requireExchangeService().upload(location, canonicalData(), id);
		if (!objectIds.contains(id)) objectIds.add(id);
		return id;
	}

	/**
	 * The current data in the form in which it crosses the exchange service.
	 */
	public final ColumnTable canonicalData() {
		T input = data;
		if (input instanceof ColumnTable table) {
			return table;
		}
		Function<Object, ?> conversion = frameworkTransformFunction(false, ColumnTable.class);
		if (conversion == null) {
			throw DataShapeException.of(input, ColumnTable.class, getClass());
		}
		return (ColumnTable) conversion.apply(input);
	}

	/**
	 * Convert data downloaded from the exchange service back to this backend's type.
	 */
	public final T convertExternalDataBack(Object external) {
		Class<T> expected = expectedDataFramework();
		if (expected.isInstance(external)) {
			return expected.cast(external);
		}
		if (external instanceof ColumnTable) {
			Function<Object, ?> conversion = frameworkTransformFunction(true, ColumnTable.class);
			if (conversion != null) {
				return expected.cast(conversion.apply(external));
			}
		}
		throw new DataShapeException("Conversion from %s to %s is not supported by %s",
				external == null ? "null" : external.getClass().getName(), expected.getName(), getClass().getSimpleName());
	}

	public final void dropData(Set<String> objectIdsToDrop, String location) {
		requireExchangeService().drop(location, objectIdsToDrop);
	}

	public final void dropLastData(String location) {
		if (location != null && !objectIds.isEmpty()) {
			dropData(Set.of(objectIds.get(objectIds.size() - 1)), location);
			objectIds.clear();
		}
		data = null;
	}

	private ExchangeService requireExchangeService() {
		if (exchangeService == null) {
			throw new ConfigurationException("No exchange service bound to %s", getClass().getSimpleName());
		}
		return exchangeService;
	}

	public final void setExchangeService(ExchangeService exchangeService) {
		this.exchangeService = exchangeService;
	}

	public final T getData() {
		return data;
	}

	public final void setData(T data) {
		this.data = data;
		if (data != null) {
			columnNames.clear();
			columnNames.addAll(columnNamesOf(data));
		}
	}

	public final UUID getUuid() {
		return uuid;
	}

	public final ParallelizationMode getMode() {
		return mode;
	}

	public final Set<UUID> getChildrenIfRoot() {
		return childrenIfRoot;
	}

	public final Set<String> getColumnNames() {
		return Collections.unmodifiableSet(columnNames);
	}

	public final List<String> getObjectIds() {
		return Collections.unmodifiableList(objectIds);
	}

	public final String getClassName() {
		return getClass().getSimpleName();
	}

	@Override
	public final boolean equals(Object other) {
		if (!(other instanceof ComputeFramework<?> cfw)) return false;
		return getClassName().equals(cfw.getClassName()) && childrenIfRoot.equals(cfw.childrenIfRoot);
	}

	@Override
	public final int hashCode() {
		return Objects.hash(getClassName(), childrenIfRoot);
	}

	@Override
	public String toString() {
		return String.format("%s[%s]", getClassName(), uuid);
	}
}
