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
package eu.openanalytics.phaedra.featureengine.plugin;

import java.util.Collections;
import java.util.Set;

import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.Options;

/**
 * The business logic behind one or more features.
 *
 * A feature group declares which feature names it serves, which features it needs as input and on
 * which backends it can run. The engine calls {@link #calculateFeature(Object, FeatureSet)} with the
 * current data of the compute framework instance the feature set was assigned to.
 */
public abstract class FeatureGroup {

	/**
	 * Return true if this group calculates the feature with the given name and options.
	 * By default, a group serves its own class name and the names of {@link #featureNamesSupported()}.
	 */
	public boolean matchFeatureGroupCriteria(String featureName, Options options) {
		return getClassName().equals(featureName) || featureNamesSupported().contains(featureName);
	}

	public Set<String> featureNamesSupported() {
		return Collections.emptySet();
	}

	/**
	 * The features this feature needs as input, or null if the group produces its data from nothing.
	 */
	public Set<Feature> inputFeatures(Options options, String featureName) {
		return null;
	}

	/**
	 * Calculate the features of the set.
	 *
	 * @param data the current data of the instance, or null for a group without input features
	 * @param features the features to calculate
	 * @return the new data, in any form the backend can transform
	 */
	public abstract Object calculateFeature(Object data, FeatureSet features);

	/**
	 * The backends this group can run on, or null if it runs on any backend.
	 */
	public Set<ComputeFrameworkType> computeFrameworkRule() {
		return null;
	}

	/**
	 * Validate the data before calculation. Return null or true if valid, any other value is raised as the error detail.
	 */
	public Object validateInputFeatures(Object data, FeatureSet features) {
		return null;
	}

	/**
	 * Validate the data after calculation. Return null or true if valid, any other value is raised as the error detail.
	 */
	public Object validateOutputFeatures(Object data, FeatureSet features) {
		return null;
	}

	/**
	 * The artifact handler of this group, or null if the group neither loads nor saves artifacts.
	 */
	public Artifact artifact() {
		return null;
	}

	public final String getClassName() {
		return getClass().getSimpleName();
	}

	@Override
	public String toString() {
		return getClassName();
	}
}
