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

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.Options;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;

/**
 * Base class for features that fill the missing values of a source feature.
 *
 * Feature names follow the pattern {@code {imputation_method}_imputed_{source_feature}},
 * e.g. {@code mean_imputed_income}. The {@code constant} method reads its value from the
 * {@value #CONSTANT_VALUE} option; all methods except {@code constant} accept a
 * {@value #GROUP_BY_FEATURES} option to impute within groups.
 */
public abstract class MissingValueFeatureGroup extends FeatureGroup {

	public static final String SEPARATOR = "_imputed_";
	public static final String CONSTANT_VALUE = "constant_value";
	public static final String GROUP_BY_FEATURES = "group_by_features";

	public static final Set<String> IMPUTATION_METHODS = Set.of("mean", "median", "mode", "constant", "ffill", "bfill");

	@Override
	public boolean matchFeatureGroupCriteria(String featureName, Options options) {
		String[] parts = split(featureName);
		return parts != null && IMPUTATION_METHODS.contains(parts[0]);
	}

	@Override
	public Set<Feature> inputFeatures(Options options, String featureName) {
		return Set.of(Feature.of(getSourceFeature(featureName)));
	}

	public static String getImputationMethod(String featureName) {
		return requireParts(featureName)[0];
	}

	public static String getSourceFeature(String featureName) {
		return requireParts(featureName)[1];
	}

	protected static Object getConstantValue(FeatureSet features, String featureName) {
		Object value = features.getOptionsKey(CONSTANT_VALUE);
		if (value == null) {
			throw new ConfigurationException("Option %s is required for feature %s", CONSTANT_VALUE, featureName);
		}
		return value;
	}

	protected static List<String> getGroupByFeatures(FeatureSet features) {
		Object value = features.getOptionsKey(GROUP_BY_FEATURES);
		if (value == null) return List.of();
		if (value instanceof Collection<?> names) {
			return names.stream().map(String::valueOf).collect(Collectors.toList());
		}
		return List.of(String.valueOf(value));
	}

	private static String[] requireParts(String featureName) {
		String[] parts = split(featureName);
		if (parts == null) {
			throw new ConfigurationException("Invalid imputed feature name format: %s", featureName);
		}
		return parts;
	}

	private static String[] split(String featureName) {
		String[] parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(featureName, SEPARATOR);
		if (parts == null || parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) return null;
		return parts;
	}
}
