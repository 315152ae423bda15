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

import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.Options;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;

/**
 * Base class for features that aggregate a source feature.
 *
 * Feature names follow the pattern {@code {aggregation_type}_aggr_{source_feature}},
 * e.g. {@code sum_aggr_sales} or {@code max_aggr_price}.
 */
public abstract class AggregatedFeatureGroup extends FeatureGroup {

	public static final String SEPARATOR = "_aggr_";

	public static final Set<String> AGGREGATION_TYPES = Set.of("sum", "min", "max", "avg", "mean", "count", "std", "var", "median");

	@Override
	public boolean matchFeatureGroupCriteria(String featureName, Options options) {
		String[] parts = split(featureName);
		return parts != null && AGGREGATION_TYPES.contains(parts[0]);
	}

	@Override
	public Set<Feature> inputFeatures(Options options, String featureName) {
		return Set.of(Feature.of(getSourceFeature(featureName)));
	}

	public static String getAggregationType(String featureName) {
		return requireParts(featureName)[0];
	}

	public static String getSourceFeature(String featureName) {
		return requireParts(featureName)[1];
	}

	private static String[] requireParts(String featureName) {
		String[] parts = split(featureName);
		if (parts == null) {
			throw new ConfigurationException("Invalid aggregated feature name format: %s", featureName);
		}
		return parts;
	}

	private static String[] split(String featureName) {
		String[] parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(featureName, SEPARATOR);
		if (parts == null || parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) return null;
		return parts;
	}
}
