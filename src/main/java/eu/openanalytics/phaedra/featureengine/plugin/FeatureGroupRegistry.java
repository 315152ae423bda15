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

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.model.Feature;

/**
 * Resolves features to the feature group that calculates them.
 */
@Service
public class FeatureGroupRegistry {

	private final List<FeatureGroup> featureGroups;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public FeatureGroupRegistry(List<FeatureGroup> featureGroups) {
		this.featureGroups = List.copyOf(featureGroups);
		logger.info("Registered feature groups: {}", featureGroups);
	}

	public FeatureGroup resolve(Feature feature) {
		List<FeatureGroup> matches = featureGroups.stream()
				.filter(fg -> fg.matchFeatureGroupCriteria(feature.getName(), feature.getOptions()))
				.collect(Collectors.toList());

		if (matches.isEmpty()) {
			throw new ConfigurationException("No feature group found for feature %s", feature);
		}
		if (matches.size() > 1) {
			throw new ConfigurationException("Multiple feature groups found for feature %s: %s", feature, matches);
		}
		return matches.get(0);
	}

	public List<FeatureGroup> getFeatureGroups() {
		return featureGroups;
	}
}
