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
package eu.openanalytics.phaedra.featureengine.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.filter.FilterEngine;
import lombok.Getter;
import lombok.Setter;

/**
 * The features that are calculated together in one pass of a feature group.
 *
 * The first feature that is added fixes the options and the representative name of the set.
 * These are used for artifact identity, so they never change afterwards.
 */
@Getter
public class FeatureSet {

    private final Set<Feature> features = new LinkedHashSet<>();

    private Options options;
    private UUID anyUuid;
    private String nameOfOneFeature;

    private Set<SingleFilter> filters;

    @Setter
    private FilterEngine filterEngine;

    private String artifactToSave;
    private String artifactToLoad;

    @Setter
    private Object savedArtifact;

    public void add(Feature feature) {
        features.add(feature);
        if (options == null) {
            options = feature.getOptions();
            nameOfOneFeature = feature.getName();
            anyUuid = feature.getUuid();
        }
    }

    public void remove(Feature feature) {
        features.remove(feature);
    }

    public Set<UUID> getAllFeatureIds() {
        return features.stream().map(Feature::getUuid).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> getAllNames() {
        return features.stream().map(Feature::getName).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Options getOptions() {
        if (options == null) {
            throw new ConfigurationException("No options set. Add a feature to the feature set first.");
        }
        return options;
    }

    public Object getOptionsKey(String key) {
        return getOptions().get(key);
    }

    public Set<String> getInitialRequestedFeatures() {
        return features.stream()
                .filter(Feature::isInitialRequested)
                .map(Feature::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public String getNameOfOneFeature() {
        if (nameOfOneFeature == null) {
            throw new ConfigurationException("No feature added yet. Add a feature to the feature set first.");
        }
        return nameOfOneFeature;
    }

    public Set<SingleFilter> getFilters() {
        return filters == null ? Collections.emptySet() : filters;
    }

    public boolean hasFilters() {
        return filters != null && !filters.isEmpty();
    }

    public void addFilters(Set<SingleFilter> singleFilters) {
        if (filters != null) {
            throw new ConfigurationException("Filters are already set on feature set %s", getAllNames());
        }
        if (singleFilters == null) {
            throw new ConfigurationException("Filters must not be null");
        }
        filters = Collections.unmodifiableSet(new LinkedHashSet<>(singleFilters));
    }

    /**
     * Decide whether this feature set loads an existing artifact or saves a new one.
     * An artifact is loaded when one of the feature names is present as an options key.
     */
    public void addArtifactName() {
        Options opts = getOptions();
        for (String name : getAllNames()) {
            if (opts.containsKey(name)) {
                artifactToLoad = name;
                return;
            }
        }
        artifactToSave = getNameOfOneFeature();
    }

    @Override
    public String toString() {
        return String.format("FeatureSet%s", getAllNames());
    }
}
