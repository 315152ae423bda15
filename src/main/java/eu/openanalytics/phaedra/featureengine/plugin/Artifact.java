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

import eu.openanalytics.phaedra.featureengine.exception.ArtifactException;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;

/**
 * Loads and saves the artifact of a feature set, for example a trained model.
 *
 * By default an artifact is loaded from the feature set options, under the name of the feature
 * that requested it, and saved by handing it back to the caller in the run result. Override
 * {@link #customLoader(FeatureSet)} and {@link #customSaver(FeatureSet, Object)} to store it elsewhere.
 */
public abstract class Artifact {

	public final Object load(FeatureSet features) {
		if (features.getArtifactToLoad() == null) return null;

		validate(features);
		Object loaded = customLoader(features);
		if (loaded == null) {
			throw new ArtifactException("No artifact to load for %s although it was requested", features.getArtifactToLoad());
		}
		return loaded;
	}

	public final Object save(FeatureSet features, Object artifact) {
		if (features.getArtifactToSave() == null) return null;

		validate(features);
		Object saved = customSaver(features, artifact);
		if (saved == null) {
			throw new ArtifactException("No artifact to save for %s although it was requested", features.getArtifactToSave());
		}
		return saved;
	}

	protected Object customLoader(FeatureSet features) {
		return features.getOptionsKey(features.getArtifactToLoad());
	}

	protected Object customSaver(FeatureSet features, Object artifact) {
		return artifact;
	}

	private static void validate(FeatureSet features) {
		// Both getters fail when no feature was added yet.
		features.getOptions();
		features.getNameOfOneFeature();
	}

	public final String getClassName() {
		return getClass().getSimpleName();
	}
}
