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
package eu.openanalytics.phaedra.featureengine.execution.step;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.transport.DataTransport;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.plugin.Artifact;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;
import lombok.Getter;

/**
 * Calculates one feature set of a feature group on a compute framework instance.
 */
@Getter
public class FeatureGroupStep extends Step {

	private final FeatureGroup featureGroup;
	private final FeatureSet featureSet;
	private final ComputeFrameworkType frameworkType;
	private final UUID instanceId;

	public FeatureGroupStep(UUID uuid, FeatureGroup featureGroup, FeatureSet featureSet, ComputeFrameworkType frameworkType, UUID instanceId) {
		super(uuid);
		this.featureGroup = featureGroup;
		this.featureSet = featureSet;
		this.frameworkType = frameworkType;
		this.instanceId = instanceId;
	}

	@Override
	public StepOutcome execute(ComputeFrameworkRegistry registry, DataTransport transport) {
		markExecuted();
		ComputeFramework<?> cfw = registry.get(instanceId);
		Object handle = cfw.runCalculation(featureGroup, featureSet, registry.getLocation(), null);
		return new StepOutcome(handle, saveArtifact());
	}

	private Map<String, Object> saveArtifact() {
		Artifact artifact = featureGroup.artifact();
		if (artifact == null || featureSet.getArtifactToSave() == null) return Collections.emptyMap();
		Object saved = artifact.save(featureSet, featureSet.getSavedArtifact());
		return Map.of(featureSet.getArtifactToSave(), saved);
	}

	@Override
	public Set<UUID> getInstanceIds() {
		return Set.of(instanceId);
	}

	@Override
	public Set<UUID> getProvidedFeatureIds() {
		return featureSet.getAllFeatureIds();
	}

	@Override
	public ComputeFrameworkType getProvidedFrameworkType() {
		return frameworkType;
	}

	@Override
	public Map<UUID, Set<UUID>> getSatisfiedChildren() {
		return Map.of(instanceId, featureSet.getAllFeatureIds());
	}

	@Override
	public String toString() {
		return String.format("FeatureGroupStep[%s %s on %s]", featureGroup.getClassName(), featureSet.getAllNames(), frameworkType);
	}
}
