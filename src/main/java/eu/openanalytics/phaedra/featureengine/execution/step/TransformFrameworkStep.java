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

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.transport.DataTransport;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import lombok.Getter;

/**
 * Copies the data of an instance to a new instance on another backend.
 */
@Getter
public class TransformFrameworkStep extends Step {

	private final UUID sourceInstanceId;
	private final ComputeFrameworkType sourceFramework;
	private final UUID instanceId;
	private final ComputeFrameworkType targetFramework;
	private final Set<UUID> carriedFeatureIds;

	public TransformFrameworkStep(UUID uuid, UUID sourceInstanceId, ComputeFrameworkType sourceFramework,
			UUID instanceId, ComputeFrameworkType targetFramework, Set<UUID> carriedFeatureIds) {
		super(uuid);
		if (sourceInstanceId.equals(instanceId)) {
			throw new ConfigurationException("A transform step needs two different instances, got %s twice", instanceId);
		}
		this.sourceInstanceId = sourceInstanceId;
		this.sourceFramework = sourceFramework;
		this.instanceId = instanceId;
		this.targetFramework = targetFramework;
		this.carriedFeatureIds = Set.copyOf(carriedFeatureIds);
	}

	@Override
	public StepOutcome execute(ComputeFrameworkRegistry registry, DataTransport transport) {
		markExecuted();
		transport.moveData(registry.get(instanceId), registry.get(sourceInstanceId), registry);
		return StepOutcome.empty();
	}

	@Override
	public Set<UUID> getInstanceIds() {
		return Set.of(sourceInstanceId, instanceId);
	}

	@Override
	public Set<UUID> getProvidedFeatureIds() {
		return carriedFeatureIds;
	}

	@Override
	public ComputeFrameworkType getProvidedFrameworkType() {
		return targetFramework;
	}

	@Override
	public Map<UUID, Set<UUID>> getSatisfiedChildren() {
		return Map.of(sourceInstanceId, Set.of(getUuid()), instanceId, Set.of(getUuid()));
	}

	@Override
	public String toString() {
		return String.format("TransformFrameworkStep[%s -> %s]", sourceFramework, targetFramework);
	}
}
