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

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.transport.DataTransport;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.model.Link;
import lombok.Getter;

/**
 * Merges the data of one instance (the "from" side, right side of the link) into another
 * instance (the destination, left side of the link).
 *
 * The from side is handed over either as the instance itself, when both share memory, or as its
 * uuid, in which case its data is read from the exchange service. When the destination was
 * uploaded to the exchange service before, the merged data replaces it under the same id.
 */
@Getter
public class JoinStep extends Step {

	private final Link link;
	private final ComputeFrameworkType leftFramework;
	private final ComputeFrameworkType rightFramework;
	private final Set<UUID> leftFrameworkUuids;
	private final Set<UUID> rightFrameworkUuids;
	private final Set<UUID> requiredUuids;
	private final UUID instanceId;
	private final UUID fromInstanceId;

	private static final Logger logger = LoggerFactory.getLogger(JoinStep.class);

	public JoinStep(UUID uuid, Link link, ComputeFrameworkType leftFramework, ComputeFrameworkType rightFramework,
			Set<UUID> leftFrameworkUuids, Set<UUID> rightFrameworkUuids, UUID instanceId, UUID fromInstanceId) {
		super(uuid);
		if (instanceId.equals(fromInstanceId)) {
			throw new ConfigurationException("A join step needs two different instances, got %s twice", instanceId);
		}
		this.link = link;
		this.leftFramework = leftFramework;
		this.rightFramework = rightFramework;
		this.leftFrameworkUuids = Set.copyOf(leftFrameworkUuids);
		this.rightFrameworkUuids = Set.copyOf(rightFrameworkUuids);
		Set<UUID> required = new LinkedHashSet<>(leftFrameworkUuids);
		required.addAll(rightFrameworkUuids);
		this.requiredUuids = Set.copyOf(required);
		this.instanceId = instanceId;
		this.fromInstanceId = fromInstanceId;
	}

	/**
	 * Return the id of this step if it consumes the given feature calculated on the given backend.
	 */
	public Optional<UUID> matched(ComputeFrameworkType frameworkType, UUID featureId) {
		if (!requiredUuids.contains(featureId)) return Optional.empty();
		if (frameworkType != leftFramework && frameworkType != rightFramework) return Optional.empty();
		return Optional.of(getUuid());
	}

	@Override
	public StepOutcome execute(ComputeFrameworkRegistry registry, DataTransport transport) {
		transport.join(this, registry, registry.get(instanceId), registry.get(fromInstanceId));
		return StepOutcome.empty();
	}

	/**
	 * Join with data handed over directly by the from instance.
	 */
	public void execute(ComputeFrameworkRegistry registry, ComputeFramework<?> cfw, ComputeFramework<?> from) {
		if (from == null) {
			throw new FeatureEngineException("Join step %s has no from side", this);
		}
		markExecuted();
		merge(registry, cfw, from.getData(), from.getColumnNames());
	}

	/**
	 * Join with data of the from instance read from the exchange service.
	 */
	public void execute(ComputeFrameworkRegistry registry, ComputeFramework<?> cfw, UUID from) {
		if (from == null) {
			throw new FeatureEngineException("Join step %s has no from side", this);
		}
		if (registry.getLocation() == null) {
			throw new ConfigurationException("Join step %s reads %s from the exchange service, but no exchange location is set", this, from);
		}
		markExecuted();
		Object external = registry.getExchangeService().download(registry.getLocation(), from.toString());
		merge(registry, cfw, cfw.convertExternalDataBack(external), Set.of());
	}

	private <T> void merge(ComputeFrameworkRegistry registry, ComputeFramework<T> cfw, Object fromData, Set<String> fromColumns) {
		T right = cfw.transform(fromData, fromColumns);
		T merged = cfw.mergeEngine().merge(cfw.getData(), right, link.getJoinType(), link.getLeftIndex(), link.getRightIndex());
		cfw.setData(merged);

		if (registry.isExternalized(cfw.getUuid())) {
			logger.debug("Re-uploading joined data of {}", cfw);
			cfw.uploadFinishedData(registry.getLocation());
		}
	}

	@Override
	public Set<UUID> getInstanceIds() {
		return Set.of(instanceId, fromInstanceId);
	}

	@Override
	public Set<UUID> getProvidedFeatureIds() {
		return requiredUuids;
	}

	@Override
	public ComputeFrameworkType getProvidedFrameworkType() {
		return leftFramework;
	}

	@Override
	public Map<UUID, Set<UUID>> getSatisfiedChildren() {
		return Map.of(instanceId, Set.of(getUuid()), fromInstanceId, Set.of(getUuid()));
	}

	@Override
	public String toString() {
		return String.format("JoinStep[%s %s.%s = %s.%s]", link.getJoinType().getValue(),
				link.getLeftFeatureGroup().getSimpleName(), link.getLeftIndex().getColumns(),
				link.getRightFeatureGroup().getSimpleName(), link.getRightIndex().getColumns());
	}
}
