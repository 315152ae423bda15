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
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.transport.DataTransport;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;

/**
 * A node of an execution plan. Every step runs exactly once.
 */
public abstract class Step {

	private final UUID uuid;
	private final AtomicBoolean executed = new AtomicBoolean(false);

	protected Step(UUID uuid) {
		this.uuid = Objects.requireNonNull(uuid);
	}

	public abstract StepOutcome execute(ComputeFrameworkRegistry registry, DataTransport transport);

	/**
	 * The instance whose data this step produces or changes.
	 */
	public abstract UUID getInstanceId();

	/**
	 * All instances this step works on. No other step may work on them while this step runs.
	 */
	public abstract Set<UUID> getInstanceIds();

	/**
	 * The features whose data is available on {@link #getInstanceId()} once this step completed.
	 */
	public abstract Set<UUID> getProvidedFeatureIds();

	public abstract ComputeFrameworkType getProvidedFrameworkType();

	/**
	 * The children to report as calculated after this step completed, by instance id.
	 */
	public abstract Map<UUID, Set<UUID>> getSatisfiedChildren();

	protected final void markExecuted() {
		if (!executed.compareAndSet(false, true)) {
			throw new FeatureEngineException("Step %s was already executed", this);
		}
	}

	public final boolean isExecuted() {
		return executed.get();
	}

	public final UUID getUuid() {
		return uuid;
	}

	@Override
	public final boolean equals(Object o) {
		return o instanceof Step step && uuid.equals(step.uuid);
	}

	@Override
	public final int hashCode() {
		return uuid.hashCode();
	}
}
