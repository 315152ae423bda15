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
package eu.openanalytics.phaedra.featureengine.execution.transport;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;

/**
 * How data moves from one compute framework instance to another.
 *
 * The strategy is fixed per parallelization mode: instances that share memory hand over their
 * data directly, isolated instances only exchange data through the exchange service.
 */
public interface DataTransport {

	/**
	 * Run a join step, handing the data of {@code from} to the step.
	 */
	void join(JoinStep step, ComputeFrameworkRegistry registry, ComputeFramework<?> destination, ComputeFramework<?> from);

	/**
	 * Replace the data of {@code destination} with the data of {@code from}, converted to the destination backend.
	 */
	<T> void moveData(ComputeFramework<T> destination, ComputeFramework<?> from, ComputeFrameworkRegistry registry);

	/**
	 * Return a copy of the current data of an instance, to be handed to the caller of the run.
	 */
	Object collect(ComputeFramework<?> instance, ComputeFrameworkRegistry registry);

	static DataTransport forMode(ParallelizationMode mode) {
		return mode.usesExchange() ? new ExchangeDataTransport() : new DirectDataTransport();
	}
}
