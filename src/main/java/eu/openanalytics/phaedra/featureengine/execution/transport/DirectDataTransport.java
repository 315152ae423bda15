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

import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;

/**
 * Hands data over by reference. All backend data types are immutable, so no copy is needed.
 */
public class DirectDataTransport implements DataTransport {

	@Override
	public void join(JoinStep step, ComputeFrameworkRegistry registry, ComputeFramework<?> destination, ComputeFramework<?> from) {
		step.execute(registry, destination, from);
	}

	@Override
	public <T> void moveData(ComputeFramework<T> destination, ComputeFramework<?> from, ComputeFrameworkRegistry registry) {
		destination.setData(destination.transform(from.getData(), from.getColumnNames()));
	}

	@Override
	public Object collect(ComputeFramework<?> instance, ComputeFrameworkRegistry registry) {
		return instance.getData();
	}
}
