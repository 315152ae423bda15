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
package eu.openanalytics.phaedra.featureengine.config;

import java.util.EnumSet;
import java.util.Set;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import lombok.Data;

/**
 * Engine settings, read from the {@code phaedra.featureengine.*} properties.
 */
@Data
public class FeatureEngineProperties {

	/**
	 * The mode used by runs that do not specify one.
	 */
	private ParallelizationMode mode = ParallelizationMode.SYNC;

	/**
	 * Size of the worker pool in the THREADING and MULTIPROCESSING modes.
	 */
	private int workerThreads = 4;

	/**
	 * The backends used by runs that do not specify them.
	 */
	private Set<ComputeFrameworkType> computeFrameworks = EnumSet.allOf(ComputeFrameworkType.class);

	/**
	 * Log the duration of every feature calculation.
	 */
	private boolean timeCalculations = false;
}
