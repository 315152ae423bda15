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

import lombok.Value;

/**
 * What a step hands back to the scheduler besides the data it left on its instances.
 */
@Value
public class StepOutcome {

	private static final StepOutcome EMPTY = new StepOutcome(null, Collections.emptyMap());

	/**
	 * The return value of the calculation pipeline: null, the data kept in the unit, or an exchange object id.
	 */
	Object handle;

	/**
	 * Artifacts saved by the step, by feature name.
	 */
	Map<String, Object> artifacts;

	public static StepOutcome empty() {
		return EMPTY;
	}
}
