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
package eu.openanalytics.phaedra.featureengine.execution;

import java.util.Set;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.openanalytics.phaedra.featureengine.enumeration.WrappedFunction;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;

/**
 * Logs how long every feature calculation takes.
 */
public class TimingFunctionExtender implements FunctionExtender {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@Override
	public Set<WrappedFunction> wraps() {
		return Set.of(WrappedFunction.CALCULATE_FEATURE);
	}

	@Override
	public Object apply(WrappedFunction function, BiFunction<Object, FeatureSet, Object> call, Object data, FeatureSet features) {
		long start = System.currentTimeMillis();
		try {
			return call.apply(data, features);
		} finally {
			logger.info("Calculation of {} took {} ms", features.getAllNames(), System.currentTimeMillis() - start);
		}
	}
}
