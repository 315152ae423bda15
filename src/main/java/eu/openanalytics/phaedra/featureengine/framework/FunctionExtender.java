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
package eu.openanalytics.phaedra.featureengine.framework;

import java.util.Set;
import java.util.function.BiFunction;

import eu.openanalytics.phaedra.featureengine.enumeration.WrappedFunction;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;

/**
 * Wraps feature group calls made by a compute framework, for example to measure or log them.
 * At most one extender may wrap a given function.
 */
public interface FunctionExtender {

	Set<WrappedFunction> wraps();

	Object apply(WrappedFunction function, BiFunction<Object, FeatureSet, Object> call, Object data, FeatureSet features);

}
