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
package eu.openanalytics.phaedra.featureengine.exception;

/**
 * Caller misuse: missing options, a feature set used before a feature was added,
 * filters set twice, features that cannot be resolved or joined.
 */
public class ConfigurationException extends FeatureEngineException {

	private static final long serialVersionUID = -1830431062251930811L;

	public ConfigurationException(String msg) {
		super(msg);
	}

	public ConfigurationException(String msg, Object... args) {
		super(msg, args);
	}
}
