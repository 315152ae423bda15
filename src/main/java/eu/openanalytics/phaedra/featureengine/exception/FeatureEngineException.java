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
 * Base class of all errors raised by the engine. None of them is recovered locally:
 * they propagate and abort the run.
 */
public class FeatureEngineException extends RuntimeException {

	private static final long serialVersionUID = 4188153606735011432L;

	public FeatureEngineException(String msg) {
		super(msg);
	}

	public FeatureEngineException(String msg, Throwable cause) {
		super(msg, cause);
	}

	public FeatureEngineException(String msg, Object... args) {
		super(String.format(msg, args));
	}
}
