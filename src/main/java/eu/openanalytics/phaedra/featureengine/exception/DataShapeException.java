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

public class DataShapeException extends FeatureEngineException {

	private static final long serialVersionUID = -5502790431446384772L;

	public DataShapeException(String msg, Object... args) {
		super(msg, args);
	}

	public static DataShapeException of(Object data, Class<?> expected, Class<?> backend) {
		String observed = (data == null) ? "null" : data.getClass().getName();
		return new DataShapeException("Data type %s cannot be converted to %s by %s", observed, expected.getName(), backend.getSimpleName());
	}
}
