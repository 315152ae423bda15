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
package eu.openanalytics.phaedra.featureengine.enumeration;

import java.util.Arrays;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;

public enum JoinType {

	INNER("inner"),
	LEFT("left"),
	RIGHT("right"),
	OUTER("outer");

	private final String value;

	JoinType(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/**
	 * Parse a join type name. Accepts the enum name or its lower-case value,
	 * and "full outer" as an alias for {@link #OUTER}.
	 */
	public static JoinType of(String name) {
		if (name == null) throw new ConfigurationException("Join type must not be null");
		String normalized = name.trim().toLowerCase();
		if (normalized.equals("full outer") || normalized.equals("full_outer")) return OUTER;
		return Arrays.stream(values())
				.filter(t -> t.value.equals(normalized))
				.findFirst()
				.orElseThrow(() -> new ConfigurationException("Unknown join type: %s", name));
	}
}
