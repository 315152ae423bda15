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

import java.util.Arrays;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTableFramework;
import eu.openanalytics.phaedra.featureengine.framework.rowlist.RowListFramework;

/**
 * The backends a feature can be calculated on. The concrete backend of every feature
 * is chosen once, while planning a run.
 */
public enum ComputeFrameworkType {

	COLUMN_TABLE(ColumnTableFramework.class, ColumnTableFramework::new),
	ROW_LIST(RowListFramework.class, RowListFramework::new);

	private final Class<? extends ComputeFramework<?>> frameworkClass;
	private final ComputeFrameworkFactory factory;

	ComputeFrameworkType(Class<? extends ComputeFramework<?>> frameworkClass, ComputeFrameworkFactory factory) {
		this.frameworkClass = frameworkClass;
		this.factory = factory;
	}

	public Class<? extends ComputeFramework<?>> getFrameworkClass() {
		return frameworkClass;
	}

	public ComputeFrameworkFactory getFactory() {
		return factory;
	}

	/**
	 * Look up a backend by enum name or by the simple name of its class, e.g. "ColumnTableFramework".
	 */
	public static ComputeFrameworkType of(String name) {
		return Arrays.stream(values())
				.filter(t -> t.name().equalsIgnoreCase(name) || t.frameworkClass.getSimpleName().equals(name))
				.findFirst()
				.orElseThrow(() -> new ConfigurationException("Unknown compute framework: %s", name));
	}
}
