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
package eu.openanalytics.phaedra.featureengine.exchange;

import java.util.Set;

/**
 * Table store used to hand data between execution units that do not share memory.
 *
 * Objects are addressed by a location, which is scoped to one run, and an object id. Data
 * is always exchanged in its canonical form, a {@link eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable}.
 */
public interface ExchangeService {

	/**
	 * Store data under the given id, replacing any data that was stored under the same id.
	 *
	 * @return the object id
	 */
	String upload(String location, Object data, String objectId);

	/**
	 * @throws eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException if no object is stored under the id
	 */
	Object download(String location, String objectId);

	void drop(String location, Set<String> objectIds);

	Set<String> list(String location);

}
