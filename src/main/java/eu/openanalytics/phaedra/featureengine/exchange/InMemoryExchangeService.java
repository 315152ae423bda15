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

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;

/**
 * Keeps exchanged tables as serialized bytes in memory. Safe for concurrent use by several workers.
 */
@Service
public class InMemoryExchangeService implements ExchangeService {

	private final Map<String, Map<String, byte[]>> store = new ConcurrentHashMap<>();
	private final TableCodec codec;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public InMemoryExchangeService(ObjectMapper objectMapper) {
		this.codec = new TableCodec(objectMapper);
	}

	@Override
	public String upload(String location, Object data, String objectId) {
		byte[] bytes = codec.encode(data);
		store.computeIfAbsent(location, l -> new ConcurrentHashMap<>()).put(objectId, bytes);
		logger.debug("Uploaded {} bytes to {}/{}", bytes.length, location, objectId);
		return objectId;
	}

	@Override
	public Object download(String location, String objectId) {
		Map<String, byte[]> objects = store.get(location);
		byte[] bytes = (objects == null) ? null : objects.get(objectId);
		if (bytes == null) {
			throw new FeatureEngineException("No object %s found at location %s", objectId, location);
		}
		return codec.decode(bytes);
	}

	@Override
	public void drop(String location, Set<String> objectIds) {
		Map<String, byte[]> objects = store.get(location);
		if (objects == null) return;
		objectIds.forEach(objects::remove);
		logger.debug("Dropped {} from {}", objectIds, location);
	}

	@Override
	public Set<String> list(String location) {
		Map<String, byte[]> objects = store.get(location);
		if (objects == null) return Collections.emptySet();
		return new HashSet<>(objects.keySet());
	}
}
