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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;

/**
 * The compute framework instances of one run, and the exchange location they share.
 * The location is null when all instances live in the same address space.
 */
public class ComputeFrameworkRegistry {

	private final String location;
	private final ExchangeService exchangeService;
	private final Map<UUID, ComputeFramework<?>> instances;

	public ComputeFrameworkRegistry(String location, ExchangeService exchangeService, Collection<? extends ComputeFramework<?>> instances) {
		this.location = location;
		this.exchangeService = exchangeService;
		Map<UUID, ComputeFramework<?>> map = new LinkedHashMap<>();
		for (ComputeFramework<?> cfw : instances) {
			cfw.setExchangeService(exchangeService);
			map.put(cfw.getUuid(), cfw);
		}
		this.instances = Collections.unmodifiableMap(map);
	}

	public ComputeFramework<?> get(UUID instanceId) {
		ComputeFramework<?> cfw = instances.get(instanceId);
		if (cfw == null) {
			throw new ConfigurationException("Unknown compute framework instance %s", instanceId);
		}
		return cfw;
	}

	public Collection<ComputeFramework<?>> getInstances() {
		return instances.values();
	}

	/**
	 * True if data of the instance is currently stored in the exchange service.
	 */
	public boolean isExternalized(UUID instanceId) {
		return location != null && exchangeService.list(location).contains(instanceId.toString());
	}

	/**
	 * Drop every object stored under the location of this run.
	 */
	public Set<String> dropAll() {
		if (location == null) return Collections.emptySet();
		Set<String> remaining = new HashSet<>(exchangeService.list(location));
		if (!remaining.isEmpty()) exchangeService.drop(location, remaining);
		return remaining;
	}

	public String getLocation() {
		return location;
	}

	public ExchangeService getExchangeService() {
		return exchangeService;
	}
}
