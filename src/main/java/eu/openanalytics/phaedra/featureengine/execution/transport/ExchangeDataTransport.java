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
package eu.openanalytics.phaedra.featureengine.execution.transport;

import java.util.Set;
import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;

/**
 * Hands data over through the exchange service only. The from instance uploads its data under
 * its own uuid and the receiving side downloads it by that id.
 */
public class ExchangeDataTransport implements DataTransport {

	@Override
	public void join(JoinStep step, ComputeFrameworkRegistry registry, ComputeFramework<?> destination, ComputeFramework<?> from) {
		UUID objectId = export(from, registry);
		step.execute(registry, destination, objectId);
	}

	@Override
	public <T> void moveData(ComputeFramework<T> destination, ComputeFramework<?> from, ComputeFrameworkRegistry registry) {
		UUID objectId = export(from, registry);
		Object external = registry.getExchangeService().download(registry.getLocation(), objectId.toString());
		destination.setData(destination.convertExternalDataBack(external));
	}

	@Override
	public Object collect(ComputeFramework<?> instance, ComputeFrameworkRegistry registry) {
		String location = requireLocation(registry);
		ExchangeService exchange = registry.getExchangeService();
		String key = UUID.randomUUID().toString();
		exchange.upload(location, instance.canonicalData(), key);
		try {
			return instance.convertExternalDataBack(exchange.download(location, key));
		} finally {
			exchange.drop(location, Set.of(key));
		}
	}

	private static UUID export(ComputeFramework<?> from, ComputeFrameworkRegistry registry) {
		from.uploadFinishedData(requireLocation(registry));
		return from.getUuid();
	}

	private static String requireLocation(ComputeFrameworkRegistry registry) {
		if (registry.getLocation() == null) {
			throw new ConfigurationException("The exchange transport needs an exchange location");
		}
		return registry.getLocation();
	}
}
