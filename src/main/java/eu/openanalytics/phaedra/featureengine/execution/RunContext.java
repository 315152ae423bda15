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

import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.execution.transport.DataTransport;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Setter;

@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Setter(AccessLevel.PRIVATE)
public class RunContext {

	String runId;
	ParallelizationMode mode;

	ExecutionPlan plan;
	ComputeFrameworkRegistry registry;
	DataTransport transport;

	/**
	 * Create the context of a new run. In a mode that exchanges data, the run id is also the exchange location.
	 */
	public static RunContext create(ExecutionPlan plan, ParallelizationMode mode, ExchangeService exchangeService) {
		String runId = UUID.randomUUID().toString();
		String location = mode.usesExchange() ? runId : null;
		ComputeFrameworkRegistry registry = new ComputeFrameworkRegistry(location, exchangeService, plan.getInstances());
		return new RunContext(runId, mode, plan, registry, DataTransport.forMode(mode));
	}
}
