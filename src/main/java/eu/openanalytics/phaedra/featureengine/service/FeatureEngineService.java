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
package eu.openanalytics.phaedra.featureengine.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.featureengine.config.FeatureEngineProperties;
import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.execution.ExecutionPlan;
import eu.openanalytics.phaedra.featureengine.execution.ExecutionPlanner;
import eu.openanalytics.phaedra.featureengine.execution.RunContext;
import eu.openanalytics.phaedra.featureengine.execution.StepScheduler;
import eu.openanalytics.phaedra.featureengine.execution.TimingFunctionExtender;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.Link;
import eu.openanalytics.phaedra.featureengine.model.RunResult;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;

/**
 * Entry point of the engine: plans and runs the calculation of a set of requested features.
 * Every call is one run with its own compute framework instances and exchange location.
 */
@Service
public class FeatureEngineService {

	private final ExecutionPlanner planner;
	private final StepScheduler scheduler;
	private final ExchangeService exchangeService;
	private final FeatureEngineProperties properties;
	private final Set<FunctionExtender> functionExtenders;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public FeatureEngineService(ExecutionPlanner planner, StepScheduler scheduler, ExchangeService exchangeService,
			FeatureEngineProperties properties, ObjectProvider<FunctionExtender> functionExtenders) {
		this.planner = planner;
		this.scheduler = scheduler;
		this.exchangeService = exchangeService;
		this.properties = properties;
		Set<FunctionExtender> extenders = functionExtenders.orderedStream().collect(Collectors.toCollection(LinkedHashSet::new));
		if (properties.isTimeCalculations()) {
			extenders.add(new TimingFunctionExtender());
		}
		this.functionExtenders = Collections.unmodifiableSet(extenders);
	}

	/**
	 * Calculate the features with the configured backends and mode.
	 */
	public RunResult runAll(Collection<Feature> features, Collection<Link> links) {
		return runAll(features, properties.getComputeFrameworks(), links, Set.of(), properties.getMode());
	}

	public RunResult runAll(Collection<Feature> features, Set<ComputeFrameworkType> computeFrameworks, Collection<Link> links,
			Set<SingleFilter> filters, ParallelizationMode mode) {

		ParallelizationMode runMode = (mode == null) ? properties.getMode() : mode;
		ExecutionPlan plan = planner.plan(features, computeFrameworks, links, filters, runMode, functionExtenders);
		RunContext ctx = RunContext.create(plan, runMode, exchangeService);
		logger.info("Run {} of {} in mode {}", ctx.getRunId(), features, runMode);
		return scheduler.execute(ctx);
	}

	public Set<FunctionExtender> getFunctionExtenders() {
		return functionExtenders;
	}
}
