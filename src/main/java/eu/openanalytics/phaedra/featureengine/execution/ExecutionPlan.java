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

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import eu.openanalytics.phaedra.featureengine.execution.step.FeatureGroupStep;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.execution.step.Step;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import lombok.Value;

/**
 * The steps of one run in plan order, the steps each of them waits for, and the
 * compute framework instances they work on.
 */
@Value
public class ExecutionPlan {

	List<Step> steps;
	Map<UUID, Set<UUID>> prerequisites;
	List<ComputeFramework<?>> instances;

	public Set<UUID> getPrerequisites(Step step) {
		return prerequisites.getOrDefault(step.getUuid(), Set.of());
	}

	public List<JoinStep> getJoinSteps() {
		return steps.stream().filter(JoinStep.class::isInstance).map(JoinStep.class::cast).collect(Collectors.toList());
	}

	public List<FeatureGroupStep> getFeatureGroupSteps() {
		return steps.stream().filter(FeatureGroupStep.class::isInstance).map(FeatureGroupStep.class::cast).collect(Collectors.toList());
	}
}
