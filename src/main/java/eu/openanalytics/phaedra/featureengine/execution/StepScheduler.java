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

import static eu.openanalytics.phaedra.featureengine.util.RunLogger.debug;
import static eu.openanalytics.phaedra.featureengine.util.RunLogger.error;
import static eu.openanalytics.phaedra.featureengine.util.RunLogger.log;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.featureengine.config.FeatureEngineProperties;
import eu.openanalytics.phaedra.featureengine.enumeration.DropState;
import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;
import eu.openanalytics.phaedra.featureengine.execution.step.FeatureGroupStep;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.execution.step.Step;
import eu.openanalytics.phaedra.featureengine.execution.step.StepOutcome;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.DropOutcome;
import eu.openanalytics.phaedra.featureengine.model.RunResult;
import eu.openanalytics.phaedra.featureengine.model.RunResult.FeatureResult;

/**
 * Runs the steps of an execution plan.
 *
 * A step is dispatched once the steps it waits for completed and no running step works on any of its
 * instances. A join step additionally waits until all features it requires were reported to it through
 * {@link JoinStep#matched}. After every step, the scheduler reports the satisfied children to the
 * instances, which drop their data when all their children are done.
 *
 * The first failing step stops the dispatching of new steps. Steps that are already running are awaited,
 * then the failure is rethrown. All objects the run stored in the exchange service are dropped before
 * returning, also after a failure.
 */
@Service
public class StepScheduler {

	private final FeatureEngineProperties properties;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public StepScheduler(FeatureEngineProperties properties) {
		this.properties = properties;
	}

	public RunResult execute(RunContext ctx) {
		ThreadPoolExecutor pool = (ctx.getMode() == ParallelizationMode.SYNC) ? null : createPool();
		try {
			return schedule(ctx, pool);
		} finally {
			if (pool != null) pool.shutdown();
			Set<String> dropped = ctx.getRegistry().dropAll();
			if (!dropped.isEmpty()) debug(logger, ctx, "Dropped %d remaining exchange objects", dropped.size());
		}
	}

	private ThreadPoolExecutor createPool() {
		int threads = Math.max(1, properties.getWorkerThreads());
		return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
	}

	private RunResult schedule(RunContext ctx, ThreadPoolExecutor pool) {
		ExecutionPlan plan = ctx.getPlan();
		CompletionService<Completion> completion = new ExecutorCompletionService<>((pool == null) ? Runnable::run : pool);
		int maxInFlight = (pool == null) ? 1 : pool.getMaximumPoolSize();

		List<Step> pending = new ArrayList<>(plan.getSteps());
		Set<UUID> completed = new HashSet<>();
		Set<UUID> busyInstances = new HashSet<>();
		int running = 0;
		Map<UUID, Set<UUID>> matchedFeatures = new HashMap<>();
		plan.getJoinSteps().forEach(j -> matchedFeatures.put(j.getUuid(), new HashSet<>()));

		List<FeatureResult> results = new ArrayList<>();
		Map<String, Object> artifacts = new LinkedHashMap<>();
		RuntimeException failure = null;

		log(logger, ctx, "Starting run of %d steps", pending.size());
		while (!pending.isEmpty() || running > 0) {
			if (failure == null) {
				for (Step step : new ArrayList<>(pending)) {
					if (running >= maxInFlight) break;
					if (!isRunnable(plan, step, completed, busyInstances, matchedFeatures)) continue;
					pending.remove(step);
					busyInstances.addAll(step.getInstanceIds());
					running++;
					debug(logger, ctx, "Dispatching %s", step);
					completion.submit(() -> run(ctx, step));
				}
			}

			if (running == 0) {
				if (failure != null) break;
				throw new FeatureEngineException("No runnable step left, %d steps cannot run: %s", pending.size(), pending);
			}

			Completion done = take(completion);
			running--;
			busyInstances.removeAll(done.step.getInstanceIds());
			completed.add(done.step.getUuid());

			if (done.failure != null) {
				error(logger, ctx, done.failure, "%s failed", done.step);
				if (failure == null) failure = done.failure;
			} else if (failure == null) {
				handleCompleted(ctx, done.step, done.outcome, matchedFeatures, results, artifacts);
			}
		}

		if (failure != null) {
			throw failure;
		}
		log(logger, ctx, "Run finished: %d results, %d artifacts", results.size(), artifacts.size());
		return new RunResult(results, artifacts);
	}

	private static Completion run(RunContext ctx, Step step) {
		try {
			return new Completion(step, step.execute(ctx.getRegistry(), ctx.getTransport()), null);
		} catch (RuntimeException e) {
			return new Completion(step, null, e);
		}
	}

	private static boolean isRunnable(ExecutionPlan plan, Step step, Set<UUID> completed, Set<UUID> busyInstances, Map<UUID, Set<UUID>> matchedFeatures) {
		if (!completed.containsAll(plan.getPrerequisites(step))) return false;
		for (UUID instanceId : step.getInstanceIds()) {
			if (busyInstances.contains(instanceId)) return false;
		}
		if (step instanceof JoinStep join) {
			return matchedFeatures.get(join.getUuid()).containsAll(join.getRequiredUuids());
		}
		return true;
	}

	private void handleCompleted(RunContext ctx, Step step, StepOutcome outcome, Map<UUID, Set<UUID>> matchedFeatures,
			List<FeatureResult> results, Map<String, Object> artifacts) {

		debug(logger, ctx, "Completed %s", step);

		for (JoinStep join : ctx.getPlan().getJoinSteps()) {
			if (join.isExecuted()) continue;
			for (UUID featureId : step.getProvidedFeatureIds()) {
				join.matched(step.getProvidedFrameworkType(), featureId).ifPresent(id -> matchedFeatures.get(id).add(featureId));
			}
		}

		if (step instanceof FeatureGroupStep fgs) {
			Set<String> requested = fgs.getFeatureSet().getInitialRequestedFeatures();
			if (!requested.isEmpty()) {
				ComputeFramework<?> cfw = ctx.getRegistry().get(fgs.getInstanceId());
				results.add(new FeatureResult(new LinkedHashSet<>(requested), ctx.getTransport().collect(cfw, ctx.getRegistry())));
			}
		}
		artifacts.putAll(outcome.getArtifacts());
		if (outcome.getHandle() instanceof String objectId) {
			debug(logger, ctx, "%s left its data in the exchange service as %s", step, objectId);
		}

		for (Map.Entry<UUID, Set<UUID>> entry : step.getSatisfiedChildren().entrySet()) {
			ComputeFramework<?> cfw = ctx.getRegistry().get(entry.getKey());
			DropOutcome drop = cfw.addAlreadyCalculatedChildrenAndDropIfPossible(entry.getValue(), ctx.getRegistry().getLocation());
			if (drop.isDropped()) {
				debug(logger, ctx, "Dropped data of %s", cfw);
			} else if (drop.getState() == DropState.WAITING) {
				debug(logger, ctx, "%s keeps its exchanged data for %d pending children", cfw, drop.getPendingChildren().size());
			}
		}
	}

	private static Completion take(CompletionService<Completion> completion) {
		try {
			return completion.take().get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new FeatureEngineException("Interrupted while waiting for a step", e);
		} catch (ExecutionException e) {
			// Steps report their failures in the completion, only errors end up here.
			throw new FeatureEngineException("Unexpected error in a step", e.getCause());
		}
	}

	private static final class Completion {
		final Step step;
		final StepOutcome outcome;
		final RuntimeException failure;

		Completion(Step step, StepOutcome outcome, RuntimeException failure) {
			this.step = step;
			this.outcome = outcome;
			this.failure = failure;
		}
	}
}
