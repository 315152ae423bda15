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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.execution.step.FeatureGroupStep;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.execution.step.Step;
import eu.openanalytics.phaedra.featureengine.execution.step.TransformFrameworkStep;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.Link;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroupRegistry;

/**
 * Turns requested features into an execution plan.
 *
 * <ol>
 * <li>Every feature and, recursively, its input features is resolved to one feature group and one backend.
 * Features with the same name and options are calculated once.</li>
 * <li>Features of the same group, backend, options and inputs form one feature set.</li>
 * <li>Feature sets are assigned to compute framework instances, in dependency order. A set without inputs
 * opens a new instance. Any other set runs on the instance that holds most of its inputs, among the
 * instances whose rows only stem from the data of those inputs. Inputs held by other instances are joined
 * into it following the declared links. A join never changes the rows of an instance that later feature
 * sets still read: such an instance is copied first. A backend change also copies the data to a new
 * instance.</li>
 * <li>The children of an instance are the ids of the features calculated on it and the ids of the join and
 * transform steps that read or write it. Steps on the same instance run in plan order.</li>
 * </ol>
 */
@Service
public class ExecutionPlanner {

	private final FeatureGroupRegistry featureGroupRegistry;

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public ExecutionPlanner(FeatureGroupRegistry featureGroupRegistry) {
		this.featureGroupRegistry = featureGroupRegistry;
	}

	public ExecutionPlan plan(Collection<Feature> features, Set<ComputeFrameworkType> frameworks, Collection<Link> links,
			Set<SingleFilter> filters, ParallelizationMode mode, Set<FunctionExtender> functionExtenders) {

		if (features == null || features.isEmpty()) {
			throw new ConfigurationException("No features requested");
		}
		if (frameworks == null || frameworks.isEmpty()) {
			throw new ConfigurationException("No compute frameworks allowed");
		}

		Resolution resolution = new Resolution(EnumSet.copyOf(frameworks));
		for (Feature feature : features) {
			Feature requested = feature.isInitialRequested() ? feature : feature.toBuilder().initialRequested(true).build();
			resolution.resolve(requested, new ArrayDeque<>());
		}

		List<FeatureSetDraft> featureSets = buildFeatureSets(resolution.order);
		attachFilters(featureSets, (filters == null) ? Set.of() : filters);

		Assignment assignment = new Assignment((links == null) ? List.of() : new ArrayList<>(links), featureSets);
		featureSets.forEach(assignment::assign);

		ExecutionPlan plan = assignment.materialize(mode, (functionExtenders == null) ? Set.of() : functionExtenders);
		logger.info("Planned {} steps on {} compute framework instances for {}", plan.getSteps().size(), plan.getInstances().size(), features);
		return plan;
	}

	private static List<FeatureSetDraft> buildFeatureSets(List<Node> order) {
		Map<List<Object>, FeatureSetDraft> drafts = new LinkedHashMap<>();
		for (Node node : order) {
			List<Object> key = Arrays.asList(node.group, node.framework, node.feature.getOptions(), node.inputs);
			drafts.computeIfAbsent(key, k -> new FeatureSetDraft(node.group, node.framework, node.inputs)).members.add(node);
		}

		List<FeatureSetDraft> result = new ArrayList<>(drafts.values());
		for (FeatureSetDraft draft : result) {
			draft.members.forEach(n -> draft.featureSet.add(n.feature));
			if (draft.group.artifact() != null) {
				draft.featureSet.addArtifactName();
			}
		}
		return result;
	}

	private void attachFilters(List<FeatureSetDraft> featureSets, Set<SingleFilter> filters) {
		Set<SingleFilter> unused = new LinkedHashSet<>(filters);
		for (FeatureSetDraft draft : featureSets) {
			Set<String> names = draft.featureSet.getAllNames();
			Set<SingleFilter> matching = filters.stream()
					.filter(f -> names.contains(f.getFeatureName()))
					.collect(Collectors.toCollection(LinkedHashSet::new));
			if (matching.isEmpty()) continue;
			draft.featureSet.addFilters(matching);
			unused.removeAll(matching);
		}
		if (!unused.isEmpty()) {
			logger.warn("Filters on features that are not calculated are ignored: {}", unused);
		}
	}

	private static final class Node {
		Feature feature;
		final FeatureGroup group;
		final ComputeFrameworkType framework;
		final Set<Node> inputs;

		Node(Feature feature, FeatureGroup group, ComputeFrameworkType framework, Set<Node> inputs) {
			this.feature = feature;
			this.group = group;
			this.framework = framework;
			this.inputs = inputs;
		}
	}

	private static final class FeatureSetDraft {
		final FeatureGroup group;
		final ComputeFrameworkType framework;
		final Set<Node> inputs;
		final List<Node> members = new ArrayList<>();
		final FeatureSet featureSet = new FeatureSet();

		FeatureSetDraft(FeatureGroup group, ComputeFrameworkType framework, Set<Node> inputs) {
			this.group = group;
			this.framework = framework;
			this.inputs = inputs;
		}
	}

	private static final class InstanceDraft {
		final ComputeFrameworkType type;
		final Set<UUID> children = new LinkedHashSet<>();
		final Set<Class<? extends FeatureGroup>> groups = new LinkedHashSet<>();
		final Set<Node> held = new LinkedHashSet<>();
		/** The source instances whose rows make up the data of this instance. */
		final Set<InstanceDraft> origins = new LinkedHashSet<>();

		InstanceDraft(ComputeFrameworkType type) {
			this.type = type;
		}
	}

	@FunctionalInterface
	private interface StepDraft {
		Step build(Function<InstanceDraft, UUID> instanceIds);
	}

	private final class Resolution {

		private final Set<ComputeFrameworkType> frameworks;
		private final Map<Feature, Node> nodes = new HashMap<>();
		private final List<Node> order = new ArrayList<>();

		Resolution(Set<ComputeFrameworkType> frameworks) {
			this.frameworks = frameworks;
		}

		Node resolve(Feature feature, Deque<Feature> path) {
			Node existing = nodes.get(feature);
			if (existing != null) {
				if (feature.isInitialRequested() && !existing.feature.isInitialRequested()) {
					existing.feature = existing.feature.toBuilder().initialRequested(true).build();
				}
				return existing;
			}
			if (path.contains(feature)) {
				throw new ConfigurationException("Cycle in feature dependencies: %s -> %s", path, feature);
			}

			FeatureGroup group = featureGroupRegistry.resolve(feature);
			path.push(feature);
			Set<Node> inputs = new LinkedHashSet<>();
			Set<Feature> inputFeatures = group.inputFeatures(feature.getOptions(), feature.getName());
			if (inputFeatures != null) {
				for (Feature input : inputFeatures) {
					inputs.add(resolve(input, path));
				}
			}
			path.pop();

			ComputeFrameworkType framework = chooseFramework(feature, group, inputs);
			Node node = new Node(feature.withComputeFramework(framework), group, framework, inputs);
			nodes.put(feature, node);
			order.add(node);
			return node;
		}

		private ComputeFrameworkType chooseFramework(Feature feature, FeatureGroup group, Set<Node> inputs) {
			Set<ComputeFrameworkType> candidates = EnumSet.copyOf(frameworks);
			Set<ComputeFrameworkType> rule = group.computeFrameworkRule();
			if (rule != null) candidates.retainAll(rule);
			if (feature.getComputeFramework() != null) candidates.retainAll(Set.of(feature.getComputeFramework()));

			if (candidates.isEmpty()) {
				throw new ConfigurationException("No compute framework for feature %s: allowed are %s, %s supports %s",
						feature, frameworks, group.getClassName(), (rule == null) ? "all" : rule);
			}
			if (candidates.size() == 1) {
				return candidates.iterator().next();
			}

			Set<ComputeFrameworkType> fromInputs = inputs.stream()
					.map(n -> n.framework)
					.filter(candidates::contains)
					.collect(Collectors.toCollection(() -> EnumSet.noneOf(ComputeFrameworkType.class)));
			if (fromInputs.size() == 1) {
				return fromInputs.iterator().next();
			}
			throw new ConfigurationException("Feature %s can run on several compute frameworks %s, set one on the feature", feature, candidates);
		}
	}

	private static final class Assignment {

		private final List<Link> links;
		private final List<InstanceDraft> instances = new ArrayList<>();
		private final Map<Node, List<InstanceDraft>> holders = new HashMap<>();
		private final List<StepDraft> steps = new ArrayList<>();
		private final Map<Node, Integer> pendingConsumers = new HashMap<>();

		Assignment(List<Link> links, List<FeatureSetDraft> featureSets) {
			this.links = links;
			for (FeatureSetDraft set : featureSets) {
				set.inputs.forEach(n -> pendingConsumers.merge(n, 1, Integer::sum));
			}
		}

		void assign(FeatureSetDraft set) {
			set.inputs.forEach(n -> pendingConsumers.merge(n, -1, Integer::sum));

			InstanceDraft target;
			if (set.inputs.isEmpty()) {
				target = newInstance(set.framework);
				target.origins.add(target);
			} else {
				target = joinInputs(set.inputs);
				if (target.type != set.framework) {
					target = copy(target, set.framework);
				}
			}

			UUID stepId = UUID.randomUUID();
			InstanceDraft instance = target;
			steps.add(ids -> new FeatureGroupStep(stepId, set.group, set.featureSet, set.framework, ids.apply(instance)));
			instance.children.addAll(set.featureSet.getAllFeatureIds());
			instance.groups.add(set.group.getClass());
			set.members.forEach(n -> hold(instance, n));
		}

		private InstanceDraft joinInputs(Set<Node> inputs) {
			Set<InstanceDraft> origins = new LinkedHashSet<>();
			inputs.forEach(n -> origins.addAll(home(n).origins));

			InstanceDraft destination = null;
			long best = 0;
			for (InstanceDraft candidate : instances) {
				if (!origins.containsAll(candidate.origins)) continue;
				long count = inputs.stream().filter(candidate.held::contains).count();
				if (count > best) {
					best = count;
					destination = candidate;
				}
			}
			if (destination == null) {
				throw new ConfigurationException("Inputs %s are not calculated on any instance", inputs.stream().map(n -> n.feature).collect(Collectors.toList()));
			}

			for (Node input : inputs) {
				if (destination.held.contains(input)) continue;
				InstanceDraft from = home(input);
				Pair<Link, Boolean> found = findLink(destination, from);
				if (found.getRight()) {
					InstanceDraft swap = destination;
					destination = from;
					from = swap;
				}
				if (isStillRead(destination)) {
					destination = copy(destination, destination.type);
				}
				join(found.getLeft(), destination, from, inputs);
			}
			return destination;
		}

		/**
		 * Find a link with its left side on the destination and its right side on the from instance.
		 * The boolean is true if the link only fits the other way around.
		 */
		private Pair<Link, Boolean> findLink(InstanceDraft destination, InstanceDraft from) {
			for (Link link : links) {
				if (destination.groups.contains(link.getLeftFeatureGroup()) && from.groups.contains(link.getRightFeatureGroup())) {
					return Pair.of(link, false);
				}
			}
			for (Link link : links) {
				if (from.groups.contains(link.getLeftFeatureGroup()) && destination.groups.contains(link.getRightFeatureGroup())) {
					return Pair.of(link, true);
				}
			}
			throw new ConfigurationException("No link found to join the data of %s with %s", names(destination.groups), names(from.groups));
		}

		private void join(Link link, InstanceDraft destination, InstanceDraft from, Set<Node> inputs) {
			Set<UUID> leftIds = idsOf(inputs.stream().filter(destination.held::contains));
			Set<UUID> rightIds = idsOf(inputs.stream().filter(n -> from.held.contains(n) && !destination.held.contains(n)));

			UUID stepId = UUID.randomUUID();
			steps.add(ids -> new JoinStep(stepId, link, destination.type, from.type, leftIds, rightIds, ids.apply(destination), ids.apply(from)));
			destination.children.add(stepId);
			from.children.add(stepId);
			destination.groups.addAll(from.groups);
			destination.origins.addAll(from.origins);
			new ArrayList<>(from.held).forEach(n -> hold(destination, n));
		}

		/**
		 * The instance a feature was calculated on.
		 */
		private InstanceDraft home(Node node) {
			List<InstanceDraft> found = holders.get(node);
			if (found == null) {
				throw new ConfigurationException("Input %s is not calculated on any instance", node.feature);
			}
			return found.get(0);
		}

		/**
		 * True if a feature set that is not assigned yet reads data held by the instance.
		 */
		private boolean isStillRead(InstanceDraft instance) {
			return instance.held.stream().anyMatch(n -> pendingConsumers.getOrDefault(n, 0) > 0);
		}

		/**
		 * Copy the data of an instance to a new instance, on the same or on another backend.
		 */
		private InstanceDraft copy(InstanceDraft source, ComputeFrameworkType type) {
			InstanceDraft target = newInstance(type);
			Set<UUID> carried = idsOf(source.held.stream());

			UUID stepId = UUID.randomUUID();
			steps.add(ids -> new TransformFrameworkStep(stepId, ids.apply(source), source.type, ids.apply(target), type, carried));
			source.children.add(stepId);
			target.children.add(stepId);
			target.groups.addAll(source.groups);
			target.origins.addAll(source.origins);
			new ArrayList<>(source.held).forEach(n -> hold(target, n));
			return target;
		}

		private InstanceDraft newInstance(ComputeFrameworkType type) {
			InstanceDraft instance = new InstanceDraft(type);
			instances.add(instance);
			return instance;
		}

		private void hold(InstanceDraft instance, Node node) {
			if (instance.held.add(node)) {
				holders.computeIfAbsent(node, n -> new ArrayList<>()).add(instance);
			}
		}

		ExecutionPlan materialize(ParallelizationMode mode, Set<FunctionExtender> functionExtenders) {
			Map<InstanceDraft, ComputeFramework<?>> created = new LinkedHashMap<>();
			for (InstanceDraft draft : instances) {
				created.put(draft, draft.type.getFactory().create(mode, draft.children, functionExtenders));
			}

			List<Step> built = steps.stream().map(d -> d.build(i -> created.get(i).getUuid())).collect(Collectors.toList());

			Map<UUID, UUID> lastStepOnInstance = new HashMap<>();
			Map<UUID, Set<UUID>> prerequisites = new LinkedHashMap<>();
			for (Step step : built) {
				Set<UUID> before = new LinkedHashSet<>();
				for (UUID instanceId : step.getInstanceIds()) {
					UUID last = lastStepOnInstance.put(instanceId, step.getUuid());
					if (last != null) before.add(last);
				}
				prerequisites.put(step.getUuid(), Set.copyOf(before));
			}
			return new ExecutionPlan(List.copyOf(built), Map.copyOf(prerequisites), List.copyOf(created.values()));
		}

		private static Set<UUID> idsOf(Stream<Node> nodes) {
			return nodes.map(n -> n.feature.getUuid()).collect(Collectors.toCollection(LinkedHashSet::new));
		}

		private static List<String> names(Set<Class<? extends FeatureGroup>> groups) {
			return groups.stream().map(Class::getSimpleName).collect(Collectors.toList());
		}
	}
}
