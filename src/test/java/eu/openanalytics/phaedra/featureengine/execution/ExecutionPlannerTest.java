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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.execution.step.FeatureGroupStep;
import eu.openanalytics.phaedra.featureengine.execution.step.JoinStep;
import eu.openanalytics.phaedra.featureengine.execution.step.TransformFrameworkStep;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.Index;
import eu.openanalytics.phaedra.featureengine.model.Link;
import eu.openanalytics.phaedra.featureengine.model.Options;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroupRegistry;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.DoubledA;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.SourceA;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.SourceB;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.SumAB;

public class ExecutionPlannerTest {

    private static final Set<ComputeFrameworkType> ALL_FRAMEWORKS = Set.of(ComputeFrameworkType.values());

    private final Link linkAB = Link.inner(SourceA.class, SourceB.class, Index.of("id"));

    private ExecutionPlanner planner(FeatureGroup... groups) {
        return new ExecutionPlanner(new FeatureGroupRegistry(List.of(groups)));
    }

    private ExecutionPlan plan(ExecutionPlanner planner, List<Feature> features, List<Link> links) {
        return planner.plan(features, ALL_FRAMEWORKS, links, Set.of(), ParallelizationMode.SYNC, Set.of());
    }

    private static List<Class<?>> stepTypes(ExecutionPlan plan) {
        return plan.getSteps().stream().map(Object::getClass).collect(Collectors.toList());
    }

    @Test
    public void joinedInputsRunOnTheLeftInstance() {
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB()), List.of(Feature.of("AB")), List.of(linkAB));

        assertEquals(List.of(FeatureGroupStep.class, FeatureGroupStep.class, JoinStep.class, FeatureGroupStep.class), stepTypes(plan));
        assertEquals(2, plan.getInstances().size());

        FeatureGroupStep stepA = plan.getFeatureGroupSteps().get(0);
        FeatureGroupStep stepB = plan.getFeatureGroupSteps().get(1);
        FeatureGroupStep stepAB = plan.getFeatureGroupSteps().get(2);
        JoinStep join = plan.getJoinSteps().get(0);

        assertEquals(stepA.getInstanceId(), join.getInstanceId());
        assertEquals(stepB.getInstanceId(), join.getFromInstanceId());
        assertEquals(stepA.getInstanceId(), stepAB.getInstanceId());
        assertEquals(Set.of(stepA.getUuid(), stepB.getUuid()), plan.getPrerequisites(join));
        assertEquals(Set.of(join.getUuid()), plan.getPrerequisites(stepAB));
        assertEquals(Set.of(), plan.getPrerequisites(stepA));

        Set<UUID> required = Set.of(stepA.getFeatureSet().getAnyUuid(), stepB.getFeatureSet().getAnyUuid());
        assertEquals(required, join.getRequiredUuids());
    }

    @Test
    public void childrenCoverFeaturesAndJoins() {
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB()), List.of(Feature.of("AB")), List.of(linkAB));
        JoinStep join = plan.getJoinSteps().get(0);
        List<FeatureGroupStep> steps = plan.getFeatureGroupSteps();

        ComputeFramework<?> left = instance(plan, join.getInstanceId());
        ComputeFramework<?> right = instance(plan, join.getFromInstanceId());

        assertEquals(Set.of(steps.get(0).getFeatureSet().getAnyUuid(), steps.get(2).getFeatureSet().getAnyUuid(), join.getUuid()), left.getChildrenIfRoot());
        assertEquals(Set.of(steps.get(1).getFeatureSet().getAnyUuid(), join.getUuid()), right.getChildrenIfRoot());
    }

    private static ComputeFramework<?> instance(ExecutionPlan plan, UUID uuid) {
        return plan.getInstances().stream().filter(i -> i.getUuid().equals(uuid)).findFirst().orElseThrow();
    }

    @Test
    public void reversedLinkSwapsDestination() {
        Link reversed = Link.inner(SourceB.class, SourceA.class, Index.of("id"));
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB()), List.of(Feature.of("AB")), List.of(reversed));

        FeatureGroupStep stepB = plan.getFeatureGroupSteps().get(1);
        JoinStep join = plan.getJoinSteps().get(0);

        assertEquals(stepB.getInstanceId(), join.getInstanceId());
        assertEquals(stepB.getInstanceId(), plan.getFeatureGroupSteps().get(2).getInstanceId());
        assertEquals(reversed, join.getLink());
    }

    private static FeatureGroupStep step(ExecutionPlan plan, String featureName) {
        return plan.getFeatureGroupSteps().stream().filter(s -> s.getFeatureSet().getAllNames().contains(featureName)).findFirst().orElseThrow();
    }

    @Test
    public void consumerOfOneJoinedInputRunsOnTheInstanceOfThatInput() {
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB(), new Needs("B2", "B")),
                List.of(Feature.of("AB"), Feature.of("B2")), List.of(linkAB));
        JoinStep join = plan.getJoinSteps().get(0);

        assertEquals(step(plan, "A").getInstanceId(), join.getInstanceId());
        assertEquals(step(plan, "B").getInstanceId(), join.getFromInstanceId());
        assertEquals(step(plan, "A").getInstanceId(), step(plan, "AB").getInstanceId());
        assertEquals(step(plan, "B").getInstanceId(), step(plan, "B2").getInstanceId());
        assertEquals(2, plan.getInstances().size());
    }

    @Test
    public void joinCopiesADestinationThatIsStillRead() {
        Link reversed = Link.inner(SourceB.class, SourceA.class, Index.of("id"));
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB(), new Needs("B2", "B")),
                List.of(Feature.of("AB"), Feature.of("B2")), List.of(reversed));
        JoinStep join = plan.getJoinSteps().get(0);
        TransformFrameworkStep copy = plan.getSteps().stream()
                .filter(TransformFrameworkStep.class::isInstance).map(TransformFrameworkStep.class::cast).findFirst().orElseThrow();

        assertEquals(step(plan, "B").getInstanceId(), copy.getSourceInstanceId());
        assertEquals(ComputeFrameworkType.COLUMN_TABLE, copy.getTargetFramework());
        assertEquals(copy.getInstanceId(), join.getInstanceId());
        assertEquals(step(plan, "A").getInstanceId(), join.getFromInstanceId());
        assertEquals(copy.getInstanceId(), step(plan, "AB").getInstanceId());
        assertEquals(step(plan, "B").getInstanceId(), step(plan, "B2").getInstanceId());
        assertEquals(3, plan.getInstances().size());
        assertTrue(instance(plan, step(plan, "B").getInstanceId()).getChildrenIfRoot().contains(copy.getUuid()));
    }

    @Test
    public void sharedInputIsCalculatedOnce() {
        ExecutionPlan plan = plan(planner(new SourceA(), new SourceB(), new SumAB()),
                List.of(Feature.of("A"), Feature.of("AB")), List.of(linkAB));

        List<FeatureGroupStep> steps = plan.getFeatureGroupSteps();
        assertEquals(3, steps.size());
        assertEquals(Set.of("A"), steps.get(0).getFeatureSet().getInitialRequestedFeatures());
        assertEquals(Set.of(), steps.get(1).getFeatureSet().getInitialRequestedFeatures());
        assertEquals(Set.of("AB"), steps.get(2).getFeatureSet().getInitialRequestedFeatures());
    }

    @Test
    public void featuresWithDifferentOptionsFormSeparateSets() {
        ExecutionPlan plan = plan(planner(new SourceA()),
                List.of(Feature.of("A", Options.of("scale", 1)), Feature.of("A", Options.of("scale", 2))), List.of());

        assertEquals(2, plan.getFeatureGroupSteps().size());
        assertEquals(2, plan.getInstances().size());
    }

    @Test
    public void frameworkChangeAddsTransformStep() {
        ExecutionPlan plan = plan(planner(new SourceA(), new DoubledA()), List.of(Feature.of("A2")), List.of());

        assertEquals(List.of(FeatureGroupStep.class, TransformFrameworkStep.class, FeatureGroupStep.class), stepTypes(plan));
        TransformFrameworkStep transform = (TransformFrameworkStep) plan.getSteps().get(1);
        FeatureGroupStep doubled = plan.getFeatureGroupSteps().get(1);

        assertEquals(ComputeFrameworkType.ROW_LIST, transform.getTargetFramework());
        assertEquals(transform.getInstanceId(), doubled.getInstanceId());
        assertEquals(ComputeFrameworkType.ROW_LIST, instance(plan, doubled.getInstanceId()).getFrameworkType());
    }

    @Test
    public void filtersAttachToTheFeatureSetOfTheirFeature() {
        SingleFilter filter = SingleFilter.min("A", 15);
        ExecutionPlan plan = new ExecutionPlanner(new FeatureGroupRegistry(List.of(new SourceA())))
                .plan(List.of(Feature.of("A")), ALL_FRAMEWORKS, List.of(), Set.of(filter, SingleFilter.max("unknown", 1)), ParallelizationMode.SYNC, Set.of());

        FeatureSet features = plan.getFeatureGroupSteps().get(0).getFeatureSet();
        assertEquals(Set.of(filter), features.getFilters());
    }

    @Test
    public void missingLinkIsAConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> plan(planner(new SourceA(), new SourceB(), new SumAB()), List.of(Feature.of("AB")), List.of()));
        assertTrue(e.getMessage().contains("No link"));
    }

    @Test
    public void ambiguousFeatureGroupIsAConfigurationError() {
        ExecutionPlanner planner = planner(new SourceA(), new AlsoA());
        assertThrows(ConfigurationException.class, () -> plan(planner, List.of(Feature.of("A")), List.of()));
    }

    @Test
    public void unknownFeatureIsAConfigurationError() {
        ExecutionPlanner planner = planner(new SourceA());
        assertThrows(ConfigurationException.class, () -> plan(planner, List.of(Feature.of("Z")), List.of()));
    }

    @Test
    public void dependencyCycleIsAConfigurationError() {
        ExecutionPlanner planner = planner(new Needs("X", "Y"), new Needs("Y", "X"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> plan(planner, List.of(Feature.of("X")), List.of()));
        assertTrue(e.getMessage().contains("Cycle"));
    }

    @Test
    public void frameworkMustBeUnambiguous() {
        ExecutionPlanner planner = planner(new AnyFramework());

        assertThrows(ConfigurationException.class, () -> plan(planner, List.of(Feature.of("Any")), List.of()));

        ExecutionPlan plan = plan(planner, List.of(Feature.of("Any").withComputeFramework(ComputeFrameworkType.ROW_LIST)), List.of());
        assertEquals(ComputeFrameworkType.ROW_LIST, plan.getFeatureGroupSteps().get(0).getFrameworkType());
    }

    @Test
    public void disallowedFrameworkIsAConfigurationError() {
        ExecutionPlanner planner = planner(new SourceA());
        assertThrows(ConfigurationException.class, () -> planner.plan(List.of(Feature.of("A")), Set.of(ComputeFrameworkType.ROW_LIST),
                List.of(), Set.of(), ParallelizationMode.SYNC, Set.of()));
    }

    @Test
    public void emptyRequestIsAConfigurationError() {
        ExecutionPlanner planner = planner(new SourceA());
        assertThrows(ConfigurationException.class, () -> plan(planner, List.of(), List.of()));
        assertThrows(ConfigurationException.class, () -> planner.plan(List.of(Feature.of("A")), Set.of(), List.of(), Set.of(), ParallelizationMode.SYNC, Set.of()));
    }

    private static class AlsoA extends FeatureGroup {

        @Override
        public Set<String> featureNamesSupported() {
            return Set.of("A");
        }

        @Override
        public Object calculateFeature(Object data, FeatureSet features) {
            return data;
        }
    }

    private static class AnyFramework extends FeatureGroup {

        @Override
        public Set<String> featureNamesSupported() {
            return Set.of("Any");
        }

        @Override
        public Object calculateFeature(Object data, FeatureSet features) {
            return Map.of("Any", List.of(1));
        }
    }

    private static class Needs extends FeatureGroup {

        private final String name;
        private final String input;

        Needs(String name, String input) {
            this.name = name;
            this.input = input;
        }

        @Override
        public Set<String> featureNamesSupported() {
            return Set.of(name);
        }

        @Override
        public Set<Feature> inputFeatures(Options options, String featureName) {
            return Set.of(Feature.of(input));
        }

        @Override
        public Object calculateFeature(Object data, FeatureSet features) {
            return data;
        }
    }
}
