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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import eu.openanalytics.phaedra.featureengine.config.FeatureEngineProperties;
import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.execution.TimingFunctionExtender;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.FunctionExtender;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.Index;
import eu.openanalytics.phaedra.featureengine.model.Link;
import eu.openanalytics.phaedra.featureengine.model.Options;
import eu.openanalytics.phaedra.featureengine.model.RunResult;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroupRegistry;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.SourceA;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups.SourceB;

@SpringBootTest(properties = "phaedra.featureengine.time-calculations=true")
@Import(TestFeatureGroups.Beans.class)
public class FeatureEngineServiceTest {

    @Autowired
    private FeatureEngineService featureEngineService;

    @Autowired
    private FeatureEngineProperties properties;

    @Autowired
    private FeatureGroupRegistry featureGroupRegistry;

    private final Link linkAB = Link.inner(SourceA.class, SourceB.class, Index.of("id"));

    private static ColumnTable table(RunResult result, String featureName) {
        return assertInstanceOf(ColumnTable.class, result.findResult(featureName).orElseThrow().getData());
    }

    @Test
    public void contextRegistersPluginsAndSettings() {
        assertEquals(ParallelizationMode.SYNC, properties.getMode());
        assertEquals(Set.of(ComputeFrameworkType.values()), properties.getComputeFrameworks());
        assertTrue(featureGroupRegistry.getFeatureGroups().size() >= 8);
        assertTrue(properties.isTimeCalculations());
        assertEquals(1, featureEngineService.getFunctionExtenders().size());
        FunctionExtender extender = featureEngineService.getFunctionExtenders().iterator().next();
        assertInstanceOf(TimingFunctionExtender.class, extender);
    }

    @Test
    public void runWithConfiguredDefaults() {
        RunResult result = featureEngineService.runAll(List.of(Feature.of("AB")), List.of(linkAB));

        ColumnTable joined = table(result, "AB");
        assertEquals(List.of(1), joined.getColumn("id"));
        assertEquals(List.of(110), joined.getColumn("AB"));
    }

    @Test
    public void runInEveryMode() {
        for (ParallelizationMode mode : ParallelizationMode.values()) {
            RunResult result = featureEngineService.runAll(List.of(Feature.of("AB")), Set.of(ComputeFrameworkType.COLUMN_TABLE),
                    List.of(linkAB), Set.of(), mode);
            assertEquals(List.of(100), table(result, "AB").getColumn("B"), mode::name);
        }
    }

    @Test
    public void filtersApplyToTheFinalData() {
        RunResult result = featureEngineService.runAll(List.of(Feature.of("A")), Set.of(ComputeFrameworkType.COLUMN_TABLE),
                List.of(), Set.of(SingleFilter.min("A", 15)), ParallelizationMode.SYNC);

        assertEquals(List.of(2), table(result, "A").getColumn("id"));
    }

    @Test
    public void artifactIsSavedAndLoaded() {
        RunResult saved = featureEngineService.runAll(List.of(Feature.of("Scaled")), List.of());
        assertEquals(20.0, saved.getArtifacts().get("Scaled"));
        assertEquals(List.of(0.5, 1.0), table(saved, "Scaled").getColumn("Scaled"));

        RunResult loaded = featureEngineService.runAll(List.of(Feature.of("Scaled", Options.of("Scaled", 10))), List.of());
        assertTrue(loaded.getArtifacts().isEmpty());
        assertEquals(List.of(1.0, 2.0), table(loaded, "Scaled").getColumn("Scaled"));
    }

    @Test
    public void aggregationOfACalculatedFeature() {
        RunResult result = featureEngineService.runAll(List.of(Feature.of("sum_aggr_A"), Feature.of("max_aggr_A")), List.of());

        ColumnTable table = table(result, "sum_aggr_A");
        assertEquals(List.of(30.0, 30.0), table.getColumn("sum_aggr_A"));
        assertEquals(List.of(20.0, 20.0), table.getColumn("max_aggr_A"));
    }

    @Test
    public void unknownFeatureFailsBeforeRunning() {
        assertThrows(ConfigurationException.class, () -> featureEngineService.runAll(List.of(Feature.of("nothing")), List.of()));
    }
}
