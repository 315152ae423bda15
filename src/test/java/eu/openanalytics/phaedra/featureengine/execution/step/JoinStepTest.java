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
package eu.openanalytics.phaedra.featureengine.execution.step;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import eu.openanalytics.phaedra.featureengine.enumeration.ParallelizationMode;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.FeatureEngineException;
import eu.openanalytics.phaedra.featureengine.exchange.ExchangeService;
import eu.openanalytics.phaedra.featureengine.exchange.InMemoryExchangeService;
import eu.openanalytics.phaedra.featureengine.execution.ComputeFrameworkRegistry;
import eu.openanalytics.phaedra.featureengine.execution.transport.DirectDataTransport;
import eu.openanalytics.phaedra.featureengine.execution.transport.ExchangeDataTransport;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFramework;
import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTable;
import eu.openanalytics.phaedra.featureengine.framework.columntable.ColumnTableFramework;
import eu.openanalytics.phaedra.featureengine.model.Index;
import eu.openanalytics.phaedra.featureengine.model.Link;
import eu.openanalytics.phaedra.featureengine.support.TestFeatureGroups;

public class JoinStepTest {

    private static final String LOCATION = "join-location";

    private final UUID featureA = UUID.randomUUID();
    private final UUID featureB = UUID.randomUUID();
    private final Link link = Link.inner(TestFeatureGroups.SourceA.class, TestFeatureGroups.SourceB.class, Index.of("id"));

    private ExchangeService exchangeService;
    private ColumnTableFramework destination;
    private ColumnTableFramework from;

    @BeforeEach
    public void before() {
        exchangeService = spy(new InMemoryExchangeService(new ObjectMapper()));
        destination = new ColumnTableFramework(ParallelizationMode.MULTIPROCESSING, Set.of(featureA), null);
        from = new ColumnTableFramework(ParallelizationMode.MULTIPROCESSING, Set.of(featureB), null);
        destination.setData(ColumnTable.of("id", List.of(1, 2), "A", List.of(10, 20)));
        from.setData(ColumnTable.of("id", List.of(1, 3), "B", List.of(100, 300)));
    }

    private JoinStep joinStep() {
        return new JoinStep(UUID.randomUUID(), link, ComputeFrameworkType.COLUMN_TABLE, ComputeFrameworkType.COLUMN_TABLE,
                Set.of(featureA), Set.of(featureB), destination.getUuid(), from.getUuid());
    }

    private ComputeFrameworkRegistry registry(String location) {
        return new ComputeFrameworkRegistry(location, exchangeService, List.<ComputeFramework<?>>of(destination, from));
    }

    @Test
    public void matchedRoutesRequiredFeaturesOfKnownFrameworks() {
        JoinStep step = joinStep();

        assertEquals(Optional.of(step.getUuid()), step.matched(ComputeFrameworkType.COLUMN_TABLE, featureA));
        assertEquals(Optional.of(step.getUuid()), step.matched(ComputeFrameworkType.COLUMN_TABLE, featureB));
        assertEquals(Optional.empty(), step.matched(ComputeFrameworkType.COLUMN_TABLE, UUID.randomUUID()));
        assertEquals(Optional.empty(), step.matched(ComputeFrameworkType.ROW_LIST, featureA));
    }

    @Test
    public void joinsDataHandedOverDirectly() {
        JoinStep step = joinStep();

        step.execute(registry(null), new DirectDataTransport());

        ColumnTable joined = destination.getData();
        assertEquals(List.of(1), joined.getColumn("id"));
        assertEquals(List.of(10), joined.getColumn("A"));
        assertEquals(List.of(100), joined.getColumn("B"));
        assertTrue(step.isExecuted());
    }

    @Test
    public void joinsDataReadFromTheExchangeService() {
        joinStep().execute(registry(LOCATION), new ExchangeDataTransport());

        assertEquals(ColumnTable.of("id", List.of(1), "A", List.of(10)).withColumn("B", List.of(100)), destination.getData());
        assertEquals(Set.of(from.getUuid().toString()), exchangeService.list(LOCATION));
    }

    @Test
    public void externalizedDestinationIsOverwrittenUnderTheSameId() {
        ComputeFrameworkRegistry registry = registry(LOCATION);
        String objectId = destination.uploadFinishedData(LOCATION);

        joinStep().execute(registry, new ExchangeDataTransport());

        verify(exchangeService, times(2)).upload(eq(LOCATION), any(), eq(objectId));
        assertEquals(List.of(objectId), destination.getObjectIds());
        ColumnTable stored = (ColumnTable) exchangeService.download(LOCATION, objectId);
        assertEquals(List.of(100), stored.getColumn("B"));
        assertEquals(1, stored.getRowCount());
    }

    @Test
    public void missingFromSideIsRejected() {
        JoinStep step = joinStep();
        ComputeFrameworkRegistry registry = registry(LOCATION);

        assertThrows(FeatureEngineException.class, () -> step.execute(registry, destination, (ComputeFramework<?>) null));
        assertThrows(FeatureEngineException.class, () -> step.execute(registry, destination, (UUID) null));
        assertFalse(step.isExecuted());
    }

    @Test
    public void readingFromTheExchangeNeedsALocation() {
        JoinStep step = joinStep();

        assertThrows(ConfigurationException.class, () -> step.execute(registry(null), destination, from.getUuid()));
    }

    @Test
    public void stepRunsOnlyOnce() {
        JoinStep step = joinStep();
        ComputeFrameworkRegistry registry = registry(null);
        step.execute(registry, destination, from);

        FeatureEngineException e = assertThrows(FeatureEngineException.class, () -> step.execute(registry, destination, from));
        assertTrue(e.getMessage().contains("already executed"));
    }

    @Test
    public void joinNeedsTwoInstances() {
        UUID instance = destination.getUuid();
        assertThrows(ConfigurationException.class, () -> new JoinStep(UUID.randomUUID(), link, ComputeFrameworkType.COLUMN_TABLE,
                ComputeFrameworkType.COLUMN_TABLE, Set.of(featureA), Set.of(featureB), instance, instance));
    }

    @Test
    public void satisfiesBothInstances() {
        JoinStep step = joinStep();

        assertEquals(Set.of(step.getUuid()), step.getSatisfiedChildren().get(destination.getUuid()));
        assertEquals(Set.of(step.getUuid()), step.getSatisfiedChildren().get(from.getUuid()));
        assertEquals(Set.of(featureA, featureB), step.getRequiredUuids());
    }
}
