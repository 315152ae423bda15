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
package eu.openanalytics.phaedra.featureengine.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;

public class FeatureSetTest {

    @Test
    public void firstFeatureFixesOptionsAndName() {
        FeatureSet features = new FeatureSet();
        Feature first = Feature.of("first", Options.of("k", 1));
        features.add(first);
        features.add(Feature.of("second", Options.of("k", 2)));

        assertEquals(Options.of("k", 1), features.getOptions());
        assertEquals("first", features.getNameOfOneFeature());
        assertEquals(first.getUuid(), features.getAnyUuid());
        assertEquals(Set.of("first", "second"), features.getAllNames());
    }

    @Test
    public void emptySetHasNoOptions() {
        FeatureSet features = new FeatureSet();

        assertThrows(ConfigurationException.class, features::getOptions);
        assertThrows(ConfigurationException.class, features::getNameOfOneFeature);
    }

    @Test
    public void filtersAreSetOnce() {
        FeatureSet features = new FeatureSet();
        features.add(Feature.of("x"));
        assertFalse(features.hasFilters());

        features.addFilters(Set.of(SingleFilter.min("x", 1)));

        assertTrue(features.hasFilters());
        assertThrows(ConfigurationException.class, () -> features.addFilters(Set.of(SingleFilter.max("x", 2))));
    }

    @Test
    public void artifactIsLoadedWhenAFeatureNameIsAnOption() {
        FeatureSet loading = new FeatureSet();
        loading.add(Feature.of("model", Options.of("model", "stored")));
        loading.addArtifactName();
        assertEquals("model", loading.getArtifactToLoad());
        assertNull(loading.getArtifactToSave());

        FeatureSet saving = new FeatureSet();
        saving.add(Feature.of("model"));
        saving.addArtifactName();
        assertEquals("model", saving.getArtifactToSave());
        assertNull(saving.getArtifactToLoad());
    }

    @Test
    public void featureIdentityIgnoresUuid() {
        Feature one = Feature.of("x", Options.of("k", 1));
        Feature other = Feature.of("x", Options.of("k", 1));

        assertEquals(one, other);
        assertFalse(one.getUuid().equals(other.getUuid()));
        assertFalse(one.equals(Feature.of("x", Options.of("k", 2))));
    }

    @Test
    public void indexNeedsAColumn() {
        assertThrows(ConfigurationException.class, () -> new Index(List.of()));
        assertTrue(Index.of("a", "b").isComposite());
    }
}
