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
package eu.openanalytics.phaedra.featureengine.framework.columntable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import eu.openanalytics.phaedra.featureengine.enumeration.FilterType;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.model.Feature;
import eu.openanalytics.phaedra.featureengine.model.FeatureSet;
import eu.openanalytics.phaedra.featureengine.model.SingleFilter;

public class ColumnTableFilterEngineTest {

    private final ColumnTableFilterEngine engine = new ColumnTableFilterEngine();

    private final ColumnTable table = ColumnTable.of(
            "value", Arrays.asList(1, 5, null, 10),
            "label", Arrays.asList("alpha", "beta", "gamma", "delta"));

    private List<Object> labelsAfter(SingleFilter... filters) {
        FeatureSet features = new FeatureSet();
        features.add(Feature.of("value"));
        features.addFilters(Set.of(filters));
        return engine.applyFilters(table, features).getColumn("label");
    }

    @Test
    public void appliedToFinalData() {
        assertTrue(engine.finalFilters());
    }

    @Test
    public void minAndMaxAreInclusive() {
        assertEquals(List.of("beta", "delta"), labelsAfter(SingleFilter.min("value", 5)));
        assertEquals(List.of("alpha", "beta"), labelsAfter(SingleFilter.max("value", 5)));
    }

    @Test
    public void rangeHonorsExclusiveMax() {
        assertEquals(List.of("beta", "delta"), labelsAfter(SingleFilter.range("value", 5, 10, false)));
        assertEquals(List.of("beta"), labelsAfter(SingleFilter.range("value", 5, 10, true)));
    }

    @Test
    public void equalComparesNumbersByValue() {
        assertEquals(List.of("delta"), labelsAfter(SingleFilter.equal("value", 10.0)));
    }

    @Test
    public void regexMustMatchTheWholeValue() {
        assertEquals(List.of("alpha", "gamma"), labelsAfter(SingleFilter.regex("label", "[ag].*")));
        assertEquals(List.of(), labelsAfter(SingleFilter.regex("label", "alp")));
    }

    @Test
    public void categoricalInclusionKeepsListedValues() {
        assertEquals(List.of("alpha", "gamma"), labelsAfter(SingleFilter.categoricalInclusion("label", List.of("alpha", "gamma", "omega"))));
    }

    @Test
    public void filtersAreCombined() {
        assertEquals(List.of("beta"), labelsAfter(SingleFilter.min("value", 2), SingleFilter.max("value", 6)));
    }

    @Test
    public void numericFilterNeedsNumericParameter() {
        SingleFilter invalid = new SingleFilter("value", FilterType.MIN, Map.of(SingleFilter.VALUE, "five"));
        assertThrows(ConfigurationException.class, () -> labelsAfter(invalid));
    }

    @Test
    public void numericFilterOnTextColumnIsADataShapeError() {
        DataShapeException e = assertThrows(DataShapeException.class, () -> labelsAfter(SingleFilter.min("label", 5)));
        assertTrue(e.getMessage().contains("java.lang.String"));
        assertThrows(DataShapeException.class, () -> labelsAfter(SingleFilter.max("label", 5)));
        assertThrows(DataShapeException.class, () -> labelsAfter(SingleFilter.range("label", 1, 5, false)));
    }

    @Test
    public void equalFilterNeedsAValue() {
        SingleFilter withoutValue = new SingleFilter("value", FilterType.EQUAL, Map.of());
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> labelsAfter(withoutValue));
        assertTrue(e.getMessage().contains("'value'"));
    }
}
