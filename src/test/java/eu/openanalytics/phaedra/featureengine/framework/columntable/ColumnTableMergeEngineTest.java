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

import org.junit.jupiter.api.Test;

import eu.openanalytics.phaedra.featureengine.enumeration.JoinType;
import eu.openanalytics.phaedra.featureengine.exception.ConfigurationException;
import eu.openanalytics.phaedra.featureengine.exception.DataShapeException;
import eu.openanalytics.phaedra.featureengine.exception.UnsupportedEngineOperationException;
import eu.openanalytics.phaedra.featureengine.model.Index;

public class ColumnTableMergeEngineTest {

    private final ColumnTableMergeEngine engine = new ColumnTableMergeEngine();

    private final ColumnTable left = ColumnTable.of("idx", List.of(1, 3), "col1", List.of("a", "b"));
    private final ColumnTable right = ColumnTable.of("idx", List.of(1, 2), "col2", List.of("x", "z"));
    private final Index index = Index.of("idx");

    @Test
    public void innerJoinKeepsMatchingRows() {
        ColumnTable result = engine.merge(left, right, JoinType.INNER, index, index);

        assertEquals(List.of("idx", "col1", "col2"), result.getColumnNames());
        assertEquals(1, result.getRowCount());
        assertEquals(List.of(1), result.getColumn("idx"));
        assertEquals(List.of("a"), result.getColumn("col1"));
        assertEquals(List.of("x"), result.getColumn("col2"));
    }

    @Test
    public void leftJoinKeepsAllLeftRows() {
        ColumnTable result = engine.merge(left, right, JoinType.LEFT, index, index);

        assertEquals(2, result.getRowCount());
        assertEquals(List.of(1, 3), result.getColumn("idx"));
        assertEquals(List.of("a", "b"), result.getColumn("col1"));
        assertEquals(Arrays.asList("x", null), result.getColumn("col2"));
    }

    @Test
    public void rightJoinKeepsAllRightRows() {
        ColumnTable result = engine.merge(left, right, JoinType.RIGHT, index, index);

        assertEquals(2, result.getRowCount());
        assertEquals(List.of(1, 2), result.getColumn("idx"));
        assertEquals(Arrays.asList("a", null), result.getColumn("col1"));
        assertEquals(List.of("x", "z"), result.getColumn("col2"));
    }

    @Test
    public void fullOuterJoinKeepsAllRows() {
        ColumnTable result = engine.merge(left, right, JoinType.OUTER, index, index);

        assertEquals(3, result.getRowCount());
        assertEquals(List.of(1, 3, 2), result.getColumn("idx"));
        assertEquals(Arrays.asList("a", "b", null), result.getColumn("col1"));
        assertEquals(Arrays.asList("x", null, "z"), result.getColumn("col2"));
    }

    @Test
    public void keysOfDifferentNumericTypesMatch() {
        ColumnTable longKeys = ColumnTable.of("idx", List.of(1L, 2L), "col2", List.of("x", "z"));

        ColumnTable result = engine.merge(left, longKeys, JoinType.INNER, index, index);

        assertEquals(List.of("x"), result.getColumn("col2"));
    }

    @Test
    public void differentKeyNamesKeepBothKeyColumns() {
        ColumnTable other = ColumnTable.of("key", List.of(3), "col1", List.of("c"));

        ColumnTable result = engine.merge(left, other, JoinType.INNER, index, Index.of("key"));

        assertEquals(List.of("idx", "col1", "key", "col1_right"), result.getColumnNames());
        assertEquals(List.of("b"), result.getColumn("col1"));
        assertEquals(List.of("c"), result.getColumn("col1_right"));
    }

    @Test
    public void duplicateKeysMultiplyRows() {
        ColumnTable duplicates = ColumnTable.of("idx", List.of(1, 1), "col2", List.of("x", "y"));

        ColumnTable result = engine.merge(left, duplicates, JoinType.INNER, index, index);

        assertEquals(List.of("x", "y"), result.getColumn("col2"));
        assertEquals(List.of("a", "a"), result.getColumn("col1"));
    }

    @Test
    public void nullKeysNeverMatch() {
        ColumnTable withNull = ColumnTable.of("idx", Arrays.asList(null, 1), "col2", List.of("n", "x"));

        ColumnTable result = engine.merge(ColumnTable.of("idx", Arrays.asList(null, 1), "col1", List.of("m", "a")), withNull, JoinType.INNER, index, index);

        assertEquals(List.of("a"), result.getColumn("col1"));
        assertEquals(List.of("x"), result.getColumn("col2"));
    }

    @Test
    public void compositeIndexIsNotSupported() {
        UnsupportedEngineOperationException e = assertThrows(UnsupportedEngineOperationException.class,
                () -> engine.merge(left, right, JoinType.INNER, Index.of("idx", "col1"), Index.of("idx", "col2")));
        assertTrue(e.getMessage().contains("ColumnTableMergeEngine"));
    }

    @Test
    public void missingJoinTypeIsRejected() {
        assertThrows(ConfigurationException.class, () -> engine.merge(left, right, null, index, index));
    }

    @Test
    public void appendConcatenatesRows() {
        ColumnTable more = ColumnTable.of("idx", List.of(5), "col1", List.of("e"));

        ColumnTable result = engine.mergeAppend(left, more, index, index);

        assertEquals(List.of(1, 3, 5), result.getColumn("idx"));
        assertEquals(List.of("a", "b", "e"), result.getColumn("col1"));
    }

    @Test
    public void appendRequiresTheSameColumns() {
        assertThrows(DataShapeException.class, () -> engine.mergeAppend(left, right, index, index));
    }

    @Test
    public void joinTypeParsesNamesAndAliases() {
        assertEquals(JoinType.OUTER, JoinType.of("full outer"));
        assertEquals(JoinType.LEFT, JoinType.of("LEFT"));
        assertThrows(ConfigurationException.class, () -> JoinType.of("cross"));
    }
}
