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

import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.enumeration.JoinType;
import eu.openanalytics.phaedra.featureengine.plugin.FeatureGroup;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Declares how the data of two feature groups is joined: the join type and the key on each side.
 * Every link gets its own uuid, which is used as the key of the join edge in an execution plan.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Link {

    @NonNull JoinType joinType;
    @NonNull Class<? extends FeatureGroup> leftFeatureGroup;
    @NonNull Index leftIndex;
    @NonNull Class<? extends FeatureGroup> rightFeatureGroup;
    @NonNull Index rightIndex;
    @NonNull UUID uuid;

    public static Link of(JoinType joinType, Class<? extends FeatureGroup> left, Index leftIndex, Class<? extends FeatureGroup> right, Index rightIndex) {
        return new Link(joinType, left, leftIndex, right, rightIndex, UUID.randomUUID());
    }

    public static Link of(String joinType, Class<? extends FeatureGroup> left, Index leftIndex, Class<? extends FeatureGroup> right, Index rightIndex) {
        return of(JoinType.of(joinType), left, leftIndex, right, rightIndex);
    }

    public static Link inner(Class<? extends FeatureGroup> left, Class<? extends FeatureGroup> right, Index index) {
        return of(JoinType.INNER, left, index, right, index);
    }
}
