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

import eu.openanalytics.phaedra.featureengine.framework.ComputeFrameworkType;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A named, parameterized request for a derived data column.
 * Identity is (name, options): the uuid only distinguishes instances during scheduling.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Feature {

    @NonNull
    @EqualsAndHashCode.Include
    String name;

    @NonNull
    @Builder.Default
    @EqualsAndHashCode.Include
    Options options = Options.empty();

    @NonNull
    @Builder.Default
    UUID uuid = UUID.randomUUID();

    ComputeFrameworkType computeFramework;

    boolean initialRequested;

    public static Feature of(String name) {
        return Feature.builder().name(name).build();
    }

    public static Feature of(String name, Options options) {
        return Feature.builder().name(name).options(options).build();
    }

    /**
     * Create a feature that was requested by the caller, as opposed to a dependency found during resolution.
     */
    public static Feature requested(String name, Options options) {
        return Feature.builder().name(name).options(options).initialRequested(true).build();
    }

    public Feature withComputeFramework(ComputeFrameworkType computeFramework) {
        return toBuilder().computeFramework(computeFramework).build();
    }

    @Override
    public String toString() {
        return String.format("Feature[%s %s]", name, options);
    }
}
