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

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Value;

/**
 * Outcome of one run: the data of every requested feature set, and the artifacts saved during the run.
 */
@Value
public class RunResult {

    List<FeatureResult> results;
    Map<String, Object> artifacts;

    public List<Object> getData() {
        return results.stream().map(FeatureResult::getData).toList();
    }

    public Optional<FeatureResult> findResult(String featureName) {
        return results.stream().filter(r -> r.getFeatureNames().contains(featureName)).findFirst();
    }

    @Value
    public static class FeatureResult {
        Set<String> featureNames;
        Object data;
    }
}
