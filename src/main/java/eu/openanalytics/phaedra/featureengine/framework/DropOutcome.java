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
package eu.openanalytics.phaedra.featureengine.framework;

import java.util.Collections;
import java.util.Set;
import java.util.UUID;

import eu.openanalytics.phaedra.featureengine.enumeration.DropState;
import lombok.Value;

/**
 * Result of reporting calculated children to a compute framework instance.
 */
@Value
public class DropOutcome {

	private static final DropOutcome DROPPED = new DropOutcome(DropState.DROPPED, Collections.emptySet());
	private static final DropOutcome NOT_READY = new DropOutcome(DropState.NOT_READY, Collections.emptySet());

	DropState state;
	Set<UUID> pendingChildren;

	public static DropOutcome dropped() {
		return DROPPED;
	}

	public static DropOutcome notReady() {
		return NOT_READY;
	}

	public static DropOutcome waiting(Set<UUID> pendingChildren) {
		return new DropOutcome(DropState.WAITING, Set.copyOf(pendingChildren));
	}

	public boolean isDropped() {
		return state == DropState.DROPPED;
	}
}
