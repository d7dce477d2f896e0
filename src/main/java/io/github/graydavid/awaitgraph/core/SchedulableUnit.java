/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

/** A unit of cooperative work tracked by a scheduler: it owns a suspended computation and a completion state. */
public interface SchedulableUnit extends Awaitable {
    /**
     * Returns the entry frame of this unit's suspended computation: the outermost frame that belongs to the unit itself
     * rather than to the scheduler driving it. Returns null if the computation hasn't started yet.
     */
    ExecutionFrame getEntryFrame();
}
