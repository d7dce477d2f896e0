/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.Optional;

/**
 * The graph builder's window into a cooperative scheduler: tells which SchedulableUnit, if any, is currently running on
 * the calling thread. Passed explicitly to {@link AsyncGraphs#getAsyncGraph(ExecutionFrame, SchedulerHook)} rather than
 * looked up globally.
 */
@FunctionalInterface
public interface SchedulerHook {
    /**
     * Returns the currently-running unit, or empty if either no scheduler is active or it isn't running any unit at the
     * moment.
     */
    Optional<SchedulableUnit> getCurrentUnit();

    /** Returns a hook for when no scheduling runtime is active. The hook never reports a current unit. */
    static SchedulerHook inactive() {
        return Optional::empty;
    }
}
