/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.Set;

/**
 * A dependency object that other Awaitables can suspend on: e.g. a schedulable unit, a deferred result, or a
 * synchronization primitive. Implementing this interface lets an object participate in the construction of a logical
 * call graph by {@link AsyncGraphs}.
 * 
 * Implementations typically delegate awaiter bookkeeping to an {@link AwaiterSet}.
 * 
 * Identity is reference identity: the graph builder memoizes expansions with an IdentityHashMap, so overriding equals
 * has no effect on graph construction.
 */
public interface Awaitable {
    /**
     * Returns the Awaitables currently suspended waiting for this Awaitable to complete. The response is a read-only
     * view, not a copy: it reflects registrations made by the runtime up until the moment it's iterated.
     */
    Set<Awaitable> getAwaiters();

    /**
     * Registers awaiter as waiting for this Awaitable to complete. This method is called by the runtime as a side effect
     * of suspension, never by the graph builder.
     */
    void addAwaiter(Awaitable awaiter);

    /**
     * Expands this Awaitable into nodes forming a sub-graph that represents it. The sub-graph's head is the node that
     * whatever causally precedes this Awaitable should point to; its tail is the node representing this Awaitable
     * reaching completion, whose awaiters the graph builder will explore next.
     * 
     * Each call must create new nodes: the builder calls this method at most once per Awaitable per graph.
     */
    SubGraph makeAsyncGraphNodes();
}
