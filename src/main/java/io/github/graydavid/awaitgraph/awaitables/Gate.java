/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.awaitables;

import java.util.Objects;
import java.util.Set;

import io.github.graydavid.awaitgraph.core.AsyncGraphNode.AwaitableNode;
import io.github.graydavid.awaitgraph.core.Awaitable;
import io.github.graydavid.awaitgraph.core.AwaiterSet;
import io.github.graydavid.awaitgraph.core.SubGraph;

/**
 * A synchronization point that units wait on until it's opened: e.g. the exit of a task group, which waits for all of
 * the group's tasks, or an event. Often awaited by one unit while itself awaiting several others.
 */
public class Gate implements Awaitable {
    private final String name;
    private final AwaiterSet awaiters = new AwaiterSet();
    private volatile boolean open;

    private Gate(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public static Gate create(String name) {
        return new Gate(name);
    }

    /** Opens the gate, releasing its awaiters. No awaiters can be added afterwards. */
    public void open() {
        awaiters.freeze();
        open = true;
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public Set<Awaitable> getAwaiters() {
        return awaiters.view();
    }

    @Override
    public void addAwaiter(Awaitable awaiter) {
        awaiters.add(awaiter);
    }

    @Override
    public SubGraph makeAsyncGraphNodes() {
        return SubGraph.single(AwaitableNode.of(this));
    }

    @Override
    public String toString() {
        return "Gate[" + name + "]";
    }
}
