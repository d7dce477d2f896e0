/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.Objects;

/** The tail and head nodes of a sub-graph produced by {@link Awaitable#makeAsyncGraphNodes()}. */
public final class SubGraph {
    private final AsyncGraphNode tail;
    private final AsyncGraphNode head;

    private SubGraph(AsyncGraphNode tail, AsyncGraphNode head) {
        this.tail = Objects.requireNonNull(tail);
        this.head = Objects.requireNonNull(head);
    }

    /**
     * Creates a sub-graph. It's the creator's responsibility to have linked the nodes between head and tail already
     * (i.e. tail should be reachable from head by following {@link AsyncGraphNode#getAwaitedBy()}).
     */
    public static SubGraph of(AsyncGraphNode tail, AsyncGraphNode head) {
        return new SubGraph(tail, head);
    }

    /** Creates a sub-graph consisting of a single node, which is both the tail and head. */
    public static SubGraph single(AsyncGraphNode node) {
        return new SubGraph(node, node);
    }

    public AsyncGraphNode getTail() {
        return tail;
    }

    public AsyncGraphNode getHead() {
        return head;
    }

    @Override
    public String toString() {
        return "{" + head + "}...{" + tail + "}";
    }
}
