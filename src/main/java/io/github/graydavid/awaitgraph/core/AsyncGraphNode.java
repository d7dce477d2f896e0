/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A vertex in a logical call graph. There are exactly three kinds of node: {@link FrameNode}, {@link AwaitableNode},
 * and {@link ErrorNode}; no others can be created.
 * 
 * Edges point forward in causal time: from an earlier event to the thing that later depended on it. E.g. a frame node
 * for a called function is awaited by the frame node for its caller. Each node owns its set of outgoing edges, available
 * through {@link #getAwaitedBy()}.
 * 
 * Identity is per instance: two nodes with identical labels are still distinct vertices. Node classes don't override
 * equals or hashCode.
 */
public abstract class AsyncGraphNode {
    private final Set<AsyncGraphNode> awaitedBy = new LinkedHashSet<>();
    private final Set<AsyncGraphNode> awaitedByView = Collections.unmodifiableSet(awaitedBy);

    private AsyncGraphNode() {}

    /** Returns a read-only view of the nodes that causally follow this one, in the order they were added. */
    public final Set<AsyncGraphNode> getAwaitedBy() {
        return awaitedByView;
    }

    /**
     * Adds an edge from this node to node. Adding the same edge twice has no effect.
     * 
     * @return whether the edge was newly added.
     */
    public final boolean addAwaitedBy(AsyncGraphNode node) {
        return awaitedBy.add(Objects.requireNonNull(node));
    }

    /**
     * Returns the Awaitables waiting on this node. The graph builder uses this to discover more of the graph. By
     * default, there are none.
     */
    public Set<Awaitable> getAwaiters() {
        return Set.of();
    }

    /** A brief, human-readable description of this node. */
    public abstract String getLabel();

    @Override
    public String toString() {
        return getLabel();
    }

    /** A node representing a single synchronous call. */
    public static final class FrameNode extends AsyncGraphNode {
        private final ExecutionFrame frame;

        private FrameNode(ExecutionFrame frame) {
            this.frame = Objects.requireNonNull(frame);
        }

        public static FrameNode of(ExecutionFrame frame) {
            return new FrameNode(frame);
        }

        public ExecutionFrame getFrame() {
            return frame;
        }

        @Override
        public String getLabel() {
            return frame.getSynopsis();
        }
    }

    /** A node representing an Awaitable. Its awaiters are always the Awaitable's current awaiters. */
    public static final class AwaitableNode extends AsyncGraphNode {
        private final Awaitable awaitable;

        private AwaitableNode(Awaitable awaitable) {
            this.awaitable = Objects.requireNonNull(awaitable);
        }

        public static AwaitableNode of(Awaitable awaitable) {
            return new AwaitableNode(awaitable);
        }

        public Awaitable getAwaitable() {
            return awaitable;
        }

        @Override
        public Set<Awaitable> getAwaiters() {
            return awaitable.getAwaiters();
        }

        @Override
        public String getLabel() {
            return awaitable.toString();
        }
    }

    /**
     * A synthetic node inserted where linkage between parts of the graph could not be established. It carries a
     * diagnostic message as its label.
     */
    public static final class ErrorNode extends AsyncGraphNode {
        private final String text;
        private final Set<Awaitable> awaiters;

        private ErrorNode(String text, Collection<? extends Awaitable> awaiters) {
            this.text = Objects.requireNonNull(text);
            Set<Awaitable> ownedAwaiters = Collections.newSetFromMap(new IdentityHashMap<>());
            ownedAwaiters.addAll(awaiters);
            this.awaiters = Collections.unmodifiableSet(ownedAwaiters);
        }

        /** Creates an error node with no awaiters. */
        public static ErrorNode of(String text) {
            return new ErrorNode(text, Set.of());
        }

        /** Creates an error node with a fixed set of awaiters, copied from the given collection. */
        public static ErrorNode of(String text, Collection<? extends Awaitable> awaiters) {
            return new ErrorNode(text, awaiters);
        }

        public String getText() {
            return text;
        }

        @Override
        public Set<Awaitable> getAwaiters() {
            return awaiters;
        }

        @Override
        public String getLabel() {
            return text;
        }
    }
}
