/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.graydavid.awaitgraph.core.AsyncGraphNode.ErrorNode;
import io.github.graydavid.awaitgraph.core.AsyncGraphNode.FrameNode;
import io.github.graydavid.onemoretry.Try;

/**
 * Builds logical call graphs: graphs leading from the point of a diagnostic call back to the program's entry point,
 * including both ordinary call linkage between frames and "awaits" linkage between Awaitables.
 */
public class AsyncGraphs {
    private static final Logger LOG = LoggerFactory.getLogger(AsyncGraphs.class);
    static final String EXIT_FRAME_NOT_FOUND = "Could not find exit frame for current task";
    static final String ENTRY_POINT_NOT_FOUND = "Could not link current task to entry point.";

    private AsyncGraphs() {}

    /**
     * Same as {@link #getAsyncGraph(ExecutionFrame, SchedulerHook)}, except using the current Java thread's stack,
     * starting at the caller of this method, along with an inactive scheduler. The result is always a plain chain of
     * frames.
     */
    public static AsyncGraphNode getAsyncGraph() {
        return getAsyncGraph(ThreadFrames.capture(1), SchedulerHook.inactive());
    }

    /**
     * Same as {@link #getAsyncGraph(ExecutionFrame, SchedulerHook)}, except using the current Java thread's stack,
     * starting at the caller of this method.
     */
    public static AsyncGraphNode getAsyncGraph(SchedulerHook hook) {
        Objects.requireNonNull(hook);
        return getAsyncGraph(ThreadFrames.capture(1), hook);
    }

    /**
     * Generates a logical call graph from callingFrame to the entry point of the program. For example, for the following
     * (pseudo-)code:
     * 
     * <pre>
     * void printGraph() { ... getAsyncGraph(...) ... }
     * 
     * async void coroPrintGraph() { printGraph(); }
     * 
     * void main() { scheduler.run(coroPrintGraph()); }
     * </pre>
     * 
     * the graph looks approximately like this:
     * 
     * <pre>
     * [frame for printGraph] -> [frame for coroPrintGraph] -> [Task for coroPrintGraph] ->
     *     ... [frames through the innards of scheduler.run] ... -> [frame for main]
     * </pre>
     * 
     * The graph only covers the portion reachable from callingFrame to the entry point, not every pending Awaitable in
     * the program. It's a point-in-time snapshot: construction is synchronous and never suspends, so callers on a
     * cooperative scheduler thread see a consistent view of the awaiter registrations.
     * 
     * If there's no current unit (or hook fails to report one), this method walks callingFrame's chain as a plain stack.
     * Otherwise, the current unit and everything awaiting it (transitively) are expanded into sub-graphs, which are
     * spliced between the frames above the unit's own stack and the frames below its entry point. Linkage that can't be
     * established is represented by {@link ErrorNode}s in the graph rather than by exceptions.
     * 
     * @param callingFrame the frame of the code asking for the graph.
     * @param hook reports the current unit, if any.
     * @return the head of the graph: the earliest node in causal order. Every other node is reachable from it by
     *         following {@link AsyncGraphNode#getAwaitedBy()}.
     * @throws MisbehaviorException if the awaiter registrations reachable from the current unit form no terminal node
     *         (i.e. everything is awaited by something else, which implies a cycle) or if an Awaitable expands to a null
     *         sub-graph.
     */
    public static AsyncGraphNode getAsyncGraph(ExecutionFrame callingFrame, SchedulerHook hook) {
        Objects.requireNonNull(callingFrame);
        Objects.requireNonNull(hook);

        Optional<SchedulableUnit> currentUnit = queryCurrentUnit(hook);
        if (currentUnit.isEmpty()) {
            LOG.debug("No current schedulable unit. Walking plain stack from '{}'", callingFrame.getSynopsis());
            return walkPlainStack(callingFrame);
        }
        return buildCooperativeGraph(callingFrame, currentUnit.get());
    }

    private static Optional<SchedulableUnit> queryCurrentUnit(SchedulerHook hook) {
        Try<Optional<SchedulableUnit>> query = Try
                .callCatchRuntime(() -> Objects.requireNonNull(hook.getCurrentUnit()));
        query.getFailure()
                .ifPresent(failure -> LOG.warn("Scheduler hook failed to report the current unit. Falling back to a "
                        + "plain stack walk.", failure));
        return query.getSuccess().flatMap(unit -> unit);
    }

    private static AsyncGraphNode walkPlainStack(ExecutionFrame callingFrame) {
        NodeChain chain = new NodeChain();
        for (ExecutionFrame frame = callingFrame; frame != null; frame = frame.getCaller()) {
            chain.append(FrameNode.of(frame));
        }
        return chain.getHead();
    }

    private static AsyncGraphNode buildCooperativeGraph(ExecutionFrame callingFrame, SchedulableUnit unit) {
        SubGraph unitGraph = expand(unit);
        Set<AsyncGraphNode> terminalNodes = expandAwaiters(unit, unitGraph);

        // The top of the graph: the frames from callingFrame until the first frame covered by the current unit.
        AsyncGraphNode unitHead = unitGraph.getHead();
        AsyncGraphNode head = unitHead;
        ExecutionFrame frame = callingFrame;
        if (unitHead instanceof FrameNode) {
            ExecutionFrame exitFrame = ((FrameNode) unitHead).getFrame();
            NodeChain top = new NodeChain();
            while (frame != null && frame != exitFrame) {
                top.append(FrameNode.of(frame));
                frame = frame.getCaller();
            }
            if (frame == null) {
                LOG.debug("Frames from '{}' never reached exit frame '{}' of current unit '{}'",
                        callingFrame.getSynopsis(), exitFrame.getSynopsis(), unit);
                top.append(ErrorNode.of(EXIT_FRAME_NOT_FOUND));
            }
            if (!top.isEmpty()) {
                top.getTail().addAwaitedBy(unitHead);
                head = top.getHead();
            }
        }

        // The bottom of the graph: the frames after the current unit's entry point leading to the program entry point.
        ExecutionFrame entryFrame = unit.getEntryFrame();
        while (frame != null && frame != entryFrame) {
            frame = frame.getCaller();
        }
        if (frame == null) {
            LOG.debug("Could not find entry frame '{}' of current unit '{}'", entryFrame, unit);
            ErrorNode error = ErrorNode.of(ENTRY_POINT_NOT_FOUND);
            terminalNodes.forEach(terminal -> terminal.addAwaitedBy(error));
            return head;
        }

        NodeChain bottom = new NodeChain();
        for (frame = frame.getCaller(); frame != null; frame = frame.getCaller()) {
            bottom.append(FrameNode.of(frame));
        }
        if (!bottom.isEmpty()) {
            terminalNodes.forEach(terminal -> terminal.addAwaitedBy(bottom.getHead()));
        }
        return head;
    }

    /**
     * Traverses the graph of Awaitables waiting on unit, expanding each into its sub-graph exactly once and linking
     * awaited nodes to the heads of their awaiters.
     * 
     * @return the nodes with no awaiters. Never empty.
     */
    private static Set<AsyncGraphNode> expandAwaiters(SchedulableUnit unit, SubGraph unitGraph) {
        Map<Awaitable, AsyncGraphNode> awaitableToHead = new IdentityHashMap<>();
        awaitableToHead.put(unit, unitGraph.getHead());
        Set<AsyncGraphNode> terminalNodes = new LinkedHashSet<>();
        // Visitation order doesn't matter: only that each Awaitable is expanded once.
        Deque<AsyncGraphNode> worklist = new ArrayDeque<>();
        worklist.push(unitGraph.getTail());

        while (!worklist.isEmpty()) {
            AsyncGraphNode node = worklist.pop();
            List<Awaitable> awaiters = new ArrayList<>(node.getAwaiters());
            if (awaiters.isEmpty()) {
                terminalNodes.add(node);
            }
            for (Awaitable awaiter : awaiters) {
                AsyncGraphNode awaiterHead = awaitableToHead.get(awaiter);
                if (awaiterHead == null) {
                    SubGraph awaiterGraph = expand(awaiter);
                    awaiterHead = awaiterGraph.getHead();
                    awaitableToHead.put(awaiter, awaiterHead);
                    worklist.push(awaiterGraph.getTail());
                }
                node.addAwaitedBy(awaiterHead);
            }
        }

        if (terminalNodes.isEmpty()) {
            String message = String.format(
                    "Expanded %s awaitables reachable from current unit '%s' but found no terminal node: each one is "
                            + "awaited by another, so the awaiter registrations must contain a cycle",
                    awaitableToHead.size(), unit);
            throw new MisbehaviorException(message);
        }
        LOG.debug("Expanded {} awaitables reachable from '{}' into {} terminal nodes", awaitableToHead.size(), unit,
                terminalNodes.size());
        return terminalNodes;
    }

    private static SubGraph expand(Awaitable awaitable) {
        Objects.requireNonNull(awaitable, "Found null awaiter");
        SubGraph subGraph = awaitable.makeAsyncGraphNodes();
        if (subGraph == null) {
            throw new MisbehaviorException("Awaitable '" + awaitable + "' expanded into a null sub-graph");
        }
        return subGraph;
    }

    /** A linear chain of nodes under construction, each awaited by the next. */
    private static class NodeChain {
        private AsyncGraphNode head;
        private AsyncGraphNode tail;

        void append(AsyncGraphNode node) {
            if (head == null) {
                head = node;
            } else {
                tail.addAwaitedBy(node);
            }
            tail = node;
        }

        boolean isEmpty() {
            return head == null;
        }

        AsyncGraphNode getHead() {
            return head;
        }

        AsyncGraphNode getTail() {
            return tail;
        }
    }
}
