/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.awaitables;

import java.util.Objects;
import java.util.Set;

import io.github.graydavid.awaitgraph.core.AsyncGraphNode;
import io.github.graydavid.awaitgraph.core.AsyncGraphNode.AwaitableNode;
import io.github.graydavid.awaitgraph.core.AsyncGraphNode.FrameNode;
import io.github.graydavid.awaitgraph.core.Awaitable;
import io.github.graydavid.awaitgraph.core.AwaiterSet;
import io.github.graydavid.awaitgraph.core.ExecutionFrame;
import io.github.graydavid.awaitgraph.core.SchedulableUnit;
import io.github.graydavid.awaitgraph.core.SubGraph;

/**
 * A schedulable unit as seen by a cooperative scheduler. The scheduler is in charge of the lifecycle: it starts the task
 * at an entry frame, moves its innermost frame as the task suspends in nested calls, and completes it when done.
 * 
 * The task's own stack is the chain of frames from its innermost frame outward to (and including) its entry frame. A
 * started task expands into that chain followed by a node for the task itself:
 * 
 * <pre>
 * [innermost frame] -> ... -> [entry frame] -> [Task]
 * </pre>
 * 
 * An unstarted task expands into just the node for the task itself.
 */
public class Task implements SchedulableUnit {
    private final String name;
    private final AwaiterSet awaiters = new AwaiterSet();
    private ExecutionFrame entryFrame; // Guarded by this
    private ExecutionFrame innermostFrame; // Guarded by this
    private boolean done; // Guarded by this

    private Task(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public static Task create(String name) {
        return new Task(name);
    }

    /**
     * Starts the task's computation at entryFrame, which also becomes the innermost frame.
     * 
     * @return this task.
     * @throws IllegalStateException if the task has already been started.
     */
    public synchronized Task start(ExecutionFrame entryFrame) {
        Objects.requireNonNull(entryFrame);
        if (this.entryFrame != null) {
            throw new IllegalStateException("Task already started: " + this);
        }
        this.entryFrame = entryFrame;
        this.innermostFrame = entryFrame;
        return this;
    }

    /**
     * Records that the task is suspended (or running) at frame, which should be the entry frame or be called from it,
     * directly or transitively.
     * 
     * @throws IllegalStateException if the task has not been started or has already completed.
     */
    public synchronized void suspendAt(ExecutionFrame frame) {
        Objects.requireNonNull(frame);
        if (entryFrame == null || done) {
            throw new IllegalStateException("Can only suspend running tasks: " + this);
        }
        this.innermostFrame = frame;
    }

    /** Marks the task as done. No awaiters can be added afterwards. */
    public synchronized void complete() {
        awaiters.freeze();
        done = true;
    }

    public synchronized boolean isDone() {
        return done;
    }

    @Override
    public synchronized ExecutionFrame getEntryFrame() {
        return entryFrame;
    }

    public synchronized ExecutionFrame getInnermostFrame() {
        return innermostFrame;
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
    public synchronized SubGraph makeAsyncGraphNodes() {
        AwaitableNode taskNode = AwaitableNode.of(this);
        if (entryFrame == null) {
            return SubGraph.single(taskNode);
        }

        AsyncGraphNode head = null;
        AsyncGraphNode tail = null;
        for (ExecutionFrame frame = innermostFrame; frame != null; frame = frame.getCaller()) {
            FrameNode frameNode = FrameNode.of(frame);
            if (head == null) {
                head = frameNode;
            } else {
                tail.addAwaitedBy(frameNode);
            }
            tail = frameNode;
            if (frame == entryFrame) {
                break;
            }
        }
        tail.addAwaitedBy(taskNode);
        return SubGraph.of(taskNode, head);
    }

    @Override
    public String toString() {
        return "Task[" + name + "]";
    }
}
