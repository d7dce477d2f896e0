/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

/**
 * One entry in a synchronous call chain: a snapshot of a single call's activation record along with a link to the
 * frame that called it. Frames are supplied by the host runtime; this library only reads them.
 * 
 * Identity is reference identity. The graph builder matches frames against each other (e.g. to find where a
 * SchedulableUnit's own stack begins) with ==, never with equals. Frames are expected to be immutable for the duration
 * of a {@link AsyncGraphs#getAsyncGraph(ExecutionFrame, SchedulerHook)} call.
 */
public interface ExecutionFrame {
    /** Returns the frame that called this one, or null if this frame is the end of the chain (the program entry). */
    ExecutionFrame getCaller();

    /** A brief description of the frame, suitable for debugging. Used as the label of the frame's graph node. */
    String getSynopsis();
}
