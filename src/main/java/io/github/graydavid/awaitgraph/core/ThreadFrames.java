/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.lang.StackWalker.StackFrame;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Captures the current Java thread's call stack as a chain of ExecutionFrames. */
public class ThreadFrames {
    private static final StackWalker WALKER = StackWalker.getInstance();

    private ThreadFrames() {}

    /**
     * Captures the stack of the current thread, starting with the method that called this method.
     * 
     * @param skipFrames the number of additional frames to skip above the calling method. E.g. a utility method that
     *        wants the frame of its own caller would pass 1.
     * @return the innermost captured frame. Following {@link ExecutionFrame#getCaller()} leads to the thread's entry
     *         point.
     * @throws IllegalArgumentException if skipFrames is negative or would skip the entire stack.
     */
    public static ExecutionFrame capture(int skipFrames) {
        if (skipFrames < 0) {
            throw new IllegalArgumentException("skipFrames must be non-negative but was " + skipFrames);
        }

        // +1 for this method itself
        List<StackFrame> innermostFirst = WALKER
                .walk(frames -> frames.skip(skipFrames + 1L).collect(Collectors.toList()));
        if (innermostFirst.isEmpty()) {
            throw new IllegalArgumentException("Skipped all frames in the stack: " + skipFrames);
        }

        JavaFrame caller = null;
        for (int i = innermostFirst.size() - 1; i >= 0; --i) {
            caller = new JavaFrame(innermostFirst.get(i), caller);
        }
        return caller;
    }

    /** An ExecutionFrame backed by one StackWalker frame. */
    private static class JavaFrame implements ExecutionFrame {
        private final StackFrame stackFrame;
        private final JavaFrame caller;

        private JavaFrame(StackFrame stackFrame, JavaFrame caller) {
            this.stackFrame = Objects.requireNonNull(stackFrame);
            this.caller = caller;
        }

        @Override
        public ExecutionFrame getCaller() {
            return caller;
        }

        @Override
        public String getSynopsis() {
            return stackFrame.toString();
        }

        @Override
        public String toString() {
            return getSynopsis();
        }
    }
}
