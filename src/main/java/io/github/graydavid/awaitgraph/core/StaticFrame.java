/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

/**
 * An immutable, named ExecutionFrame. Runtimes that model their own call chains (rather than borrowing Java's) can use
 * this class to describe them, calling {@link #call(String)} for each nested call.
 */
public final class StaticFrame implements ExecutionFrame {
    private final String name;
    private final StaticFrame caller;

    private StaticFrame(String name, StaticFrame caller) {
        this.name = requireValidName(name);
        this.caller = caller;
    }

    private static String requireValidName(String name) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Frame names must not be blank");
        }
        return name;
    }

    /** Creates an outermost frame: one with no caller. */
    public static StaticFrame root(String name) {
        return new StaticFrame(name, null);
    }

    /**
     * Creates a chain of frames, where the first name is the outermost frame and each subsequent name is called by the
     * one before it.
     * 
     * @return the innermost frame of the chain.
     * @throws IllegalArgumentException if names is empty.
     */
    public static StaticFrame chain(String... names) {
        if (names.length == 0) {
            throw new IllegalArgumentException("Frame chains must contain at least one name");
        }
        StaticFrame frame = root(names[0]);
        for (int i = 1; i < names.length; ++i) {
            frame = frame.call(names[i]);
        }
        return frame;
    }

    /** Creates a new frame called by this one. */
    public StaticFrame call(String calleeName) {
        return new StaticFrame(calleeName, this);
    }

    @Override
    public StaticFrame getCaller() {
        return caller;
    }

    @Override
    public String getSynopsis() {
        return name;
    }

    /** Returns the number of frames from this one to the end of the chain, inclusive. */
    public int depth() {
        int depth = 0;
        for (ExecutionFrame frame = this; frame != null; frame = frame.getCaller()) {
            ++depth;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "StaticFrame[" + name + "]";
    }
}
