/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

/**
 * Indicates that a runtime-provided implementation of an awaitgraph concept (e.g. an {@link Awaitable}'s awaiter
 * registrations or its sub-graph expansion) is not meeting its contract. Graph construction aborts rather than
 * returning a graph built on broken assumptions, so the presence of this exception should be treated seriously.
 */
public class MisbehaviorException extends RuntimeException {
    private static final long serialVersionUID = 1;

    public MisbehaviorException(String message) {
        super(message);
    }
}
