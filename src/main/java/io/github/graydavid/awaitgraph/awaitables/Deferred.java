/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.awaitables;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import io.github.graydavid.awaitgraph.core.AsyncGraphNode.AwaitableNode;
import io.github.graydavid.awaitgraph.core.Awaitable;
import io.github.graydavid.awaitgraph.core.AwaiterSet;
import io.github.graydavid.awaitgraph.core.SubGraph;

/**
 * A value-holder that becomes available asynchronously. Units suspend while awaiting it; the runtime registers them via
 * {@link #addAwaiter(Awaitable)}. Once completed, a Deferred accepts no more awaiters.
 * 
 * Awaiters are frozen before the backing future completes, so anything that sees this Deferred as done also sees its
 * final set of awaiters.
 * 
 * Deferred delegates to a backing CompletableFuture, but never exposes it directly: only the producer holding the
 * Deferred can complete it.
 */
public class Deferred<T> implements Awaitable {
    private final String name;
    private final AwaiterSet awaiters = new AwaiterSet();
    private final CompletableFuture<T> backing = new CompletableFuture<>();

    private Deferred(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public static <T> Deferred<T> create(String name) {
        return new Deferred<>(name);
    }

    /**
     * Completes this Deferred with value, if not already completed.
     * 
     * @return whether this call completed the Deferred.
     */
    public boolean complete(T value) {
        awaiters.freeze();
        return backing.complete(value);
    }

    /**
     * Completes this Deferred exceptionally with throwable, if not already completed.
     * 
     * @return whether this call completed the Deferred.
     */
    public boolean completeExceptionally(Throwable throwable) {
        Objects.requireNonNull(throwable);
        awaiters.freeze();
        return backing.completeExceptionally(throwable);
    }

    public boolean isDone() {
        return backing.isDone();
    }

    /**
     * Returns a copy of the backing future. Mutating the copy has no effect on this Deferred, but the copy completes
     * when this Deferred does.
     */
    public CompletableFuture<T> toCompletableFuture() {
        return backing.copy();
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
        return "Deferred[" + name + ", " + (isDone() ? "done" : "pending") + "]";
    }
}
