/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Awaiter bookkeeping shared by Awaitable implementations, which can delegate {@link Awaitable#getAwaiters()} to
 * {@link #view()} and {@link Awaitable#addAwaiter(Awaitable)} to {@link #add(Awaitable)}.
 * 
 * The set only grows while its owner is pending and is frozen once the owner completes: no further waits are meaningful
 * after completion. Membership is by reference identity. The set is copy-on-write: every iteration of the view walks a
 * consistent snapshot, even if the runtime registers awaiters from other threads in the meantime.
 */
public final class AwaiterSet {
    private final Set<Awaitable> view = new View();
    private volatile List<Awaitable> snapshot = List.of();
    private boolean frozen; // Guarded by this

    /**
     * Registers awaiter, unless it's already registered or this set is frozen.
     * 
     * @return whether the awaiter was newly registered.
     */
    public synchronized boolean add(Awaitable awaiter) {
        Objects.requireNonNull(awaiter);
        if (frozen || containsIdentical(snapshot, awaiter)) {
            return false;
        }

        List<Awaitable> next = new ArrayList<>(snapshot.size() + 1);
        next.addAll(snapshot);
        next.add(awaiter);
        snapshot = Collections.unmodifiableList(next);
        return true;
    }

    private static boolean containsIdentical(List<Awaitable> awaiters, Object object) {
        for (Awaitable awaiter : awaiters) {
            if (awaiter == object) {
                return true;
            }
        }
        return false;
    }

    /** Stops accepting new awaiters. Existing awaiters stay registered. Idempotent. */
    public synchronized void freeze() {
        frozen = true;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    /** Returns a live, read-only view of the registered awaiters, in registration order. */
    public Set<Awaitable> view() {
        return view;
    }

    @Override
    public String toString() {
        return snapshot.toString();
    }

    private class View extends AbstractSet<Awaitable> {
        @Override
        public Iterator<Awaitable> iterator() {
            return snapshot.iterator();
        }

        @Override
        public int size() {
            return snapshot.size();
        }

        @Override
        public boolean contains(Object object) {
            return containsIdentical(snapshot, object);
        }
    }
}
