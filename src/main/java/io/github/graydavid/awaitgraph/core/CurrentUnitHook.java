/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A SchedulerHook that a scheduler thread publishes its running unit through. The current unit is tracked per thread:
 * a cooperative scheduler runs all of its units on a single thread, and separate schedulers on separate threads don't
 * see each others' units.
 */
public class CurrentUnitHook implements SchedulerHook {
    private final ThreadLocal<SchedulableUnit> current = new ThreadLocal<>();

    @Override
    public Optional<SchedulableUnit> getCurrentUnit() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Marks unit as the current unit on this thread until the returned Scope is closed, at which point whatever unit was
     * current before is restored. Scopes should be closed in the reverse order they were entered (e.g. by using
     * try-with-resources).
     */
    public Scope enter(SchedulableUnit unit) {
        Objects.requireNonNull(unit);
        SchedulableUnit previous = current.get();
        current.set(unit);
        return new Scope(previous);
    }

    /** Calls supplier with unit as the current unit, restoring the previous one afterwards. */
    public <T> T callAs(SchedulableUnit unit, Supplier<T> supplier) {
        try (Scope scope = enter(unit)) {
            return supplier.get();
        }
    }

    /** A period during which a unit is current. */
    public class Scope implements AutoCloseable {
        private final SchedulableUnit previous;

        private Scope(SchedulableUnit previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                current.remove();
            } else {
                current.set(previous);
            }
        }
    }
}
