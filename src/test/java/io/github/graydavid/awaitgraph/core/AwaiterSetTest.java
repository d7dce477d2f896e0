package io.github.graydavid.awaitgraph.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

import io.github.graydavid.awaitgraph.core.TestData.TestAwaitable;

public class AwaiterSetTest {
    private final AwaiterSet awaiters = new AwaiterSet();

    @Test
    public void addThrowsExceptionGivenNull() {
        assertThrows(NullPointerException.class, () -> awaiters.add(null));
    }

    @Test
    public void addRegistersEachAwaiterOnceInRegistrationOrder() {
        TestAwaitable awaiter1 = new TestAwaitable("awaiter1");
        TestAwaitable awaiter2 = new TestAwaitable("awaiter2");

        assertTrue(awaiters.add(awaiter2));
        assertTrue(awaiters.add(awaiter1));
        assertFalse(awaiters.add(awaiter2));

        assertThat(awaiters.view(), contains(awaiter2, awaiter1));
        assertThat(awaiters.view().size(), is(2));
    }

    @Test
    public void membershipIsByIdentityRatherThanEquals() {
        TestAwaitable awaiter1 = new AlwaysEqualAwaitable("awaiter1");
        TestAwaitable awaiter2 = new AlwaysEqualAwaitable("awaiter2");

        awaiters.add(awaiter1);
        awaiters.add(awaiter2);

        assertThat(awaiters.view().size(), is(2));
        assertTrue(awaiters.view().contains(awaiter1));
        assertFalse(awaiters.view().contains(new AlwaysEqualAwaitable("awaiter3")));
    }

    private static class AlwaysEqualAwaitable extends TestAwaitable {
        private AlwaysEqualAwaitable(String name) {
            super(name);
        }

        @Override
        public boolean equals(Object object) {
            return object instanceof AlwaysEqualAwaitable;
        }

        @Override
        public int hashCode() {
            return 1;
        }
    }

    @Test
    public void frozenSetRejectsNewAwaitersButKeepsExistingOnes() {
        TestAwaitable before = new TestAwaitable("before");
        awaiters.add(before);

        awaiters.freeze();

        assertTrue(awaiters.isFrozen());
        assertFalse(awaiters.add(new TestAwaitable("after")));
        assertThat(awaiters.view(), contains(before));
    }

    @Test
    public void freezeIsIdempotent() {
        awaiters.freeze();
        awaiters.freeze();

        assertTrue(awaiters.isFrozen());
    }

    @Test
    public void viewIsLive() {
        Set<Awaitable> view = awaiters.view();
        TestAwaitable awaiter = new TestAwaitable("awaiter");

        assertThat(view, empty());
        awaiters.add(awaiter);

        assertThat(view, contains(awaiter));
    }

    @Test
    public void viewIsReadOnly() {
        TestAwaitable awaiter = new TestAwaitable("awaiter");
        awaiters.add(awaiter);

        assertThrows(UnsupportedOperationException.class, () -> awaiters.view().add(new TestAwaitable("other")));
        assertThrows(UnsupportedOperationException.class, () -> awaiters.view().remove(awaiter));
        assertThrows(UnsupportedOperationException.class, () -> awaiters.view().clear());
    }

    @Test
    public void iterationWalksSnapshotDespiteConcurrentRegistration() {
        TestAwaitable awaiter1 = new TestAwaitable("awaiter1");
        TestAwaitable awaiter2 = new TestAwaitable("awaiter2");
        awaiters.add(awaiter1);

        List<Awaitable> iterated = new ArrayList<>();
        Iterator<Awaitable> iterator = awaiters.view().iterator();
        awaiters.add(awaiter2);
        iterator.forEachRemaining(iterated::add);

        assertThat(iterated, contains(awaiter1));
        assertThat(awaiters.view(), contains(awaiter1, awaiter2));
    }

    @Test
    public void registrationsFromManyThreadsAreAllKept() {
        List<TestAwaitable> all = IntStream.range(0, 200)
                .mapToObj(i -> new TestAwaitable("awaiter" + i))
                .collect(Collectors.toList());

        CompletableFuture<?>[] registrations = all.stream()
                .map(awaiter -> CompletableFuture.runAsync(() -> awaiters.add(awaiter)))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(registrations).join();

        assertThat(awaiters.view().size(), is(200));
        all.forEach(awaiter -> assertTrue(awaiters.view().contains(awaiter)));
    }
}
