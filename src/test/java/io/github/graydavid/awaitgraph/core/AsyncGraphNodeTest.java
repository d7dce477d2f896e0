package io.github.graydavid.awaitgraph.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.graydavid.awaitgraph.core.AsyncGraphNode.AwaitableNode;
import io.github.graydavid.awaitgraph.core.AsyncGraphNode.ErrorNode;
import io.github.graydavid.awaitgraph.core.AsyncGraphNode.FrameNode;
import io.github.graydavid.awaitgraph.core.TestData.TestAwaitable;

public class AsyncGraphNodeTest {

    @Test
    public void factoriesThrowExceptionGivenNullArguments() {
        assertThrows(NullPointerException.class, () -> FrameNode.of(null));
        assertThrows(NullPointerException.class, () -> AwaitableNode.of(null));
        assertThrows(NullPointerException.class, () -> ErrorNode.of(null));
        assertThrows(NullPointerException.class, () -> ErrorNode.of("text", null));
    }

    @Test
    public void frameNodeIsLabeledWithFrameSynopsis() {
        StaticFrame frame = StaticFrame.root("main");

        FrameNode node = FrameNode.of(frame);

        assertThat(node.getFrame(), sameInstance(frame));
        assertThat(node.getLabel(), is("main"));
        assertThat(node.toString(), is("main"));
        assertThat(node.getAwaiters(), empty());
    }

    @Test
    public void awaitableNodeDelegatesAwaitersToAwaitableLive() {
        TestAwaitable awaitable = new TestAwaitable("awaitable");
        AwaitableNode node = AwaitableNode.of(awaitable);
        TestAwaitable awaiter = new TestAwaitable("awaiter");

        assertThat(node.getAwaiters(), empty());
        awaitable.addAwaiter(awaiter);

        assertThat(node.getAwaiters(), contains(awaiter));
        assertThat(node.getAwaitable(), sameInstance(awaitable));
        assertThat(node.getLabel(), is("awaitable"));
    }

    @Test
    public void errorNodesEachOwnAnEmptyAwaiterSetByDefault() {
        ErrorNode error1 = ErrorNode.of("error1");
        ErrorNode error2 = ErrorNode.of("error2");

        assertThat(error1.getAwaiters(), empty());
        assertThat(error2.getAwaiters(), empty());
        assertThat(error1.getAwaiters(), not(sameInstance(error2.getAwaiters())));
        assertThrows(UnsupportedOperationException.class,
                () -> error1.getAwaiters().add(new TestAwaitable("sneaky")));
        assertThat(error1.getText(), is("error1"));
        assertThat(error1.getLabel(), is("error1"));
    }

    @Test
    public void errorNodeKeepsFixedCopyOfGivenAwaiters() {
        TestAwaitable awaiter1 = new TestAwaitable("awaiter1");
        TestAwaitable awaiter2 = new TestAwaitable("awaiter2");
        List<Awaitable> awaiters = new ArrayList<>(List.of(awaiter1));

        ErrorNode error = ErrorNode.of("error", awaiters);
        awaiters.add(awaiter2);

        assertThat(error.getAwaiters(), containsInAnyOrder(awaiter1));
    }

    @Test
    public void addAwaitedByAddsEachEdgeOnceInInsertionOrder() {
        ErrorNode node = ErrorNode.of("node");
        ErrorNode awaiter1 = ErrorNode.of("awaiter1");
        ErrorNode awaiter2 = ErrorNode.of("awaiter2");

        assertTrue(node.addAwaitedBy(awaiter2));
        assertTrue(node.addAwaitedBy(awaiter1));
        assertFalse(node.addAwaitedBy(awaiter2));

        assertThat(node.getAwaitedBy(), contains(awaiter2, awaiter1));
    }

    @Test
    public void addAwaitedByThrowsExceptionGivenNull() {
        assertThrows(NullPointerException.class, () -> ErrorNode.of("node").addAwaitedBy(null));
    }

    @Test
    public void awaitedByViewIsReadOnly() {
        ErrorNode node = ErrorNode.of("node");

        assertThrows(UnsupportedOperationException.class, () -> node.getAwaitedBy().add(ErrorNode.of("other")));
    }

    @Test
    public void nodesWithSameContentAreDistinct() {
        StaticFrame frame = StaticFrame.root("main");
        FrameNode node1 = FrameNode.of(frame);
        FrameNode node2 = FrameNode.of(frame);
        ErrorNode node3 = ErrorNode.of("error");
        node3.addAwaitedBy(node1);
        node3.addAwaitedBy(node2);

        assertThat(node1, not(equalTo(node2)));
        assertThat(node3.getAwaitedBy(), contains(node1, node2));
    }
}
