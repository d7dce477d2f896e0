/*
 * Copyright 2021 David Gray
 * 
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.awaitgraph.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Renders logical call graphs as GraphViz dot documents. */
public class AsyncGraphDot {
    private AsyncGraphDot() {}

    /**
     * Renders the graph reachable from head. Every reachable node is emitted exactly once as a box-shaped vertex labeled
     * with {@link AsyncGraphNode#getLabel()}; every edge is emitted exactly once, pointing from a node to the node that
     * awaits it. Vertex ids are assigned in order of first encounter, starting from 1 for head. No other ordering is
     * guaranteed.
     * 
     * Rendering is iterative and tracks visited nodes by identity, so arbitrarily long chains, diamonds, and even cycles
     * are all safe to render.
     */
    public static String render(AsyncGraphNode head) {
        StringBuilder builder = new StringBuilder();
        render(head, builder);
        return builder.toString();
    }

    /**
     * Same as {@link #render(AsyncGraphNode)}, except appending the document to out.
     * 
     * @throws UncheckedIOException if out throws an IOException.
     */
    public static void render(AsyncGraphNode head, Appendable out) {
        Objects.requireNonNull(head);
        Objects.requireNonNull(out);
        try {
            new Rendering(out).render(head);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Escapes label for embedding in a double-quoted dot string, keeping it on a single line. */
    static String escapeLabel(String label) {
        StringBuilder escaped = new StringBuilder(label.length());
        for (int i = 0; i < label.length(); ++i) {
            char c = label.charAt(i);
            switch (c) {
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '"':
                    escaped.append("\\\"");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\r':
                    escaped.append("\\r");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }

    /** The state of a single render. Ids are only meaningful within one Rendering. */
    private static class Rendering {
        private final Appendable out;
        private final Map<AsyncGraphNode, Integer> nodeToId = new IdentityHashMap<>();
        private int nextId = 1;

        private Rendering(Appendable out) {
            this.out = out;
        }

        private void render(AsyncGraphNode head) throws IOException {
            out.append("digraph {\n");
            Set<AsyncGraphNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            Deque<AsyncGraphNode> worklist = new ArrayDeque<>();
            worklist.push(head);
            while (!worklist.isEmpty()) {
                AsyncGraphNode node = worklist.pop();
                if (!seen.add(node)) {
                    continue;
                }

                int id = idOf(node);
                String label = escapeLabel(String.valueOf(node.getLabel()));
                out.append("  n" + id + " [label=\"" + label + "\" shape=box];\n");
                for (AsyncGraphNode child : node.getAwaitedBy()) {
                    worklist.push(child);
                    out.append("  n" + id + " -> n" + idOf(child) + ";\n");
                }
            }
            out.append("}\n");
        }

        private int idOf(AsyncGraphNode node) {
            Integer id = nodeToId.get(node);
            if (id == null) {
                id = nextId++;
                nodeToId.put(node, id);
            }
            return id;
        }
    }
}
