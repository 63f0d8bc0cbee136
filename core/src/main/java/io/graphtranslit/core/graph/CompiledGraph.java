package io.graphtranslit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rule tree compiled by {@link GraphBuilder}: tokens as internal nodes, rules as leaves. Node ids
 * are dense, starting at {@link #ROOT}.
 *
 * <p>
 * Immutable and thread-safe once built; one instance is shared by all matches of an engine.
 */
public final class CompiledGraph {

    /** Id of the {@link GraphNode.Start} node. */
    public static final int ROOT = 0;

    private final List<GraphNode> nodes;
    private final List<Map<Integer, Edge>> outgoing;
    private final List<ChildIndex> childIndex;
    private final List<EdgeKey> edgeList;

    CompiledGraph(List<GraphNode> nodes, List<Map<Integer, Edge>> outgoing, List<ChildIndex> childIndex) {
        this.nodes = List.copyOf(nodes);
        List<Map<Integer, Edge>> edgesCopy = new ArrayList<>(outgoing.size());
        List<EdgeKey> keys = new ArrayList<>();
        for (int head = 0; head < outgoing.size(); head++) {
            Map<Integer, Edge> out = outgoing.get(head);
            edgesCopy.add(Collections.unmodifiableMap(new LinkedHashMap<>(out)));
            for (Integer tail : out.keySet()) {
                keys.add(new EdgeKey(head, tail));
            }
        }
        this.outgoing = Collections.unmodifiableList(edgesCopy);
        this.childIndex = List.copyOf(childIndex);
        this.edgeList = Collections.unmodifiableList(keys);
    }

    public GraphNode node(int nodeId) {
        return nodes.get(nodeId);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the edge from {@code head} to {@code tail}.
     *
     * @throws IllegalArgumentException if there is no such edge
     */
    public Edge edge(int head, int tail) {
        Edge edge = outgoing.get(head).get(tail);
        if (edge == null) {
            throw new IllegalArgumentException("No edge " + head + " -> " + tail);
        }
        return edge;
    }

    /** Outgoing edges of {@code head}, keyed by tail id, in insertion order. */
    public Map<Integer, Edge> edgesFrom(int head) {
        return outgoing.get(head);
    }

    /** Every edge of the tree, grouped by head. */
    public List<EdgeKey> edgeList() {
        return edgeList;
    }

    public int edgeCount() {
        return edgeList.size();
    }

    public ChildIndex childIndex(int nodeId) {
        return childIndex.get(nodeId);
    }

    /** Identifies an edge by its head and tail node ids. */
    public record EdgeKey(int head, int tail) {}

    @Override
    public String toString() {
        return "CompiledGraph[nodes=" + nodes.size() + ", edges=" + edgeList.size() + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledGraph other)) {
            return false;
        }
        return nodes.equals(other.nodes) && outgoing.equals(other.outgoing) && childIndex.equals(other.childIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, outgoing, childIndex);
    }
}
