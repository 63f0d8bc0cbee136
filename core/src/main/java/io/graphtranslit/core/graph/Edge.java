package io.graphtranslit.core.graph;

/**
 * A compiled edge.
 *
 * @param cost        cost of the cheapest rule reachable through this edge
 * @param constraints context to check before accepting the rule leaf, or {@code null}
 */
public record Edge(double cost, EdgeConstraints constraints) {

    public boolean hasConstraints() {
        return constraints != null;
    }
}
