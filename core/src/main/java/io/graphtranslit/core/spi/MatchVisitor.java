package io.graphtranslit.core.spi;

/**
 * SPI for observing graph traversal during {@code transliterate}. Used for coverage checking of
 * rule sets; the engine itself never depends on a visitor being present.
 *
 * <p>
 * All methods default to no-ops. Implementations shared across concurrent calls MUST be
 * thread-safe. Exceptions thrown by a visitor are caught by the engine and logged; they do NOT
 * affect transliteration.
 */
public interface MatchVisitor {

    /** Visitor that ignores every callback. */
    MatchVisitor NONE = new MatchVisitor() {};

    /**
     * Called when the matcher reaches a graph node (the root once per match attempt).
     *
     * @param nodeId id of the node in the compiled graph
     */
    default void onNodeVisited(int nodeId) {}

    /**
     * Called when the matcher follows an edge.
     *
     * @param headId id of the node the edge leaves
     * @param tailId id of the node the edge enters
     */
    default void onEdgeVisited(int headId, int tailId) {}

    /**
     * Called when an on-match rule inserts its production.
     *
     * @param onMatchRuleIndex index of the rule in the engine's on-match rule list
     */
    default void onOnMatchRuleApplied(int onMatchRuleIndex) {}
}
