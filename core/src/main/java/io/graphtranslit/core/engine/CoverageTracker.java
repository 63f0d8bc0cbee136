package io.graphtranslit.core.engine;

import io.graphtranslit.core.error.IncompleteGraphCoverageException;
import io.graphtranslit.core.error.IncompleteOnMatchRulesCoverageException;
import io.graphtranslit.core.graph.CompiledGraph;
import io.graphtranslit.core.spi.MatchVisitor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MatchVisitor} recording which nodes, edges and on-match rules of an engine have been
 * exercised. Pass it to {@code transliterate} while running a test corpus, then call
 * {@link #checkCoverage()}.
 *
 * <p>
 * Thread-safe.
 */
public final class CoverageTracker implements MatchVisitor {

    private final CompiledGraph graph;
    private final int onMatchRuleCount;
    private final Set<Integer> visitedNodes = ConcurrentHashMap.newKeySet();
    private final Set<CompiledGraph.EdgeKey> visitedEdges = ConcurrentHashMap.newKeySet();
    private final Set<Integer> visitedOnMatchRules = ConcurrentHashMap.newKeySet();

    public CoverageTracker(TransliterationEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        this.graph = engine.graph();
        this.onMatchRuleCount = engine.onMatchRules().size();
    }

    @Override
    public void onNodeVisited(int nodeId) {
        visitedNodes.add(nodeId);
    }

    @Override
    public void onEdgeVisited(int headId, int tailId) {
        visitedEdges.add(new CompiledGraph.EdgeKey(headId, tailId));
    }

    @Override
    public void onOnMatchRuleApplied(int onMatchRuleIndex) {
        visitedOnMatchRules.add(onMatchRuleIndex);
    }

    /**
     * Verifies that every node, edge and on-match rule has been visited.
     *
     * @return {@code true} when coverage is complete
     * @throws IncompleteGraphCoverageException         if a node or edge was never visited
     * @throws IncompleteOnMatchRulesCoverageException  if an on-match rule never fired
     */
    public boolean checkCoverage() {
        List<Integer> missingNodes = new ArrayList<>();
        for (int node = 0; node < graph.nodeCount(); node++) {
            if (!visitedNodes.contains(node)) {
                missingNodes.add(node);
            }
        }
        List<CompiledGraph.EdgeKey> missingEdges = new ArrayList<>();
        for (CompiledGraph.EdgeKey edge : graph.edgeList()) {
            if (!visitedEdges.contains(edge)) {
                missingEdges.add(edge);
            }
        }
        if (!missingNodes.isEmpty() || !missingEdges.isEmpty()) {
            throw new IncompleteGraphCoverageException(
                    "Unvisited nodes: " + missingNodes + "; unvisited edges: " + missingEdges);
        }

        List<Integer> missingOnMatch = new ArrayList<>();
        for (int index = 0; index < onMatchRuleCount; index++) {
            if (!visitedOnMatchRules.contains(index)) {
                missingOnMatch.add(index);
            }
        }
        if (!missingOnMatch.isEmpty()) {
            throw new IncompleteOnMatchRulesCoverageException("Unvisited on-match rules: " + missingOnMatch);
        }
        return true;
    }

    /** Forgets everything visited so far. */
    public void clearVisited() {
        visitedNodes.clear();
        visitedEdges.clear();
        visitedOnMatchRules.clear();
    }

    public Set<Integer> visitedNodes() {
        return Set.copyOf(visitedNodes);
    }

    public Set<CompiledGraph.EdgeKey> visitedEdges() {
        return Set.copyOf(visitedEdges);
    }

    public Set<Integer> visitedOnMatchRules() {
        return Set.copyOf(visitedOnMatchRules);
    }
}
