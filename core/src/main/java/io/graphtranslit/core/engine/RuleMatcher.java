package io.graphtranslit.core.engine;

import io.graphtranslit.core.graph.CompiledGraph;
import io.graphtranslit.core.graph.Edge;
import io.graphtranslit.core.graph.EdgeConstraints;
import io.graphtranslit.core.graph.GraphNode;
import io.graphtranslit.core.model.TokenInventory;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.spi.MatchVisitor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Depth-first search of a {@link CompiledGraph} for the rules that match at a token position.
 *
 * <p>
 * Children are explored in ascending edge cost, so the first accepting leaf whose constraints hold
 * is the best match. Stateless apart from the immutable graph; safe for concurrent use.
 */
public final class RuleMatcher {

    private final CompiledGraph graph;
    private final List<TransliterationRule> rules;
    private final TokenInventory inventory;

    public RuleMatcher(CompiledGraph graph, List<TransliterationRule> rules, TokenInventory inventory) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.rules = List.copyOf(rules);
        this.inventory = Objects.requireNonNull(inventory, "inventory must not be null");
    }

    /**
     * Finds the cheapest rule matching at {@code position}.
     *
     * @param position index into {@code tokens}
     * @param tokens   tokenized input, sentinels included
     * @param visitor  traversal observer, may be {@code null}
     * @return index of the matching rule in the cost-sorted rule list, or empty
     */
    public OptionalInt matchAt(int position, List<String> tokens, MatchVisitor visitor) {
        List<Integer> found = search(position, tokens, visitor, false);
        return found.isEmpty() ? OptionalInt.empty() : OptionalInt.of(found.get(0));
    }

    /**
     * Finds every rule matching at {@code position}, cheapest first.
     *
     * @param position index into {@code tokens}
     * @param tokens   tokenized input, sentinels included
     * @param visitor  traversal observer, may be {@code null}
     * @return indices of matching rules, in exploration order
     */
    public List<Integer> matchAllAt(int position, List<String> tokens, MatchVisitor visitor) {
        return search(position, tokens, visitor, true);
    }

    private List<Integer> search(int position, List<String> tokens, MatchVisitor visitor, boolean all) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (position < 0 || position >= tokens.size()) {
            throw new IllegalArgumentException(
                    "position " + position + " is outside the token list of size " + tokens.size());
        }
        MatchVisitor observer = visitor != null ? visitor : MatchVisitor.NONE;

        List<Integer> matches = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        observer.onNodeVisited(CompiledGraph.ROOT);
        pushChildren(stack, CompiledGraph.ROOT, position, tokens);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            observer.onNodeVisited(frame.nodeId());
            observer.onEdgeVisited(frame.parentId(), frame.nodeId());

            GraphNode node = graph.node(frame.nodeId());
            if (node instanceof GraphNode.RuleLeaf leaf && constraintsHold(frame, leaf.ruleIndex(), tokens)) {
                if (!all) {
                    return List.of(leaf.ruleIndex());
                }
                matches.add(leaf.ruleIndex());
                continue;
            }

            // The final sentinel is never consumed past.
            int next = frame.tokenIndex() < tokens.size() - 1 ? frame.tokenIndex() + 1 : frame.tokenIndex();
            pushChildren(stack, frame.nodeId(), next, tokens);
        }
        return Collections.unmodifiableList(matches);
    }

    private void pushChildren(Deque<Frame> stack, int nodeId, int tokenIndex, List<String> tokens) {
        List<Integer> children = graph.childIndex(nodeId).childrenFor(tokens.get(tokenIndex));
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), nodeId, tokenIndex));
        }
    }

    private boolean constraintsHold(Frame frame, int ruleIndex, List<String> tokens) {
        Edge edge = graph.edge(frame.parentId(), frame.nodeId());
        if (!edge.hasConstraints()) {
            return true;
        }
        EdgeConstraints constraints = edge.constraints();
        int segmentStart = frame.tokenIndex() - rules.get(ruleIndex).tokens().size();

        List<String> prevTokens = constraints.prevTokens();
        List<String> prevClasses = constraints.prevClasses();
        List<String> nextTokens = constraints.nextTokens();
        List<String> nextClasses = constraints.nextClasses();

        if (!prevTokens.isEmpty() && !TokenWindow.tokensMatch(tokens, segmentStart - prevTokens.size(), prevTokens)) {
            return false;
        }
        if (!prevClasses.isEmpty()
                && !TokenWindow.classesMatch(
                        tokens, segmentStart - prevTokens.size() - prevClasses.size(), prevClasses, inventory)) {
            return false;
        }
        if (!nextTokens.isEmpty() && !TokenWindow.tokensMatch(tokens, frame.tokenIndex(), nextTokens)) {
            return false;
        }
        return nextClasses.isEmpty()
                || TokenWindow.classesMatch(tokens, frame.tokenIndex() + nextTokens.size(), nextClasses, inventory);
    }

    /** A node waiting to be explored; {@code tokenIndex} is the next token to consume below it. */
    private record Frame(int nodeId, int parentId, int tokenIndex) {}
}
