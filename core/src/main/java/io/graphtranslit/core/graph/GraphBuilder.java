package io.graphtranslit.core.graph;

import io.graphtranslit.core.error.InvalidRuleDefinitionException;
import io.graphtranslit.core.model.TransliterationRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles rules into a {@link CompiledGraph}.
 *
 * <p>
 * Construction is two-phase. First every rule's token path is inserted from the root, sharing
 * prefixes; each traversed edge keeps the lowest cost of the rules passing through it, so the
 * final cost of an edge is only known once all rules are in. Then each node's {@link ChildIndex}
 * is derived with a stable sort by edge cost, so equal costs keep insertion order and the same
 * rule list always yields the same graph.
 *
 * <p>
 * Stateless; safe to use from multiple threads.
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    private GraphBuilder() {}

    /**
     * Builds the rule tree. A rule's leaf records its position in {@code rules}, so callers pass
     * the cost-sorted list they match against.
     *
     * @param rules rules, normally sorted ascending by cost
     * @return the compiled graph
     * @throws InvalidRuleDefinitionException if a rule has no tokens
     */
    public static CompiledGraph build(List<TransliterationRule> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        Draft draft = new Draft();

        for (int ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
            draft.insert(ruleIndex, rules.get(ruleIndex));
        }

        CompiledGraph graph = draft.freeze();
        LOG.debug("Compiled rule graph: rules={}, nodes={}, edges={}", rules.size(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /** Mutable graph used during the insertion phase. */
    private static final class Draft {

        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<Map<String, Integer>> tokenChildren = new ArrayList<>();
        private final List<List<Integer>> ruleChildren = new ArrayList<>();
        private final List<Map<Integer, MutableEdge>> edges = new ArrayList<>();

        Draft() {
            addNode(new GraphNode.Start());
        }

        void insert(int ruleIndex, TransliterationRule rule) {
            if (rule.tokens().isEmpty()) {
                throw new InvalidRuleDefinitionException(
                        "rule " + ruleIndex + " (production '" + rule.production() + "') has no tokens");
            }

            int parent = CompiledGraph.ROOT;
            for (String token : rule.tokens()) {
                Integer child = tokenChildren.get(parent).get(token);
                if (child == null) {
                    child = addNode(new GraphNode.TokenNode(token));
                    tokenChildren.get(parent).put(token, child);
                    edges.get(parent).put(child, new MutableEdge(Double.POSITIVE_INFINITY, null));
                }
                MutableEdge edge = edges.get(parent).get(child);
                edge.cost = Math.min(edge.cost, rule.cost());
                parent = child;
            }

            int leaf = addNode(new GraphNode.RuleLeaf(ruleIndex));
            ruleChildren.get(parent).add(leaf);
            edges.get(parent).put(leaf, new MutableEdge(rule.cost(), EdgeConstraints.of(rule)));
        }

        CompiledGraph freeze() {
            List<Map<Integer, Edge>> frozenEdges = new ArrayList<>(nodes.size());
            List<ChildIndex> index = new ArrayList<>(nodes.size());

            for (int nodeId = 0; nodeId < nodes.size(); nodeId++) {
                Map<Integer, MutableEdge> out = edges.get(nodeId);
                Map<Integer, Edge> frozen = new LinkedHashMap<>();
                out.forEach((tail, edge) -> frozen.put(tail, new Edge(edge.cost, edge.constraints)));
                frozenEdges.add(frozen);

                List<Integer> leaves = ruleChildren.get(nodeId);
                Map<String, Integer> tokens = tokenChildren.get(nodeId);
                if (leaves.isEmpty() && tokens.isEmpty()) {
                    index.add(ChildIndex.EMPTY);
                    continue;
                }

                // List.sort is stable: equal costs keep insertion order.
                Comparator<Integer> byCost = Comparator.comparingDouble(tail -> out.get(tail).cost);

                List<Integer> immediate = new ArrayList<>(leaves);
                immediate.sort(byCost);

                Map<String, List<Integer>> byToken = new LinkedHashMap<>();
                tokens.forEach((token, child) -> {
                    List<Integer> candidates = new ArrayList<>(1 + leaves.size());
                    candidates.add(child);
                    candidates.addAll(leaves);
                    candidates.sort(byCost);
                    byToken.put(token, candidates);
                });
                index.add(new ChildIndex(byToken, immediate));
            }
            return new CompiledGraph(nodes, frozenEdges, index);
        }

        private int addNode(GraphNode node) {
            nodes.add(node);
            tokenChildren.add(new LinkedHashMap<>());
            ruleChildren.add(new ArrayList<>());
            edges.add(new LinkedHashMap<>());
            return nodes.size() - 1;
        }
    }

    private static final class MutableEdge {
        private double cost;
        private final EdgeConstraints constraints;

        MutableEdge(double cost, EdgeConstraints constraints) {
            this.cost = cost;
            this.constraints = constraints;
        }
    }
}
