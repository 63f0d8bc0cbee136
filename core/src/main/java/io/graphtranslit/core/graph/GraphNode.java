package io.graphtranslit.core.graph;

import java.util.Objects;

/** A node of the compiled rule tree: the root, a consumed token, or an accepting rule leaf. */
public sealed interface GraphNode permits GraphNode.Start, GraphNode.TokenNode, GraphNode.RuleLeaf {

    /** Whether reaching this node completes a rule match (subject to edge constraints). */
    default boolean isAccepting() {
        return false;
    }

    /** The root node. There is exactly one, with id {@link CompiledGraph#ROOT}. */
    record Start() implements GraphNode {}

    /** An intermediate node reached by consuming {@code token}. */
    record TokenNode(String token) implements GraphNode {
        public TokenNode {
            Objects.requireNonNull(token, "token must not be null");
        }
    }

    /** An accepting leaf for the rule at {@code ruleIndex} in the cost-sorted rule list. */
    record RuleLeaf(int ruleIndex) implements GraphNode {
        @Override
        public boolean isAccepting() {
            return true;
        }
    }
}
