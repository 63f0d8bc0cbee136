package io.graphtranslit.core.graph;

import io.graphtranslit.core.model.TransliterationRule;
import java.util.List;

/**
 * Context a rule places on the tokens around its matched segment. Attached only to edges ending
 * in a {@link GraphNode.RuleLeaf}.
 *
 * @param prevClasses classes required before {@code prevTokens}
 * @param prevTokens  tokens required immediately before the matched segment
 * @param nextTokens  tokens required immediately after the matched segment
 * @param nextClasses classes required after {@code nextTokens}
 */
public record EdgeConstraints(
        List<String> prevClasses, List<String> prevTokens, List<String> nextTokens, List<String> nextClasses) {

    public EdgeConstraints {
        prevClasses = List.copyOf(prevClasses);
        prevTokens = List.copyOf(prevTokens);
        nextTokens = List.copyOf(nextTokens);
        nextClasses = List.copyOf(nextClasses);
    }

    /** Constraints of {@code rule}, or {@code null} when it has no context lists. */
    public static EdgeConstraints of(TransliterationRule rule) {
        if (!rule.hasConstraints()) {
            return null;
        }
        return new EdgeConstraints(rule.prevClasses(), rule.prevTokens(), rule.nextTokens(), rule.nextClasses());
    }
}
