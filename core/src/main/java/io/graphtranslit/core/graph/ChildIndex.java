package io.graphtranslit.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered children of one node. For every token that continues a path, the candidate child ids
 * (the token node plus any rule leaves hanging off this node) sorted ascending by edge cost; and
 * the rule leaves reachable without consuming another token, also sorted by cost.
 *
 * @param byToken   token to cost-ordered child ids
 * @param immediate cost-ordered rule-leaf ids reachable with no further token
 */
public record ChildIndex(Map<String, List<Integer>> byToken, List<Integer> immediate) {

    static final ChildIndex EMPTY = new ChildIndex(Map.of(), List.of());

    public ChildIndex {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        byToken.forEach((token, ids) -> copy.put(token, List.copyOf(ids)));
        byToken = Collections.unmodifiableMap(copy);
        immediate = List.copyOf(immediate);
    }

    /** Cost-ordered children to try when the next input token is {@code token}. */
    public List<Integer> childrenFor(String token) {
        List<Integer> children = byToken.get(token);
        return children != null && !children.isEmpty() ? children : immediate;
    }

    public boolean isEmpty() {
        return byToken.isEmpty() && immediate.isEmpty();
    }
}
