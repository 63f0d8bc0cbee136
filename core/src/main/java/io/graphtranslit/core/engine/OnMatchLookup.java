package io.graphtranslit.core.engine;

import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TokenInventory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index of on-match rules by (current token, previous token). Built once per engine; lists keep
 * on-match rule order so the first applicable rule wins.
 */
public final class OnMatchLookup {

    private final Map<String, Map<String, List<Integer>>> byCurrentThenPrevious;

    private OnMatchLookup(Map<String, Map<String, List<Integer>>> byCurrentThenPrevious) {
        this.byCurrentThenPrevious = byCurrentThenPrevious;
    }

    /**
     * Indexes {@code rules} against every declared token pair their boundary classes admit.
     *
     * @param rules     on-match rules in priority order
     * @param inventory declared tokens and classes
     * @return the lookup
     */
    public static OnMatchLookup build(List<OnMatchRule> rules, TokenInventory inventory) {
        Map<String, Map<String, List<Integer>>> index = new HashMap<>();
        for (int ruleIndex = 0; ruleIndex < rules.size(); ruleIndex++) {
            OnMatchRule rule = rules.get(ruleIndex);
            for (String current : inventory.tokensOf(rule.firstNextClass())) {
                for (String previous : inventory.tokensOf(rule.lastPrevClass())) {
                    index.computeIfAbsent(current, k -> new HashMap<>())
                            .computeIfAbsent(previous, k -> new ArrayList<>())
                            .add(ruleIndex);
                }
            }
        }
        Map<String, Map<String, List<Integer>>> frozen = new HashMap<>();
        index.forEach((current, byPrevious) -> {
            Map<String, List<Integer>> inner = new HashMap<>();
            byPrevious.forEach((previous, indices) -> inner.put(previous, List.copyOf(indices)));
            frozen.put(current, Collections.unmodifiableMap(inner));
        });
        return new OnMatchLookup(Collections.unmodifiableMap(frozen));
    }

    /**
     * Candidate on-match rule indices for a match starting at {@code current} preceded by
     * {@code previous}. Callers still check the full class windows.
     */
    public List<Integer> candidates(String current, String previous) {
        return byCurrentThenPrevious.getOrDefault(current, Map.of()).getOrDefault(previous, List.of());
    }

    public boolean isEmpty() {
        return byCurrentThenPrevious.isEmpty();
    }
}
