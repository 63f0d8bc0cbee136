package io.graphtranslit.core.model;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Two equal-cost rules that can match the same token window with no cheaper rule guaranteed to
 * win first.
 *
 * @param firstRuleIndex  index of the first rule in the cost-sorted rule list
 * @param secondRuleIndex index of the second rule in the cost-sorted rule list
 * @param firstRule       the first rule
 * @param secondRule      the second rule
 * @param pattern         per-slot token sets both rules accept, aligned on the matched segment
 */
public record AmbiguityReport(
        int firstRuleIndex,
        int secondRuleIndex,
        TransliterationRule firstRule,
        TransliterationRule secondRule,
        List<Set<String>> pattern) {

    public AmbiguityReport {
        pattern = pattern.stream().map(Set::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /** One-line description naming the pattern and both rules. */
    public String describe() {
        String slots = pattern.stream()
                .map(slot -> new TreeSet<>(slot).toString())
                .collect(Collectors.joining(", ", "[", "]"));
        return "The pattern " + slots + " can be matched by both: " + firstRule.toEasyReading() + " | "
                + secondRule.toEasyReading();
    }
}
