package io.graphtranslit.core.engine;

import io.graphtranslit.core.model.AmbiguityReport;
import io.graphtranslit.core.model.TokenInventory;
import io.graphtranslit.core.model.TransliterationRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects pairs of equal-cost rules that can match the same token window.
 *
 * <p>
 * Each rule is expanded into a row of per-slot token sets aligned on the first consumed token:
 * class constraints become the tokens of that class, token constraints singletons, and unused
 * slots on either side are padded with every declared token. Two rules of equal cost conflict
 * when every slot of their rows intersects, unless a strictly cheaper rule's row contains the whole
 * intersection (the cheaper rule always wins first).
 */
public final class AmbiguityChecker {

    private static final Logger LOG = LoggerFactory.getLogger(AmbiguityChecker.class);

    private AmbiguityChecker() {}

    /**
     * Checks {@code rules} and returns every ambiguity found. Each one is also logged at WARN.
     *
     * @param rules     rules, as indexed in reports (normally the cost-sorted list)
     * @param inventory declared tokens and classes
     * @return reports ordered by cost group, then rule index; empty when the rule set is unambiguous
     */
    public static List<AmbiguityReport> check(List<TransliterationRule> rules, TokenInventory inventory) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(inventory, "inventory must not be null");
        if (rules.size() < 2) {
            return List.of();
        }

        int maxPreceding = rules.stream().mapToInt(TransliterationRule::precedingWidth).max().orElse(0);
        int width = rules.stream()
                .mapToInt(rule -> maxPreceding + rule.followingWidth())
                .max()
                .orElse(0);

        List<List<Set<String>>> rows = new ArrayList<>(rules.size());
        for (TransliterationRule rule : rules) {
            rows.add(rowOf(rule, inventory, maxPreceding, width));
        }

        Map<Double, List<Integer>> byCost = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            byCost.computeIfAbsent(groupKey(rules.get(i).cost()), k -> new ArrayList<>()).add(i);
        }

        List<AmbiguityReport> reports = new ArrayList<>();
        for (Map.Entry<Double, List<Integer>> group : byCost.entrySet()) {
            List<Integer> members = group.getValue();
            for (int a = 0; a < members.size(); a++) {
                for (int b = a + 1; b < members.size(); b++) {
                    int first = members.get(a);
                    int second = members.get(b);
                    List<Set<String>> overlap = intersect(rows.get(first), rows.get(second));
                    if (overlap == null || coveredByCheaperRule(overlap, group.getKey(), rules, rows)) {
                        continue;
                    }
                    AmbiguityReport report =
                            new AmbiguityReport(first, second, rules.get(first), rules.get(second), overlap);
                    LOG.warn("Ambiguous rules: {}", report.describe());
                    reports.add(report);
                }
            }
        }
        return Collections.unmodifiableList(reports);
    }

    private static List<Set<String>> rowOf(
            TransliterationRule rule, TokenInventory inventory, int maxPreceding, int width) {
        Set<String> any = inventory.allTokens();
        List<Set<String>> row = new ArrayList<>(width);
        for (int i = rule.precedingWidth(); i < maxPreceding; i++) {
            row.add(any);
        }
        rule.prevClasses().forEach(c -> row.add(inventory.tokensOf(c)));
        rule.prevTokens().forEach(t -> row.add(Set.of(t)));
        rule.tokens().forEach(t -> row.add(Set.of(t)));
        rule.nextTokens().forEach(t -> row.add(Set.of(t)));
        rule.nextClasses().forEach(c -> row.add(inventory.tokensOf(c)));
        while (row.size() < width) {
            row.add(any);
        }
        return row;
    }

    /** Slot-wise intersection, or {@code null} if some slot is empty. */
    private static List<Set<String>> intersect(List<Set<String>> left, List<Set<String>> right) {
        List<Set<String>> result = new ArrayList<>(left.size());
        for (int slot = 0; slot < left.size(); slot++) {
            Set<String> common = new HashSet<>(left.get(slot));
            common.retainAll(right.get(slot));
            if (common.isEmpty()) {
                return null;
            }
            result.add(common);
        }
        return result;
    }

    /** Folds -0.0 into 0.0 so both land in one group, as {@code <} treats them. */
    private static double groupKey(double cost) {
        return cost == 0.0 ? 0.0 : cost;
    }

    private static boolean coveredByCheaperRule(
            List<Set<String>> overlap, double cost, List<TransliterationRule> rules, List<List<Set<String>>> rows) {
        for (int k = 0; k < rules.size(); k++) {
            if (rules.get(k).cost() < cost && contains(rows.get(k), overlap)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(List<Set<String>> row, List<Set<String>> overlap) {
        for (int slot = 0; slot < row.size(); slot++) {
            if (!row.get(slot).containsAll(overlap.get(slot))) {
                return false;
            }
        }
        return true;
    }
}
