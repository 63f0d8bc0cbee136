package io.graphtranslit.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one {@code transliterate} call: the output text, the tokens the input was split into,
 * and the trace of rules matched, in input order. Owned by the caller; the engine keeps no copy.
 *
 * @param output             transliterated text
 * @param inputTokens        tokenized input, whitespace sentinels included
 * @param matchedRuleIndices indices (into the engine's cost-sorted rule list) of each match
 * @param matchedRules       the matched rules, parallel to {@code matchedRuleIndices}
 */
public record TransliterationResult(
        String output,
        List<String> inputTokens,
        List<Integer> matchedRuleIndices,
        List<TransliterationRule> matchedRules) {

    public TransliterationResult {
        Objects.requireNonNull(output, "output must not be null");
        inputTokens = List.copyOf(inputTokens);
        matchedRuleIndices = List.copyOf(matchedRuleIndices);
        matchedRules = List.copyOf(matchedRules);
        if (matchedRuleIndices.size() != matchedRules.size()) {
            throw new IllegalArgumentException("matchedRuleIndices and matchedRules differ in size");
        }
    }

    /** The tokens consumed by each matched rule. */
    public List<List<String>> matchedRuleTokens() {
        return matchedRules.stream().map(TransliterationRule::tokens).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "TransliterationResult[output=\"" + output + "\", matches=" + matchedRuleIndices + "]";
    }
}
