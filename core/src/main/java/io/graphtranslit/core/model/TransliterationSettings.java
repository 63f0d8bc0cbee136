package io.graphtranslit.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured input of {@code TransliterationEngine.compile}: declared tokens with their classes,
 * rules, on-match rules, whitespace handling and free-form metadata.
 *
 * <p>
 * Rules are kept in declaration order; the engine sorts its own copy by cost. Immutable,
 * thread-safe.
 *
 * @param tokens       token to list of classes, in declaration order
 * @param rules        transliteration rules in declaration order
 * @param onMatchRules on-match rules; order decides which one fires first
 * @param whitespace   whitespace handling
 * @param metadata     free-form metadata (author, version, ...), never interpreted
 */
public record TransliterationSettings(
        Map<String, List<String>> tokens,
        List<TransliterationRule> rules,
        List<OnMatchRule> onMatchRules,
        WhitespaceRules whitespace,
        Map<String, Object> metadata) {

    public TransliterationSettings {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(whitespace, "whitespace must not be null");
        Map<String, List<String>> tokenCopy = new LinkedHashMap<>();
        tokens.forEach((token, classes) -> tokenCopy.put(token, classes == null ? List.of() : List.copyOf(classes)));
        tokens = Collections.unmodifiableMap(tokenCopy);
        rules = List.copyOf(rules);
        onMatchRules = onMatchRules != null ? List.copyOf(onMatchRules) : List.of();
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /** Returns a copy of these settings with a different rule list. */
    public TransliterationSettings withRules(List<TransliterationRule> newRules) {
        return new TransliterationSettings(tokens, newRules, onMatchRules, whitespace, metadata);
    }

    /**
     * Returns a new {@link Builder} for assembling settings in code.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link TransliterationSettings}. */
    public static final class Builder {

        private final Map<String, List<String>> tokens = new LinkedHashMap<>();
        private final List<TransliterationRule> rules = new ArrayList<>();
        private final List<OnMatchRule> onMatchRules = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private WhitespaceRules whitespace;

        Builder() {}

        /** Declares a token with its classes. Re-declaring a token replaces its classes. */
        public Builder token(String token, String... classes) {
            tokens.put(token, Arrays.asList(classes));
            return this;
        }

        public Builder rule(TransliterationRule rule) {
            rules.add(rule);
            return this;
        }

        /** Adds a rule that consumes {@code tokens} with no context, at its derived cost. */
        public Builder rule(String production, String... ruleTokens) {
            return rule(TransliterationRule.builder(production).tokens(ruleTokens).build());
        }

        public Builder onMatch(OnMatchRule rule) {
            onMatchRules.add(rule);
            return this;
        }

        public Builder whitespace(String defaultToken, String tokenClass, boolean consolidate) {
            this.whitespace = new WhitespaceRules(defaultToken, tokenClass, consolidate);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public TransliterationSettings build() {
            return new TransliterationSettings(tokens, rules, onMatchRules, whitespace, metadata);
        }
    }
}
