package io.graphtranslit.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single transliteration rule: when {@code tokens} are matched at the current position, and the
 * optional context lists before and after them hold, {@code production} is emitted.
 *
 * <p>
 * Context lists are never {@code null}; an absent context is an empty list. The matched window,
 * left to right, is {@code prevClasses | prevTokens | tokens | nextTokens | nextClasses}.
 *
 * <p>
 * Immutable, thread-safe.
 *
 * @param production  output emitted when the rule matches
 * @param prevClasses token classes required before {@code prevTokens}
 * @param prevTokens  tokens required immediately before {@code tokens}
 * @param tokens      tokens consumed by the rule (must be non-empty to compile)
 * @param nextTokens  tokens required immediately after {@code tokens}
 * @param nextClasses token classes required after {@code nextTokens}
 * @param cost        rule priority; lower is more specific and tried first
 */
public record TransliterationRule(
        String production,
        List<String> prevClasses,
        List<String> prevTokens,
        List<String> tokens,
        List<String> nextTokens,
        List<String> nextClasses,
        double cost) {

    public TransliterationRule {
        Objects.requireNonNull(production, "production must not be null");
        Objects.requireNonNull(tokens, "tokens must not be null");
        prevClasses = copyOf(prevClasses);
        prevTokens = copyOf(prevTokens);
        tokens = List.copyOf(tokens);
        nextTokens = copyOf(nextTokens);
        nextClasses = copyOf(nextClasses);
        if (Double.isNaN(cost) || Double.isInfinite(cost)) {
            throw new IllegalArgumentException("cost must be finite, got: " + cost);
        }
    }

    /**
     * Creates a rule whose cost is derived from the number of tokens and classes it requires.
     *
     * @see #costOf(int)
     */
    public static TransliterationRule of(
            String production,
            List<String> prevClasses,
            List<String> prevTokens,
            List<String> tokens,
            List<String> nextTokens,
            List<String> nextClasses) {
        int total = sizeOf(prevClasses) + sizeOf(prevTokens) + sizeOf(tokens) + sizeOf(nextTokens)
                + sizeOf(nextClasses);
        return new TransliterationRule(
                production, prevClasses, prevTokens, tokens, nextTokens, nextClasses, costOf(total));
    }

    /**
     * Cost of a rule requiring {@code tokenCount} tokens and classes in total:
     * {@code log2(1 + 1 / (1 + tokenCount))}. More required tokens give a lower cost.
     */
    public static double costOf(int tokenCount) {
        return Math.log(1.0 + 1.0 / (1.0 + tokenCount)) / Math.log(2.0);
    }

    /** Returns a builder for a rule with the given production. */
    public static Builder builder(String production) {
        return new Builder(production);
    }

    /** Total number of tokens and classes this rule requires, context included. */
    public int tokenCount() {
        return prevClasses.size() + prevTokens.size() + tokens.size() + nextTokens.size() + nextClasses.size();
    }

    /** Width of the context required before {@link #tokens()}. */
    public int precedingWidth() {
        return prevClasses.size() + prevTokens.size();
    }

    /** Width of {@link #tokens()} plus the context required after it. */
    public int followingWidth() {
        return tokens.size() + nextTokens.size() + nextClasses.size();
    }

    /** Whether any of the four context lists is non-empty. */
    public boolean hasConstraints() {
        return !prevClasses.isEmpty() || !prevTokens.isEmpty() || !nextTokens.isEmpty() || !nextClasses.isEmpty();
    }

    /** Returns a copy of this rule with the given cost. */
    public TransliterationRule withCost(double newCost) {
        return new TransliterationRule(production, prevClasses, prevTokens, tokens, nextTokens, nextClasses, newCost);
    }

    /**
     * Renders the rule's match pattern in easy-reading form, e.g. {@code (<vowel> b) a (b <consonant>)}.
     * Output only; used in logs and ambiguity reports.
     */
    public String toEasyReading() {
        StringBuilder out = new StringBuilder();
        if (!prevClasses.isEmpty() && !prevTokens.isEmpty()) {
            out.append('(').append(classString(prevClasses)).append(' ').append(tokenString(prevTokens)).append(") ");
        } else if (!prevClasses.isEmpty()) {
            out.append(classString(prevClasses)).append(' ');
        } else if (!prevTokens.isEmpty()) {
            out.append('(').append(tokenString(prevTokens)).append(") ");
        }

        out.append(tokenString(tokens));

        if (!nextTokens.isEmpty() && !nextClasses.isEmpty()) {
            out.append(" (").append(tokenString(nextTokens)).append(' ').append(classString(nextClasses)).append(')');
        } else if (!nextTokens.isEmpty()) {
            out.append(" (").append(tokenString(nextTokens)).append(')');
        } else if (!nextClasses.isEmpty()) {
            out.append(' ').append(classString(nextClasses));
        }
        return out.toString();
    }

    private static String tokenString(List<String> values) {
        return String.join(" ", values);
    }

    private static String classString(List<String> values) {
        return values.stream().map(c -> "<" + c + ">").collect(Collectors.joining(" "));
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    private static int sizeOf(List<String> values) {
        return values == null ? 0 : values.size();
    }

    /**
     * Fluent builder for {@link TransliterationRule}. The cost is derived unless
     * {@link #cost(double)} is called.
     */
    public static final class Builder {

        private final String production;
        private final List<String> prevClasses = new ArrayList<>();
        private final List<String> prevTokens = new ArrayList<>();
        private final List<String> tokens = new ArrayList<>();
        private final List<String> nextTokens = new ArrayList<>();
        private final List<String> nextClasses = new ArrayList<>();
        private Double cost;

        Builder(String production) {
            this.production = Objects.requireNonNull(production, "production must not be null");
        }

        public Builder prevClasses(String... classes) {
            prevClasses.addAll(Arrays.asList(classes));
            return this;
        }

        public Builder prevTokens(String... values) {
            prevTokens.addAll(Arrays.asList(values));
            return this;
        }

        public Builder tokens(String... values) {
            tokens.addAll(Arrays.asList(values));
            return this;
        }

        public Builder nextTokens(String... values) {
            nextTokens.addAll(Arrays.asList(values));
            return this;
        }

        public Builder nextClasses(String... classes) {
            nextClasses.addAll(Arrays.asList(classes));
            return this;
        }

        /** Overrides the derived cost. */
        public Builder cost(double value) {
            this.cost = value;
            return this;
        }

        public TransliterationRule build() {
            TransliterationRule rule = of(production, prevClasses, prevTokens, tokens, nextTokens, nextClasses);
            return cost != null ? rule.withCost(cost) : rule;
        }
    }
}
