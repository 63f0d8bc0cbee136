package io.graphtranslit.core.error;

import java.util.List;

/** Thrown in strict mode when no rule matches at a token position during transliteration. */
public final class NoMatchingRuleException extends TransliterationEvalException {

    private static final long serialVersionUID = 1L;

    private final int tokenIndex;
    private final List<String> tokens;

    public NoMatchingRuleException(String input, int tokenIndex, List<String> tokens) {
        super("No matching rule at token " + tokenIndex + " of " + tokens, input);
        this.tokenIndex = tokenIndex;
        this.tokens = List.copyOf(tokens);
    }

    /** Index into {@link #tokens()} (which includes the whitespace sentinels) that could not be matched. */
    public int tokenIndex() {
        return tokenIndex;
    }

    /** The full token sequence, sentinels included. */
    public List<String> tokens() {
        return tokens;
    }
}
