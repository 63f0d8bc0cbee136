package io.graphtranslit.core.error;

import java.util.List;

/**
 * Thrown when transliteration settings are structurally valid but semantically wrong: a rule with
 * no tokens, a reference to an undeclared token or class, or an inconsistent whitespace
 * definition. Lists every problem found, not only the first.
 */
public final class InvalidRuleDefinitionException extends TransliterationBuildException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public InvalidRuleDefinitionException(String problem) {
        this(List.of(problem), null);
    }

    public InvalidRuleDefinitionException(List<String> problems, String source) {
        super(
                problems.size() == 1
                        ? "Invalid settings: " + problems.get(0)
                        : "Invalid settings (" + problems.size() + " problems): " + String.join("; ", problems),
                source);
        this.problems = List.copyOf(problems);
    }

    /** Every validation problem found. */
    public List<String> problems() {
        return problems;
    }
}
