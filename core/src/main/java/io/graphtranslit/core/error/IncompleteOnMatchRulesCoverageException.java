package io.graphtranslit.core.error;

/** Thrown when some on-match rules never fired during a coverage run. */
public final class IncompleteOnMatchRulesCoverageException extends CoverageException {

    private static final long serialVersionUID = 1L;

    public IncompleteOnMatchRulesCoverageException(String message) {
        super(message);
    }
}
