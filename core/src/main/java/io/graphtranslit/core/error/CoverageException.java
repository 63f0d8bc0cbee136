package io.graphtranslit.core.error;

/** Abstract parent for failures reported by {@code CoverageTracker.checkCoverage()}. */
public abstract class CoverageException extends TransliterationException {

    private static final long serialVersionUID = 1L;

    protected CoverageException(String message) {
        super(message, Phase.COVERAGE);
    }
}
