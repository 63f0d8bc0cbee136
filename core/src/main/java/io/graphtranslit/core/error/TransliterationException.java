package io.graphtranslit.core.error;

/**
 * Abstract base for all graph-transliterator exceptions. Never thrown directly; use the concrete
 * subclasses under {@link TransliterationBuildException}, {@link TransliterationEvalException} or
 * {@link CoverageException}.
 */
public abstract class TransliterationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        BUILD,
        TRANSLITERATION,
        COVERAGE
    }

    private final Phase phase;

    protected TransliterationException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected TransliterationException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
