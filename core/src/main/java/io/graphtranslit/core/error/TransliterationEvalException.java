package io.graphtranslit.core.error;

/**
 * Abstract parent for per-call errors raised by {@code tokenize} and {@code transliterate} in
 * strict mode. In lenient mode the engine logs the offending position and skips it instead.
 * Carries the input text that was being processed.
 */
public abstract class TransliterationEvalException extends TransliterationException {

    private static final long serialVersionUID = 1L;

    private final String input;

    protected TransliterationEvalException(String message, String input) {
        super(message, Phase.TRANSLITERATION);
        this.input = input;
    }

    /** The input text being processed when the error occurred. */
    public String input() {
        return input;
    }
}
