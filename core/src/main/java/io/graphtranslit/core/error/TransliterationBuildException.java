package io.graphtranslit.core.error;

/**
 * Abstract parent for build-time errors. Thrown while loading settings or compiling a {@code
 * TransliterationEngine}; a build error never leaves a partially usable engine behind. Carries an
 * optional {@code source} identifying the file or resource that caused the error.
 */
public abstract class TransliterationBuildException extends TransliterationException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected TransliterationBuildException(String message, String source) {
        super(message, Phase.BUILD);
        this.source = source;
    }

    protected TransliterationBuildException(String message, Throwable cause, String source) {
        super(message, cause, Phase.BUILD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if built in memory. */
    public String source() {
        return source;
    }
}
