package io.graphtranslit.core.engine;

/**
 * Compile and runtime options of a {@link TransliterationEngine}.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param checkSettings  validate token and class references before compiling (default: true)
 * @param checkAmbiguity reject rule sets with unresolved equal-cost overlaps (default: true)
 * @param ignoreErrors   default lenience of {@code tokenize}/{@code transliterate}: skip
 *                       unrecognized characters and unmatched tokens instead of throwing
 *                       (default: false)
 */
public record EngineOptions(boolean checkSettings, boolean checkAmbiguity, boolean ignoreErrors) {

    /** Validate settings, check ambiguity, fail on errors. */
    public static final EngineOptions DEFAULT = new EngineOptions(true, true, false);

    public EngineOptions withCheckSettings(boolean value) {
        return new EngineOptions(value, checkAmbiguity, ignoreErrors);
    }

    public EngineOptions withCheckAmbiguity(boolean value) {
        return new EngineOptions(checkSettings, value, ignoreErrors);
    }

    public EngineOptions withIgnoreErrors(boolean value) {
        return new EngineOptions(checkSettings, checkAmbiguity, value);
    }
}
