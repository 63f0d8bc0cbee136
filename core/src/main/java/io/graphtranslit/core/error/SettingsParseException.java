package io.graphtranslit.core.error;

/** Thrown when a settings YAML/JSON document cannot be read, violates the schema, or has unknown keys. */
public final class SettingsParseException extends TransliterationBuildException {

    private static final long serialVersionUID = 1L;

    public SettingsParseException(String message, String source) {
        super(message, source);
    }

    public SettingsParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
