package io.graphtranslit.core.error;

/** Thrown in strict mode when no declared token matches the input at some character offset. */
public final class UnrecognizedTokenException extends TransliterationEvalException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public UnrecognizedTokenException(String input, int offset) {
        super(
                "Unrecognized character '" + new String(Character.toChars(input.codePointAt(offset))) + "' at offset "
                        + offset + " of \"" + input + "\"",
                input);
        this.offset = offset;
    }

    /** Character offset in the input at which tokenization failed. */
    public int offset() {
        return offset;
    }
}
