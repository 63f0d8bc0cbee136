package io.graphtranslit.core.error;

/** Thrown when some graph nodes or edges were never visited during a coverage run. */
public final class IncompleteGraphCoverageException extends CoverageException {

    private static final long serialVersionUID = 1L;

    public IncompleteGraphCoverageException(String message) {
        super(message);
    }
}
