package io.graphtranslit.core.model;

import java.util.Objects;

/**
 * Whitespace handling.
 *
 * @param defaultToken token used as sentinel at both ends of every tokenization
 * @param tokenClass   class marking a token as whitespace
 * @param consolidate  collapse runs of whitespace and drop leading/trailing whitespace
 */
public record WhitespaceRules(String defaultToken, String tokenClass, boolean consolidate) {

    public WhitespaceRules {
        Objects.requireNonNull(defaultToken, "defaultToken must not be null");
        Objects.requireNonNull(tokenClass, "tokenClass must not be null");
    }
}
