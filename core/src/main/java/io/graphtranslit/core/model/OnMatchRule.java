package io.graphtranslit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Connector text inserted before a rule's production when the tokens preceding the match belong
 * to {@code prevClasses} and the tokens starting the match belong to {@code nextClasses}.
 *
 * @param prevClasses classes required for the tokens just before the match, nearest last
 * @param nextClasses classes required for the tokens at the start of the match
 * @param production  text to insert
 */
public record OnMatchRule(List<String> prevClasses, List<String> nextClasses, String production) {

    public OnMatchRule {
        Objects.requireNonNull(prevClasses, "prevClasses must not be null");
        Objects.requireNonNull(nextClasses, "nextClasses must not be null");
        Objects.requireNonNull(production, "production must not be null");
        if (prevClasses.isEmpty() || nextClasses.isEmpty()) {
            throw new IllegalArgumentException("on-match rule needs at least one previous and one next class");
        }
        prevClasses = List.copyOf(prevClasses);
        nextClasses = List.copyOf(nextClasses);
    }

    /** Convenience factory for the common single-class case. */
    public static OnMatchRule between(String prevClass, String nextClass, String production) {
        return new OnMatchRule(List.of(prevClass), List.of(nextClass), production);
    }

    /** Class the token immediately before the match must belong to. */
    public String lastPrevClass() {
        return prevClasses.get(prevClasses.size() - 1);
    }

    /** Class the first matched token must belong to. */
    public String firstNextClass() {
        return nextClasses.get(0);
    }
}
