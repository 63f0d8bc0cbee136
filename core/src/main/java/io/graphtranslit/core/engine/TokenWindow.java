package io.graphtranslit.core.engine;

import io.graphtranslit.core.model.TokenInventory;
import java.util.List;

/** Bounds-checked comparison of a window of input tokens against expected tokens or classes. */
final class TokenWindow {

    private TokenWindow() {}

    /** Whether {@code tokens[start ..]} equals {@code expected}. Out-of-bounds windows never match. */
    static boolean tokensMatch(List<String> tokens, int start, List<String> expected) {
        if (!inBounds(tokens, start, expected.size())) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!tokens.get(start + i).equals(expected.get(i))) {
                return false;
            }
        }
        return true;
    }

    /** Whether each of {@code tokens[start ..]} belongs to the corresponding class. */
    static boolean classesMatch(List<String> tokens, int start, List<String> classes, TokenInventory inventory) {
        if (!inBounds(tokens, start, classes.size())) {
            return false;
        }
        for (int i = 0; i < classes.size(); i++) {
            if (!inventory.hasClass(tokens.get(start + i), classes.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean inBounds(List<String> tokens, int start, int length) {
        return start >= 0 && start + length <= tokens.size();
    }
}
