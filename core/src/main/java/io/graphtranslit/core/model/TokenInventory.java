package io.graphtranslit.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declared tokens and their classes, with the reverse class-to-tokens index precomputed. Class
 * constraints are answered by set membership against these maps.
 *
 * <p>
 * Immutable, thread-safe. Iteration follows declaration order.
 */
public final class TokenInventory {

    private final Map<String, Set<String>> classesByToken;
    private final Map<String, Set<String>> tokensByClass;

    private TokenInventory(Map<String, Set<String>> classesByToken, Map<String, Set<String>> tokensByClass) {
        this.classesByToken = classesByToken;
        this.tokensByClass = tokensByClass;
    }

    /**
     * Builds an inventory from a token-to-classes mapping.
     *
     * @param tokens map of token to its classes (possibly empty)
     * @return the inventory
     */
    public static TokenInventory of(Map<String, ? extends Collection<String>> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Map<String, Set<String>> byToken = new LinkedHashMap<>();
        Map<String, Set<String>> byClass = new LinkedHashMap<>();
        tokens.forEach((token, classes) -> {
            Set<String> classSet = classes == null ? Set.of() : new LinkedHashSet<>(classes);
            byToken.put(token, Collections.unmodifiableSet(classSet));
            for (String tokenClass : classSet) {
                byClass.computeIfAbsent(tokenClass, k -> new LinkedHashSet<>()).add(token);
            }
        });
        byClass.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        return new TokenInventory(Collections.unmodifiableMap(byToken), Collections.unmodifiableMap(byClass));
    }

    public boolean contains(String token) {
        return classesByToken.containsKey(token);
    }

    /** Classes of {@code token}, or an empty set if the token is undeclared. */
    public Set<String> classesOf(String token) {
        return classesByToken.getOrDefault(token, Set.of());
    }

    public boolean hasClass(String token, String tokenClass) {
        return classesOf(token).contains(tokenClass);
    }

    /** Tokens belonging to {@code tokenClass}, or an empty set if no token has it. */
    public Set<String> tokensOf(String tokenClass) {
        return tokensByClass.getOrDefault(tokenClass, Set.of());
    }

    public Set<String> allTokens() {
        return classesByToken.keySet();
    }

    public Set<String> classNames() {
        return tokensByClass.keySet();
    }

    /** Token-to-classes view, in declaration order. */
    public Map<String, Set<String>> asMap() {
        return classesByToken;
    }

    public int size() {
        return classesByToken.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TokenInventory other && classesByToken.equals(other.classesByToken);
    }

    @Override
    public int hashCode() {
        return classesByToken.hashCode();
    }

    @Override
    public String toString() {
        return "TokenInventory" + classesByToken;
    }
}
