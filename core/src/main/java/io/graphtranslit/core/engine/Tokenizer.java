package io.graphtranslit.core.engine;

import io.graphtranslit.core.error.InvalidRuleDefinitionException;
import io.graphtranslit.core.error.UnrecognizedTokenException;
import io.graphtranslit.core.model.TokenInventory;
import io.graphtranslit.core.model.WhitespaceRules;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits text into declared tokens, always taking the longest token that matches at the current
 * offset. The result is bracketed by the default whitespace token so downstream matching never
 * runs off either end.
 *
 * <p>
 * Thread-safe: the compiled {@link Pattern} is shared and each call uses its own {@link Matcher}.
 */
public final class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    // Longest first, then reverse lexical.
    private static final Comparator<String> MUNCH_ORDER =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()).reversed();

    private final TokenInventory inventory;
    private final WhitespaceRules whitespace;
    private final Pattern pattern;

    /**
     * Creates a tokenizer for the tokens declared in {@code inventory}.
     *
     * @param inventory  declared tokens and their classes
     * @param whitespace whitespace handling
     * @throws InvalidRuleDefinitionException if a declared token is the empty string
     */
    public Tokenizer(TokenInventory inventory, WhitespaceRules whitespace) {
        this.inventory = Objects.requireNonNull(inventory, "inventory must not be null");
        this.whitespace = Objects.requireNonNull(whitespace, "whitespace must not be null");
        this.pattern = patternOf(new ArrayList<>(inventory.allTokens()));
    }

    /**
     * Tokenizes {@code text}.
     *
     * @param text         input text
     * @param ignoreErrors skip characters no token matches instead of failing
     * @return unmodifiable token list, starting and ending with the default whitespace token
     * @throws UnrecognizedTokenException if a character cannot be tokenized and {@code ignoreErrors}
     *                                    is false
     */
    public List<String> tokenize(String text, boolean ignoreErrors) {
        Objects.requireNonNull(text, "text must not be null");

        List<String> tokens = new ArrayList<>();
        tokens.add(whitespace.defaultToken());

        boolean prevWhitespace = true;
        Matcher matcher = pattern != null ? pattern.matcher(text) : null;
        int offset = 0;
        while (offset < text.length()) {
            if (matcher != null && matcher.region(offset, text.length()).lookingAt()) {
                String token = matcher.group();
                offset = matcher.end();
                if (isWhitespace(token)) {
                    if (prevWhitespace && whitespace.consolidate()) {
                        continue;
                    }
                    prevWhitespace = true;
                } else {
                    prevWhitespace = false;
                }
                tokens.add(token);
            } else {
                LOG.warn("Unrecognizable token at offset {} of \"{}\"", offset, text);
                if (!ignoreErrors) {
                    throw new UnrecognizedTokenException(text, offset);
                }
                offset += Character.charCount(text.codePointAt(offset));
            }
        }

        if (whitespace.consolidate()) {
            while (tokens.size() > 1 && isWhitespace(tokens.get(tokens.size() - 1))) {
                tokens.remove(tokens.size() - 1);
            }
        }

        tokens.add(whitespace.defaultToken());
        return Collections.unmodifiableList(tokens);
    }

    /** Whether {@code token} belongs to the whitespace class. */
    public boolean isWhitespace(String token) {
        return inventory.hasClass(token, whitespace.tokenClass());
    }

    /** The alternation pattern used for matching, or {@code null} when no tokens are declared. */
    public Pattern pattern() {
        return pattern;
    }

    private static Pattern patternOf(List<String> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        if (tokens.contains("")) {
            throw new InvalidRuleDefinitionException("tokens must not be empty strings");
        }
        tokens.sort(MUNCH_ORDER);
        return Pattern.compile(tokens.stream().map(Pattern::quote).collect(Collectors.joining("|")));
    }
}
