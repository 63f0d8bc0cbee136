package io.graphtranslit.core.settings;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code \N{UNICODE CHARACTER NAME}} escapes, e.g. {@code \N{LATIN SMALL LETTER A}} to
 * {@code a}. Names are looked up case-insensitively via {@link Character#codePointOf(String)}.
 */
public final class CharacterNames {

    private static final Pattern ESCAPE = Pattern.compile("\\\\N\\{([^}]+)}");

    private CharacterNames() {}

    /**
     * Replaces every {@code \N{...}} escape in {@code text} by the named character.
     *
     * @param text text possibly containing escapes
     * @return the expanded text; {@code text} itself if it has no escapes
     * @throws IllegalArgumentException if a name is not a Unicode character name
     */
    public static String unescape(String text) {
        Matcher matcher = ESCAPE.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        do {
            String name = matcher.group(1).trim();
            int codePoint;
            try {
                codePoint = Character.codePointOf(name);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown Unicode character name: '" + name + "'", e);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(new String(Character.toChars(codePoint))));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }
}
