package io.graphtranslit.core.settings;

import io.graphtranslit.core.error.InvalidRuleDefinitionException;
import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TokenInventory;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.model.TransliterationSettings;
import io.graphtranslit.core.model.WhitespaceRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Semantic checks on {@link TransliterationSettings} that the schema cannot express: references
 * between rules and the token inventory, and whitespace consistency. Collects every problem
 * before failing.
 */
public final class SettingsValidator {

    private SettingsValidator() {}

    /**
     * Validates {@code settings}.
     *
     * @param settings settings to check
     * @throws InvalidRuleDefinitionException listing all problems found, if any
     */
    public static void validate(TransliterationSettings settings) {
        validate(settings, null);
    }

    /**
     * Validates {@code settings}, attributing failures to {@code source}.
     *
     * @param settings settings to check
     * @param source   file or resource the settings came from, may be {@code null}
     * @throws InvalidRuleDefinitionException listing all problems found, if any
     */
    public static void validate(TransliterationSettings settings, String source) {
        Objects.requireNonNull(settings, "settings must not be null");
        List<String> problems = new ArrayList<>();
        TokenInventory inventory = TokenInventory.of(settings.tokens());

        if (inventory.allTokens().contains("")) {
            problems.add("tokens must not be empty strings");
        }

        List<TransliterationRule> rules = settings.rules();
        for (int i = 0; i < rules.size(); i++) {
            checkRule(i, rules.get(i), inventory, problems);
        }

        List<OnMatchRule> onMatchRules = settings.onMatchRules();
        for (int i = 0; i < onMatchRules.size(); i++) {
            OnMatchRule rule = onMatchRules.get(i);
            String where = "onmatch_rules[" + i + "]";
            checkClasses(where + ".prev_classes", rule.prevClasses(), inventory, problems);
            checkClasses(where + ".next_classes", rule.nextClasses(), inventory, problems);
        }

        WhitespaceRules whitespace = settings.whitespace();
        if (!inventory.contains(whitespace.defaultToken())) {
            problems.add("whitespace default token '" + whitespace.defaultToken() + "' is not declared");
        } else if (!inventory.hasClass(whitespace.defaultToken(), whitespace.tokenClass())) {
            problems.add("whitespace default token '" + whitespace.defaultToken() + "' lacks class '"
                    + whitespace.tokenClass() + "'");
        }
        if (!inventory.classNames().contains(whitespace.tokenClass())) {
            problems.add("whitespace class '" + whitespace.tokenClass() + "' is not assigned to any token");
        }

        if (!problems.isEmpty()) {
            throw new InvalidRuleDefinitionException(problems, source);
        }
    }

    private static void checkRule(int index, TransliterationRule rule, TokenInventory inventory, List<String> problems) {
        String where = "rules[" + index + "] ('" + rule.production() + "')";
        if (rule.tokens().isEmpty()) {
            problems.add(where + " has no tokens");
        }
        checkTokens(where + ".prev_tokens", rule.prevTokens(), inventory, problems);
        checkTokens(where + ".tokens", rule.tokens(), inventory, problems);
        checkTokens(where + ".next_tokens", rule.nextTokens(), inventory, problems);
        checkClasses(where + ".prev_classes", rule.prevClasses(), inventory, problems);
        checkClasses(where + ".next_classes", rule.nextClasses(), inventory, problems);
    }

    private static void checkTokens(String where, List<String> tokens, TokenInventory inventory, List<String> problems) {
        for (String token : tokens) {
            if (!inventory.contains(token)) {
                problems.add(where + ": token '" + token + "' is not declared");
            }
        }
    }

    private static void checkClasses(
            String where, List<String> classes, TokenInventory inventory, List<String> problems) {
        for (String tokenClass : classes) {
            if (!inventory.classNames().contains(tokenClass)) {
                problems.add(where + ": class '" + tokenClass + "' is not assigned to any token");
            }
        }
    }
}
