package io.graphtranslit.core.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphtranslit.core.error.SettingsParseException;
import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.model.TransliterationSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SettingsParser")
class SettingsParserTest {

    private static final Path RULE_SETS = Path.of("src/test/resources/rule-sets");

    private final SettingsParser parser = new SettingsParser();

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("valid documents")
    class Valid {

        @Test
        @DisplayName("parses every section of a YAML file")
        void parsesExample() {
            TransliterationSettings settings = parser.parse(RULE_SETS.resolve("example.yaml"));

            assertThat(settings.tokens()).containsOnlyKeys("a", "b", " ");
            assertThat(settings.tokens().get("a")).containsExactly("class1");
            assertThat(settings.rules()).extracting(TransliterationRule::production).containsExactly("A", "B", " ", "A*");
            assertThat(settings.onMatchRules()).containsExactly(OnMatchRule.between("class1", "class1", ","));
            assertThat(settings.whitespace().defaultToken()).isEqualTo(" ");
            assertThat(settings.whitespace().tokenClass()).isEqualTo("wb");
            assertThat(settings.whitespace().consolidate()).isFalse();
            assertThat(settings.metadata()).containsEntry("author", "Author McAuthorson");
        }

        @Test
        @DisplayName("keeps every context list of a rule")
        void ruleContext() {
            TransliterationRule rule = parser.parse(RULE_SETS.resolve("example.yaml")).rules().get(3);

            assertThat(rule.prevClasses()).containsExactly("class2");
            assertThat(rule.prevTokens()).containsExactly("a");
            assertThat(rule.tokens()).containsExactly("a");
            assertThat(rule.nextTokens()).containsExactly("a");
            assertThat(rule.nextClasses()).containsExactly("class2");
            assertThat(rule.cost()).isEqualTo(TransliterationRule.costOf(5));
        }

        @Test
        @DisplayName("explicit cost overrides the derived one")
        void explicitCost() {
            TransliterationSettings settings = parser.parse("""
                    tokens:
                      a: []
                      ' ': [wb]
                    rules:
                      - production: A
                        tokens: [a]
                        cost: 0.25
                    whitespace:
                      default: ' '
                      token_class: wb
                    """, "inline");

            assertThat(settings.rules().get(0).cost()).isEqualTo(0.25);
            assertThat(settings.whitespace().consolidate()).isFalse();
            assertThat(settings.onMatchRules()).isEmpty();
            assertThat(settings.metadata()).isEmpty();
        }

        @Test
        @DisplayName("accepts JSON documents")
        void json() {
            TransliterationSettings settings = parser.parse(
                    "{\"tokens\": {\"a\": [], \" \": [\"wb\"]},"
                            + " \"rules\": [{\"production\": \"A\", \"tokens\": [\"a\"]}],"
                            + " \"whitespace\": {\"default\": \" \", \"token_class\": \"wb\", \"consolidate\": true}}",
                    "inline.json");

            assertThat(settings.rules()).hasSize(1);
            assertThat(settings.whitespace().consolidate()).isTrue();
        }

        @Test
        @DisplayName("expands character names before parsing")
        void characterNames() {
            TransliterationSettings settings = parser.parse(RULE_SETS.resolve("unicode-names.yaml"));

            assertThat(settings.rules())
                    .extracting(TransliterationRule::production)
                    .containsExactly("\u0909", "\u0941");
        }
    }

    @Nested
    @DisplayName("invalid documents")
    class Invalid {

        @Test
        @DisplayName("unknown top-level key")
        void unknownRootKey() {
            Path path = RULE_SETS.resolve("invalid/unknown-root-key.yaml");

            assertThatThrownBy(() -> parser.parse(path))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageContaining("Unknown key in 'settings root': [ignore_errors]")
                    .satisfies(e -> assertThat(((SettingsParseException) e).source()).isEqualTo(path.toString()));
        }

        @Test
        @DisplayName("unknown rule key")
        void unknownRuleKey() {
            assertThatThrownBy(() -> parser.parse(RULE_SETS.resolve("invalid/unknown-rule-key.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageContaining("Unknown key in 'rules[0]': [next_token]");
        }

        @Test
        @DisplayName("missing required section")
        void missingWhitespace() {
            assertThatThrownBy(() -> parser.parse(RULE_SETS.resolve("invalid/missing-whitespace.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Settings do not match schema")
                    .hasMessageContaining("whitespace");
        }

        @Test
        @DisplayName("classes given as a scalar instead of a list")
        void classesNotAList() {
            assertThatThrownBy(() -> parser.parse(RULE_SETS.resolve("invalid/classes-not-a-list.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Settings do not match schema");
        }

        @Test
        @DisplayName("rule without tokens")
        void emptyRuleTokens() {
            assertThatThrownBy(() -> parser.parse(RULE_SETS.resolve("invalid/empty-rule-tokens.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Settings do not match schema");
        }

        @Test
        @DisplayName("unknown character name")
        void unknownCharacterName() {
            assertThatThrownBy(() -> parser.parse(RULE_SETS.resolve("invalid/unknown-character-name.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageContaining("Unknown Unicode character name");
        }

        @Test
        @DisplayName("malformed YAML")
        void malformedYaml() {
            assertThatThrownBy(() -> parser.parse("tokens: [a", "broken.yaml"))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Failed to parse YAML");
        }

        @Test
        @DisplayName("duplicate token declarations")
        void duplicateKeys() {
            assertThatThrownBy(() -> parser.parse("""
                            tokens:
                              a: []
                              a: [vowel]
                            rules: []
                            whitespace:
                              default: a
                              token_class: vowel
                            """, "dup.yaml"))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Failed to parse YAML");
        }

        @Test
        @DisplayName("document that is not a mapping")
        void notAMapping() {
            assertThatThrownBy(() -> parser.parse("- a\n- b\n", "list.yaml"))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessage("Settings document must be a mapping");
            assertThatThrownBy(() -> parser.parse("", "empty.yaml")).isInstanceOf(SettingsParseException.class);
        }

        @Test
        @DisplayName("missing file")
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("nope.yaml")))
                    .isInstanceOf(SettingsParseException.class)
                    .hasMessageStartingWith("Failed to read settings");
        }
    }

    @Test
    @DisplayName("reads files written at runtime")
    void readsTempFile() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, """
                tokens:
                  x: [letter]
                  ' ': [wb]
                rules:
                  - production: ks
                    tokens: [x]
                whitespace:
                  default: ' '
                  token_class: wb
                  consolidate: true
                """);

        TransliterationSettings settings = parser.parse(file);

        assertThat(settings.rules()).singleElement().extracting(TransliterationRule::tokens).isEqualTo(List.of("x"));
    }
}
