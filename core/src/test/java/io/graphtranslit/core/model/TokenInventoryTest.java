package io.graphtranslit.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenInventory")
class TokenInventoryTest {

    private static TokenInventory inventory() {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        tokens.put("a", List.of("vowel", "letter"));
        tokens.put("b", List.of("consonant", "letter"));
        tokens.put(" ", List.of("wb"));
        tokens.put("-", List.of());
        return TokenInventory.of(tokens);
    }

    @Test
    @DisplayName("answers class membership both ways")
    void membership() {
        TokenInventory inventory = inventory();

        assertThat(inventory.hasClass("a", "vowel")).isTrue();
        assertThat(inventory.hasClass("b", "vowel")).isFalse();
        assertThat(inventory.tokensOf("letter")).containsExactly("a", "b");
        assertThat(inventory.classesOf("-")).isEmpty();
    }

    @Test
    @DisplayName("unknown tokens and classes are empty, not errors")
    void unknownLookups() {
        TokenInventory inventory = inventory();

        assertThat(inventory.contains("z")).isFalse();
        assertThat(inventory.classesOf("z")).isEmpty();
        assertThat(inventory.tokensOf("nope")).isEmpty();
        assertThat(inventory.hasClass("z", "vowel")).isFalse();
    }

    @Test
    @DisplayName("keeps declaration order")
    void declarationOrder() {
        TokenInventory inventory = inventory();

        assertThat(inventory.allTokens()).containsExactly("a", "b", " ", "-");
        assertThat(inventory.classNames()).containsExactly("vowel", "letter", "consonant", "wb");
        assertThat(inventory.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("equal when built from the same mapping")
    void equality() {
        assertThat(inventory()).isEqualTo(inventory()).hasSameHashCodeAs(inventory());
    }
}
