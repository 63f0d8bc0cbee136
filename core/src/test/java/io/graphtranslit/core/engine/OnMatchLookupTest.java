package io.graphtranslit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TokenInventory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OnMatchLookup")
class OnMatchLookupTest {

    private static final TokenInventory INVENTORY;

    static {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        tokens.put("a", List.of("vowel"));
        tokens.put("e", List.of("vowel"));
        tokens.put("k", List.of("consonant"));
        tokens.put(" ", List.of("wb"));
        INVENTORY = TokenInventory.of(tokens);
    }

    @Test
    @DisplayName("indexes every token pair admitted by the boundary classes")
    void indexesPairs() {
        OnMatchLookup lookup = OnMatchLookup.build(List.of(OnMatchRule.between("vowel", "consonant", "-")), INVENTORY);

        assertThat(lookup.candidates("k", "a")).containsExactly(0);
        assertThat(lookup.candidates("k", "e")).containsExactly(0);
        assertThat(lookup.candidates("a", "k")).isEmpty();
        assertThat(lookup.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("candidates keep on-match rule order")
    void keepsRuleOrder() {
        OnMatchLookup lookup = OnMatchLookup.build(
                List.of(
                        new OnMatchRule(List.of("consonant", "vowel"), List.of("vowel"), "!"),
                        OnMatchRule.between("vowel", "vowel", ",")),
                INVENTORY);

        assertThat(lookup.candidates("a", "e")).containsExactly(0, 1);
    }

    @Test
    @DisplayName("no on-match rules give an empty lookup")
    void empty() {
        OnMatchLookup lookup = OnMatchLookup.build(List.of(), INVENTORY);

        assertThat(lookup.isEmpty()).isTrue();
        assertThat(lookup.candidates("a", "e")).isEmpty();
        assertThat(lookup.candidates("unknown", "a")).isEmpty();
    }
}
