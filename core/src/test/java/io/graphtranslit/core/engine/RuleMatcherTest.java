package io.graphtranslit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphtranslit.core.model.TransliterationSettings;
import io.graphtranslit.core.settings.SettingsParser;
import io.graphtranslit.core.spi.MatchVisitor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RuleMatcher")
class RuleMatcherTest {

    private static TransliterationEngine singleAndDouble() {
        return TransliterationEngine.compile(TransliterationSettings.builder()
                .token("a")
                .token(" ", "wb")
                .rule("<A>", "a")
                .rule("<AA>", "a", "a")
                .whitespace(" ", "wb", true)
                .build());
    }

    @Nested
    @DisplayName("token paths")
    class TokenPaths {

        @Test
        @DisplayName("prefers the longer, cheaper rule")
        void prefersCheaper() {
            TransliterationEngine engine = singleAndDouble();
            List<String> tokens = engine.tokenize("aa");

            assertThat(engine.rules().get(0).production()).isEqualTo("<AA>");
            assertThat(engine.matchAt(1, tokens)).hasValue(0);
        }

        @Test
        @DisplayName("matchAllAt lists every match, cheapest first")
        void allMatches() {
            TransliterationEngine engine = singleAndDouble();

            assertThat(engine.matchAllAt(1, engine.tokenize("aa"))).containsExactly(0, 1);
            assertThat(engine.matchAllAt(1, engine.tokenize("a"))).containsExactly(1);
        }

        @Test
        @DisplayName("a position with no rule yields no match")
        void noMatch() {
            TransliterationEngine engine = TransliterationEngine.compile(TransliterationSettings.builder()
                    .token("a")
                    .token(" ", "wb")
                    .rule("B2", "a", "a")
                    .whitespace(" ", "wb", true)
                    .build());

            assertThat(engine.matchAt(1, engine.tokenize("a"))).isEmpty();
            assertThat(engine.matchAllAt(1, engine.tokenize("a"))).isEmpty();
        }

        @Test
        @DisplayName("positions outside the token list are rejected")
        void outOfRange() {
            TransliterationEngine engine = singleAndDouble();
            List<String> tokens = engine.tokenize("a");

            assertThatThrownBy(() -> engine.matchAt(3, tokens)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> engine.matchAt(-1, tokens)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("context constraints")
    class Constraints {

        private final TransliterationEngine engine = TransliterationEngine.compile(
                new SettingsParser().parse(Path.of("src/test/resources/rule-sets/example.yaml")));

        @Test
        @DisplayName("constrained rule matches when all four windows hold")
        void allWindowsHold() {
            List<String> tokens = engine.tokenize("baaab");

            assertThat(engine.rules().get(engine.matchAt(3, tokens).getAsInt()).production())
                    .isEqualTo("A*");
        }

        @Test
        @DisplayName("falls back to the unconstrained rule when a window fails")
        void fallsBack() {
            List<String> tokens = engine.tokenize("baaab");

            assertThat(engine.rules().get(engine.matchAt(2, tokens).getAsInt()).production())
                    .isEqualTo("A");
            assertThat(engine.rules().get(engine.matchAt(4, tokens).getAsInt()).production())
                    .isEqualTo("A");
        }

        @Test
        @DisplayName("windows running past either end never match")
        void windowsOutOfBounds() {
            List<String> tokens = engine.tokenize("aaa");

            // previous class window would start before the first token
            assertThat(engine.rules().get(engine.matchAt(1, tokens).getAsInt()).production())
                    .isEqualTo("A");
        }
    }

    @Test
    @DisplayName("reports the root, every popped node and its incoming edge")
    void visitorSeesTraversal() {
        TransliterationEngine engine = singleAndDouble();
        RuleMatcher matcher = new RuleMatcher(engine.graph(), engine.rules(), engine.tokens());
        List<Integer> nodes = new ArrayList<>();
        List<String> edges = new ArrayList<>();

        matcher.matchAt(1, engine.tokenize("aa"), new MatchVisitor() {
            @Override
            public void onNodeVisited(int nodeId) {
                nodes.add(nodeId);
            }

            @Override
            public void onEdgeVisited(int headId, int tailId) {
                edges.add(headId + "->" + tailId);
            }
        });

        // root, a, a a, leaf <AA>
        assertThat(nodes).containsExactly(0, 1, 2, 3);
        assertThat(edges).containsExactly("0->1", "1->2", "2->3");
    }
}
