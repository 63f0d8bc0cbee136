package io.graphtranslit.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.graphtranslit.core.error.AmbiguousRulesException;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.model.TransliterationSettings;
import io.graphtranslit.core.spi.MatchVisitor;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Log output of compile and transliterate: one INFO line per compile, a WARN per ambiguity and per
 * skipped input, and a WARN for a failing visitor.
 */
@DisplayName("TransliterationLoggingTest")
class TransliterationLoggingTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger packageLogger;

    @BeforeEach
    void setUp() {
        packageLogger = (Logger) LoggerFactory.getLogger("io.graphtranslit.core.engine");
        logAppender = new ListAppender<>();
        logAppender.start();
        packageLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        packageLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> eventsAt(Level level) {
        return logAppender.list.stream().filter(e -> e.getLevel() == level).collect(Collectors.toList());
    }

    private static TransliterationSettings.Builder base() {
        return TransliterationSettings.builder()
                .token("a")
                .token("b")
                .token(" ", "wb")
                .rule("A", "a")
                .whitespace(" ", "wb", true);
    }

    @Test
    @DisplayName("compile logs counts once at INFO")
    void compileSummary() {
        TransliterationEngine.compile(base().build());

        List<ILoggingEvent> info = eventsAt(Level.INFO);
        assertThat(info).hasSize(1);
        assertThat(info.get(0).getLoggerName()).isEqualTo(TransliterationEngine.class.getName());
        assertThat(info.get(0).getFormattedMessage())
                .isEqualTo("Transliterator compiled: rules=1, tokens=3, onmatch_rules=0, nodes=3");
    }

    @Test
    @DisplayName("each ambiguity is logged at WARN before compile fails")
    void ambiguityWarnings() {
        TransliterationSettings settings = base()
                .rule(TransliterationRule.builder("_A")
                        .prevClasses("wb")
                        .tokens("a")
                        .build())
                .rule(TransliterationRule.builder("A_")
                        .tokens("a")
                        .nextClasses("wb")
                        .build())
                .build();

        assertThatThrownBy(() -> TransliterationEngine.compile(settings)).isInstanceOf(AmbiguousRulesException.class);

        assertThat(eventsAt(Level.WARN))
                .extracting(ILoggingEvent::getFormattedMessage)
                .singleElement()
                .asString()
                .startsWith("Ambiguous rules: ")
                .contains("<wb> a | a <wb>");
        assertThat(eventsAt(Level.INFO)).isEmpty();
    }

    @Test
    @DisplayName("skipped characters and unmatched tokens are logged at WARN")
    void lenientWarnings() {
        TransliterationEngine engine = TransliterationEngine.compile(base().build());
        logAppender.list.clear();

        assertThat(engine.transliterate("a!b", true).output()).isEqualTo("A");

        assertThat(eventsAt(Level.WARN))
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "Unrecognizable token at offset 1 of \"a!b\"", "No matching rule at token 2 of [ , a, b,  ]");
    }

    @Test
    @DisplayName("matches are logged at DEBUG")
    void matchDebug() {
        TransliterationEngine engine = TransliterationEngine.compile(base().build());
        logAppender.list.clear();

        engine.transliterate("aa");

        assertThat(eventsAt(Level.DEBUG))
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Matched rule 0 at token 1: a", "Matched rule 0 at token 2: a");
    }

    @Test
    @DisplayName("a failing visitor is logged at WARN and ignored")
    void visitorFailure() {
        TransliterationEngine engine = TransliterationEngine.compile(base().build());
        logAppender.list.clear();
        MatchVisitor broken = new MatchVisitor() {
            @Override
            public void onEdgeVisited(int headId, int tailId) {
                throw new IllegalStateException("boom");
            }
        };

        assertThat(engine.transliterate("a", false, broken).output()).isEqualTo("A");

        assertThat(eventsAt(Level.WARN))
                .isNotEmpty()
                .allSatisfy(e -> {
                    assertThat(e.getFormattedMessage()).isEqualTo("MatchVisitor.onEdgeVisited failed");
                    assertThat(e.getThrowableProxy().getMessage()).isEqualTo("boom");
                });
    }
}
