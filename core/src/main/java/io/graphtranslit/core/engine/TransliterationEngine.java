package io.graphtranslit.core.engine;

import io.graphtranslit.core.error.AmbiguousRulesException;
import io.graphtranslit.core.error.NoMatchingRuleException;
import io.graphtranslit.core.error.UnrecognizedTokenException;
import io.graphtranslit.core.graph.CompiledGraph;
import io.graphtranslit.core.graph.GraphBuilder;
import io.graphtranslit.core.model.AmbiguityReport;
import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TokenInventory;
import io.graphtranslit.core.model.TransliterationResult;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.model.TransliterationSettings;
import io.graphtranslit.core.model.WhitespaceRules;
import io.graphtranslit.core.settings.SettingsParser;
import io.graphtranslit.core.settings.SettingsValidator;
import io.graphtranslit.core.spi.MatchVisitor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled transliterator: tokenizes input, matches the cheapest applicable rule at each position
 * and concatenates productions, inserting on-match connector text between matches.
 *
 * <p>
 * Built once via {@link #compile(TransliterationSettings, EngineOptions)} and immutable afterwards.
 * All methods are safe to call from multiple threads; per-call state (tokens, output buffer, match
 * trace) lives on the caller's stack.
 */
public final class TransliterationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TransliterationEngine.class);

    private final TransliterationSettings settings;
    private final EngineOptions options;
    private final TokenInventory inventory;
    private final List<TransliterationRule> rules;
    private final CompiledGraph graph;
    private final RuleMatcher matcher;
    private final Tokenizer tokenizer;
    private final OnMatchLookup onMatchLookup;

    private TransliterationEngine(
            TransliterationSettings settings,
            EngineOptions options,
            TokenInventory inventory,
            List<TransliterationRule> rules,
            CompiledGraph graph) {
        this.settings = settings;
        this.options = options;
        this.inventory = inventory;
        this.rules = rules;
        this.graph = graph;
        this.matcher = new RuleMatcher(graph, rules, inventory);
        this.tokenizer = new Tokenizer(inventory, settings.whitespace());
        this.onMatchLookup = OnMatchLookup.build(settings.onMatchRules(), inventory);
    }

    /** Compiles {@code settings} with {@link EngineOptions#DEFAULT}. */
    public static TransliterationEngine compile(TransliterationSettings settings) {
        return compile(settings, EngineOptions.DEFAULT);
    }

    /**
     * Validates and compiles {@code settings}.
     *
     * @param settings tokens, rules, on-match rules and whitespace handling
     * @param options  compile and runtime options
     * @return the engine
     * @throws io.graphtranslit.core.error.InvalidRuleDefinitionException if settings validation is
     *                                                                    enabled and fails, or a rule
     *                                                                    has no tokens
     * @throws AmbiguousRulesException if ambiguity checking is enabled and finds conflicts
     */
    public static TransliterationEngine compile(TransliterationSettings settings, EngineOptions options) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(options, "options must not be null");

        if (options.checkSettings()) {
            SettingsValidator.validate(settings);
        }

        List<TransliterationRule> sorted = new ArrayList<>(settings.rules());
        sorted.sort(Comparator.comparingDouble(TransliterationRule::cost));
        List<TransliterationRule> rules = List.copyOf(sorted);

        TokenInventory inventory = TokenInventory.of(settings.tokens());
        if (options.checkAmbiguity()) {
            List<AmbiguityReport> reports = AmbiguityChecker.check(rules, inventory);
            if (!reports.isEmpty()) {
                throw new AmbiguousRulesException(reports);
            }
        }

        CompiledGraph graph = GraphBuilder.build(rules);
        TransliterationEngine engine = new TransliterationEngine(settings, options, inventory, rules, graph);
        LOG.info(
                "Transliterator compiled: rules={}, tokens={}, onmatch_rules={}, nodes={}",
                rules.size(),
                inventory.size(),
                settings.onMatchRules().size(),
                graph.nodeCount());
        return engine;
    }

    /**
     * Parses a YAML or JSON settings file and compiles it.
     *
     * @param path    settings file
     * @param options compile and runtime options
     * @return the engine
     * @throws io.graphtranslit.core.error.SettingsParseException if the file cannot be read or parsed
     */
    public static TransliterationEngine load(Path path, EngineOptions options) {
        return compile(new SettingsParser().parse(path), options);
    }

    /** Tokenizes {@code text} using the engine's default error handling. */
    public List<String> tokenize(String text) {
        return tokenize(text, options.ignoreErrors());
    }

    /**
     * Tokenizes {@code text}, bracketing the result with the default whitespace token.
     *
     * @throws UnrecognizedTokenException if a character cannot be tokenized and
     *                                    {@code ignoreErrors} is false
     */
    public List<String> tokenize(String text, boolean ignoreErrors) {
        return tokenizer.tokenize(text, ignoreErrors);
    }

    /** Transliterates {@code text} using the engine's default error handling. */
    public TransliterationResult transliterate(String text) {
        return transliterate(text, options.ignoreErrors(), MatchVisitor.NONE);
    }

    public TransliterationResult transliterate(String text, boolean ignoreErrors) {
        return transliterate(text, ignoreErrors, MatchVisitor.NONE);
    }

    /**
     * Transliterates {@code text}.
     *
     * @param text         input text
     * @param ignoreErrors skip unrecognized characters and unmatched tokens instead of failing
     * @param visitor      traversal observer; its exceptions are logged and ignored
     * @return output text and the trace of matched rules
     * @throws UnrecognizedTokenException if tokenization fails and {@code ignoreErrors} is false
     * @throws NoMatchingRuleException    if no rule matches a token and {@code ignoreErrors} is false
     */
    public TransliterationResult transliterate(String text, boolean ignoreErrors, MatchVisitor visitor) {
        MatchVisitor observer = SafeMatchVisitor.wrap(visitor);
        List<String> tokens = tokenizer.tokenize(text, ignoreErrors);

        StringBuilder output = new StringBuilder();
        List<Integer> matchedIndices = new ArrayList<>();
        List<TransliterationRule> matchedRules = new ArrayList<>();

        int position = 1;
        while (position < tokens.size() - 1) {
            OptionalInt match = matcher.matchAt(position, tokens, observer);
            if (match.isEmpty()) {
                LOG.warn("No matching rule at token {} of {}", position, tokens);
                if (!ignoreErrors) {
                    throw new NoMatchingRuleException(text, position, tokens);
                }
                position++;
                continue;
            }

            TransliterationRule rule = rules.get(match.getAsInt());
            LOG.debug("Matched rule {} at token {}: {}", match.getAsInt(), position, rule.toEasyReading());
            matchedIndices.add(match.getAsInt());
            matchedRules.add(rule);

            if (!onMatchLookup.isEmpty()) {
                appendOnMatchProduction(output, tokens, position, observer);
            }
            output.append(rule.production());
            position += rule.tokens().size();
        }
        return new TransliterationResult(output.toString(), tokens, matchedIndices, matchedRules);
    }

    private void appendOnMatchProduction(StringBuilder output, List<String> tokens, int position, MatchVisitor visitor) {
        List<OnMatchRule> onMatchRules = settings.onMatchRules();
        for (int index : onMatchLookup.candidates(tokens.get(position), tokens.get(position - 1))) {
            OnMatchRule rule = onMatchRules.get(index);
            if (TokenWindow.classesMatch(tokens, position - rule.prevClasses().size(), rule.prevClasses(), inventory)
                    && TokenWindow.classesMatch(tokens, position, rule.nextClasses(), inventory)) {
                output.append(rule.production());
                visitor.onOnMatchRuleApplied(index);
                return;
            }
        }
    }

    /** Index of the cheapest rule matching at {@code position} of {@code tokens}, if any. */
    public OptionalInt matchAt(int position, List<String> tokens) {
        return matcher.matchAt(position, tokens, MatchVisitor.NONE);
    }

    /** Indices of every rule matching at {@code position} of {@code tokens}, cheapest first. */
    public List<Integer> matchAllAt(int position, List<String> tokens) {
        return matcher.matchAllAt(position, tokens, MatchVisitor.NONE);
    }

    /**
     * Returns a new engine without the rules whose productions are in {@code productions}.
     * Unknown productions are ignored. Tokens, on-match rules, whitespace handling and options are
     * kept as-is.
     */
    public TransliterationEngine prunedOf(Collection<String> productions) {
        Objects.requireNonNull(productions, "productions must not be null");
        Set<String> removed = new HashSet<>(productions);
        List<TransliterationRule> kept = settings.rules().stream()
                .filter(rule -> !removed.contains(rule.production()))
                .collect(Collectors.toList());
        LOG.debug("Pruning rules: kept {} of {}", kept.size(), settings.rules().size());
        return compile(settings.withRules(kept), options);
    }

    /** Runs the ambiguity check on the compiled rules without throwing. */
    public List<AmbiguityReport> checkForAmbiguity() {
        return AmbiguityChecker.check(rules, inventory);
    }

    /** Rules sorted ascending by cost; rule indices everywhere refer to this list. */
    public List<TransliterationRule> rules() {
        return rules;
    }

    public List<OnMatchRule> onMatchRules() {
        return settings.onMatchRules();
    }

    public WhitespaceRules whitespace() {
        return settings.whitespace();
    }

    public TokenInventory tokens() {
        return inventory;
    }

    /** Distinct productions of all rules, in cost order. */
    public Set<String> productions() {
        return rules.stream()
                .map(TransliterationRule::production)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public CompiledGraph graph() {
        return graph;
    }

    public Map<String, Object> metadata() {
        return settings.metadata();
    }

    public EngineOptions options() {
        return options;
    }

    /** The settings this engine was compiled from. */
    public TransliterationSettings settings() {
        return settings;
    }
}
