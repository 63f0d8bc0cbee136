package io.graphtranslit.core.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.graphtranslit.core.error.SettingsParseException;
import io.graphtranslit.core.model.OnMatchRule;
import io.graphtranslit.core.model.TransliterationRule;
import io.graphtranslit.core.model.TransliterationSettings;
import io.graphtranslit.core.model.WhitespaceRules;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Parses YAML (or JSON) transliteration settings into {@link TransliterationSettings}.
 *
 * <p>
 * The document is checked in three passes: unknown keys are rejected, the structure is validated
 * against {@code /schema/transliteration-settings.schema.json}, and the values are converted to
 * model records. {@code \N{...}} character-name escapes are expanded before parsing. Semantic
 * checks (undeclared tokens, unknown classes) are left to {@link SettingsValidator}.
 *
 * <p>
 * Thread-safe.
 */
public final class SettingsParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(YAMLFactory.builder()
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schema/transliteration-settings.schema.json";

    private static final Set<String> KNOWN_ROOT_KEYS =
            Set.of("tokens", "rules", "onmatch_rules", "whitespace", "metadata");

    private static final Set<String> KNOWN_RULE_KEYS = Set.of(
            "production", "prev_classes", "prev_tokens", "tokens", "next_tokens", "next_classes", "cost");

    private static final Set<String> KNOWN_ONMATCH_KEYS = Set.of("prev_classes", "next_classes", "production");

    private static final Set<String> KNOWN_WHITESPACE_KEYS = Set.of("default", "token_class", "consolidate");

    private final JsonSchema schema;

    public SettingsParser() {
        this.schema = loadSchema();
    }

    /**
     * Parses the settings file at {@code path}.
     *
     * @param path YAML or JSON settings file
     * @return the parsed settings
     * @throws SettingsParseException if the file cannot be read, is malformed or violates the schema
     */
    public TransliterationSettings parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SettingsParseException("Failed to read settings: " + e.getMessage(), e, source);
        }
        return parse(content, source);
    }

    /**
     * Parses settings from a YAML or JSON string.
     *
     * @param content document text
     * @param source  name used in error messages, may be {@code null}
     * @return the parsed settings
     * @throws SettingsParseException if the document is malformed or violates the schema
     */
    public TransliterationSettings parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");

        String expanded;
        try {
            expanded = CharacterNames.unescape(content);
        } catch (IllegalArgumentException e) {
            throw new SettingsParseException(e.getMessage(), e, source);
        }

        JsonNode root = readYaml(expanded, source);
        if (root == null || !root.isObject()) {
            throw new SettingsParseException("Settings document must be a mapping", source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "settings root", source);
        validateAgainstSchema(root, source);

        Map<String, List<String>> tokens = parseTokens(root.get("tokens"));
        List<TransliterationRule> rules = parseRules(root.get("rules"), source);
        List<OnMatchRule> onMatchRules = parseOnMatchRules(root.get("onmatch_rules"), source);
        WhitespaceRules whitespace = parseWhitespace(root.get("whitespace"), source);
        Map<String, Object> metadata = parseMetadata(root.get("metadata"));

        return new TransliterationSettings(tokens, rules, onMatchRules, whitespace, metadata);
    }

    private JsonNode readYaml(String content, String source) {
        try {
            return YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new SettingsParseException("Failed to parse YAML: " + e.getOriginalMessage(), e, source);
        }
    }

    private void validateAgainstSchema(JsonNode root, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String messages = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SettingsParseException("Settings do not match schema: " + messages, source);
        }
    }

    private Map<String, List<String>> parseTokens(JsonNode node) {
        Map<String, List<String>> tokens = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            tokens.put(entry.getKey(), stringList(entry.getValue()));
        }
        return tokens;
    }

    private List<TransliterationRule> parseRules(JsonNode node, String source) {
        List<TransliterationRule> rules = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode ruleNode = node.get(i);
            rejectUnknownKeys(ruleNode, KNOWN_RULE_KEYS, "rules[" + i + "]", source);
            String production = ruleNode.get("production").asText();
            List<String> prevClasses = stringList(ruleNode.get("prev_classes"));
            List<String> prevTokens = stringList(ruleNode.get("prev_tokens"));
            List<String> tokens = stringList(ruleNode.get("tokens"));
            List<String> nextTokens = stringList(ruleNode.get("next_tokens"));
            List<String> nextClasses = stringList(ruleNode.get("next_classes"));
            JsonNode cost = ruleNode.get("cost");
            rules.add(cost == null || cost.isNull()
                    ? TransliterationRule.of(production, prevClasses, prevTokens, tokens, nextTokens, nextClasses)
                    : new TransliterationRule(
                            production, prevClasses, prevTokens, tokens, nextTokens, nextClasses, cost.asDouble()));
        }
        return rules;
    }

    private List<OnMatchRule> parseOnMatchRules(JsonNode node, String source) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<OnMatchRule> rules = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode ruleNode = node.get(i);
            rejectUnknownKeys(ruleNode, KNOWN_ONMATCH_KEYS, "onmatch_rules[" + i + "]", source);
            rules.add(new OnMatchRule(
                    stringList(ruleNode.get("prev_classes")),
                    stringList(ruleNode.get("next_classes")),
                    ruleNode.get("production").asText()));
        }
        return rules;
    }

    private WhitespaceRules parseWhitespace(JsonNode node, String source) {
        rejectUnknownKeys(node, KNOWN_WHITESPACE_KEYS, "whitespace", source);
        JsonNode consolidate = node.get("consolidate");
        return new WhitespaceRules(
                node.get("default").asText(),
                node.get("token_class").asText(),
                consolidate != null && consolidate.asBoolean());
    }

    private Map<String, Object> parseMetadata(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        return YAML_MAPPER.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        if (node == null || !node.isObject()) {
            return;
        }
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SettingsParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys.stream().sorted().collect(Collectors.toList()),
                    source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = SettingsParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(YAML_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
