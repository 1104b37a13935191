package com.vidnyan.sigmaeval.adapter.out.parser;

import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import com.vidnyan.sigmaeval.domain.rule.YamlMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses rule YAML into {@link YamlMap} documents and {@link SigmaRule} views.
 * 
 * Reads the token stream directly instead of binding to {@code Map}, so duplicate
 * keys inside a selection survive parsing. Only the first YAML document is read.
 */
@Slf4j
@Component
public class SigmaRuleParser {

    private final YAMLFactory yamlFactory = new YAMLFactory();

    /**
     * Parse a rule; the text is cleaned of markdown wrapping first.
     */
    public SigmaRule parse(String ruleText) throws RuleParseException {
        return SigmaRule.from(parseDocument(ruleText));
    }

    /**
     * Parse to the raw document, which must be a mapping.
     */
    public YamlMap parseDocument(String ruleText) throws RuleParseException {
        Object root = parseValue(RuleTextCleaner.clean(ruleText));
        if (root == null) {
            throw new RuleParseException("Empty or invalid YAML content");
        }
        if (!(root instanceof YamlMap map)) {
            throw new RuleParseException("Rule must be a YAML mapping, got " + describe(root));
        }
        return map;
    }

    /**
     * Parse any YAML value. Returns null for an empty document. Aliases resolve to the value of
     * their anchor.
     */
    public Object parseValue(String yaml) throws RuleParseException {
        try (YAMLParser parser = yamlFactory.createParser(yaml)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                return null;
            }
            return readValue(parser, token, new HashMap<>());
        } catch (IOException | RuntimeException e) {
            log.debug("YAML parse failure: {}", e.getMessage());
            throw new RuleParseException("Invalid YAML syntax: " + e.getMessage(), e);
        }
    }

    private Object readValue(YAMLParser parser, JsonToken token, Map<String, Object> anchors) throws IOException {
        if (parser.isCurrentAlias()) {
            String alias = parser.getText();
            if (!anchors.containsKey(alias)) {
                throw new IOException("Unknown YAML alias: *" + alias);
            }
            return anchors.get(alias);
        }
        Object anchor = parser.getObjectId();
        Object value = switch (token) {
            case START_OBJECT -> readMap(parser, anchors);
            case START_ARRAY -> readList(parser, anchors);
            case VALUE_NULL -> null;
            default -> parser.getText();
        };
        if (anchor != null) {
            anchors.put(anchor.toString(), value);
        }
        return value;
    }

    private YamlMap readMap(YAMLParser parser, Map<String, Object> anchors) throws IOException {
        List<YamlMap.Entry> entries = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new IOException("Unexpected token in mapping: " + token);
            }
            String key = parser.currentName();
            JsonToken valueToken = parser.nextToken();
            entries.add(new YamlMap.Entry(key, readValue(parser, valueToken, anchors)));
        }
        return new YamlMap(entries);
    }

    private List<Object> readList(YAMLParser parser, Map<String, Object> anchors) throws IOException {
        List<Object> items = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token == null) {
                throw new IOException("Unterminated sequence");
            }
            items.add(readValue(parser, token, anchors));
        }
        return Collections.unmodifiableList(items);
    }

    static String describe(Object value) {
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof YamlMap) {
            return "mapping";
        }
        return value == null ? "null" : "scalar";
    }
}
