package com.vidnyan.sigmaeval.adapter.out.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sigmaeval.application.port.in.EvaluateRuleUseCase.DatasetItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads evaluation datasets from JSON.
 *
 * Accepts a top-level array or an object with an {@code items} array. Each entry may carry
 * {@code item_id} (or {@code article_id}), {@code generated_rule}, {@code reference_rules}
 * (first one used) or {@code reference_rule}, and {@code input_id}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatasetLoader {

    private final ObjectMapper objectMapper;

    public List<DatasetItem> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            List<DatasetItem> items = load(in);
            log.info("Loaded {} dataset items from {}", items.size(), path);
            return items;
        }
    }

    public List<DatasetItem> load(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        JsonNode entries = root != null && root.isObject() ? root.path("items") : root;
        if (entries == null || !entries.isArray()) {
            throw new IOException("Dataset must be a JSON array or an object with an 'items' array");
        }

        List<DatasetItem> items = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            if (!entry.isObject()) {
                log.warn("Skipping dataset entry {}: not an object", index);
                continue;
            }
            items.add(toItem(entry, index));
        }
        return items;
    }

    private DatasetItem toItem(JsonNode entry, int index) {
        String articleId = text(entry, "article_id");
        String itemId = firstNonNull(text(entry, "item_id"), articleId, "item-" + index);
        String inputId = firstNonNull(text(entry, "input_id"), articleId, null);
        return new DatasetItem(itemId, text(entry, "generated_rule"), referenceRule(entry), inputId);
    }

    private static String referenceRule(JsonNode entry) {
        JsonNode references = entry.get("reference_rules");
        if (references != null && references.isArray() && !references.isEmpty()) {
            JsonNode first = references.get(0);
            if (first.isTextual()) {
                return first.asText();
            }
            for (String field : List.of("rule_yaml", "yaml", "rule")) {
                String value = text(first, field);
                if (value != null) {
                    return value;
                }
            }
        }
        return text(entry, "reference_rule");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String firstNonNull(String first, String second, String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
