package com.vidnyan.sigmaeval.domain.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed SIGMA rule.
 * Immutable view over the YAML document; fields with an unexpected shape are left null/empty
 * so that stage checks can treat them as not applicable.
 */
public record SigmaRule(
    String title,
    String id,
    String description,
    List<String> tags,
    LogSource logsource,
    Detection detection,
    String level,
    String status,
    YamlMap document
) {

    public static final String CONDITION = "condition";
    public static final String TIMEFRAME = "timeframe";

    /**
     * Logsource block. All parts optional.
     */
    public record LogSource(String category, String product, String service) {

        public static LogSource from(YamlMap map) {
            if (map == null) {
                return new LogSource(null, null, null);
            }
            return new LogSource(map.getString("category"), map.getString("product"), map.getString("service"));
        }

        public String normalizedCategory() {
            return normalize(category);
        }

        public String normalizedProduct() {
            return normalize(product);
        }

        public boolean isWindowsProcessCreation() {
            return "process_creation".equals(normalizedCategory()) && "windows".equals(normalizedProduct());
        }

        private static String normalize(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            return value.trim().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Detection block: named selections plus condition and optional timeframe.
     */
    public record Detection(YamlMap body) {

        public String condition() {
            return body.getString(CONDITION);
        }

        public String timeframe() {
            return body.getString(TIMEFRAME);
        }

        /**
         * Selection entries, condition and timeframe excluded.
         */
        public List<YamlMap.Entry> selections() {
            List<YamlMap.Entry> selections = new ArrayList<>();
            for (YamlMap.Entry entry : body.entries()) {
                if (!isReservedKey(entry.key())) {
                    selections.add(entry);
                }
            }
            return selections;
        }

        public List<String> selectionNames() {
            return selections().stream()
                    .map(YamlMap.Entry::key)
                    .distinct()
                    .toList();
        }
    }

    public static boolean isReservedKey(String key) {
        return CONDITION.equals(key) || TIMEFRAME.equals(key);
    }

    /**
     * Build a rule view from a parsed document.
     */
    public static SigmaRule from(YamlMap document) {
        List<String> tags = new ArrayList<>();
        List<Object> rawTags = document.getList("tags");
        if (rawTags != null) {
            for (Object tag : rawTags) {
                if (tag instanceof String s) {
                    tags.add(s);
                }
            }
        }

        YamlMap detectionBody = document.getMap("detection");
        return new SigmaRule(
                document.getString("title"),
                document.getString("id"),
                document.getString("description"),
                List.copyOf(tags),
                LogSource.from(document.getMap("logsource")),
                detectionBody != null ? new Detection(detectionBody) : null,
                document.getString("level"),
                document.getString("status"),
                document);
    }

    public boolean hasDetection() {
        return detection != null;
    }
}
