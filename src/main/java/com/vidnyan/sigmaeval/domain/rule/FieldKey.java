package com.vidnyan.sigmaeval.domain.rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selection key split into its base field and modifier chain.
 * {@code CommandLine|contains|all} -> field {@code CommandLine}, modifiers [contains, all].
 */
public record FieldKey(String field, List<String> modifiers) {

    public static FieldKey parse(String key) {
        if (key == null) {
            return new FieldKey("", List.of());
        }
        String[] parts = key.replace('=', '|').split("\\|");
        String field = parts.length > 0 ? parts[0].trim() : "";
        List<String> modifiers = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            String modifier = parts[i].trim().toLowerCase(Locale.ROOT);
            if (!modifier.isEmpty()) {
                modifiers.add(modifier);
            }
        }
        return new FieldKey(field, List.copyOf(modifiers));
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isRegex() {
        return hasModifier("re") || hasModifier("regex");
    }
}
