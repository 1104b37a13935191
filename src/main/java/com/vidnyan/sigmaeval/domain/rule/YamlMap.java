package com.vidnyan.sigmaeval.domain.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered YAML mapping that keeps every key occurrence.
 * 
 * Generated rules often repeat a key inside one selection
 * (two {@code CommandLine|contains} lines). Each occurrence is a separate
 * constraint, so they are all retained. Single-key lookups return the last
 * occurrence, the way common YAML loaders resolve duplicates.
 * 
 * Values are {@code String}, {@code null}, {@code List<Object>} or {@code YamlMap}.
 */
public final class YamlMap {

    private final List<Entry> entries;

    public YamlMap(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static YamlMap empty() {
        return new YamlMap(List.of());
    }

    /**
     * One key occurrence.
     */
    public record Entry(String key, Object value) {}

    public List<Entry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public boolean containsKey(String key) {
        for (Entry entry : entries) {
            if (entry.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Distinct keys in first-seen order.
     */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Entry entry : entries) {
            keys.add(entry.key());
        }
        return keys;
    }

    public Object get(String key) {
        Object found = null;
        for (Entry entry : entries) {
            if (entry.key().equals(key)) {
                found = entry.value();
            }
        }
        return found;
    }

    public String getString(String key) {
        return get(key) instanceof String s ? s : null;
    }

    public YamlMap getMap(String key) {
        return get(key) instanceof YamlMap m ? m : null;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        return get(key) instanceof List<?> l ? (List<Object>) l : null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof YamlMap other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
