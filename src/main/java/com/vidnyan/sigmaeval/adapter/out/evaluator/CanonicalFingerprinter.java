package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.domain.evaluation.BehavioralCore;
import com.vidnyan.sigmaeval.domain.evaluation.CoreComparison;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import com.vidnyan.sigmaeval.domain.rule.YamlMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Extracts the behavioral core of a rule: normalized {@code field=value} selectors
 * plus command lines and process chains, hashed independently of ordering and formatting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CanonicalFingerprinter {

    public static final String HASH_PREFIX = "sha256:";

    static final String KEYWORD_FIELD = "keyword";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WILDCARD_RUN = Pattern.compile("\\*{2,}");

    private final SigmaRuleParser parser;

    /**
     * Extract the core of raw rule text. Unparsable text yields an empty core.
     */
    public BehavioralCore extractBehavioralCore(String ruleText) {
        try {
            return extractBehavioralCore(parser.parse(ruleText));
        } catch (RuleParseException e) {
            log.debug("Cannot fingerprint rule: {}", e.getMessage());
            return BehavioralCore.empty();
        }
    }

    public BehavioralCore extractBehavioralCore(SigmaRule rule) {
        if (rule == null || !rule.hasDetection()) {
            return BehavioralCore.empty();
        }

        Collector collector = new Collector();
        for (YamlMap.Entry selection : rule.detection().selections()) {
            collectBody(selection.value(), collector);
        }

        List<String> selectors = new ArrayList<>(collector.selectors);
        return new BehavioralCore(
                selectors,
                new ArrayList<>(collector.commandlines),
                new ArrayList<>(collector.processChains),
                hash(selectors),
                selectors.size());
    }

    /**
     * Set comparison of two cores: similarity is |A n B| / max(|A|, |B|, 1).
     */
    public CoreComparison compareCores(BehavioralCore first, BehavioralCore second) {
        Set<String> a = new HashSet<>(first.behaviorSelectors());
        Set<String> b = new HashSet<>(second.behaviorSelectors());

        Set<String> common = new HashSet<>(a);
        common.retainAll(b);

        double similarity = (double) common.size() / Math.max(Math.max(a.size(), b.size()), 1);
        boolean hashMatch = !first.coreHash().isEmpty() && first.coreHash().equals(second.coreHash());

        return new CoreComparison(
                similarity,
                common.size(),
                a.size() - common.size(),
                b.size() - common.size(),
                hashMatch,
                Math.abs(first.selectorCount() - second.selectorCount()));
    }

    /**
     * Lowercase, collapse whitespace and wildcard runs, trim, strip surrounding quotes.
     * Idempotent.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "null";
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        normalized = WILDCARD_RUN.matcher(normalized).replaceAll("*");
        normalized = normalized.trim();
        while (normalized.length() >= 2 && isQuote(normalized.charAt(0))
                && normalized.charAt(normalized.length() - 1) == normalized.charAt(0)) {
            normalized = normalized.substring(1, normalized.length() - 1).trim();
        }
        return normalized;
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    static String hash(List<String> selectors) {
        if (selectors.isEmpty()) {
            return "";
        }
        String canonical = String.join("\n", new TreeSet<>(selectors));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HASH_PREFIX + HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void collectBody(Object body, Collector collector) {
        if (body instanceof YamlMap map) {
            collectMap(map, collector);
        } else if (body instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof YamlMap || item instanceof List<?>) {
                    collectBody(item, collector);
                } else {
                    collector.add(KEYWORD_FIELD, item);
                }
            }
        } else {
            collector.add(KEYWORD_FIELD, body);
        }
    }

    private void collectMap(YamlMap map, Collector collector) {
        List<String> images = new ArrayList<>();
        List<String> parentImages = new ArrayList<>();

        for (YamlMap.Entry entry : map.entries()) {
            Object value = entry.value();
            if (value instanceof YamlMap nested) {
                collectMap(nested, collector);
                continue;
            }
            List<Object> values = value instanceof List<?> list ? new ArrayList<>(list) : singleton(value);
            for (Object item : values) {
                if (item instanceof YamlMap || item instanceof List<?>) {
                    collectBody(item, collector);
                    continue;
                }
                collector.add(entry.key(), item);

                String key = entry.key().toLowerCase(Locale.ROOT);
                if (item != null && key.contains("image")) {
                    String path = normalize(item.toString()).replace('\\', '/');
                    if (key.contains("parent")) {
                        parentImages.add(path);
                    } else {
                        images.add(path);
                    }
                }
            }
        }

        for (String image : images) {
            if (parentImages.isEmpty()) {
                collector.processChains.add(image);
            }
            for (String parent : parentImages) {
                collector.processChains.add(parent + " -> " + image);
            }
        }
    }

    private static List<Object> singleton(Object value) {
        List<Object> values = new ArrayList<>(1);
        values.add(value);
        return values;
    }

    private static final class Collector {
        private final Set<String> selectors = new LinkedHashSet<>();
        private final Set<String> commandlines = new LinkedHashSet<>();
        private final Set<String> processChains = new LinkedHashSet<>();

        void add(String key, Object value) {
            String normalizedValue = normalize(value == null ? null : value.toString());
            selectors.add(normalize(key) + "=" + normalizedValue);
            if (key.toLowerCase(Locale.ROOT).contains("command") && value != null) {
                commandlines.add(normalizedValue);
            }
        }
    }
}
