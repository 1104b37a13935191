package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.domain.evaluation.FalsePositiveRisk;
import com.vidnyan.sigmaeval.domain.evaluation.HuntabilityScore;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import com.vidnyan.sigmaeval.domain.rule.YamlMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Rubric-based huntability score (0-10).
 *
 * Weighted sub-scores: command-line specificity, TTP clarity, parent/child tracking,
 * telemetry feasibility and overfitting (inverted indicator density).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HuntabilityScorer {

    static final double WEIGHT_COMMANDLINE = 0.25;
    static final double WEIGHT_TTP = 0.20;
    static final double WEIGHT_PARENT_CHILD = 0.15;
    static final double WEIGHT_TELEMETRY = 0.15;
    static final double WEIGHT_OVERFITTING = 0.25;

    private static final double WEAK_THRESHOLD = 0.5;

    private final SigmaRuleParser parser;

    public HuntabilityScore scoreRule(String ruleText) {
        return scoreRule(ruleText, null);
    }

    /**
     * Score a rule, parsing {@code ruleText} only when no parsed rule is given.
     */
    public HuntabilityScore scoreRule(String ruleText, SigmaRule parsed) {
        SigmaRule rule = parsed;
        if (rule == null) {
            try {
                rule = parser.parse(ruleText);
            } catch (RuleParseException e) {
                log.debug("Huntability: failed to parse rule: {}", e.getMessage());
                return HuntabilityScore.unscorable("Failed to parse rule");
            }
        }
        if (!rule.hasDetection()) {
            return HuntabilityScore.unscorable("No detection section");
        }

        YamlMap detection = rule.detection().body();
        double commandline = commandlineSpecificity(detection);
        double ttp = ttpClarity(rule);
        double parentChild = parentChild(detection);
        double telemetry = TelemetryCatalog.feasibility(rule.logsource());
        double overfitting = overfitting(detection);
        FalsePositiveRisk risk = falsePositiveRisk(detection);

        double total = commandline * WEIGHT_COMMANDLINE
                + ttp * WEIGHT_TTP
                + parentChild * WEIGHT_PARENT_CHILD
                + telemetry * WEIGHT_TELEMETRY
                + overfitting * WEIGHT_OVERFITTING;
        double score = Math.min(10.0, Math.max(0.0, total * 10));

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("commandline_specificity", commandline * 10);
        breakdown.put("ttp_clarity", ttp * 10);
        breakdown.put("parent_child", parentChild * 10);
        breakdown.put("telemetry_feasibility", telemetry * 10);
        breakdown.put("overfitting", overfitting * 10);

        String notes = coverageNotes(commandline, ttp, parentChild, telemetry, overfitting, risk);
        log.debug("Huntability {} (fp risk {}): {}", score, risk.label(), notes);
        return new HuntabilityScore(score, risk, notes, breakdown);
    }

    double commandlineSpecificity(YamlMap detection) {
        List<String> values = new ArrayList<>();
        boolean[] hasField = {false};
        walkFields(detection, (entry) -> {
            if (entry.key().toLowerCase(Locale.ROOT).contains("command")) {
                hasField[0] = true;
                values.addAll(strings(entry.value()));
            }
        });

        if (!hasField[0]) {
            return 0.3;
        }
        if (values.isEmpty()) {
            return 0.5;
        }
        long specific = values.stream()
                .filter(value -> !value.contains("*") || value.replace("*", "").trim().length() > 10)
                .count();
        return (double) specific / values.size();
    }

    double ttpClarity(SigmaRule rule) {
        double score = 0.5;
        boolean attackTag = rule.tags().stream()
                .anyMatch(tag -> tag.toLowerCase(Locale.ROOT).startsWith("attack."));
        if (attackTag) {
            score += 0.3;
        }
        String description = rule.description() == null ? "" : rule.description();
        if (description.length() > 50) {
            score += 0.1;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        if (lower.contains("ttp") || lower.contains("technique")) {
            score += 0.1;
        }
        return Math.min(1.0, score);
    }

    double parentChild(YamlMap detection) {
        boolean[] found = {false, false};
        walkFields(detection, (entry) -> {
            String key = entry.key().toLowerCase(Locale.ROOT);
            if (key.contains("image") && !key.contains("parent")) {
                found[0] = true;
            } else if (key.contains("parentimage") || key.contains("parent_image")) {
                found[1] = true;
            }
        });
        double score = 0.5;
        if (found[0]) {
            score += 0.3;
        }
        if (found[1]) {
            score += 0.2;
        }
        return Math.min(1.0, score);
    }

    double overfitting(YamlMap detection) {
        int indicators = 0;
        for (String value : detectionStrings(detection)) {
            if (!IndicatorPatterns.ipAddresses(value).isEmpty()) {
                indicators += 2;
            }
            if (!IndicatorPatterns.domains(value).isEmpty()) {
                indicators += 1;
            }
        }
        if (indicators == 0) {
            return 1.0;
        }
        if (indicators <= 1) {
            return 0.8;
        }
        if (indicators <= 2) {
            return 0.6;
        }
        return 0.3;
    }

    FalsePositiveRisk falsePositiveRisk(YamlMap detection) {
        int factors = 0;
        for (String value : detectionStrings(detection)) {
            String trimmed = value.trim();
            if (trimmed.equals("*") || trimmed.equals(".*")) {
                factors += 2;
            }
            if (value.replace("*", "").trim().length() < 3) {
                factors += 1;
            }
        }
        if (factors >= 3) {
            return FalsePositiveRisk.HIGH;
        }
        return factors >= 1 ? FalsePositiveRisk.MEDIUM : FalsePositiveRisk.LOW;
    }

    private static String coverageNotes(double commandline, double ttp, double parentChild,
                                        double telemetry, double overfitting, FalsePositiveRisk risk) {
        List<String> notes = new ArrayList<>();
        if (commandline < WEAK_THRESHOLD) {
            notes.add("Low command-line specificity");
        }
        if (ttp < WEAK_THRESHOLD) {
            notes.add("Limited TTP clarity");
        }
        if (parentChild < WEAK_THRESHOLD) {
            notes.add("Weak parent/child process tracking");
        }
        if (telemetry < WEAK_THRESHOLD) {
            notes.add("Telemetry feasibility concerns");
        }
        if (overfitting < WEAK_THRESHOLD) {
            notes.add("Indicator-heavy detection logic (overfitting)");
        }
        if (risk == FalsePositiveRisk.HIGH) {
            notes.add("High false-positive risk");
        }
        return notes.isEmpty() ? "Good coverage across all categories" : String.join("; ", notes);
    }

    /**
     * Visit every mapping entry inside the selections, at any depth.
     */
    private static void walkFields(YamlMap detection, Consumer<YamlMap.Entry> visitor) {
        for (YamlMap.Entry entry : detection.entries()) {
            if (!SigmaRule.isReservedKey(entry.key())) {
                walkBody(entry.value(), visitor);
            }
        }
    }

    private static void walkBody(Object body, Consumer<YamlMap.Entry> visitor) {
        if (body instanceof YamlMap map) {
            for (YamlMap.Entry entry : map.entries()) {
                visitor.accept(entry);
                walkBody(entry.value(), visitor);
            }
        } else if (body instanceof List<?> items) {
            items.forEach(item -> walkBody(item, visitor));
        }
    }

    private static List<String> detectionStrings(YamlMap detection) {
        List<String> values = new ArrayList<>();
        for (YamlMap.Entry entry : detection.entries()) {
            if (!SigmaRule.isReservedKey(entry.key())) {
                collectStrings(entry.value(), values);
            }
        }
        return values;
    }

    private static void collectStrings(Object value, List<String> values) {
        if (value instanceof String s) {
            values.add(s);
        } else if (value instanceof YamlMap map) {
            map.entries().forEach(entry -> collectStrings(entry.value(), values));
        } else if (value instanceof List<?> items) {
            items.forEach(item -> collectStrings(item, values));
        }
    }

    private static List<String> strings(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof String s) {
            values.add(s);
        } else if (value instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof String s) {
                    values.add(s);
                }
            }
        }
        return values;
    }
}
