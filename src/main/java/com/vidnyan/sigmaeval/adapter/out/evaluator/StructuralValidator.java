package com.vidnyan.sigmaeval.adapter.out.evaluator;

import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.out.BaseGrammarValidator;
import com.vidnyan.sigmaeval.application.port.out.BaseGrammarValidator.BaseValidationResult;
import com.vidnyan.sigmaeval.domain.condition.ConditionAnalyzer;
import com.vidnyan.sigmaeval.domain.condition.ConditionNode;
import com.vidnyan.sigmaeval.domain.condition.ConditionParser;
import com.vidnyan.sigmaeval.domain.condition.ConditionSyntaxException;
import com.vidnyan.sigmaeval.domain.evaluation.ExtendedValidationResult;
import com.vidnyan.sigmaeval.domain.rule.FieldKey;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import com.vidnyan.sigmaeval.domain.rule.YamlMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural validation: the base grammar gate followed by the extended checks
 * (telemetry, condition graph, impossible selections, pattern safety, IOC leakage,
 * field conformance).
 *
 * Extended checks never throw on odd rule shapes; a substructure they do not
 * understand is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralValidator {

    private static final Set<String> WINDOWS_PROCESS_CREATION_FIELDS = Set.of(
            "Image", "ParentImage", "CommandLine", "ParentCommandLine",
            "ProcessId", "ParentProcessId", "IntegrityLevel", "Hashes",
            "CurrentDirectory", "User", "LogonId");

    /**
     * Fields that carry at most one value per log event.
     */
    private static final Set<String> SINGLE_VALUE_FIELDS = Set.of(
            "image", "parentimage", "processid", "parentprocessid",
            "user", "logonid", "currentdirectory", "integritylevel");

    /**
     * Whole condition of the form {@code X or not X}. Identifiers compare case-sensitively.
     */
    private static final Pattern LITERAL_TAUTOLOGY = Pattern.compile(
            "^\\s*\\(?\\s*([\\w*-]+)\\s+(?i:or)\\s+(?i:not)\\s+\\1\\s*\\)?\\s*$");

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private final BaseGrammarValidator baseGrammarValidator;
    private final SigmaRuleParser parser;

    public ExtendedValidationResult validate(String ruleText) {
        BaseValidationResult base;
        try {
            base = baseGrammarValidator.validateBase(ruleText);
        } catch (RuntimeException e) {
            log.warn("Base grammar validator failed: {}", e.getMessage());
            base = BaseValidationResult.failure("Base grammar validation failed: " + e.getMessage());
        }
        if (!base.valid()) {
            log.debug("Rule rejected by grammar gate: {}", base.errors());
            return ExtendedValidationResult.baseGrammarFailure(base.errors(), base.warnings());
        }

        SigmaRule rule;
        try {
            rule = parser.parse(ruleText);
        } catch (RuleParseException e) {
            return ExtendedValidationResult.baseGrammarFailure(List.of(e.getMessage()), base.warnings());
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>(base.warnings());
        try {
            boolean telemetry = checkTelemetry(rule.logsource(), errors, warnings);
            boolean condition = checkCondition(rule.detection(), errors, warnings);
            boolean feasible = checkSelectionFeasibility(rule.detection(), errors);
            List<Leaf> leaves = stringLeaves(rule.detection());
            boolean patternSafe = checkPatternSafety(leaves, errors, warnings);
            boolean iocLeakage = checkIocLeakage(leaves, errors, warnings);
            boolean conformance = checkFieldConformance(rule, errors);

            ExtendedValidationResult result = ExtendedValidationResult.of(
                    telemetry, condition, patternSafe, iocLeakage, conformance, feasible, errors, warnings);
            log.debug("Structural validation: pass={} errors={} warnings={}",
                    result.finalPass(), errors.size(), warnings.size());
            return result;
        } catch (RuntimeException e) {
            log.error("Extended validation failed unexpectedly", e);
            errors.add("Extended validation failed: " + e.getMessage());
            return new ExtendedValidationResult(true, List.of(), false, false, false, false, false, false,
                    false, errors, warnings);
        }
    }

    // --- Telemetry ---

    private boolean checkTelemetry(SigmaRule.LogSource logsource, List<String> errors, List<String> warnings) {
        String category = logsource.normalizedCategory();
        String product = logsource.normalizedProduct();

        if (category == null && product == null) {
            warnings.add("Logsource has no category or product");
            return true;
        }
        if (TelemetryCatalog.isWindowsOnly(category) && product != null && !product.equals("windows")) {
            errors.add("Logsource category " + category + " requires Windows product, got " + product);
            return false;
        }
        if (category == null) {
            warnings.add("Logsource has no category");
            return true;
        }
        if (product == null) {
            warnings.add("Logsource has no product");
            return true;
        }
        if (!TelemetryCatalog.isKnown(category, product)) {
            warnings.add("Uncommon logsource combination: " + category + " + " + product);
        }
        return true;
    }

    // --- Condition graph ---

    private boolean checkCondition(SigmaRule.Detection detection, List<String> errors, List<String> warnings) {
        if (detection == null) {
            errors.add("Missing detection block");
            return false;
        }
        String condition = detection.condition();
        if (condition == null || condition.isBlank()) {
            errors.add("Missing detection condition");
            return false;
        }

        int errorsBefore = errors.size();
        List<String> selections = detection.selectionNames();
        String expression = ConditionParser.stripAggregation(condition);

        for (String token : ConditionParser.tokenize(expression)) {
            if (token.equals("(") || token.equals(")") || token.contains("*")
                    || ConditionParser.KEYWORDS.contains(token.toLowerCase(Locale.ROOT))
                    || NUMBER.matcher(token).matches()) {
                continue;
            }
            if (!selections.contains(token)) {
                warnings.add("Condition references undefined selection: " + token);
            }
        }

        Matcher literal = LITERAL_TAUTOLOGY.matcher(expression);
        boolean literalTautology = literal.find();
        if (literalTautology) {
            String name = literal.group(1);
            errors.add("Condition is always true (" + name + " or not " + name + ")");
        }

        Set<String> referenced = new LinkedHashSet<>();
        ConditionAnalyzer analyzer = new ConditionAnalyzer(selections);
        try {
            ConditionNode root = ConditionParser.parse(expression);
            ConditionAnalyzer.Analysis analysis = analyzer.analyze(root);
            referenced.addAll(analysis.referencedSelections());

            for (String pattern : analysis.unmatchedPatterns()) {
                warnings.add("Condition pattern '" + pattern + "' matches no selection");
            }
            if (analysis.alwaysTrue() && !literalTautology) {
                errors.add("Condition is always true: " + root.render());
            }
            if (analysis.neverTrue()) {
                errors.add("Condition can never match: " + root.render());
            }
            for (String part : analysis.tautologicalParts()) {
                warnings.add("Tautological sub-expression in condition: " + part);
            }
            if (!analysis.exhaustive()) {
                log.debug("Condition has too many selections for exhaustive analysis: {}", condition);
            }
        } catch (ConditionSyntaxException e) {
            warnings.add("Condition could not be fully parsed: " + e.getMessage());
            for (String token : ConditionParser.tokenize(expression)) {
                if (selections.contains(token)) {
                    referenced.add(token);
                }
            }
        }

        List<String> unused = selections.stream().filter(name -> !referenced.contains(name)).toList();
        if (!unused.isEmpty()) {
            warnings.add("Unused selections: " + String.join(", ", unused));
        }
        return errors.size() == errorsBefore;
    }

    // --- Impossible selections ---

    private enum MatchMode { EQUALS, ENDS_WITH, STARTS_WITH }

    private record Constraint(String field, MatchMode mode, List<String> values) {}

    private boolean checkSelectionFeasibility(SigmaRule.Detection detection, List<String> errors) {
        if (detection == null) {
            return true;
        }
        boolean feasible = true;
        for (YamlMap.Entry selection : detection.selections()) {
            if (selection.value() instanceof YamlMap block) {
                feasible &= checkBlock(selection.key(), block, errors);
            } else if (selection.value() instanceof List<?> items) {
                for (Object item : items) {
                    if (item instanceof YamlMap block) {
                        feasible &= checkBlock(selection.key(), block, errors);
                    }
                }
            }
        }
        return feasible;
    }

    private boolean checkBlock(String selectionName, YamlMap block, List<String> errors) {
        Map<String, List<Constraint>> byField = new LinkedHashMap<>();
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (YamlMap.Entry entry : block.entries()) {
            FieldKey key = FieldKey.parse(entry.key());
            String field = key.field().toLowerCase(Locale.ROOT);
            if (!SINGLE_VALUE_FIELDS.contains(field)) {
                continue;
            }
            MatchMode mode = identityMode(key);
            List<String> values = stringValues(entry.value());
            if (mode == null || values.isEmpty()) {
                continue;
            }
            displayNames.putIfAbsent(field, key.field());
            List<Constraint> constraints = byField.computeIfAbsent(field, f -> new ArrayList<>());
            if (key.hasModifier("all")) {
                values.forEach(value -> constraints.add(new Constraint(field, mode, List.of(value))));
            } else {
                constraints.add(new Constraint(field, mode, values));
            }
        }

        boolean feasible = true;
        for (Map.Entry<String, List<Constraint>> entry : byField.entrySet()) {
            if (!jointlySatisfiable(entry.getValue())) {
                errors.add("Selection '" + selectionName + "' requires " + displayNames.get(entry.getKey())
                        + " to match incompatible values (never true)");
                feasible = false;
            }
        }
        return feasible;
    }

    private static MatchMode identityMode(FieldKey key) {
        List<String> modifiers = key.modifiers().stream().filter(m -> !m.equals("all")).toList();
        if (modifiers.isEmpty()) {
            return MatchMode.EQUALS;
        }
        if (modifiers.size() == 1) {
            return switch (modifiers.get(0)) {
                case "endswith" -> MatchMode.ENDS_WITH;
                case "startswith" -> MatchMode.STARTS_WITH;
                default -> null;
            };
        }
        return null;
    }

    private static boolean jointlySatisfiable(List<Constraint> constraints) {
        for (int i = 0; i < constraints.size(); i++) {
            for (int j = i + 1; j < constraints.size(); j++) {
                if (!compatible(constraints.get(i), constraints.get(j))) {
                    return false;
                }
            }
        }
        return true;
    }

    // List values are alternatives: two constraints conflict only if no pair of values can co-exist.
    private static boolean compatible(Constraint a, Constraint b) {
        for (String first : a.values()) {
            for (String second : b.values()) {
                if (compatible(a.mode(), first, b.mode(), second)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean compatible(MatchMode modeA, String a, MatchMode modeB, String b) {
        if (hasWildcard(a) || hasWildcard(b)) {
            return true;
        }
        String x = a.toLowerCase(Locale.ROOT);
        String y = b.toLowerCase(Locale.ROOT);
        if (modeA == modeB) {
            return switch (modeA) {
                case EQUALS -> x.equals(y);
                case ENDS_WITH -> x.endsWith(y) || y.endsWith(x);
                case STARTS_WITH -> x.startsWith(y) || y.startsWith(x);
            };
        }
        if (modeA == MatchMode.EQUALS) {
            return modeB == MatchMode.ENDS_WITH ? x.endsWith(y) : x.startsWith(y);
        }
        if (modeB == MatchMode.EQUALS) {
            return modeA == MatchMode.ENDS_WITH ? y.endsWith(x) : y.startsWith(x);
        }
        // a prefix and a suffix can always be satisfied together
        return true;
    }

    private static boolean hasWildcard(String value) {
        return value.indexOf('*') >= 0 || value.indexOf('?') >= 0;
    }

    private static List<String> stringValues(Object value) {
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

    // --- Pattern safety and IOC leakage ---

    private record Leaf(String path, FieldKey key, String value) {}

    private static List<Leaf> stringLeaves(SigmaRule.Detection detection) {
        List<Leaf> leaves = new ArrayList<>();
        if (detection != null) {
            for (YamlMap.Entry selection : detection.selections()) {
                collectLeaves("detection." + selection.key(), null, selection.value(), leaves);
            }
        }
        return leaves;
    }

    private static void collectLeaves(String path, FieldKey key, Object value, List<Leaf> leaves) {
        if (value instanceof String s) {
            leaves.add(new Leaf(path, key, s));
        } else if (value instanceof YamlMap map) {
            for (YamlMap.Entry entry : map.entries()) {
                collectLeaves(path + "." + entry.key(), FieldKey.parse(entry.key()), entry.value(), leaves);
            }
        } else if (value instanceof List<?> items) {
            for (int i = 0; i < items.size(); i++) {
                collectLeaves(path + "[" + i + "]", key, items.get(i), leaves);
            }
        }
    }

    private boolean checkPatternSafety(List<Leaf> leaves, List<String> errors, List<String> warnings) {
        boolean safe = true;
        for (Leaf leaf : leaves) {
            String value = leaf.value();
            String trimmed = value.trim();
            boolean regex = leaf.key() != null && leaf.key().isRegex();

            if (IndicatorPatterns.BASE64.matcher(value).find()) {
                errors.add("Base64-like blob at " + leaf.path() + " (embedded artifact, not a behavior)");
                safe = false;
            }
            if (trimmed.equals("*") || trimmed.equals(".*")) {
                errors.add("Unanchored wildcard-only value at " + leaf.path());
                safe = false;
            }
            if (value.contains("(.*|.+)")) {
                errors.add("Dangerous alternation regex at " + leaf.path());
                safe = false;
            }
            if (regex && value.contains("\n")) {
                errors.add("Multi-line value with regex modifier at " + leaf.path());
                safe = false;
            }
            if (regex && !value.contains("(?i)") && !leaf.key().hasModifier("i")
                    && !leaf.key().hasModifier("nocase")) {
                warnings.add("Case-sensitive regex at " + leaf.path() + "; consider (?i) or the |i modifier");
            }
        }
        return safe;
    }

    private boolean checkIocLeakage(List<Leaf> leaves, List<String> errors, List<String> warnings) {
        boolean leakage = false;
        for (Leaf leaf : leaves) {
            for (String ip : IndicatorPatterns.ipAddresses(leaf.value())) {
                errors.add("IP address found at " + leaf.path() + ": " + ip);
                leakage = true;
            }
            for (String domain : IndicatorPatterns.domains(leaf.value())) {
                errors.add("Domain found at " + leaf.path() + ": " + domain);
                leakage = true;
            }
            if (!IndicatorPatterns.tokens(leaf.value()).isEmpty()) {
                errors.add("JWT token found at " + leaf.path());
                leakage = true;
            }
            for (String guid : IndicatorPatterns.guids(leaf.value())) {
                warnings.add("GUID found at " + leaf.path() + ": " + guid + " (may be a legitimate constant)");
            }
        }
        return leakage;
    }

    // --- Field conformance ---

    private boolean checkFieldConformance(SigmaRule rule, List<String> errors) {
        if (!rule.logsource().isWindowsProcessCreation() || !rule.hasDetection()) {
            return true;
        }
        Set<String> invalid = new LinkedHashSet<>();
        for (YamlMap.Entry selection : rule.detection().selections()) {
            collectInvalidFields(selection.value(), invalid);
        }
        if (!invalid.isEmpty()) {
            errors.add("Invalid fields for Windows process_creation: " + String.join(", ", invalid));
            return false;
        }
        return true;
    }

    private static void collectInvalidFields(Object body, Set<String> invalid) {
        if (body instanceof YamlMap map) {
            for (YamlMap.Entry entry : map.entries()) {
                String field = FieldKey.parse(entry.key()).field();
                if (!WINDOWS_PROCESS_CREATION_FIELDS.contains(field)) {
                    invalid.add(field);
                }
                collectInvalidFields(entry.value(), invalid);
            }
        } else if (body instanceof List<?> items) {
            items.forEach(item -> collectInvalidFields(item, invalid));
        }
    }
}
