package com.vidnyan.sigmaeval.adapter.out.validator;

import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.out.BaseGrammarValidator;
import com.vidnyan.sigmaeval.domain.rule.RuleParseException;
import com.vidnyan.sigmaeval.domain.rule.SigmaRule;
import com.vidnyan.sigmaeval.domain.rule.YamlMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default grammar gate: checks the SIGMA document structure.
 * Replaceable by any other {@link BaseGrammarValidator} bean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SigmaSchemaValidator implements BaseGrammarValidator {

    private static final List<String> REQUIRED_FIELDS = List.of("title", "logsource", "detection");

    private static final Set<String> VALID_CATEGORIES = Set.of(
            "process_creation", "process_access", "process_termination", "image_load",
            "file_access", "file_change", "file_delete", "file_event", "file_rename", "file_write",
            "network_connection", "dns_query", "http_request", "proxy", "firewall", "webserver",
            "registry_access", "registry_add", "registry_change", "registry_delete", "registry_event",
            "registry_rename", "registry_set", "create_remote_thread", "driver_load", "pipe_created",
            "powershell", "ps_script", "ps_module", "wmi", "wmi_event", "sysmon",
            "windows", "linux", "macos");

    private static final Set<String> VALID_LEVELS = Set.of("informational", "low", "medium", "high", "critical");

    private static final Set<String> VALID_STATUSES = Set.of(
            "experimental", "test", "stable", "deprecated", "unsupported");

    private static final Pattern TAG_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final SigmaRuleParser parser;

    @Override
    public BaseValidationResult validateBase(String ruleText) {
        YamlMap document;
        try {
            document = parser.parseDocument(ruleText);
        } catch (RuleParseException e) {
            log.debug("Grammar gate rejected rule: {}", e.getMessage());
            return BaseValidationResult.failure(e.getMessage());
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String field : REQUIRED_FIELDS) {
            if (!document.containsKey(field)) {
                errors.add("Missing required field: " + field);
            }
        }
        if (!errors.isEmpty()) {
            return new BaseValidationResult(false, errors, warnings);
        }

        validateLogsource(document.get("logsource"), errors, warnings);
        validateDetection(document.get("detection"), errors);
        validateMetadata(document, errors, warnings);

        return new BaseValidationResult(errors.isEmpty(), errors, warnings);
    }

    private void validateLogsource(Object logsource, List<String> errors, List<String> warnings) {
        if (!(logsource instanceof YamlMap map)) {
            errors.add("Logsource must be a mapping (e.g. category: process_creation, product: windows)");
            return;
        }
        if (map.isEmpty()) {
            errors.add("Logsource section is empty");
            return;
        }
        if (!map.containsKey("category") && !map.containsKey("product") && !map.containsKey("service")) {
            warnings.add("Logsource should specify category, product, or service");
        }
        String category = map.getString("category");
        if (category != null && !VALID_CATEGORIES.contains(category.trim().toLowerCase(Locale.ROOT))) {
            errors.add("Invalid logsource category: " + category);
        }
    }

    private void validateDetection(Object detection, List<String> errors) {
        if (!(detection instanceof YamlMap map)) {
            errors.add("Detection must be a mapping containing selections and a 'condition'");
            return;
        }
        if (map.isEmpty()) {
            errors.add("Detection section is empty");
            return;
        }
        if (!map.containsKey(SigmaRule.CONDITION)) {
            errors.add("Detection must contain a 'condition' key. Example: condition: selection");
            return;
        }
        String condition = map.getString(SigmaRule.CONDITION);
        if (condition == null || condition.isBlank()) {
            errors.add("Detection condition must be a non-empty string");
        }

        boolean hasSelection = false;
        for (YamlMap.Entry entry : map.entries()) {
            if (SigmaRule.isReservedKey(entry.key())) {
                continue;
            }
            hasSelection = true;
            Object body = entry.value();
            if (!(body instanceof YamlMap) && !(body instanceof List<?>) && !(body instanceof String)) {
                errors.add("Invalid selection '" + entry.key() + "': must be a mapping, list, or string");
            }
        }
        if (!hasSelection) {
            errors.add("Detection must have at least one selection or filter (e.g. 'selection:')");
        }
    }

    private void validateMetadata(YamlMap document, List<String> errors, List<String> warnings) {
        Object title = document.get("title");
        if (!(title instanceof String titleText) || titleText.isBlank()) {
            errors.add("Title must be a non-empty string");
        } else if (titleText.length() < 10) {
            warnings.add("Title is very short (less than 10 characters)");
        } else if (titleText.length() > 200) {
            warnings.add("Title is very long (more than 200 characters)");
        }

        String description = document.getString("description");
        if (description == null || description.isBlank()) {
            warnings.add("Rule has no description");
        }

        Object level = document.get("level");
        if (level != null) {
            if (!(level instanceof String levelText) || !VALID_LEVELS.contains(levelText.trim().toLowerCase(Locale.ROOT))) {
                errors.add("Invalid level: " + level + ". Must be one of: informational, low, medium, high, critical");
            }
        }

        String status = document.getString("status");
        if (status != null && !VALID_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT))) {
            warnings.add("Unknown status: " + status);
        }

        Object tags = document.get("tags");
        if (tags == null) {
            warnings.add("Rule has no tags");
        } else if (!(tags instanceof List<?> tagList)) {
            errors.add("Tags must be a list of strings");
        } else {
            for (Object tag : tagList) {
                if (!(tag instanceof String tagText)) {
                    errors.add("Invalid tag format: " + tag + ". Tags must be simple strings");
                } else if (!TAG_PATTERN.matcher(tagText).matches()) {
                    warnings.add("Tag contains invalid special characters: " + tagText);
                }
            }
        }
    }
}
