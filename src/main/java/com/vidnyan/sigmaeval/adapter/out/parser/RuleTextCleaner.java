package com.vidnyan.sigmaeval.adapter.out.parser;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips the wrapping LLMs put around a generated rule:
 * markdown code fences and explanatory prose before the YAML starts.
 */
@Slf4j
public final class RuleTextCleaner {

    private static final Pattern CODE_BLOCK = Pattern.compile("```(?:yaml|yml)?\\s*\\n(.*?)```", Pattern.DOTALL);

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
            "title", "id", "description", "status", "author", "date", "modified", "logsource",
            "detection", "falsepositives", "level", "tags", "references", "fields", "related", "name");

    private RuleTextCleaner() {
    }

    public static String clean(String ruleText) {
        if (ruleText == null) {
            return "";
        }
        String cleaned = ruleText.strip();

        Matcher block = CODE_BLOCK.matcher(cleaned);
        if (block.find()) {
            cleaned = block.group(1).strip();
            log.debug("Extracted rule from code block");
        } else {
            cleaned = dropLeadingProse(cleaned);
        }

        // Leftover fence markers
        if (cleaned.startsWith("```yaml")) {
            cleaned = cleaned.substring(7).strip();
        } else if (cleaned.startsWith("```yml")) {
            cleaned = cleaned.substring(6).strip();
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3).strip();
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3).strip();
        }

        // "Here is the rule: title: ..." on one line
        int newline = cleaned.indexOf('\n');
        String firstLine = newline >= 0 ? cleaned.substring(0, newline) : cleaned;
        int titleIndex = firstLine.indexOf("title:");
        if (titleIndex > 0 && !startsWithTopLevelKey(firstLine)) {
            cleaned = cleaned.substring(titleIndex);
        }
        return cleaned;
    }

    private static boolean startsWithTopLevelKey(String line) {
        String stripped = line.strip();
        int colon = stripped.indexOf(':');
        return colon > 0 && TOP_LEVEL_KEYS.contains(stripped.substring(0, colon).strip());
    }

    private static String dropLeadingProse(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (startsWithTopLevelKey(lines[i])) {
                if (i > 0) {
                    log.debug("Removed {} lines of explanatory text", i);
                }
                return String.join("\n", Arrays.copyOfRange(lines, i, lines.length));
            }
        }
        return text;
    }
}
