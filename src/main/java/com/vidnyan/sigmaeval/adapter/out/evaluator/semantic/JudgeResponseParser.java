package com.vidnyan.sigmaeval.adapter.out.evaluator.semantic;

/**
 * Finds the JSON object inside a judge response that may be wrapped in prose or markdown.
 */
final class JudgeResponseParser {

    private JudgeResponseParser() {
    }

    /**
     * First balanced {@code {...}} block, braces inside string literals ignored.
     * Returns null when there is none.
     */
    static String extractJsonObject(String response) {
        if (response == null) {
            return null;
        }
        int start = response.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(response, start);
            if (end > 0) {
                return response.substring(start, end + 1);
            }
            start = response.indexOf('{', start + 1);
        }
        return null;
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
