package com.vidnyan.sigmaeval.domain.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for SIGMA detection conditions.
 * 
 * Grammar (precedence not > and > or):
 * <pre>
 * expr    := and ('or' and)*
 * and     := unary ('and' unary)*
 * unary   := 'not' unary | primary
 * primary := '(' expr ')' | (N | 'any' | 'all') 'of' pattern | name
 * </pre>
 * Aggregation suffixes after a pipe ({@code | count() > 5}) are ignored.
 */
public final class ConditionParser {

    public static final Set<String> KEYWORDS = Set.of("and", "or", "not", "of", "all", "any", "them");

    private final List<String> tokens;
    private int position;

    private ConditionParser(List<String> tokens) {
        this.tokens = tokens;
    }

    public static ConditionNode parse(String condition) {
        List<String> tokens = tokenize(stripAggregation(condition));
        if (tokens.isEmpty()) {
            throw new ConditionSyntaxException("Empty condition");
        }
        ConditionParser parser = new ConditionParser(tokens);
        ConditionNode node = parser.parseOr();
        if (parser.position < tokens.size()) {
            throw new ConditionSyntaxException("Unexpected token '" + tokens.get(parser.position)
                    + "' at position " + parser.position);
        }
        return node;
    }

    /**
     * Drop the aggregation part of a condition.
     */
    public static String stripAggregation(String condition) {
        if (condition == null) {
            return "";
        }
        int pipe = condition.indexOf('|');
        return pipe >= 0 ? condition.substring(0, pipe) : condition;
    }

    /**
     * Split on whitespace, keeping parentheses as separate tokens.
     */
    public static List<String> tokenize(String condition) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (char c : condition.toCharArray()) {
            if (c == '(' || c == ')') {
                flush(current, tokens);
                tokens.add(String.valueOf(c));
            } else if (Character.isWhitespace(c)) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }

    private ConditionNode parseOr() {
        List<ConditionNode> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peekKeyword("or")) {
            position++;
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionNode.Or(List.copyOf(operands));
    }

    private ConditionNode parseAnd() {
        List<ConditionNode> operands = new ArrayList<>();
        operands.add(parseUnary());
        while (peekKeyword("and")) {
            position++;
            operands.add(parseUnary());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionNode.And(List.copyOf(operands));
    }

    private ConditionNode parseUnary() {
        if (peekKeyword("not")) {
            position++;
            return new ConditionNode.Not(parseUnary());
        }
        return parsePrimary();
    }

    private ConditionNode parsePrimary() {
        String token = next();
        if ("(".equals(token)) {
            ConditionNode inner = parseOr();
            String closing = next();
            if (!")".equals(closing)) {
                throw new ConditionSyntaxException("Expected ')' but found '" + closing + "'");
            }
            return inner;
        }
        if (")".equals(token)) {
            throw new ConditionSyntaxException("Unbalanced ')'");
        }

        String lower = token.toLowerCase(Locale.ROOT);
        if (peekKeyword("of")) {
            int minimum;
            if ("all".equals(lower)) {
                minimum = ConditionNode.Quantified.ALL;
            } else if ("any".equals(lower)) {
                minimum = 1;
            } else {
                minimum = parseCount(token);
            }
            position++;
            String pattern = next();
            if ("(".equals(pattern) || ")".equals(pattern)) {
                throw new ConditionSyntaxException("Expected selection pattern after 'of'");
            }
            return new ConditionNode.Quantified(minimum, pattern);
        }

        if (KEYWORDS.contains(lower)) {
            throw new ConditionSyntaxException("Unexpected keyword '" + token + "'");
        }
        return new ConditionNode.Ref(token);
    }

    private int parseCount(String token) {
        try {
            int count = Integer.parseInt(token);
            if (count < 1) {
                throw new ConditionSyntaxException("Quantifier must be positive: " + token);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new ConditionSyntaxException("Invalid quantifier '" + token + "'");
        }
    }

    private boolean peekKeyword(String keyword) {
        return position < tokens.size() && tokens.get(position).equalsIgnoreCase(keyword);
    }

    private String next() {
        if (position >= tokens.size()) {
            throw new ConditionSyntaxException("Unexpected end of condition");
        }
        return tokens.get(position++);
    }
}
