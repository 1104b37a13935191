package com.vidnyan.sigmaeval.domain.condition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Truth-table analysis of a parsed condition over its selections.
 * 
 * Every selection is an independent boolean variable. The condition is evaluated
 * under all assignments, which finds conditions that always match or never match,
 * and OR sub-expressions that are redundant tautologies such as {@code (a or not a)}.
 */
public final class ConditionAnalyzer {

    /**
     * Above this many distinct selections the exhaustive check is skipped.
     */
    public static final int MAX_VARIABLES = 12;

    private final List<String> selectionNames;

    public ConditionAnalyzer(List<String> selectionNames) {
        this.selectionNames = List.copyOf(selectionNames);
    }

    /**
     * Result of analysing one condition.
     */
    public record Analysis(
        Set<String> referencedSelections,
        List<String> unmatchedPatterns,
        boolean exhaustive,
        boolean alwaysTrue,
        boolean neverTrue,
        List<String> tautologicalParts
    ) {}

    public Analysis analyze(ConditionNode root) {
        Set<String> referenced = new LinkedHashSet<>();
        List<String> unmatched = new ArrayList<>();
        collectReferences(root, referenced, unmatched);

        List<String> variables = new ArrayList<>(variables(root));
        if (variables.size() > MAX_VARIABLES) {
            return new Analysis(referenced, unmatched, false, false, false, List.of());
        }

        boolean alwaysTrue = isTautology(root, variables);
        boolean neverTrue = isContradiction(root, variables);

        List<String> tautologicalParts = new ArrayList<>();
        if (!alwaysTrue) {
            collectTautologicalParts(root, true, tautologicalParts);
        }
        return new Analysis(referenced, unmatched, true, alwaysTrue, neverTrue, tautologicalParts);
    }

    /**
     * Selections a quantifier pattern expands to. A pattern matching nothing
     * stands for itself so that it still behaves as one unknown variable.
     */
    public List<String> resolve(ConditionNode.Quantified quantified) {
        List<String> matches = matching(quantified);
        return matches.isEmpty() ? List.of(quantified.pattern()) : matches;
    }

    private List<String> matching(ConditionNode.Quantified quantified) {
        if (quantified.targetsThem()) {
            return selectionNames;
        }
        Pattern glob = toGlob(quantified.pattern());
        return selectionNames.stream()
                .filter(name -> glob.matcher(name).matches())
                .toList();
    }

    public static Pattern toGlob(String pattern) {
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    public boolean evaluate(ConditionNode node, Set<String> trueSelections) {
        if (node instanceof ConditionNode.Ref ref) {
            return trueSelections.contains(ref.name());
        }
        if (node instanceof ConditionNode.Not not) {
            return !evaluate(not.operand(), trueSelections);
        }
        if (node instanceof ConditionNode.And and) {
            for (ConditionNode operand : and.operands()) {
                if (!evaluate(operand, trueSelections)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof ConditionNode.Or or) {
            for (ConditionNode operand : or.operands()) {
                if (evaluate(operand, trueSelections)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof ConditionNode.Quantified quantified) {
            List<String> names = resolve(quantified);
            long matched = names.stream().filter(trueSelections::contains).count();
            return quantified.isAll() ? matched == names.size() : matched >= quantified.minimum();
        }
        throw new IllegalArgumentException("Unknown condition node: " + node);
    }

    private Set<String> variables(ConditionNode node) {
        Set<String> variables = new LinkedHashSet<>();
        collectVariables(node, variables);
        return variables;
    }

    private void collectVariables(ConditionNode node, Set<String> variables) {
        if (node instanceof ConditionNode.Ref ref) {
            variables.add(ref.name());
        } else if (node instanceof ConditionNode.Not not) {
            collectVariables(not.operand(), variables);
        } else if (node instanceof ConditionNode.And and) {
            and.operands().forEach(operand -> collectVariables(operand, variables));
        } else if (node instanceof ConditionNode.Or or) {
            or.operands().forEach(operand -> collectVariables(operand, variables));
        } else if (node instanceof ConditionNode.Quantified quantified) {
            variables.addAll(resolve(quantified));
        }
    }

    private void collectReferences(ConditionNode node, Set<String> referenced, List<String> unmatched) {
        if (node instanceof ConditionNode.Ref ref) {
            referenced.add(ref.name());
        } else if (node instanceof ConditionNode.Not not) {
            collectReferences(not.operand(), referenced, unmatched);
        } else if (node instanceof ConditionNode.And and) {
            and.operands().forEach(operand -> collectReferences(operand, referenced, unmatched));
        } else if (node instanceof ConditionNode.Or or) {
            or.operands().forEach(operand -> collectReferences(operand, referenced, unmatched));
        } else if (node instanceof ConditionNode.Quantified quantified) {
            List<String> matches = matching(quantified);
            if (matches.isEmpty()) {
                unmatched.add(quantified.pattern());
            }
            referenced.addAll(matches);
        }
    }

    private void collectTautologicalParts(ConditionNode node, boolean root, List<String> parts) {
        if (node instanceof ConditionNode.Or or) {
            if (!root) {
                List<String> variables = new ArrayList<>(variables(or));
                if (isTautology(or, variables)) {
                    parts.add(or.render());
                    return;
                }
            }
            or.operands().forEach(operand -> collectTautologicalParts(operand, false, parts));
        } else if (node instanceof ConditionNode.And and) {
            and.operands().forEach(operand -> collectTautologicalParts(operand, false, parts));
        } else if (node instanceof ConditionNode.Not not) {
            collectTautologicalParts(not.operand(), false, parts);
        }
    }

    private boolean isTautology(ConditionNode node, List<String> variables) {
        long combinations = 1L << variables.size();
        for (long mask = 0; mask < combinations; mask++) {
            if (!evaluate(node, assignment(variables, mask))) {
                return false;
            }
        }
        return true;
    }

    private boolean isContradiction(ConditionNode node, List<String> variables) {
        long combinations = 1L << variables.size();
        for (long mask = 0; mask < combinations; mask++) {
            if (evaluate(node, assignment(variables, mask))) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> assignment(List<String> variables, long mask) {
        Set<String> trueSelections = new HashSet<>();
        for (int i = 0; i < variables.size(); i++) {
            if ((mask & (1L << i)) != 0) {
                trueSelections.add(variables.get(i));
            }
        }
        return trueSelections;
    }
}
