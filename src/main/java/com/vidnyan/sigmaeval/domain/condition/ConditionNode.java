package com.vidnyan.sigmaeval.domain.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Node of a parsed detection condition.
 */
public interface ConditionNode {

    /**
     * Render back to condition syntax, fully parenthesized.
     */
    String render();

    /**
     * Reference to a single selection by name.
     */
    record Ref(String name) implements ConditionNode {
        @Override
        public String render() {
            return name;
        }
    }

    record Not(ConditionNode operand) implements ConditionNode {
        @Override
        public String render() {
            return "not " + operand.render();
        }
    }

    record And(List<ConditionNode> operands) implements ConditionNode {
        @Override
        public String render() {
            return operands.stream().map(ConditionNode::render)
                    .collect(Collectors.joining(" and ", "(", ")"));
        }
    }

    record Or(List<ConditionNode> operands) implements ConditionNode {
        @Override
        public String render() {
            return operands.stream().map(ConditionNode::render)
                    .collect(Collectors.joining(" or ", "(", ")"));
        }
    }

    /**
     * {@code 1 of selection*}, {@code all of them}. A minimum of -1 means all.
     */
    record Quantified(int minimum, String pattern) implements ConditionNode {

        public static final int ALL = -1;

        public boolean isAll() {
            return minimum == ALL;
        }

        public boolean targetsThem() {
            return "them".equalsIgnoreCase(pattern);
        }

        @Override
        public String render() {
            return (isAll() ? "all" : String.valueOf(minimum)) + " of " + pattern;
        }
    }
}
