package com.vidnyan.sigmaeval.domain.condition;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionParserTest {

    @Test
    void parse_ShouldRespectPrecedence() {
        ConditionNode node = ConditionParser.parse("a or b and not c");

        assertEquals("(a or (b and not c))", node.render());
    }

    @Test
    void parse_ShouldHonourParentheses() {
        ConditionNode node = ConditionParser.parse("(a or b) and c");

        assertEquals("((a or b) and c)", node.render());
    }

    @Test
    void parse_ShouldReadQuantifiers() {
        ConditionNode node = ConditionParser.parse("1 of selection* and not all of filter_*");

        ConditionNode.And and = assertInstanceOf(ConditionNode.And.class, node);
        ConditionNode.Quantified first = assertInstanceOf(ConditionNode.Quantified.class, and.operands().get(0));
        assertEquals(1, first.minimum());
        assertEquals("selection*", first.pattern());
        ConditionNode.Not not = assertInstanceOf(ConditionNode.Not.class, and.operands().get(1));
        ConditionNode.Quantified second = assertInstanceOf(ConditionNode.Quantified.class, not.operand());
        assertTrue(second.isAll());
    }

    @Test
    void parse_ShouldIgnoreAggregation() {
        ConditionNode node = ConditionParser.parse("selection | count() by host > 5");

        assertEquals(new ConditionNode.Ref("selection"), node);
    }

    @Test
    void parse_ShouldRejectBrokenConditions() {
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("(a or b"));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("a and"));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse("a b"));
        assertThrows(ConditionSyntaxException.class, () -> ConditionParser.parse(""));
    }

    @Test
    void tokenize_ShouldSplitParentheses() {
        assertEquals(List.of("not", "(", "a", "or", "b", ")"), ConditionParser.tokenize("not (a or b)"));
    }
}
