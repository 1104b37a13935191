package com.vidnyan.sigmaeval.adapter.out.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleTextCleanerTest {

    @Test
    void clean_ShouldExtractCodeBlock() {
        String text = "Sure!\n```yml\ntitle: X\nlevel: low\n```\n";

        assertEquals("title: X\nlevel: low", RuleTextCleaner.clean(text));
    }

    @Test
    void clean_ShouldDropLeadingProse() {
        String text = "The following rule detects it.\nIt is tuned for Sysmon.\ntitle: X\nlevel: low";

        assertEquals("title: X\nlevel: low", RuleTextCleaner.clean(text));
    }

    @Test
    void clean_ShouldCutInlineProseBeforeTitle() {
        assertEquals("title: X", RuleTextCleaner.clean("Rule follows title: X"));
    }

    @Test
    void clean_ShouldLeaveDescriptionMentioningTitleAlone() {
        String text = "description: 'the title: is short'\ntitle: X";

        assertEquals(text, RuleTextCleaner.clean(text));
    }

    @Test
    void clean_ShouldHandleNull() {
        assertEquals("", RuleTextCleaner.clean(null));
    }
}
