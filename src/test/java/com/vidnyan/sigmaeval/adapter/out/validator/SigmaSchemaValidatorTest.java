package com.vidnyan.sigmaeval.adapter.out.validator;

import com.vidnyan.sigmaeval.RuleFixtures;
import com.vidnyan.sigmaeval.adapter.out.parser.SigmaRuleParser;
import com.vidnyan.sigmaeval.application.port.out.BaseGrammarValidator.BaseValidationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SigmaSchemaValidatorTest {

    private final SigmaSchemaValidator validator = new SigmaSchemaValidator(new SigmaRuleParser());

    @Test
    void validateBase_ShouldAcceptMinimalRuleWithWarnings() {
        BaseValidationResult result = validator.validateBase(RuleFixtures.SCHTASKS_RULE);

        assertTrue(result.valid(), () -> "errors: " + result.errors());
        assertTrue(result.warnings().contains("Title is very short (less than 10 characters)"));
        assertTrue(result.warnings().contains("Rule has no description"));
    }

    @Test
    void validateBase_ShouldAcceptCompleteRuleWithoutWarnings() {
        BaseValidationResult result = validator.validateBase(RuleFixtures.ENCODED_POWERSHELL_RULE);

        assertTrue(result.valid());
        assertTrue(result.warnings().isEmpty(), () -> "warnings: " + result.warnings());
    }

    @Test
    void validateBase_ShouldRequireTopLevelFields() {
        BaseValidationResult result = validator.validateBase("title: Only a title here\n");

        assertFalse(result.valid());
        assertTrue(result.errors().contains("Missing required field: logsource"));
        assertTrue(result.errors().contains("Missing required field: detection"));
    }

    @Test
    void validateBase_ShouldRequireCondition() {
        BaseValidationResult result = validator.validateBase("""
                title: No condition present
                logsource:
                  category: process_creation
                detection:
                  selection:
                    Image|endswith: '\\cmd.exe'
                """);

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("Detection must contain a 'condition' key"));
    }

    @Test
    void validateBase_ShouldRejectUnknownCategoryAndLevel() {
        BaseValidationResult result = validator.validateBase("""
                title: Bad category and level
                logsource:
                  category: process_spawn
                detection:
                  selection:
                    Image|endswith: '\\cmd.exe'
                  condition: selection
                level: severe
                """);

        assertFalse(result.valid());
        assertTrue(result.errors().contains("Invalid logsource category: process_spawn"));
        assertTrue(result.errors().stream().anyMatch(e -> e.startsWith("Invalid level: severe")));
    }

    @Test
    void validateBase_ShouldRejectInvalidYaml() {
        BaseValidationResult result = validator.validateBase("title: [unclosed\n");

        assertFalse(result.valid());
        assertTrue(result.errors().get(0).startsWith("Invalid YAML syntax"));
    }
}
