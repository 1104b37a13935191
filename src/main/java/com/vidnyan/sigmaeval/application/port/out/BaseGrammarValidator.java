package com.vidnyan.sigmaeval.application.port.out;

import java.util.List;

/**
 * Port for the base rule-grammar check.
 * Any SIGMA-conformant validator can implement it.
 */
public interface BaseGrammarValidator {

    /**
     * Check that the rule text is a syntactically valid rule.
     */
    BaseValidationResult validateBase(String ruleText);

    record BaseValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings
    ) {
        public BaseValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public static BaseValidationResult failure(String error) {
            return new BaseValidationResult(false, List.of(error), List.of());
        }
    }
}
