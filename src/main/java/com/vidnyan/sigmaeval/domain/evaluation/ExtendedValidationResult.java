package com.vidnyan.sigmaeval.domain.evaluation;

import java.util.List;

/**
 * Result of base grammar validation plus the extended structural checks.
 * {@code iocLeakage} is true when indicators were found (bad).
 */
public record ExtendedValidationResult(
    boolean baseGrammarPassed,
    List<String> baseGrammarErrors,
    boolean telemetryFeasible,
    boolean conditionValid,
    boolean patternSafe,
    boolean iocLeakage,
    boolean fieldConformance,
    boolean selectionFeasible,
    boolean finalPass,
    List<String> errors,
    List<String> warnings
) {

    public ExtendedValidationResult {
        baseGrammarErrors = List.copyOf(baseGrammarErrors);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    /**
     * Create a result for a rule that passed the grammar gate; the aggregate is derived.
     */
    public static ExtendedValidationResult of(
            boolean telemetryFeasible,
            boolean conditionValid,
            boolean patternSafe,
            boolean iocLeakage,
            boolean fieldConformance,
            boolean selectionFeasible,
            List<String> errors,
            List<String> warnings) {
        boolean finalPass = telemetryFeasible
                && conditionValid
                && patternSafe
                && !iocLeakage
                && fieldConformance
                && selectionFeasible;
        return new ExtendedValidationResult(true, List.of(), telemetryFeasible, conditionValid,
                patternSafe, iocLeakage, fieldConformance, selectionFeasible, finalPass, errors, warnings);
    }

    /**
     * Create a hard-fail result when the grammar gate rejects the rule.
     */
    public static ExtendedValidationResult baseGrammarFailure(List<String> errors, List<String> warnings) {
        return new ExtendedValidationResult(false, errors, false, false, false, false, false, false,
                false, errors, warnings);
    }
}
