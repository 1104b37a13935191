package com.vidnyan.sigmaeval.domain.evaluation;

/**
 * Per-rule evaluation report. Stages that did not run are null.
 */
public record RuleReport(
    String itemId,
    String ruleId,
    String ruleTitle,
    ExtendedValidationResult structural,
    BehavioralCore behavioralCore,
    SemanticComparisonResult semanticComparison,
    HuntabilityScore huntability,
    StabilityResult stability,
    NoveltyResult novelty,
    String error
) {

    /**
     * Report for a rule rejected by structural validation.
     */
    public static RuleReport structuralFailure(String itemId, String ruleId, String ruleTitle,
                                               ExtendedValidationResult structural) {
        return new RuleReport(itemId, ruleId, ruleTitle, structural, null, null, null, null, null, null);
    }

    /**
     * Report for an item that could not be evaluated at all.
     */
    public static RuleReport failed(String itemId, String error) {
        return new RuleReport(itemId, null, null, null, null, null, null, null, null, error);
    }

    public RuleReport withItemId(String newItemId) {
        return new RuleReport(newItemId, ruleId, ruleTitle, structural, behavioralCore,
                semanticComparison, huntability, stability, novelty, error);
    }

    public RuleReport withStability(StabilityResult newStability) {
        return new RuleReport(itemId, ruleId, ruleTitle, structural, behavioralCore,
                semanticComparison, huntability, newStability, novelty, error);
    }

    public boolean passed() {
        return error == null && structural != null && structural.finalPass();
    }
}
