package com.vidnyan.sigmaeval.domain.evaluation;

import java.util.List;

/**
 * Semantic equivalence of a generated rule against a reference rule.
 */
public record SemanticComparisonResult(
    double similarityScore,
    int missingBehaviors,
    int extraneousBehaviors,
    List<String> missingBehaviorDetails,
    List<String> extraneousBehaviorDetails,
    Boolean overfittingDetected,
    String fpRisk,
    String explanation,
    Method method,
    boolean degraded
) {

    /**
     * How the score was obtained.
     */
    public enum Method {
        CORE_HASH,
        LLM_JUDGE,
        EMBEDDING,
        NEUTRAL
    }

    public SemanticComparisonResult {
        missingBehaviorDetails = List.copyOf(missingBehaviorDetails);
        extraneousBehaviorDetails = List.copyOf(extraneousBehaviorDetails);
    }

    /**
     * Identical behavioral cores.
     */
    public static SemanticComparisonResult identicalCores() {
        return new SemanticComparisonResult(1.0, 0, 0, List.of(), List.of(), null, null,
                "Behavioral cores are identical", Method.CORE_HASH, false);
    }

    /**
     * Neutral result used when no capability could produce a score.
     */
    public static SemanticComparisonResult neutral(String explanation) {
        return new SemanticComparisonResult(0.5, 0, 0, List.of(), List.of(), null, null,
                explanation, Method.NEUTRAL, true);
    }

    /**
     * Same result, flagged as computed by a fallback method.
     */
    public SemanticComparisonResult asFallback() {
        return new SemanticComparisonResult(similarityScore, missingBehaviors, extraneousBehaviors,
                missingBehaviorDetails, extraneousBehaviorDetails, overfittingDetected, fpRisk,
                explanation, method, true);
    }
}
