package com.vidnyan.sigmaeval.domain.evaluation;

import java.util.List;

/**
 * Cross-run stability of repeated rule generation for one input.
 */
public record StabilityResult(
    int totalRuns,
    int successfulRuns,
    int uniqueHashes,
    String modalHash,
    double hashConsistency,
    double selectorsVariance,
    double semanticVariance,
    double stabilityScore,
    boolean stable,
    List<String> runHashes
) {

    public static final double STABLE_THRESHOLD = 0.85;

    public StabilityResult {
        runHashes = List.copyOf(runHashes);
    }

    public static StabilityResult noSuccessfulRuns(int totalRuns) {
        return new StabilityResult(totalRuns, 0, 0, null, 0.0, 0.0, 0.0, 0.0, false, List.of());
    }
}
