package com.vidnyan.sigmaeval.domain.evaluation;

import java.util.Map;

/**
 * Huntability score on a 0-10 scale with a per-metric breakdown (also 0-10).
 */
public record HuntabilityScore(
    double score,
    FalsePositiveRisk falsePositiveRisk,
    String coverageNotes,
    Map<String, Double> breakdown
) {

    public HuntabilityScore {
        breakdown = Map.copyOf(breakdown);
    }

    public static HuntabilityScore unscorable(String reason) {
        return new HuntabilityScore(0.0, FalsePositiveRisk.HIGH, reason, Map.of());
    }
}
