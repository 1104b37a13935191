package com.vidnyan.sigmaeval.domain.evaluation;

/**
 * Aggregate metrics over a dataset evaluation.
 * Means are null when no item contributed to them.
 */
public record CorpusMetrics(
    int total,
    int evaluated,
    int errors,
    double structuralPassRate,
    Double meanHuntability,
    Double meanSemanticSimilarity,
    Double meanStability,
    NoveltyDistribution noveltyDistribution
) {

    public record NoveltyDistribution(int duplicates, int variants, int novel) {}
}
