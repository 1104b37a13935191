package com.vidnyan.sigmaeval.domain.evaluation;

/**
 * Novelty of a rule against a corpus. Closest-match fields are null when nothing was compared.
 */
public record NoveltyResult(
    int noveltyScore,
    NoveltyStatus noveltyStatus,
    String closestMatchId,
    String closestMatchTitle,
    Double closestMatchSimilarity,
    int rulesCompared,
    int rulesSkipped
) {

    public static NoveltyResult of(NoveltyStatus status, String matchId, String matchTitle,
                                   Double similarity, int compared, int skipped) {
        return new NoveltyResult(status.score(), status, matchId, matchTitle, similarity, compared, skipped);
    }

    /**
     * No corpus available: the rule is assumed novel.
     */
    public static NoveltyResult withoutCorpus() {
        return of(NoveltyStatus.NOVEL, null, null, null, 0, 0);
    }
}
