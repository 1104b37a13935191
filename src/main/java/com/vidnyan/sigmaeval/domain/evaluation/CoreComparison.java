package com.vidnyan.sigmaeval.domain.evaluation;

/**
 * Set comparison of two behavioral cores.
 */
public record CoreComparison(
    double similarity,
    int commonSelectors,
    int onlyInFirst,
    int onlyInSecond,
    boolean hashMatch,
    int selectorCountDiff
) {}
