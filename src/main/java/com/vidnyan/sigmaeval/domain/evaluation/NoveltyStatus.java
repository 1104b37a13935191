package com.vidnyan.sigmaeval.domain.evaluation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Novelty classes with their numeric score (0 = duplicate, 1 = variant, 2 = novel).
 */
public enum NoveltyStatus {
    DUPLICATE(0),
    VARIANT(1),
    NOVEL(2);

    private final int score;

    NoveltyStatus(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
