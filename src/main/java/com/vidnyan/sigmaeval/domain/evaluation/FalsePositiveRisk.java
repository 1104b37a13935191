package com.vidnyan.sigmaeval.domain.evaluation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FalsePositiveRisk {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
