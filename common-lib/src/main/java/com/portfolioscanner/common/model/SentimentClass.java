package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SentimentClass {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    public boolean isDirectional() {
        return this != NEUTRAL;
    }
}
