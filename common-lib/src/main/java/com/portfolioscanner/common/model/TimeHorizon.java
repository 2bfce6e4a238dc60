package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimeHorizon {
    SHORT("1-3 months"),
    MEDIUM("3-12 months");

    private final String range;

    TimeHorizon(String range) {
        this.range = range;
    }

    public String range() {
        return range;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /** e.g. {@code "short (1-3 months)"} */
    public String describe() {
        return label() + " (" + range + ")";
    }
}
