package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How strongly an extracted token is believed to be a ticker.
 * Declaration order is the sort order of extraction results.
 */
public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
