package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk bucket assigned to a single stock insight, with the investor profile
 * each bucket suits.
 */
public enum RiskLevel {
    LOW("Conservative - Suitable for risk-averse investors"),
    MEDIUM("Moderate - Balanced risk-reward profile"),
    HIGH("Aggressive - High risk, high potential reward");

    private final String description;

    RiskLevel(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
