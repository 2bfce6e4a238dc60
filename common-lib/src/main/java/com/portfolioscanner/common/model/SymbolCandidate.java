package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SymbolCandidate(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("company") String company,      // "Unknown" for pattern-only matches
    @JsonProperty("confidence") ConfidenceTier confidence
) {
    public static final String UNKNOWN_COMPANY = "Unknown";

    public static SymbolCandidate pattern(String symbol) {
        return new SymbolCandidate(symbol, UNKNOWN_COMPANY, ConfidenceTier.LOW);
    }

    public boolean hasKnownCompany() {
        return !UNKNOWN_COMPANY.equals(company);
    }
}
