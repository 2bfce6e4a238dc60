package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.model.SymbolCandidate;

import java.util.List;

public record ExtractionResponse(
    @JsonProperty("symbols") List<SymbolCandidate> symbols,
    @JsonProperty("count") int count
) {
    public static ExtractionResponse of(List<SymbolCandidate> symbols) {
        return new ExtractionResponse(symbols, symbols.size());
    }
}
