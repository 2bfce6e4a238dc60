package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SymbolCount(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("count") int count
) {}
