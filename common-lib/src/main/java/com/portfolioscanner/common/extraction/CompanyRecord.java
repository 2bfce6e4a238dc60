package com.portfolioscanner.common.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Canonical company name and the aliases (tickers, short names) it is known by. */
public record CompanyRecord(
    @JsonProperty("name") String name,
    @JsonProperty("aliases") List<String> aliases
) {}
