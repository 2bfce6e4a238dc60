package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Optional overrides for a full scan; any null field takes the configured default. */
public record ScanRequestBody(
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("country") String country,
    @JsonProperty("max_articles") @JsonAlias("maxArticles") Integer maxArticles
) {}
