package com.portfolioscanner.common.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScanRequest(
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("country") String country,
    @JsonProperty("maxArticles") int maxArticles
) {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
        "stock market", "earnings", "quarterly results", "IPO", "mergers",
        "Sensex", "Nifty", "Indian stocks", "dividend", "RBI", "banking");
    public static final String DEFAULT_COUNTRY = "India";
    public static final int DEFAULT_MAX_ARTICLES = 100;

    public ScanRequest {
        keywords = (keywords == null || keywords.isEmpty()) ? DEFAULT_KEYWORDS : List.copyOf(keywords);
        country = (country == null || country.isBlank()) ? DEFAULT_COUNTRY : country;
        maxArticles = maxArticles <= 0 ? DEFAULT_MAX_ARTICLES : maxArticles;
    }

    public static ScanRequest defaults() {
        return new ScanRequest(null, null, 0);
    }
}
