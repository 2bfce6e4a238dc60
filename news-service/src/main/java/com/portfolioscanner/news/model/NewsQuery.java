package com.portfolioscanner.news.model;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Keyword search for articles about one country's market.
 */
public record NewsQuery(List<String> keywords, String country, int maxArticles) {

    public static final List<String> DEFAULT_KEYWORDS = List.of(
        "stock market", "earnings", "quarterly results", "IPO", "mergers",
        "Sensex", "Nifty", "Indian stocks", "dividend", "RBI", "banking");
    public static final String DEFAULT_COUNTRY = "India";
    public static final int DEFAULT_MAX_ARTICLES = 100;

    public NewsQuery {
        keywords = (keywords == null || keywords.isEmpty()) ? DEFAULT_KEYWORDS
            : keywords.stream().map(String::trim).filter(k -> !k.isEmpty()).toList();
        if (keywords.isEmpty()) keywords = DEFAULT_KEYWORDS;
        country = (country == null || country.isBlank()) ? DEFAULT_COUNTRY : country.trim();
        maxArticles = maxArticles <= 0 ? DEFAULT_MAX_ARTICLES : maxArticles;
    }

    /**
     * NewsAPI {@code q} expression: keywords OR-joined (multi-word ones quoted),
     * followed by the country name.
     */
    public String searchExpression() {
        String joined = keywords.stream()
            .map(k -> k.contains(" ") ? "\"" + k + "\"" : k)
            .collect(Collectors.joining(" OR "));
        return "(" + joined + ") " + country;
    }

    public String cacheKey() {
        return (String.join("|", keywords) + "@" + country + "#" + maxArticles).toLowerCase(Locale.ROOT);
    }
}
