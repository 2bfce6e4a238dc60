package com.portfolioscanner.scanner.config;

import com.portfolioscanner.common.scan.ScanRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Request defaults applied when a caller omits keywords, country or article limit.
 * Values come from {@code scanner.*}; an empty keyword list falls through to
 * {@link ScanRequest#DEFAULT_KEYWORDS}.
 */
@Component
public class ScanDefaults {

    private final List<String> keywords;
    private final String country;
    private final int maxArticles;

    public ScanDefaults(
            @Value("${scanner.default-keywords:}") List<String> keywords,
            @Value("${scanner.country:India}") String country,
            @Value("${scanner.max-articles:100}") int maxArticles) {
        this.keywords    = keywords == null ? List.of() : keywords.stream().filter(k -> !k.isBlank()).toList();
        this.country     = country;
        this.maxArticles = maxArticles;
    }

    public ScanRequest resolve(List<String> requestedKeywords, String requestedCountry, Integer requestedMax) {
        return new ScanRequest(
            requestedKeywords == null || requestedKeywords.isEmpty() ? keywords : requestedKeywords,
            requestedCountry == null || requestedCountry.isBlank() ? country : requestedCountry,
            requestedMax == null || requestedMax <= 0 ? maxArticles : requestedMax);
    }

    public ScanRequest defaults() {
        return resolve(null, null, null);
    }

    /** Default keywords followed by the requested symbols, so the news search covers them. */
    public ScanRequest forSymbols(List<String> symbols) {
        List<String> combined = new ArrayList<>(defaults().keywords());
        for (String symbol : symbols) {
            if (!combined.contains(symbol)) {
                combined.add(symbol);
            }
        }
        return resolve(combined, null, null);
    }
}
