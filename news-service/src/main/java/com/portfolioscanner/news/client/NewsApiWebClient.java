package com.portfolioscanner.news.client;

import com.portfolioscanner.news.model.NewsApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Thin NewsAPI client. Returns the raw response; fallback and filtering decisions
 * belong to {@link com.portfolioscanner.news.service.NewsService}.
 */
public class NewsApiWebClient {

    private static final Logger log = LoggerFactory.getLogger(NewsApiWebClient.class);

    /** NewsAPI rejects larger pages. */
    static final int MAX_PAGE_SIZE = 100;

    private final WebClient webClient;
    private final String apiKey;
    private final int pageSize;

    public NewsApiWebClient(WebClient newsApiWebClient, String apiKey, int pageSize) {
        this.webClient = newsApiWebClient;
        this.apiKey    = apiKey;
        this.pageSize  = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /** {@code /v2/everything} for an already-built search expression, newest first. */
    public Mono<NewsApiResponse> searchEverything(String query, int maxArticles) {
        int size = Math.min(pageSize, Math.max(1, maxArticles));
        log.info("Fetching news. endpoint=everything pageSize={} query={}", size, query);
        return webClient.get()
            .uri(uri -> uri.path("/v2/everything")
                .queryParam("q", query)
                .queryParam("language", "en")
                .queryParam("sortBy", "publishedAt")
                .queryParam("pageSize", size)
                .queryParam("apiKey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(NewsApiResponse.class)
            .doOnSuccess(r -> log.info("News fetched. endpoint=everything status={} articles={}",
                r == null ? "empty" : r.status(), r == null || r.articles() == null ? 0 : r.articles().size()));
    }

    /** {@code /v2/top-headlines}; {@code category} may be null for all categories. */
    public Mono<NewsApiResponse> topHeadlines(String countryCode, String category) {
        log.info("Fetching news. endpoint=top-headlines country={} category={}", countryCode, category);
        return webClient.get()
            .uri(uri -> {
                uri.path("/v2/top-headlines")
                    .queryParam("country", countryCode)
                    .queryParam("pageSize", pageSize);
                if (category != null) {
                    uri.queryParam("category", category);
                }
                return uri.queryParam("apiKey", apiKey).build();
            })
            .retrieve()
            .bodyToMono(NewsApiResponse.class);
    }
}
