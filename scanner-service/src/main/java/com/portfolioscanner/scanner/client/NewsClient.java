package com.portfolioscanner.scanner.client;

import com.portfolioscanner.common.scan.ScanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches article texts from news-service.
 *
 * <p>All errors are absorbed into an empty batch so a scan degrades to the
 * fallback analysis instead of failing when news-service is unreachable.
 */
@Component
public class NewsClient {

    private static final Logger log = LoggerFactory.getLogger(NewsClient.class);

    private static final ParameterizedTypeReference<List<String>> ARTICLES = new ParameterizedTypeReference<>() {};

    private final WebClient newsServiceClient;

    public NewsClient(WebClient newsServiceClient) {
        this.newsServiceClient = newsServiceClient;
    }

    /**
     * @return articles for the request's keywords and country, at most
     *         {@code maxArticles}; empty on any error
     */
    public Mono<List<String>> fetchArticles(ScanRequest request) {
        return newsServiceClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/news/articles")
                .queryParam("keywords", String.join(",", request.keywords()))
                .queryParam("country", request.country())
                .queryParam("maxArticles", request.maxArticles())
                .build())
            .retrieve()
            .bodyToMono(ARTICLES)
            .defaultIfEmpty(List.of())
            .doOnNext(articles -> log.info("ARTICLES_RECEIVED count={} country={}", articles.size(), request.country()))
            .onErrorResume(e -> {
                log.warn("News fetch failed. country={} - continuing with no articles. reason={}",
                         request.country(), e.getMessage());
                return Mono.just(List.<String>of());
            });
    }

    /** Recent business headlines; empty on any error. */
    public Mono<List<String>> fetchHeadlines() {
        return newsServiceClient.get()
            .uri("/api/v1/news/headlines")
            .retrieve()
            .bodyToMono(ARTICLES)
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Headline fetch failed - continuing with no articles. reason={}", e.getMessage());
                return Mono.just(List.<String>of());
            });
    }
}
