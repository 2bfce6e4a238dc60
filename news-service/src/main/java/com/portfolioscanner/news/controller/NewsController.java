package com.portfolioscanner.news.controller;

import com.portfolioscanner.news.model.NewsQuery;
import com.portfolioscanner.news.provider.NewsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/news")
public class NewsController {

    private static final Logger log = LoggerFactory.getLogger(NewsController.class);

    private final NewsProvider provider;

    public NewsController(NewsProvider provider) {
        this.provider = provider;
    }

    /**
     * Article texts for a keyword search. {@code keywords} is comma-separated;
     * anything omitted falls back to the {@link NewsQuery} defaults.
     */
    @GetMapping("/articles")
    public Mono<ResponseEntity<List<String>>> articles(
            @RequestParam(required = false) List<String> keywords,
            @RequestParam(required = false) String country,
            @RequestParam(defaultValue = "0") int maxArticles) {
        NewsQuery query = new NewsQuery(keywords, country, maxArticles);
        return provider.articles(query)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("[NewsAPI] articles error. query={}", query.cacheKey(), e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/headlines")
    public Mono<ResponseEntity<List<String>>> headlines() {
        return provider.headlines()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError().build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
