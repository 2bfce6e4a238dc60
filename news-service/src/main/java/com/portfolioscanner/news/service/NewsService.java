package com.portfolioscanner.news.service;

import com.portfolioscanner.news.cache.CachedArticles;
import com.portfolioscanner.news.cache.NewsCache;
import com.portfolioscanner.news.client.NewsApiWebClient;
import com.portfolioscanner.news.model.NewsApiResponse;
import com.portfolioscanner.news.model.NewsQuery;
import com.portfolioscanner.news.provider.NewsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Live news access backed by NewsAPI and {@link NewsCache}.
 *
 * <p><strong>Article flow:</strong>
 * <ol>
 *   <li>Cache hit → return the cached batch.</li>
 *   <li>Miss → {@code /v2/everything} with the OR-joined keywords and country.</li>
 *   <li>Empty or failed search → the headline fallback chain.</li>
 *   <li>Non-empty result → capped to {@code maxArticles} and cached.</li>
 * </ol>
 *
 * <p><strong>Headline chain:</strong> India business, India general, US business.
 * Each step that fails or yields nothing is logged at WARN and skipped; when every
 * step is exhausted the result is an empty list, never an error.
 *
 * <p>Swapped for {@link com.portfolioscanner.news.provider.OfflineNewsProvider} when
 * profile {@code offline} is active.
 */
@Service
public class NewsService implements NewsProvider {

    private static final Logger log = LoggerFactory.getLogger(NewsService.class);

    record HeadlineSource(String name, String country, String category) {}

    static final List<HeadlineSource> HEADLINE_SOURCES = List.of(
        new HeadlineSource("India Business", "in", "business"),
        new HeadlineSource("India General",  "in", null),
        new HeadlineSource("US Business",    "us", "business")
    );

    private static final String HEADLINES_KEY = "headlines";

    private final NewsApiWebClient client;
    private final NewsCache cache;

    public NewsService(NewsApiWebClient client, NewsCache cache) {
        this.client = client;
        this.cache  = cache;
    }

    @Override
    public Mono<List<String>> articles(NewsQuery query) {
        String key = query.cacheKey();

        return Mono.defer(() -> {
            CachedArticles cached = cache.get(key);
            if (cached != null) {
                log.info("CACHE_HIT key={} articles={} fetchedAt={}", key, cached.articles().size(), cached.fetchedAt());
                return Mono.just(cached.articles());
            }
            if (!client.hasApiKey()) {
                log.warn("NEWS_API_KEY_MISSING query={} - returning no articles", key);
                return Mono.just(List.<String>of());
            }

            log.info("CACHE_MISS key={}", key);
            return search(query)
                .flatMap(found -> found.isEmpty() ? fallbackHeadlines() : Mono.just(found))
                .map(found -> found.size() > query.maxArticles() ? found.subList(0, query.maxArticles()) : found)
                .doOnNext(found -> cache.put(key, found));
        });
    }

    @Override
    public Mono<List<String>> headlines() {
        return Mono.defer(() -> {
            CachedArticles cached = cache.get(HEADLINES_KEY);
            if (cached != null) {
                return Mono.just(cached.articles());
            }
            if (!client.hasApiKey()) {
                log.warn("NEWS_API_KEY_MISSING headlines - returning no articles");
                return Mono.just(List.<String>of());
            }
            return fallbackHeadlines().doOnNext(found -> cache.put(HEADLINES_KEY, found));
        });
    }

    private Mono<List<String>> search(NewsQuery query) {
        return client.searchEverything(query.searchExpression(), query.maxArticles())
            .map(response -> okArticles(response, "everything"))
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("NEWS_SEARCH_FAILED query={} error={}", query.cacheKey(), e.getMessage());
                return Mono.just(List.<String>of());
            });
    }

    private Mono<List<String>> fallbackHeadlines() {
        return Flux.fromIterable(HEADLINE_SOURCES)
            .concatMap(source -> client.topHeadlines(source.country(), source.category())
                .map(response -> okArticles(response, source.name()))
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("NEWS_SOURCE_FAILED source={} error={}", source.name(), e.getMessage());
                    return Mono.just(List.<String>of());
                })
                .doOnNext(found -> {
                    if (!found.isEmpty()) {
                        log.info("NEWS_SOURCE_USED source={} articles={}", source.name(), found.size());
                    }
                }))
            .filter(found -> !found.isEmpty())
            .next()
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("NEWS_SOURCES_EXHAUSTED - all headline sources failed or were empty");
                return List.<String>of();
            }));
    }

    private static List<String> okArticles(NewsApiResponse response, String source) {
        if (!response.isOk()) {
            log.warn("NEWS_API_ERROR source={} code={} message={}", source, response.code(), response.message());
            return List.of();
        }
        return response.articleTexts();
    }
}
