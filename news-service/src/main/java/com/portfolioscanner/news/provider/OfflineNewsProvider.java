package com.portfolioscanner.news.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioscanner.news.model.NewsApiResponse;
import com.portfolioscanner.news.model.NewsQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Offline adapter: serves a bundled NewsAPI-shaped batch instead of calling out.
 * Useful for demos and for running the scanner without an API key.
 *
 * <p>Active only when Spring profile {@code offline} is set. {@code @Primary} makes it
 * win over the live {@link com.portfolioscanner.news.service.NewsService} bean.
 */
@Service
@Primary
@Profile("offline")
public class OfflineNewsProvider implements NewsProvider {

    private static final Logger log = LoggerFactory.getLogger(OfflineNewsProvider.class);

    private final List<String> articles;

    public OfflineNewsProvider(ObjectMapper objectMapper,
                               @Value("${news.offline-fixture:fixtures/offline-articles.json}") String fixture) {
        this.articles = load(objectMapper, fixture);
        log.info("OFFLINE_NEWS_LOADED fixture={} articles={}", fixture, articles.size());
    }

    @Override
    public Mono<List<String>> articles(NewsQuery query) {
        List<String> batch = articles.size() > query.maxArticles()
            ? articles.subList(0, query.maxArticles())
            : articles;
        return Mono.just(batch);
    }

    @Override
    public Mono<List<String>> headlines() {
        return Mono.just(articles);
    }

    static List<String> load(ObjectMapper objectMapper, String fixture) {
        try (InputStream in = new ClassPathResource(fixture).getInputStream()) {
            return List.copyOf(objectMapper.readValue(in, NewsApiResponse.class).articleTexts());
        } catch (IOException e) {
            throw new UncheckedIOException("Offline news fixture unreadable: " + fixture, e);
        }
    }
}
