package com.portfolioscanner.news.provider;

import com.portfolioscanner.news.model.NewsQuery;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface: live NewsAPI or the bundled offline batch.
 * Both emit an empty list rather than an error when nothing is available.
 */
public interface NewsProvider {

    Mono<List<String>> articles(NewsQuery query);

    Mono<List<String>> headlines();
}
