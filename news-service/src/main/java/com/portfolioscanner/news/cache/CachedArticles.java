package com.portfolioscanner.news.cache;

import java.time.Instant;
import java.util.List;

/** Immutable cache entry: formatted article texts and when they were fetched. */
public record CachedArticles(
    List<String> articles,
    Instant fetchedAt
) {}
