package com.portfolioscanner.news.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory article cache keyed by query.
 *
 * <p><strong>Fetch once, serve many:</strong> repeated scans within the TTL reuse the
 * same batch instead of spending NewsAPI quota. Empty batches are never cached so a
 * transient upstream failure does not stick.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}; all methods are synchronous lookups
 * suitable for use inside {@code Mono.defer}.
 */
@Component
public class NewsCache {

    private static final Logger log = LoggerFactory.getLogger(NewsCache.class);

    private final ConcurrentHashMap<String, CachedArticles> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public NewsCache(@Value("${news.cache-ttl:PT10M}") Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public NewsCache(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /**
     * Returns the entry for {@code key}, or {@code null} if absent or expired.
     * Expired entries are evicted on read.
     */
    public CachedArticles get(String key) {
        CachedArticles entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key);
            return null;
        }
        return entry;
    }

    public void put(String key, List<String> articles) {
        if (articles == null || articles.isEmpty()) {
            return;
        }
        store.put(key, new CachedArticles(List.copyOf(articles), clock.instant()));
        log.info("CACHE_REFRESH key={} articles={} ttlSeconds={}", key, articles.size(), ttl.toSeconds());
    }

    public boolean isExpired(CachedArticles entry) {
        return clock.instant().isAfter(entry.fetchedAt().plus(ttl));
    }

    public int size() {
        return store.size();
    }
}
