package com.portfolioscanner.news.service;

import com.portfolioscanner.news.cache.NewsCache;
import com.portfolioscanner.news.client.NewsApiWebClient;
import com.portfolioscanner.news.model.NewsApiResponse;
import com.portfolioscanner.news.model.NewsApiResponse.Article;
import com.portfolioscanner.news.model.NewsQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NewsServiceTest {

    private static final NewsQuery QUERY = new NewsQuery(List.of("IPO", "stock market"), "India", 10);

    private NewsApiWebClient client;
    private NewsCache cache;
    private NewsService service;

    @BeforeEach
    void setUp() {
        client = mock(NewsApiWebClient.class);
        cache = new NewsCache(Duration.ofMinutes(10));
        service = new NewsService(client, cache);
        when(client.hasApiKey()).thenReturn(true);
    }

    @Nested
    @DisplayName("articles")
    class Articles {

        @Test
        @DisplayName("search succeeds → search articles, cached")
        void searchResultIsReturnedAndCached() {
            when(client.searchEverything(QUERY.searchExpression(), 10)).thenReturn(Mono.just(ok("Infosys wins deal")));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).containsExactly(text("Infosys wins deal")))
                .verifyComplete();
            StepVerifier.create(service.articles(QUERY)).expectNextCount(1).verifyComplete();

            verify(client, times(1)).searchEverything(anyString(), anyInt());
            verify(client, never()).topHeadlines(anyString(), any());
        }

        @Test
        @DisplayName("search fails → first non-empty headline source")
        void searchFailureFallsBackToHeadlines() {
            when(client.searchEverything(anyString(), anyInt())).thenReturn(Mono.error(new IllegalStateException("boom")));
            when(client.topHeadlines("in", "business")).thenReturn(Mono.just(ok("Sensex closes higher")));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).containsExactly(text("Sensex closes higher")))
                .verifyComplete();

            verify(client, never()).topHeadlines("in", null);
        }

        @Test
        @DisplayName("search returns error status → headlines")
        void searchErrorStatusFallsBack() {
            when(client.searchEverything(anyString(), anyInt()))
                .thenReturn(Mono.just(new NewsApiResponse("error", 0, null, "rateLimited", "Too many requests")));
            when(client.topHeadlines("in", "business")).thenReturn(Mono.just(ok("Nifty steady")));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).containsExactly(text("Nifty steady")))
                .verifyComplete();
        }

        @Test
        @DisplayName("failing and empty sources are skipped in order")
        void chainWalksToUsBusiness() {
            when(client.searchEverything(anyString(), anyInt())).thenReturn(Mono.just(ok()));
            when(client.topHeadlines("in", "business")).thenReturn(Mono.error(new IllegalStateException("down")));
            when(client.topHeadlines("in", null)).thenReturn(Mono.just(ok()));
            when(client.topHeadlines("us", "business")).thenReturn(Mono.just(ok("Wall Street rallies")));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).containsExactly(text("Wall Street rallies")))
                .verifyComplete();
        }

        @Test
        @DisplayName("every source exhausted → empty list, nothing cached")
        void allSourcesExhausted() {
            when(client.searchEverything(anyString(), anyInt())).thenReturn(Mono.error(new IllegalStateException("down")));
            when(client.topHeadlines(anyString(), any()))
                .thenReturn(Mono.error(new IllegalStateException("down")));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).isEmpty())
                .verifyComplete();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("more articles than requested → capped")
        void resultIsCappedToMaxArticles() {
            String[] titles = IntStream.range(0, 15).mapToObj(i -> "Headline " + i).toArray(String[]::new);
            when(client.searchEverything(anyString(), anyInt())).thenReturn(Mono.just(ok(titles)));

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> {
                    assertThat(a).hasSize(10);
                    assertThat(a.get(0)).isEqualTo(text("Headline 0"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no API key → empty list without calling NewsAPI")
        void missingKeySkipsUpstream() {
            when(client.hasApiKey()).thenReturn(false);

            StepVerifier.create(service.articles(QUERY))
                .assertNext(a -> assertThat(a).isEmpty())
                .verifyComplete();
            verify(client, never()).searchEverything(anyString(), anyInt());
        }
    }

    @Test
    @DisplayName("headlines → headline chain only")
    void headlinesUseChain() {
        when(client.topHeadlines("in", "business")).thenReturn(Mono.just(ok("RBI holds rates")));

        StepVerifier.create(service.headlines())
            .assertNext(a -> assertThat(a).containsExactly(text("RBI holds rates")))
            .verifyComplete();
        verify(client, never()).searchEverything(anyString(), anyInt());
    }

    private static NewsApiResponse ok(String... titles) {
        List<Article> articles = Arrays.stream(titles)
            .map(t -> new Article(null, t, t + " details.", "https://example.com", "2024-10-18T00:00:00Z"))
            .toList();
        return new NewsApiResponse("ok", articles.size(), articles, null, null);
    }

    private static String text(String title) {
        return "Title: " + title + "\nContent: " + title + " details.\n";
    }
}
