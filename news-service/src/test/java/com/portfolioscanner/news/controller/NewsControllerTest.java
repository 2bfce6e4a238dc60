package com.portfolioscanner.news.controller;

import com.portfolioscanner.news.model.NewsQuery;
import com.portfolioscanner.news.provider.NewsProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NewsControllerTest {

    private static final ParameterizedTypeReference<List<String>> STRINGS = new ParameterizedTypeReference<>() {};

    private NewsProvider provider;
    private WebTestClient webClient;

    @BeforeEach
    void setUp() {
        provider = mock(NewsProvider.class);
        webClient = WebTestClient.bindToController(new NewsController(provider)).build();
    }

    @Test
    void articlesParsesCommaSeparatedKeywords() {
        when(provider.articles(any())).thenReturn(Mono.just(List.of("Title: a\nContent: b\n")));

        webClient.get().uri("/api/v1/news/articles?keywords=IPO,dividend&country=India&maxArticles=5")
            .exchange()
            .expectStatus().isOk()
            .expectBody(STRINGS).isEqualTo(List.of("Title: a\nContent: b\n"));

        ArgumentCaptor<NewsQuery> captor = ArgumentCaptor.forClass(NewsQuery.class);
        verify(provider).articles(captor.capture());
        assertThat(captor.getValue().keywords()).containsExactly("IPO", "dividend");
        assertThat(captor.getValue().maxArticles()).isEqualTo(5);
    }

    @Test
    void articlesWithoutParametersUsesDefaults() {
        when(provider.articles(any())).thenReturn(Mono.just(List.of()));

        webClient.get().uri("/api/v1/news/articles").exchange().expectStatus().isOk();

        ArgumentCaptor<NewsQuery> captor = ArgumentCaptor.forClass(NewsQuery.class);
        verify(provider).articles(captor.capture());
        assertThat(captor.getValue().keywords()).isEqualTo(NewsQuery.DEFAULT_KEYWORDS);
        assertThat(captor.getValue().country()).isEqualTo("India");
        assertThat(captor.getValue().maxArticles()).isEqualTo(100);
    }

    @Test
    void providerErrorMapsToServerError() {
        when(provider.articles(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

        webClient.get().uri("/api/v1/news/articles").exchange().expectStatus().is5xxServerError();
    }

    @Test
    void headlinesAndHealth() {
        when(provider.headlines()).thenReturn(Mono.just(List.of("Title: h\nContent: c\n")));

        webClient.get().uri("/api/v1/news/headlines").exchange()
            .expectStatus().isOk()
            .expectBody(STRINGS).isEqualTo(List.of("Title: h\nContent: c\n"));
        webClient.get().uri("/api/v1/news/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
