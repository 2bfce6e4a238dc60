package com.portfolioscanner.news.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of NewsAPI {@code /v2/everything} and {@code /v2/top-headlines}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsApiResponse(
    @JsonProperty("status") String status,
    @JsonProperty("totalResults") int totalResults,
    @JsonProperty("articles") List<Article> articles,
    @JsonProperty("code") String code,
    @JsonProperty("message") String message
) {
    public static final String ARTICLE_FORMAT = "Title: %s\nContent: %s\n";

    public boolean isOk() {
        return "ok".equals(status);
    }

    /**
     * Articles that carry both a title and a description, rendered as
     * {@code "Title: <t>\nContent: <d>\n"}.
     */
    public List<String> articleTexts() {
        if (articles == null) return List.of();
        return articles.stream()
            .filter(Article::isComplete)
            .map(a -> String.format(ARTICLE_FORMAT, a.title(), a.description()))
            .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Article(
        @JsonProperty("source") Source source,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("url") String url,
        @JsonProperty("publishedAt") String publishedAt
    ) {
        public boolean isComplete() {
            return title != null && !title.isBlank() && description != null && !description.isBlank();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Source(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
    ) {}
}
