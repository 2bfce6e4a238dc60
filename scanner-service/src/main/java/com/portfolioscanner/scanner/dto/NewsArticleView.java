package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.model.SentimentResult;

/** One fetched article split back into title and content, with its score. */
public record NewsArticleView(
    @JsonProperty("title") String title,
    @JsonProperty("content") String content,
    @JsonProperty("sentiment") SentimentResult sentiment
) {
    private static final String TITLE_PREFIX = "Title: ";
    private static final String CONTENT_PREFIX = "Content: ";

    /** Splits {@code "Title: <t>\nContent: <d>\n"}; text without the markers becomes the title. */
    public static NewsArticleView parse(String article, SentimentResult sentiment) {
        String title = article.strip();
        String content = "";
        int split = article.indexOf("\n" + CONTENT_PREFIX);
        if (split >= 0) {
            title = article.substring(0, split).strip();
            content = article.substring(split + 1 + CONTENT_PREFIX.length()).strip();
        }
        if (title.startsWith(TITLE_PREFIX)) {
            title = title.substring(TITLE_PREFIX.length()).strip();
        }
        return new NewsArticleView(title, content, sentiment);
    }
}
