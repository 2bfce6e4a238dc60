package com.portfolioscanner.common.sentiment;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Mentioned symbols grouped by overall sentiment, each group by confidence descending. */
public record SentimentSummary(
    @JsonProperty("positive") List<Entry> positive,
    @JsonProperty("negative") List<Entry> negative,
    @JsonProperty("neutral") List<Entry> neutral
) {
    public SentimentSummary {
        positive = List.copyOf(positive);
        negative = List.copyOf(negative);
        neutral = List.copyOf(neutral);
    }

    public record Entry(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("mentions") int mentions,
        @JsonProperty("positive_articles") int positiveArticles,
        @JsonProperty("negative_articles") int negativeArticles
    ) {}
}
