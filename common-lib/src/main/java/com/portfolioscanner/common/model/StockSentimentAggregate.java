package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sentiment of one symbol across an article batch.
 *
 * <p>{@code confidence} is the mean of the per-article confidences of the
 * mentioning articles. {@code proportionConfidence} is the share of the
 * majority class (0.5 on a tie) and is kept for diagnostics only; downstream
 * rules read {@code confidence}.
 */
public record StockSentimentAggregate(
    @JsonProperty("mentions") int mentions,
    @JsonProperty("positive_articles") int positiveArticles,
    @JsonProperty("negative_articles") int negativeArticles,
    @JsonProperty("neutral_articles") int neutralArticles,
    @JsonProperty("overall_sentiment") SentimentClass overallSentiment,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("proportion_confidence") double proportionConfidence,
    @JsonProperty("article_confidences") List<Double> articleConfidences
) {
    public StockSentimentAggregate {
        articleConfidences = articleConfidences == null ? List.of() : List.copyOf(articleConfidences);
    }

    /** Aggregate for a symbol no article mentioned. */
    public static StockSentimentAggregate unmentioned() {
        return new StockSentimentAggregate(0, 0, 0, 0, SentimentClass.NEUTRAL,
                SentimentResult.NEUTRAL_CONFIDENCE, SentimentResult.NEUTRAL_CONFIDENCE, List.of());
    }

    @JsonIgnore
    public boolean isConsistent() {
        return positiveArticles + negativeArticles + neutralArticles == mentions;
    }
}
