package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lexicon score of one piece of text.
 *
 * <p>{@code confidence} equals the winning score for a directional result and
 * is exactly {@code 0.5} for a neutral one.
 */
public record SentimentResult(
    @JsonProperty("sentiment") SentimentClass classification,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("positive_score") double positiveScore,
    @JsonProperty("negative_score") double negativeScore,
    @JsonProperty("positive_count") int positiveCount,
    @JsonProperty("negative_count") int negativeCount
) {
    public static final double NEUTRAL_CONFIDENCE = 0.5;

    public static SentimentResult empty() {
        return new SentimentResult(SentimentClass.NEUTRAL, NEUTRAL_CONFIDENCE, 0.0, 0.0, 0, 0);
    }
}
