package com.portfolioscanner.common.sentiment;

import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers the majority vote, the mean-confidence overwrite and mention matching.
 */
class SentimentAggregatorTest {

    private static final double EPS = 1e-9;

    private final SentimentAggregator aggregator = new SentimentAggregator(new SentimentScorer(
        new SentimentLexicon(List.of("strong", "growth", "gain"), List.of("weak", "falls"), List.of(), List.of())));

    @Nested
    @DisplayName("aggregate()")
    class Aggregate {

        @Test
        @DisplayName("empty articles or empty symbols → empty map")
        void emptyInputs() {
            assertTrue(aggregator.aggregate(List.of(), List.of("ABC")).isEmpty());
            assertTrue(aggregator.aggregate(List.of("ABC gain"), List.of()).isEmpty());
            assertTrue(aggregator.aggregate(null, null).isEmpty());
        }

        @Test
        @DisplayName("[positive, positive, negative] → positive; confidence is the mean of article confidences")
        void majorityWithMeanOverwrite() {
            List<String> articles = List.of("ABC strong growth", "ABC gain", "ABC falls");
            StockSentimentAggregate agg = aggregator.aggregate(articles, List.of("ABC")).get("ABC");

            assertEquals(3, agg.mentions());
            assertEquals(2, agg.positiveArticles());
            assertEquals(1, agg.negativeArticles());
            assertEquals(SentimentClass.POSITIVE, agg.overallSentiment());
            assertEquals(2.0 / 3, agg.proportionConfidence(), EPS);
            assertEquals((2.0 / 3 + 0.5 + 0.5) / 3, agg.confidence(), EPS);
            assertEquals(List.of(2.0 / 3, 0.5, 0.5), agg.articleConfidences());
        }

        @Test
        @DisplayName("positive/negative tie → neutral, proportion 0.5, confidence still the mean")
        void tieIsNeutral() {
            StockSentimentAggregate agg =
                aggregator.aggregate(List.of("ABC strong growth", "ABC weak"), List.of("ABC")).get("ABC");
            assertEquals(SentimentClass.NEUTRAL, agg.overallSentiment());
            assertEquals(0.5, agg.proportionConfidence(), EPS);
            assertEquals((2.0 / 3 + 0.5) / 2, agg.confidence(), EPS);
        }

        @Test
        @DisplayName("neutral articles count toward mentions but not the vote")
        void neutralArticles() {
            StockSentimentAggregate agg =
                aggregator.aggregate(List.of("ABC gain", "ABC quiet", "ABC idle"), List.of("ABC")).get("ABC");
            assertEquals(2, agg.neutralArticles());
            assertEquals(SentimentClass.POSITIVE, agg.overallSentiment());
            assertEquals(1.0 / 3, agg.proportionConfidence(), EPS);
            assertTrue(agg.isConsistent());
        }

        @Test
        @DisplayName("mention match ignores case and is a plain substring")
        void substringMention() {
            Map<String, StockSentimentAggregate> result =
                aggregator.aggregate(List.of("abcorp posts gain"), List.of("ABC"));
            assertEquals(1, result.get("ABC").mentions());
        }

        @Test
        @DisplayName("unmentioned symbols omitted; request order kept")
        void requestOrder() {
            Map<String, StockSentimentAggregate> result = aggregator.aggregate(
                List.of("ABC gain", "XYZ falls"), List.of("ZZZ", "XYZ", "ABC"));
            assertEquals(List.of("XYZ", "ABC"), List.copyOf(result.keySet()));
        }

        @Test
        @DisplayName("mentions == positive + negative + neutral for every symbol")
        void countsConsistent() {
            List<String> articles = List.of("ABC XYZ gain", "XYZ weak", "ABC", "XYZ strong falls");
            aggregator.aggregate(articles, List.of("ABC", "XYZ"))
                .values().forEach(agg -> assertTrue(agg.isConsistent()));
        }

        @Test
        @DisplayName("disappointing earnings headline with bundled lexicon → one negative mention")
        void tcsHeadline() {
            SentimentAggregator bundled = new SentimentAggregator(SentimentScorer.withDefaults());
            StockSentimentAggregate agg = bundled.aggregate(
                List.of("TCS announces disappointing earnings, stock falls 8%"), List.of("TCS")).get("TCS");
            assertEquals(1, agg.mentions());
            assertEquals(1, agg.negativeArticles());
            assertEquals(SentimentClass.NEGATIVE, agg.overallSentiment());
        }
    }

    @Nested
    @DisplayName("summarize()")
    class Summarize {

        @Test
        @DisplayName("groups by class, highest confidence first")
        void grouped() {
            Map<String, StockSentimentAggregate> aggregates = aggregator.aggregate(
                List.of("AAA gain", "BBB strong growth", "CCC falls", "DDD idle"),
                List.of("AAA", "BBB", "CCC", "DDD"));
            SentimentSummary summary = aggregator.summarize(aggregates);

            assertEquals(List.of("BBB", "AAA"),
                summary.positive().stream().map(SentimentSummary.Entry::symbol).toList());
            assertEquals("CCC", summary.negative().get(0).symbol());
            assertEquals("DDD", summary.neutral().get(0).symbol());
        }
    }
}
