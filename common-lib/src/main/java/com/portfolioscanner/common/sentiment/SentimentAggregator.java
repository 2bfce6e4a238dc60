package com.portfolioscanner.common.sentiment;

import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.SentimentResult;
import com.portfolioscanner.common.model.StockSentimentAggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rolls per-article sentiment up to per-symbol sentiment.
 *
 * <p>An article mentions a symbol when the symbol occurs anywhere in it, ignoring case.
 * The overall class is a strict majority of positive against negative articles
 * (neutral on a tie). The reported {@code confidence} is then the mean of the
 * mentioning articles' confidences; the majority share is kept separately as
 * {@code proportionConfidence}.
 *
 * <p>Symbols no article mentions are absent from the result. Result order follows
 * the requested symbol order.
 */
public final class SentimentAggregator {

    private final SentimentScorer scorer;

    public SentimentAggregator(SentimentScorer scorer) {
        this.scorer = scorer;
    }

    public Map<String, StockSentimentAggregate> aggregate(List<String> articles, List<String> symbols) {
        Map<String, StockSentimentAggregate> result = new LinkedHashMap<>();
        if (articles == null || articles.isEmpty() || symbols == null || symbols.isEmpty()) {
            return result;
        }

        Set<String> distinct = new LinkedHashSet<>(symbols);
        Map<String, Tally> tallies = new LinkedHashMap<>();
        for (String symbol : distinct) {
            tallies.put(symbol, new Tally());
        }

        for (String article : articles) {
            if (article == null) continue;
            String upper = article.toUpperCase(Locale.ROOT);
            SentimentResult sentiment = scorer.score(article);
            for (String symbol : distinct) {
                if (upper.contains(symbol.toUpperCase(Locale.ROOT))) {
                    tallies.get(symbol).record(sentiment);
                }
            }
        }

        tallies.forEach((symbol, tally) -> {
            if (tally.mentions > 0) {
                result.put(symbol, tally.toAggregate());
            }
        });
        return result;
    }

    public SentimentSummary summarize(Map<String, StockSentimentAggregate> aggregates) {
        List<SentimentSummary.Entry> positive = new ArrayList<>();
        List<SentimentSummary.Entry> negative = new ArrayList<>();
        List<SentimentSummary.Entry> neutral = new ArrayList<>();
        aggregates.forEach((symbol, agg) -> {
            if (agg.mentions() == 0) return;
            SentimentSummary.Entry entry = new SentimentSummary.Entry(symbol, agg.confidence(),
                    agg.mentions(), agg.positiveArticles(), agg.negativeArticles());
            switch (agg.overallSentiment()) {
                case POSITIVE -> positive.add(entry);
                case NEGATIVE -> negative.add(entry);
                default -> neutral.add(entry);
            }
        });
        Comparator<SentimentSummary.Entry> byConfidence =
                Comparator.comparingDouble(SentimentSummary.Entry::confidence).reversed();
        positive.sort(byConfidence);
        negative.sort(byConfidence);
        neutral.sort(byConfidence);
        return new SentimentSummary(positive, negative, neutral);
    }

    private static final class Tally {
        int mentions;
        int positive;
        int negative;
        int neutral;
        final List<Double> confidences = new ArrayList<>();

        void record(SentimentResult sentiment) {
            mentions++;
            confidences.add(sentiment.confidence());
            switch (sentiment.classification()) {
                case POSITIVE -> positive++;
                case NEGATIVE -> negative++;
                default -> neutral++;
            }
        }

        StockSentimentAggregate toAggregate() {
            SentimentClass overall;
            double proportion;
            if (positive > negative) {
                overall = SentimentClass.POSITIVE;
                proportion = (double) positive / mentions;
            } else if (negative > positive) {
                overall = SentimentClass.NEGATIVE;
                proportion = (double) negative / mentions;
            } else {
                overall = SentimentClass.NEUTRAL;
                proportion = SentimentResult.NEUTRAL_CONFIDENCE;
            }
            double mean = confidences.stream().mapToDouble(Double::doubleValue).average().orElse(proportion);
            return new StockSentimentAggregate(mentions, positive, negative, neutral, overall,
                    mean, proportion, confidences);
        }
    }
}
