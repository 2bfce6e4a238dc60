package com.portfolioscanner.common.insight;

import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.StockSentimentAggregate;

/** The three inputs every per-stock rule reads. */
public record InsightSignal(SentimentClass sentiment, double confidence, int mentions) {

    public static InsightSignal of(StockSentimentAggregate aggregate) {
        return new InsightSignal(aggregate.overallSentiment(), aggregate.confidence(), aggregate.mentions());
    }

    public boolean positive() { return sentiment == SentimentClass.POSITIVE; }
    public boolean negative() { return sentiment == SentimentClass.NEGATIVE; }
}
