package com.portfolioscanner.common.scan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import com.portfolioscanner.common.model.SymbolCount;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ScanResult(
    @JsonProperty("articles_analyzed") int articlesAnalyzed,
    @JsonProperty("stocks_found") int stocksFound,
    @JsonProperty("symbols") List<String> gatedSymbols,
    @JsonProperty("stock_frequency") Map<String, Integer> stockFrequency,
    @JsonProperty("top_stocks") List<SymbolCount> topStocks,
    @JsonProperty("stock_sentiments") Map<String, StockSentimentAggregate> stockSentiments,
    @JsonProperty("stock_insights") List<StockInsight> stockInsights,
    @JsonProperty("portfolio_insights") PortfolioInsight portfolioInsight,
    @JsonProperty("analysis_timestamp") Instant analyzedAt
) {
    public ScanResult {
        gatedSymbols = List.copyOf(gatedSymbols);
        stockFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(stockFrequency));
        topStocks = List.copyOf(topStocks);
        stockSentiments = Collections.unmodifiableMap(new LinkedHashMap<>(stockSentiments));
        stockInsights = List.copyOf(stockInsights);
    }

    public boolean isEmpty() {
        return stockInsights.isEmpty();
    }
}
