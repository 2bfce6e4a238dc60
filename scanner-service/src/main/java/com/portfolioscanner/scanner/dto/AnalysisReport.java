package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import com.portfolioscanner.common.scan.ScanResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a stock-list analysis. {@code fallback} marks results built from
 * zero-coverage placeholders because no article mentioned any requested symbol.
 */
public record AnalysisReport(
    @JsonProperty("articles_analyzed") int articlesAnalyzed,
    @JsonProperty("stocks_analyzed") List<String> stocksAnalyzed,
    @JsonProperty("stock_sentiments") Map<String, StockSentimentAggregate> stockSentiments,
    @JsonProperty("stock_insights") List<StockInsight> stockInsights,
    @JsonProperty("portfolio_insights") PortfolioInsight portfolioInsight,
    @JsonProperty("fallback") boolean fallback,
    @JsonProperty("analysis_timestamp") Instant analyzedAt
) {
    public static AnalysisReport of(ScanResult result, boolean fallback) {
        return new AnalysisReport(
            result.articlesAnalyzed(),
            result.gatedSymbols(),
            result.stockSentiments(),
            result.stockInsights(),
            result.portfolioInsight(),
            fallback,
            result.analyzedAt());
    }
}
