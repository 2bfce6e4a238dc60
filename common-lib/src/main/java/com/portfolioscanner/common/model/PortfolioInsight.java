package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PortfolioInsight(
    @JsonProperty("portfolio_sentiment") SentimentClass portfolioSentiment,
    @JsonProperty("total_stocks_analyzed") int totalStocksAnalyzed,
    @JsonProperty("sentiment_breakdown") SentimentBreakdown sentimentBreakdown,
    @JsonProperty("risk_breakdown") RiskBreakdown riskBreakdown,
    @JsonProperty("top_buy_recommendations") List<StockInsight> topBuyRecommendations,
    @JsonProperty("top_sell_recommendations") List<StockInsight> topSellRecommendations,
    @JsonProperty("portfolio_recommendation") String portfolioRecommendation,
    @JsonProperty("key_risks") List<String> keyRisks,
    @JsonProperty("opportunities") List<String> opportunities
) {
    public PortfolioInsight {
        topBuyRecommendations = List.copyOf(topBuyRecommendations);
        topSellRecommendations = List.copyOf(topSellRecommendations);
        keyRisks = List.copyOf(keyRisks);
        opportunities = List.copyOf(opportunities);
    }

    public record SentimentBreakdown(
        @JsonProperty("positive") int positive,
        @JsonProperty("negative") int negative,
        @JsonProperty("neutral") int neutral
    ) {}

    public record RiskBreakdown(
        @JsonProperty("high_risk") int highRisk,
        @JsonProperty("medium_risk") int mediumRisk,
        @JsonProperty("low_risk") int lowRisk
    ) {}
}
