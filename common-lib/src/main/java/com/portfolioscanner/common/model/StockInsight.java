package com.portfolioscanner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record StockInsight(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("company") String company,
    @JsonProperty("mentions") int mentions,
    @JsonProperty("sentiment") SentimentClass sentiment,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("time_horizon") TimeHorizon timeHorizon,
    @JsonProperty("price_outlook") String priceOutlook,
    @JsonProperty("key_factors") List<String> keyFactors,
    @JsonProperty("action_items") List<String> actionItems,
    @JsonProperty("sector") String sector,
    @JsonProperty("sector_impact") String sectorImpact
) {
    public StockInsight {
        keyFactors = List.copyOf(keyFactors);
        actionItems = List.copyOf(actionItems);
    }
}
