package com.portfolioscanner.common.insight;

import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.RiskLevel;
import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns aggregated sentiment into per-stock insights and a portfolio rollup by
 * evaluating {@link InsightRules} and {@link PortfolioRules}.
 *
 * <p>Deterministic and stateless after construction.
 */
public final class InsightEngine {

    static final int MAX_TOP_RECOMMENDATIONS = 5;

    private final SectorTable sectors;

    public InsightEngine(SectorTable sectors) {
        this.sectors = sectors;
    }

    public static InsightEngine withDefaults() {
        return new InsightEngine(SectorTable.loadDefault());
    }

    public StockInsight generate(String symbol, String company, StockSentimentAggregate aggregate) {
        InsightSignal signal = InsightSignal.of(aggregate);
        String sector = sectors.sectorFor(symbol);
        return new StockInsight(
                symbol,
                company,
                aggregate.mentions(),
                aggregate.overallSentiment(),
                aggregate.confidence(),
                InsightRules.RECOMMENDATION.evaluate(signal),
                InsightRules.RISK.evaluate(signal),
                InsightRules.TIME_HORIZON.evaluate(signal),
                InsightRules.PRICE_OUTLOOK.evaluate(signal),
                InsightRules.keyFactors(signal),
                InsightRules.actionItems(signal),
                sector,
                InsightRules.sectorImpact(sector, signal));
    }

    /**
     * Insights for every aggregate in map order. {@code companies} resolves the
     * display name of each symbol.
     */
    public List<StockInsight> generateAll(Map<String, StockSentimentAggregate> aggregates,
                                          Function<String, String> companies) {
        List<StockInsight> insights = new ArrayList<>(aggregates.size());
        aggregates.forEach((symbol, aggregate) ->
                insights.add(generate(symbol, companies.apply(symbol), aggregate)));
        return insights;
    }

    public PortfolioInsight generatePortfolio(List<StockInsight> insights) {
        int positive = PortfolioRules.count(insights, SentimentClass.POSITIVE);
        int negative = PortfolioRules.count(insights, SentimentClass.NEGATIVE);
        int neutral = PortfolioRules.count(insights, SentimentClass.NEUTRAL);

        SentimentClass portfolioSentiment;
        if (positive > negative) {
            portfolioSentiment = SentimentClass.POSITIVE;
        } else if (negative > positive) {
            portfolioSentiment = SentimentClass.NEGATIVE;
        } else {
            portfolioSentiment = SentimentClass.NEUTRAL;
        }

        int highRisk = PortfolioRules.count(insights, RiskLevel.HIGH);
        int mediumRisk = PortfolioRules.count(insights, RiskLevel.MEDIUM);
        int lowRisk = PortfolioRules.count(insights, RiskLevel.LOW);

        List<StockInsight> buys = insights.stream()
                .filter(i -> i.recommendation().contains("BUY"))
                .limit(MAX_TOP_RECOMMENDATIONS)
                .toList();
        List<StockInsight> sells = insights.stream()
                .filter(i -> i.recommendation().contains("SELL"))
                .limit(MAX_TOP_RECOMMENDATIONS)
                .toList();

        String recommendation = PortfolioRules.RECOMMENDATION.evaluate(
                new PortfolioRules.AllocationSignal(portfolioSentiment, highRisk, insights.size()));

        return new PortfolioInsight(
                portfolioSentiment,
                insights.size(),
                new PortfolioInsight.SentimentBreakdown(positive, negative, neutral),
                new PortfolioInsight.RiskBreakdown(highRisk, mediumRisk, lowRisk),
                buys,
                sells,
                recommendation,
                PortfolioRules.RISKS.collect(insights),
                PortfolioRules.OPPORTUNITIES.collect(insights));
    }
}
