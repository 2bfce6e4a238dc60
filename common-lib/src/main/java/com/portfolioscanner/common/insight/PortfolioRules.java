package com.portfolioscanner.common.insight;

import com.portfolioscanner.common.model.RiskLevel;
import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.StockInsight;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Portfolio-level rule tables over the full list of stock insights.
 */
public final class PortfolioRules {

    private PortfolioRules() {}

    /** Inputs of the allocation recommendation. */
    public record AllocationSignal(SentimentClass sentiment, int highRisk, int total) {
        public double riskRatio() {
            return total > 0 ? (double) highRisk / total : 0.0;
        }
    }

    public static final RuleTable<AllocationSignal, String> RECOMMENDATION =
        RuleTable.<AllocationSignal, String>named("portfolio-recommendation")
            .when("increase", s -> s.sentiment() == SentimentClass.POSITIVE && s.riskRatio() < 0.3,
                    "Consider increasing equity allocation - positive sentiment with manageable risk")
            .when("reduce", s -> s.sentiment() == SentimentClass.NEGATIVE && s.riskRatio() > 0.5,
                    "Consider reducing equity allocation - negative sentiment with high risk")
            .when("diversify", s -> s.riskRatio() > 0.6,
                    "High risk exposure - consider diversification and risk management")
            .otherwise("maintain", "Maintain current allocation - balanced risk-reward profile");

    public static final RuleTable<List<StockInsight>, String> RISKS =
        RuleTable.<List<StockInsight>, String>named("portfolio-risks")
            .when("high-risk-concentration", l -> count(l, RiskLevel.HIGH) > 3,
                    "High concentration of high-risk stocks")
            .when("negative-proportion", l -> count(l, SentimentClass.NEGATIVE) > l.size() * 0.4,
                    "High proportion of negative sentiment stocks")
            .when("sector-concentration", l -> largestSectorCount(l) > l.size() * 0.5,
                    "High sector concentration - consider diversification")
            .build();

    public static final RuleTable<List<StockInsight>, String> OPPORTUNITIES =
        RuleTable.<List<StockInsight>, String>named("portfolio-opportunities")
            .when("broad-positive", l -> count(l, SentimentClass.POSITIVE) > l.size() * 0.6,
                    "Strong positive sentiment across portfolio")
            .when("high-confidence", l -> l.stream().filter(i -> i.confidence() > 0.7).count() > 3,
                    "Multiple high-confidence opportunities identified")
            .when("under-covered-positive", l -> l.stream().anyMatch(i ->
                            i.sentiment() == SentimentClass.POSITIVE && i.mentions() < 3),
                    "Potential undervalued opportunities with positive sentiment")
            .build();

    static int count(List<StockInsight> insights, SentimentClass sentiment) {
        return (int) insights.stream().filter(i -> i.sentiment() == sentiment).count();
    }

    static int count(List<StockInsight> insights, RiskLevel risk) {
        return (int) insights.stream().filter(i -> i.riskLevel() == risk).count();
    }

    static int largestSectorCount(List<StockInsight> insights) {
        Map<String, Integer> bySector = new HashMap<>();
        for (StockInsight insight : insights) {
            bySector.merge(insight.sector(), 1, Integer::sum);
        }
        return bySector.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
