package com.portfolioscanner.common.report;

import com.portfolioscanner.common.insight.InsightEngine;
import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import com.portfolioscanner.common.model.SymbolCount;
import com.portfolioscanner.common.scan.ScanResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InsightReportFormatterTest {

    private final InsightEngine engine = InsightEngine.withDefaults();

    private final List<StockInsight> stocks = List.of(
        engine.generate("INFOSYS", "Infosys",
            new StockSentimentAggregate(3, 3, 0, 0, SentimentClass.POSITIVE, 0.75, 1.0, List.of(0.75, 0.75, 0.75))),
        engine.generate("TCS", "Tata Consultancy Services",
            new StockSentimentAggregate(4, 0, 4, 0, SentimentClass.NEGATIVE, 0.8, 1.0, List.of())),
        engine.generate("HDFC", "HDFC Bank",
            new StockSentimentAggregate(1, 1, 0, 0, SentimentClass.POSITIVE, 0.6, 1.0, List.of(0.6))));

    private final PortfolioInsight portfolio = engine.generatePortfolio(stocks);

    @Test
    @DisplayName("full report carries every section header in order and ends with the disclaimer")
    void sectionOrder() {
        String report = InsightReportFormatter.format(stocks, portfolio, LocalDateTime.of(2024, 3, 1, 9, 30, 0));

        List<String> headers = List.of("PORTFOLIO OVERVIEW", "SENTIMENT BREAKDOWN", "RISK ASSESSMENT",
            "TOP BUY RECOMMENDATIONS", "TOP SELL RECOMMENDATIONS", "INDIVIDUAL STOCK ANALYSIS",
            "KEY PORTFOLIO RISKS", "PORTFOLIO OPPORTUNITIES");
        int last = -1;
        for (String header : headers) {
            int at = report.indexOf(header);
            assertTrue(at > last, header + " missing or out of order");
            last = at;
        }
        assertTrue(report.contains("Generated on: 2024-03-01 09:30:00"));
        assertTrue(report.endsWith(InsightReportFormatter.DISCLAIMER));
    }

    @Test
    @DisplayName("recommendation entries show risk in upper case and confidence to 2 decimals")
    void recommendationLines() {
        String report = InsightReportFormatter.format(stocks, portfolio, LocalDateTime.of(2024, 3, 1, 9, 30));
        assertTrue(report.contains("* INFOSYS (Infosys)"));
        assertTrue(report.contains("  Risk: MEDIUM, Confidence: 0.75"));
        assertTrue(report.contains("SELL - Strong negative sentiment, consider exiting"));
        assertTrue(report.contains("Overall Sentiment: POSITIVE"));
        assertTrue(report.contains("   Time Horizon: short (1-3 months)"));
    }

    @Test
    @DisplayName("stock entries spell out the investor profile behind the risk level")
    void riskDescription() {
        String report = InsightReportFormatter.format(stocks, portfolio, LocalDateTime.of(2024, 3, 1, 9, 30));
        assertTrue(report.contains("   Risk Level: MEDIUM (Moderate - Balanced risk-reward profile)"));
        assertTrue(report.contains("   Risk Level: LOW (Conservative - Suitable for risk-averse investors)"));
    }

    @Test
    @DisplayName("empty portfolio omits recommendation sections")
    void emptyPortfolio() {
        String report = InsightReportFormatter.format(List.of(), engine.generatePortfolio(List.of()),
            LocalDateTime.of(2024, 1, 1, 0, 0));
        assertFalse(report.contains("TOP BUY RECOMMENDATIONS"));
        assertFalse(report.contains("KEY PORTFOLIO RISKS"));
        assertTrue(report.contains("Total Stocks Analyzed: 0"));
    }

    @Test
    @DisplayName("summary lists top mentioned stocks with company names")
    void summary() {
        ScanResult result = new ScanResult(12, 2, List.of("INFOSYS", "TCS"), Map.of("TCS", 4, "INFOSYS", 3),
            List.of(new SymbolCount("TCS", 4), new SymbolCount("INFOSYS", 3)),
            Map.of(), stocks, portfolio, Instant.parse("2024-03-01T09:30:00Z"));
        String summary = InsightReportFormatter.formatSummary(result,
            s -> s.equals("TCS") ? "Tata Consultancy Services" : "Infosys");

        assertTrue(summary.contains("Articles Analyzed: 12"));
        assertTrue(summary.contains(" 1. TCS"));
        assertTrue(summary.contains("- 4 mentions"));
        assertTrue(summary.contains("* INFOSYS - BUY - Strong positive sentiment with high confidence"));
        assertTrue(summary.endsWith("Portfolio Recommendation: " + portfolio.portfolioRecommendation()));
    }
}
