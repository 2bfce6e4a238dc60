package com.portfolioscanner.common.report;

import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.SymbolCount;
import com.portfolioscanner.common.scan.ScanResult;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Plain-text renderings of scan output.
 *
 * <p>{@link #format} produces the full insights report; {@link #formatSummary} the
 * short scan summary. Both are pure functions of their arguments.
 */
public final class InsightReportFormatter {

    public static final String DISCLAIMER = "DISCLAIMER: This analysis is based on news sentiment and should "
            + "not be considered as financial advice. Please consult with a financial advisor before making "
            + "investment decisions.";

    private static final DateTimeFormatter GENERATED_ON = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);
    private static final int SUMMARY_TOP_RECOMMENDATIONS = 3;

    private InsightReportFormatter() {}

    public static String format(List<StockInsight> stocks, PortfolioInsight portfolio, LocalDateTime generatedAt) {
        List<String> out = new ArrayList<>();
        out.add("PORTFOLIO SCANNER INSIGHTS REPORT");
        out.add(RULE);
        out.add("Generated on: " + GENERATED_ON.format(generatedAt));
        out.add("");

        section(out, "PORTFOLIO OVERVIEW", 25);
        out.add("Total Stocks Analyzed: " + portfolio.totalStocksAnalyzed());
        out.add("Overall Sentiment: " + portfolio.portfolioSentiment().name());
        out.add("Portfolio Recommendation: " + portfolio.portfolioRecommendation());
        out.add("");

        section(out, "SENTIMENT BREAKDOWN", 22);
        PortfolioInsight.SentimentBreakdown sentiment = portfolio.sentimentBreakdown();
        out.add("Positive: " + sentiment.positive() + " stocks");
        out.add("Negative: " + sentiment.negative() + " stocks");
        out.add("Neutral: " + sentiment.neutral() + " stocks");
        out.add("");

        section(out, "RISK ASSESSMENT", 18);
        PortfolioInsight.RiskBreakdown risk = portfolio.riskBreakdown();
        out.add("High Risk: " + risk.highRisk() + " stocks");
        out.add("Medium Risk: " + risk.mediumRisk() + " stocks");
        out.add("Low Risk: " + risk.lowRisk() + " stocks");
        out.add("");

        recommendations(out, "TOP BUY RECOMMENDATIONS", portfolio.topBuyRecommendations());
        recommendations(out, "TOP SELL RECOMMENDATIONS", portfolio.topSellRecommendations());

        section(out, "INDIVIDUAL STOCK ANALYSIS", 30);
        for (StockInsight stock : stocks) {
            out.add("");
            out.add("> " + stock.symbol() + " (" + stock.company() + ")");
            out.add("   Mentions: " + stock.mentions());
            out.add("   Sentiment: " + stock.sentiment().name() + " (Confidence: " + twoDp(stock.confidence()) + ")");
            out.add("   Recommendation: " + stock.recommendation());
            out.add("   Risk Level: " + stock.riskLevel().name() + " (" + stock.riskLevel().description() + ")");
            out.add("   Time Horizon: " + stock.timeHorizon().describe());
            out.add("   Price Outlook: " + stock.priceOutlook());
            if (!stock.keyFactors().isEmpty()) {
                out.add("   Key Factors: " + String.join(", ", stock.keyFactors()));
            }
            if (!stock.actionItems().isEmpty()) {
                out.add("   Action Items:");
                stock.actionItems().forEach(item -> out.add("     - " + item));
            }
        }

        if (!portfolio.keyRisks().isEmpty()) {
            out.add("");
            section(out, "KEY PORTFOLIO RISKS", 25);
            portfolio.keyRisks().forEach(r -> out.add("- " + r));
        }
        if (!portfolio.opportunities().isEmpty()) {
            out.add("");
            section(out, "PORTFOLIO OPPORTUNITIES", 27);
            portfolio.opportunities().forEach(o -> out.add("- " + o));
        }

        out.add("");
        out.add(RULE);
        out.add(DISCLAIMER);
        return String.join("\n", out);
    }

    public static String formatSummary(ScanResult result, Function<String, String> companyFor) {
        List<String> out = new ArrayList<>();
        out.add("PORTFOLIO SCANNER SUMMARY");
        out.add("=".repeat(40));
        out.add("Articles Analyzed: " + result.articlesAnalyzed());
        out.add("Stocks Found: " + result.stocksFound());
        out.add("Analysis Time: " + result.analyzedAt());
        out.add("");

        if (!result.topStocks().isEmpty()) {
            section(out, "TOP 10 MOST MENTIONED STOCKS", 35);
            int rank = 1;
            for (SymbolCount top : result.topStocks()) {
                out.add(String.format(Locale.ROOT, "%2d. %-12s (%-25s) - %d mentions",
                        rank++, top.symbol(), companyFor.apply(top.symbol()), top.count()));
            }
            out.add("");
        }

        PortfolioInsight portfolio = result.portfolioInsight();
        if (portfolio != null) {
            section(out, "SENTIMENT OVERVIEW", 22);
            out.add("Positive: " + portfolio.sentimentBreakdown().positive() + " stocks");
            out.add("Negative: " + portfolio.sentimentBreakdown().negative() + " stocks");
            out.add("Neutral:  " + portfolio.sentimentBreakdown().neutral() + " stocks");
            out.add("");
            summaryRecommendations(out, "TOP BUY RECOMMENDATIONS", 28, portfolio.topBuyRecommendations());
            summaryRecommendations(out, "TOP SELL RECOMMENDATIONS", 30, portfolio.topSellRecommendations());
            out.add("Portfolio Recommendation: " + portfolio.portfolioRecommendation());
        }
        return String.join("\n", out);
    }

    // ── helpers ────────────────────────────────────────────────────

    private static void section(List<String> out, String title, int underline) {
        out.add(title);
        out.add("-".repeat(underline));
    }

    private static void recommendations(List<String> out, String title, List<StockInsight> stocks) {
        if (stocks.isEmpty()) return;
        section(out, title, 28);
        for (StockInsight stock : stocks) {
            out.add("* " + stock.symbol() + " (" + stock.company() + ")");
            out.add("  " + stock.recommendation());
            out.add("  Risk: " + stock.riskLevel().name() + ", Confidence: " + twoDp(stock.confidence()));
            out.add("");
        }
    }

    private static void summaryRecommendations(List<String> out, String title, int underline,
                                               List<StockInsight> stocks) {
        if (stocks.isEmpty()) return;
        section(out, title, underline);
        stocks.stream().limit(SUMMARY_TOP_RECOMMENDATIONS)
                .forEach(s -> out.add("* " + s.symbol() + " - " + s.recommendation()));
        out.add("");
    }

    private static String twoDp(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
