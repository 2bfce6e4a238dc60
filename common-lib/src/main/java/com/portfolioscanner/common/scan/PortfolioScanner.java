package com.portfolioscanner.common.scan;

import com.portfolioscanner.common.extraction.SymbolExtractor;
import com.portfolioscanner.common.insight.InsightEngine;
import com.portfolioscanner.common.model.PortfolioInsight;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import com.portfolioscanner.common.model.SymbolCandidate;
import com.portfolioscanner.common.sentiment.SentimentAggregator;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * End-to-end pipeline: articles, candidate symbols, quality gate, per-symbol
 * sentiment, insights and the portfolio rollup.
 *
 * <p>Never throws for empty input; an empty batch or an empty gated set produces a
 * {@link ScanResult} with empty collections and a zero-stock portfolio summary.
 */
public final class PortfolioScanner {

    public static final int TOP_STOCKS = 10;

    private final SymbolExtractor extractor;
    private final SentimentAggregator aggregator;
    private final InsightEngine insightEngine;
    private final Clock clock;

    public PortfolioScanner(SymbolExtractor extractor, SentimentAggregator aggregator,
                            InsightEngine insightEngine, Clock clock) {
        this.extractor = extractor;
        this.aggregator = aggregator;
        this.insightEngine = insightEngine;
        this.clock = clock;
    }

    public ScanResult scan(NewsSource source, ScanRequest request) {
        List<String> articles = source.fetch(request);
        if (articles == null) articles = List.of();
        if (articles.size() > request.maxArticles()) {
            articles = articles.subList(0, request.maxArticles());
        }
        return analyze(articles);
    }

    /** Discovers symbols from the articles themselves. */
    public ScanResult analyze(List<String> articles) {
        if (articles == null || articles.isEmpty()) {
            return empty(0, List.of());
        }
        Set<String> gated = gatedSymbols(articles);
        if (gated.isEmpty()) {
            return empty(articles.size(), List.of());
        }
        return build(articles, List.copyOf(gated));
    }

    /**
     * Scores a caller-chosen symbol list against the articles. Only requested symbols
     * that the extractor found and the quality gate accepted are kept, in request order;
     * the result is empty when none survive.
     */
    public ScanResult analyzeSymbols(List<String> articles, List<String> symbols) {
        if (articles == null || articles.isEmpty() || symbols == null || symbols.isEmpty()) {
            return empty(articles == null ? 0 : articles.size(), List.of());
        }
        Set<String> gated = gatedSymbols(articles);
        Set<String> covered = new LinkedHashSet<>();
        for (String symbol : symbols) {
            String upper = symbol.toUpperCase(Locale.ROOT);
            if (gated.contains(upper)) {
                covered.add(upper);
            }
        }
        if (covered.isEmpty()) {
            return empty(articles.size(), List.of());
        }
        return build(articles, List.copyOf(covered));
    }

    private Set<String> gatedSymbols(List<String> articles) {
        Set<String> gated = new LinkedHashSet<>();
        for (List<SymbolCandidate> candidates : extractor.extractFromArticles(articles).values()) {
            for (SymbolCandidate candidate : candidates) {
                if (QualityGate.accepts(candidate)) {
                    gated.add(candidate.symbol());
                }
            }
        }
        return gated;
    }

    private ScanResult build(List<String> articles, List<String> symbols) {
        Map<String, StockSentimentAggregate> sentiments = aggregator.aggregate(articles, symbols);
        Map<String, Integer> frequency = extractor.symbolFrequency(articles);
        List<StockInsight> insights = insightEngine.generateAll(sentiments, extractor::companyFor);
        PortfolioInsight portfolio = insightEngine.generatePortfolio(insights);
        return new ScanResult(
                articles.size(),
                symbols.size(),
                symbols,
                frequency,
                SymbolExtractor.toCounts(frequency, TOP_STOCKS),
                sentiments,
                insights,
                portfolio,
                clock.instant());
    }

    private ScanResult empty(int articleCount, List<String> symbols) {
        return new ScanResult(articleCount, symbols.size(), symbols, Map.of(), List.of(), Map.of(), List.of(),
                insightEngine.generatePortfolio(List.of()), clock.instant());
    }

    public SymbolExtractor extractor() { return extractor; }
}
