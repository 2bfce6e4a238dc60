package com.portfolioscanner.scanner.service;

import com.portfolioscanner.common.extraction.SymbolExtractor;
import com.portfolioscanner.common.insight.InsightEngine;
import com.portfolioscanner.common.model.StockInsight;
import com.portfolioscanner.common.model.StockSentimentAggregate;
import com.portfolioscanner.common.scan.ScanResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the placeholder analysis used when no article mentions any requested symbol.
 *
 * <p>Every symbol gets a zero-mention neutral aggregate and runs through the normal
 * insight rules, so the output is deterministic and shaped exactly like a real result.
 */
@Component
public class FallbackAnalysisFactory {

    private final SymbolExtractor extractor;
    private final InsightEngine insightEngine;
    private final Clock clock;

    public FallbackAnalysisFactory(SymbolExtractor extractor, InsightEngine insightEngine, Clock clock) {
        this.extractor     = extractor;
        this.insightEngine = insightEngine;
        this.clock         = clock;
    }

    public ScanResult create(List<String> symbols, int articlesAnalyzed) {
        Map<String, StockSentimentAggregate> sentiments = new LinkedHashMap<>();
        for (String symbol : symbols) {
            sentiments.putIfAbsent(symbol, StockSentimentAggregate.unmentioned());
        }
        List<StockInsight> insights = insightEngine.generateAll(sentiments, extractor::companyFor);
        return new ScanResult(
            articlesAnalyzed,
            sentiments.size(),
            List.copyOf(sentiments.keySet()),
            Map.of(),
            List.of(),
            sentiments,
            insights,
            insightEngine.generatePortfolio(insights),
            clock.instant());
    }
}
