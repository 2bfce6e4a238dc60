package com.portfolioscanner.scanner.service;

import com.portfolioscanner.common.model.SentimentResult;
import com.portfolioscanner.common.report.InsightReportFormatter;
import com.portfolioscanner.common.scan.PortfolioScanner;
import com.portfolioscanner.common.scan.ScanRequest;
import com.portfolioscanner.common.scan.ScanResult;
import com.portfolioscanner.common.sentiment.SentimentScorer;
import com.portfolioscanner.scanner.client.NewsClient;
import com.portfolioscanner.scanner.config.ScanDefaults;
import com.portfolioscanner.scanner.dto.AnalysisReport;
import com.portfolioscanner.scanner.dto.ExtractionResponse;
import com.portfolioscanner.scanner.dto.NewsArticleView;
import com.portfolioscanner.scanner.dto.ScanRequestBody;
import com.portfolioscanner.scanner.exception.ScannerException;
import com.portfolioscanner.scanner.logger.ScanFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Synchronous scanner operations: news fetch through {@link NewsClient}, then the
 * {@link PortfolioScanner} pipeline on {@code boundedElastic} since lexicon scoring is CPU-bound.
 *
 * <p>Input validation happens eagerly, before any {@link Mono} is assembled, so a
 * {@link ScannerException} reaches the controller advice as a plain throw.
 */
@Service
public class PortfolioScanService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioScanService.class);

    static final int NEWS_PREVIEW_LIMIT = 10;

    private final PortfolioScanner scanner;
    private final SentimentScorer scorer;
    private final NewsClient newsClient;
    private final FallbackAnalysisFactory fallbackFactory;
    private final ScanDefaults defaults;
    private final ScanFlowLogger flowLogger;
    private final Clock clock;

    public PortfolioScanService(PortfolioScanner scanner,
                                SentimentScorer scorer,
                                NewsClient newsClient,
                                FallbackAnalysisFactory fallbackFactory,
                                ScanDefaults defaults,
                                ScanFlowLogger flowLogger,
                                Clock clock) {
        this.scanner         = scanner;
        this.scorer          = scorer;
        this.newsClient      = newsClient;
        this.fallbackFactory = fallbackFactory;
        this.defaults        = defaults;
        this.flowLogger      = flowLogger;
        this.clock           = clock;
    }

    /**
     * Trims, uppercases and de-duplicates requested symbols, keeping request order.
     *
     * @throws ScannerException when nothing usable remains
     */
    public static List<String> normalizeSymbols(List<String> stocks) {
        if (stocks == null) {
            throw new ScannerException("Field 'stocks' is required");
        }
        List<String> symbols = List.copyOf(stocks.stream()
            .filter(Objects::nonNull)
            .map(s -> s.trim().toUpperCase(Locale.ROOT))
            .filter(s -> !s.isEmpty())
            .collect(LinkedHashSet::new, LinkedHashSet::add, LinkedHashSet::addAll));
        if (symbols.isEmpty()) {
            throw new ScannerException("Field 'stocks' must contain at least one symbol");
        }
        return symbols;
    }

    public Mono<AnalysisReport> analyzeStocks(List<String> stocks) {
        List<String> symbols = normalizeSymbols(stocks);
        return newsClient.fetchArticles(defaults.forSymbols(symbols))
            .publishOn(Schedulers.boundedElastic())
            .map(articles -> analyzeArticles(articles, symbols, "none"));
    }

    /** Scores {@code symbols} against {@code articles}; substitutes the fallback when none passed the extraction gate. */
    public AnalysisReport analyzeArticles(List<String> articles, List<String> symbols, String analysisId) {
        ScanResult result = scanner.analyzeSymbols(articles, symbols);
        if (result.isEmpty()) {
            flowLogger.log(ScanFlowLogger.FALLBACK_USED, analysisId, symbols);
            return AnalysisReport.of(fallbackFactory.create(symbols, articles.size()), true);
        }
        return AnalysisReport.of(result, false);
    }

    public Mono<ScanResult> scan(ScanRequestBody body) {
        ScanRequest request = body == null
            ? defaults.defaults()
            : defaults.resolve(body.keywords(), body.country(), body.maxArticles());
        log.info("SCAN_REQUESTED country={} keywords={} maxArticles={}",
                 request.country(), request.keywords().size(), request.maxArticles());
        return newsClient.fetchArticles(request)
            .publishOn(Schedulers.boundedElastic())
            .map(articles -> scanner.scan(ignored -> articles, request))
            .doOnNext(result -> log.info("SCAN_DONE articles={} stocks={}",
                                         result.articlesAnalyzed(), result.stocksFound()));
    }

    public Mono<String> report(ScanRequestBody body) {
        return scan(body).map(result -> InsightReportFormatter.format(
            result.stockInsights(), result.portfolioInsight(), LocalDateTime.now(clock)));
    }

    public Mono<String> summary(ScanRequestBody body) {
        return scan(body).map(result -> InsightReportFormatter.formatSummary(result, scanner.extractor()::companyFor));
    }

    public ExtractionResponse extract(String text) {
        return ExtractionResponse.of(scanner.extractor().extract(requireText(text)));
    }

    public SentimentResult sentiment(String text) {
        return scorer.score(requireText(text));
    }

    /** First {@value #NEWS_PREVIEW_LIMIT} default-query articles, each scored. */
    public Mono<List<NewsArticleView>> latestNews() {
        return newsClient.fetchArticles(defaults.defaults())
            .map(articles -> articles.stream()
                .limit(NEWS_PREVIEW_LIMIT)
                .map(article -> NewsArticleView.parse(article, scorer.score(article)))
                .toList());
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new ScannerException("Field 'text' must not be blank");
        }
        return text;
    }
}
