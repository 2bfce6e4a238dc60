package com.portfolioscanner.scanner.service;

import com.portfolioscanner.common.trace.AnalysisContext;
import com.portfolioscanner.scanner.client.NewsClient;
import com.portfolioscanner.scanner.config.ScanDefaults;
import com.portfolioscanner.scanner.exception.AnalysisNotFoundException;
import com.portfolioscanner.scanner.job.AnalysisJob;
import com.portfolioscanner.scanner.job.AnalysisJobStore;
import com.portfolioscanner.scanner.logger.ScanFlowLogger;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Background portfolio analysis.
 *
 * <p>{@link #submit} registers a job and returns immediately; the run itself executes on
 * {@code boundedElastic} and reports progress into the {@link AnalysisJob}:
 * 25 fetching news, 50 analysing sentiment, 75 compiling insights, then 100 or FAILED.
 * A failed run never propagates; the error is recorded on the job.
 */
@Service
public class AnalysisJobService {

    private final AnalysisJobStore store;
    private final NewsClient newsClient;
    private final PortfolioScanService scanService;
    private final ScanDefaults defaults;
    private final ScanFlowLogger flowLogger;

    public AnalysisJobService(AnalysisJobStore store,
                              NewsClient newsClient,
                              PortfolioScanService scanService,
                              ScanDefaults defaults,
                              ScanFlowLogger flowLogger) {
        this.store       = store;
        this.newsClient  = newsClient;
        this.scanService = scanService;
        this.defaults    = defaults;
        this.flowLogger  = flowLogger;
    }

    public AnalysisJob submit(List<String> stocks) {
        List<String> symbols = PortfolioScanService.normalizeSymbols(stocks);
        AnalysisJob job = store.create(symbols);
        flowLogger.log(ScanFlowLogger.SCAN_START, job.getAnalysisId(), symbols);
        run(job).subscribeOn(Schedulers.boundedElastic()).subscribe();
        return job;
    }

    public AnalysisJob status(String analysisId) {
        return store.find(analysisId).orElseThrow(() -> new AnalysisNotFoundException(analysisId));
    }

    Mono<AnalysisJob> run(AnalysisJob job) {
        String analysisId = job.getAnalysisId();
        List<String> symbols = job.getRequestedSymbols();

        Mono<AnalysisJob> pipeline = Mono.fromRunnable(() -> job.advance(25, "Fetching news articles"))
            .then(Mono.defer(() -> newsClient.fetchArticles(defaults.forSymbols(symbols))))
            .doOnEach(flowLogger.stage(ScanFlowLogger.ARTICLES_FETCHED))
            .doOnNext(articles -> job.advance(50, "Analyzing sentiment across " + articles.size() + " articles"))
            .publishOn(Schedulers.boundedElastic())
            .map(articles -> scanService.analyzeArticles(articles, symbols, analysisId))
            .doOnEach(flowLogger.stage(ScanFlowLogger.SENTIMENT_ANALYZED))
            .doOnNext(report -> job.advance(75, "Compiling insights for " + report.stockInsights().size() + " stocks"))
            .doOnEach(flowLogger.stage(ScanFlowLogger.INSIGHTS_GENERATED))
            .map(report -> {
                job.complete(report);
                return job;
            })
            .doOnEach(flowLogger.stage(ScanFlowLogger.SCAN_COMPLETED))
            .onErrorResume(e -> {
                flowLogger.failed(analysisId, e);
                job.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                return Mono.just(job);
            });

        return AnalysisContext.bind(pipeline, analysisId);
    }
}
