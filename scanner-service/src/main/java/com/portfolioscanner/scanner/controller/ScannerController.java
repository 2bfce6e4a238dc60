package com.portfolioscanner.scanner.controller;

import com.portfolioscanner.common.model.SentimentResult;
import com.portfolioscanner.common.scan.ScanResult;
import com.portfolioscanner.scanner.dto.AnalysisAccepted;
import com.portfolioscanner.scanner.dto.AnalysisReport;
import com.portfolioscanner.scanner.dto.AnalysisStatusResponse;
import com.portfolioscanner.scanner.dto.ExtractionResponse;
import com.portfolioscanner.scanner.dto.NewsArticleView;
import com.portfolioscanner.scanner.dto.ScanRequestBody;
import com.portfolioscanner.scanner.dto.StocksRequest;
import com.portfolioscanner.scanner.dto.TextRequest;
import com.portfolioscanner.scanner.job.AnalysisJob;
import com.portfolioscanner.scanner.service.AnalysisJobService;
import com.portfolioscanner.scanner.service.PortfolioScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST surface of the scanner.
 *
 * <p>Typical client flow:
 * <ol>
 *   <li>POST /scan-portfolio {"stocks": ["TCS", "INFY"]} → analysis_id</li>
 *   <li>GET  /analysis-status/{analysis_id} until status is COMPLETED or FAILED</li>
 * </ol>
 * The remaining endpoints answer synchronously.
 */
@RestController
@RequestMapping("/api/v1/scanner")
public class ScannerController {

    private static final Logger log = LoggerFactory.getLogger(ScannerController.class);

    private final AnalysisJobService jobService;
    private final PortfolioScanService scanService;

    public ScannerController(AnalysisJobService jobService, PortfolioScanService scanService) {
        this.jobService  = jobService;
        this.scanService = scanService;
    }

    @PostMapping("/scan-portfolio")
    public ResponseEntity<AnalysisAccepted> scanPortfolio(@RequestBody(required = false) StocksRequest request) {
        AnalysisJob job = jobService.submit(request == null ? null : request.stocks());
        log.info("[ScannerAPI] scan-portfolio accepted. analysisId={}", job.getAnalysisId());
        return ResponseEntity.ok(new AnalysisAccepted(
            job.getAnalysisId(), job.getStatus(), "Portfolio analysis started"));
    }

    @GetMapping("/analysis-status/{analysisId}")
    public ResponseEntity<AnalysisStatusResponse> analysisStatus(@PathVariable String analysisId) {
        return ResponseEntity.ok(AnalysisStatusResponse.of(jobService.status(analysisId)));
    }

    @PostMapping("/analyze-stocks")
    public Mono<ResponseEntity<AnalysisReport>> analyzeStocks(@RequestBody(required = false) StocksRequest request) {
        return scanService.analyzeStocks(request == null ? null : request.stocks())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/scan")
    public Mono<ResponseEntity<ScanResult>> scan(@RequestBody(required = false) ScanRequestBody request) {
        return scanService.scan(request).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> report(@RequestBody(required = false) ScanRequestBody request) {
        return scanService.report(request).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/summary", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> summary(@RequestBody(required = false) ScanRequestBody request) {
        return scanService.summary(request).map(ResponseEntity::ok);
    }

    @PostMapping("/extract")
    public ResponseEntity<ExtractionResponse> extract(@RequestBody(required = false) TextRequest request) {
        return ResponseEntity.ok(scanService.extract(request == null ? null : request.text()));
    }

    @PostMapping("/sentiment")
    public ResponseEntity<SentimentResult> sentiment(@RequestBody(required = false) TextRequest request) {
        return ResponseEntity.ok(scanService.sentiment(request == null ? null : request.text()));
    }

    @GetMapping("/news")
    public Mono<ResponseEntity<List<NewsArticleView>>> news() {
        return scanService.latestNews().map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
