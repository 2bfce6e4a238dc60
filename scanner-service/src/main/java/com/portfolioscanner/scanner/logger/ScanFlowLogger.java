package com.portfolioscanner.scanner.logger;

import com.portfolioscanner.common.trace.AnalysisContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an analysis run. Pure side effects; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #SCAN_START}          request accepted</li>
 *   <li>{@link #ARTICLES_FETCHED}    news-service responded (possibly with nothing)</li>
 *   <li>{@link #SENTIMENT_ANALYZED}  symbols extracted and scored</li>
 *   <li>{@link #INSIGHTS_GENERATED}  per-stock and portfolio insights assembled</li>
 *   <li>{@link #SCAN_COMPLETED} or {@link #SCAN_FAILED}</li>
 * </ol>
 * {@link #FALLBACK_USED} is logged in place of real insights when no requested symbol had coverage.
 *
 * <p>Inside a reactive chain use {@link #stage(String)} with {@code doOnEach}; it reads the
 * analysis id from the Reactor Context. Elsewhere use {@link #log(String, String, Object)}.
 */
@Component
public class ScanFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ScanFlowLogger.class);

    public static final String SCAN_START         = "SCAN_START";
    public static final String ARTICLES_FETCHED   = "ARTICLES_FETCHED";
    public static final String SENTIMENT_ANALYZED = "SENTIMENT_ANALYZED";
    public static final String INSIGHTS_GENERATED = "INSIGHTS_GENERATED";
    public static final String FALLBACK_USED      = "FALLBACK_USED";
    public static final String SCAN_COMPLETED     = "SCAN_COMPLETED";
    public static final String SCAN_FAILED        = "SCAN_FAILED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The analysis id is bridged into MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return AnalysisContext.onNext((analysisId, value) ->
            log.info("[ScanFlow] stage={} analysisId={}", stageName, analysisId)
        );
    }

    public void log(String stageName, String analysisId, Object detail) {
        AnalysisContext.logWith(analysisId, () ->
            log.info("[ScanFlow] stage={} analysisId={} detail={}", stageName, analysisId, detail)
        );
    }

    public void failed(String analysisId, Throwable error) {
        AnalysisContext.logWith(analysisId, () ->
            log.error("[ScanFlow] stage={} analysisId={} reason={}", SCAN_FAILED, analysisId, error.getMessage(), error)
        );
    }
}
