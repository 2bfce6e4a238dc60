package com.portfolioscanner.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Analysis id plumbing for reactive runs.
 *
 * <p>The id lives in the Reactor Context of a background run and is copied into
 * MDC only around individual log calls. Synchronous requests have no id and
 * report {@value #NO_ANALYSIS}.
 */
public final class AnalysisContext {

    public static final String KEY = "analysisId";
    public static final String NO_ANALYSIS = "none";

    private AnalysisContext() {}

    /** Attaches {@code analysisId} to {@code pipeline}; apply after the last operator. */
    public static <T> Mono<T> bind(Mono<T> pipeline, String analysisId) {
        return pipeline.contextWrite(ctx -> ctx.put(KEY, analysisId));
    }

    public static String idOf(ContextView view) {
        return view.getOrDefault(KEY, NO_ANALYSIS);
    }

    /**
     * {@code doOnEach} hook that hands every emitted value, together with the bound
     * analysis id, to {@code action}. Completion and error signals are ignored.
     */
    public static <T> Consumer<Signal<T>> onNext(BiConsumer<String, T> action) {
        return signal -> {
            if (!signal.isOnNext()) {
                return;
            }
            String analysisId = idOf(signal.getContextView());
            logWith(analysisId, () -> action.accept(analysisId, signal.get()));
        };
    }

    /**
     * Runs {@code logStatement} with {@code analysisId} in MDC, then puts back
     * whatever value the key held before.
     */
    public static void logWith(String analysisId, Runnable logStatement) {
        String previous = MDC.get(KEY);
        MDC.put(KEY, analysisId);
        try {
            logStatement.run();
        } finally {
            if (previous == null) {
                MDC.remove(KEY);
            } else {
                MDC.put(KEY, previous);
            }
        }
    }
}
