package com.portfolioscanner.scanner.job;

import com.portfolioscanner.scanner.dto.AnalysisReport;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Mutable progress of one background analysis. Written by the run's pipeline,
 * read by status polls.
 *
 * <p>Each run has a single writer, so volatile fields are enough for visibility.
 * Progress only moves forward: QUEUED(0) → RUNNING(25, 50, 75) → COMPLETED(100) or FAILED.
 */
public class AnalysisJob {

    private final String analysisId;
    private final List<String> requestedSymbols;
    private final Instant createdAt;
    private final Clock clock;

    private volatile AnalysisStatus status = AnalysisStatus.QUEUED;
    private volatile int progress;
    private volatile String message = "Analysis queued";
    private volatile AnalysisReport result;
    private volatile String error;
    private volatile Instant updatedAt;

    AnalysisJob(String analysisId, List<String> requestedSymbols, Clock clock) {
        this.analysisId       = analysisId;
        this.requestedSymbols = List.copyOf(requestedSymbols);
        this.clock            = clock;
        this.createdAt        = clock.instant();
        this.updatedAt        = createdAt;
    }

    // ── mutators (called from the run's pipeline) ─────────────────────────

    public void advance(int newProgress, String newMessage) {
        if (status.isFinished()) {
            throw new IllegalStateException("Analysis " + analysisId + " already " + status);
        }
        this.progress  = Math.max(progress, newProgress);
        this.message   = newMessage;
        this.status    = AnalysisStatus.RUNNING;
        this.updatedAt = clock.instant();
    }

    public void complete(AnalysisReport report) {
        this.result    = report;
        this.progress  = 100;
        this.message   = report.fallback()
            ? "Analysis completed with fallback data"
            : "Analysis completed successfully";
        this.updatedAt = clock.instant();
        this.status    = AnalysisStatus.COMPLETED;
    }

    public void fail(String reason) {
        this.error     = reason;
        this.message   = "Analysis failed";
        this.updatedAt = clock.instant();
        this.status    = AnalysisStatus.FAILED;
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public String         getAnalysisId()       { return analysisId; }
    public List<String>   getRequestedSymbols() { return requestedSymbols; }
    public AnalysisStatus getStatus()           { return status; }
    public int            getProgress()         { return progress; }
    public String         getMessage()          { return message; }
    public AnalysisReport getResult()           { return result; }
    public String         getError()            { return error; }
    public Instant        getCreatedAt()        { return createdAt; }
    public Instant        getUpdatedAt()        { return updatedAt; }
}
