package com.portfolioscanner.scanner.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of analysis runs keyed by {@code analysis_<epochMillis>_<n>}.
 *
 * <p>Finished jobs are kept for {@code scanner.job-ttl} after their last update so
 * clients can poll the result, then evicted on the next read or create. Jobs still
 * queued or running never expire.
 */
@Component
public class AnalysisJobStore {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobStore.class);

    private final ConcurrentHashMap<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;

    public AnalysisJobStore(Clock clock, @Value("${scanner.job-ttl:PT1H}") Duration ttl) {
        this.clock = clock;
        this.ttl   = ttl;
    }

    public AnalysisJob create(List<String> symbols) {
        purgeExpired();
        String id = "analysis_" + clock.millis() + "_" + sequence.incrementAndGet();
        AnalysisJob job = new AnalysisJob(id, symbols, clock);
        jobs.put(id, job);
        log.info("JOB_CREATED analysisId={} symbols={}", id, symbols.size());
        return job;
    }

    public Optional<AnalysisJob> find(String analysisId) {
        AnalysisJob job = jobs.get(analysisId);
        if (job != null && isExpired(job)) {
            jobs.remove(analysisId);
            log.info("JOB_EXPIRED analysisId={}", analysisId);
            return Optional.empty();
        }
        return Optional.ofNullable(job);
    }

    public int size() {
        return jobs.size();
    }

    void purgeExpired() {
        jobs.values().removeIf(this::isExpired);
    }

    private boolean isExpired(AnalysisJob job) {
        return job.getStatus().isFinished() && clock.instant().isAfter(job.getUpdatedAt().plus(ttl));
    }
}
