package com.portfolioscanner.scanner.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) { this.now = start; }

        void advance(Duration d) { now = now.plus(d); }

        @Override public ZoneId getZone()            { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant()           { return now; }
    }

    private final MutableClock clock = new MutableClock(T0);
    private final AnalysisJobStore store = new AnalysisJobStore(clock, Duration.ofMinutes(30));

    @Test
    @DisplayName("ids carry creation millis and a running sequence")
    void idFormat() {
        AnalysisJob first = store.create(List.of("TCS"));
        AnalysisJob second = store.create(List.of("INFY"));

        assertEquals("analysis_" + T0.toEpochMilli() + "_1", first.getAnalysisId());
        assertEquals("analysis_" + T0.toEpochMilli() + "_2", second.getAnalysisId());
        assertEquals(2, store.size());
    }

    @Test
    @DisplayName("unknown id → empty")
    void unknownId() {
        assertTrue(store.find("analysis_0_99").isEmpty());
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("new job → QUEUED at 0")
        void queued() {
            AnalysisJob job = store.create(List.of("TCS"));
            assertEquals(AnalysisStatus.QUEUED, job.getStatus());
            assertEquals(0, job.getProgress());
            assertEquals(List.of("TCS"), job.getRequestedSymbols());
        }

        @Test
        @DisplayName("advance → RUNNING, progress never moves backwards")
        void advance() {
            AnalysisJob job = store.create(List.of("TCS"));
            job.advance(50, "Analyzing");
            job.advance(25, "late update");

            assertEquals(AnalysisStatus.RUNNING, job.getStatus());
            assertEquals(50, job.getProgress());
            assertEquals("late update", job.getMessage());
        }

        @Test
        @DisplayName("fail → FAILED with reason; further progress rejected")
        void fail() {
            AnalysisJob job = store.create(List.of("TCS"));
            job.advance(25, "Fetching");
            job.fail("upstream exploded");

            assertEquals(AnalysisStatus.FAILED, job.getStatus());
            assertEquals("upstream exploded", job.getError());
            assertThrows(IllegalStateException.class, () -> job.advance(50, "too late"));
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("finished job past TTL → evicted on read")
        void finishedExpires() {
            AnalysisJob job = store.create(List.of("TCS"));
            job.fail("boom");
            clock.advance(Duration.ofMinutes(31));

            assertTrue(store.find(job.getAnalysisId()).isEmpty());
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("finished job within TTL → still readable")
        void finishedWithinTtl() {
            AnalysisJob job = store.create(List.of("TCS"));
            job.fail("boom");
            clock.advance(Duration.ofMinutes(29));

            assertTrue(store.find(job.getAnalysisId()).isPresent());
        }

        @Test
        @DisplayName("running job never expires")
        void runningKept() {
            AnalysisJob job = store.create(List.of("TCS"));
            job.advance(25, "Fetching");
            clock.advance(Duration.ofHours(5));

            assertTrue(store.find(job.getAnalysisId()).isPresent());
        }

        @Test
        @DisplayName("create sweeps expired finished jobs")
        void createSweeps() {
            AnalysisJob old = store.create(List.of("TCS"));
            old.fail("boom");
            clock.advance(Duration.ofHours(1));

            store.create(List.of("INFY"));

            assertEquals(1, store.size());
        }
    }
}
