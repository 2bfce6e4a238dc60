package com.portfolioscanner.scanner.job;

public enum AnalysisStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
