package com.portfolioscanner.scanner.exception;

public class AnalysisNotFoundException extends RuntimeException {

    private final String analysisId;

    public AnalysisNotFoundException(String analysisId) {
        super("Analysis not found: " + analysisId);
        this.analysisId = analysisId;
    }

    public String getAnalysisId() {
        return analysisId;
    }
}
