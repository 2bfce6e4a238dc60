package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.scanner.job.AnalysisStatus;

public record AnalysisAccepted(
    @JsonProperty("analysis_id") String analysisId,
    @JsonProperty("status") AnalysisStatus status,
    @JsonProperty("message") String message
) {}
