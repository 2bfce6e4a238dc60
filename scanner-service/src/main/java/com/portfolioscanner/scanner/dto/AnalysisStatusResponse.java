package com.portfolioscanner.scanner.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.portfolioscanner.scanner.job.AnalysisJob;
import com.portfolioscanner.scanner.job.AnalysisStatus;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisStatusResponse(
    @JsonProperty("analysis_id") String analysisId,
    @JsonProperty("status") AnalysisStatus status,
    @JsonProperty("progress") int progress,
    @JsonProperty("message") String message,
    @JsonProperty("requested_symbols") List<String> requestedSymbols,
    @JsonProperty("result") AnalysisReport result,
    @JsonProperty("error") String error,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {
    public static AnalysisStatusResponse of(AnalysisJob job) {
        return new AnalysisStatusResponse(
            job.getAnalysisId(),
            job.getStatus(),
            job.getProgress(),
            job.getMessage(),
            job.getRequestedSymbols(),
            job.getResult(),
            job.getError(),
            job.getCreatedAt(),
            job.getUpdatedAt());
    }
}
