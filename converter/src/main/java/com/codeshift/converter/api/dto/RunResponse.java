package com.codeshift.converter.api.dto;

import com.codeshift.converter.service.RunRecord;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /runs and GET /runs/{id}. The report is null
 * until the run has completed.
 */
public record RunResponse(
        String            runId,
        String            status,
        String            targetLanguage,
        String            model,
        List<String>      sources,
        Instant           submittedAt,
        String            error,
        RunReportResponse report
) {
    public static RunResponse from(RunRecord record) {
        return new RunResponse(
                record.runId(),
                record.status().name(),
                record.request().targetLanguage().name(),
                record.request().model(),
                record.request().sources().stream().map(Path::toString).toList(),
                record.submittedAt(),
                record.error(),
                record.report() == null ? null : RunReportResponse.from(record.report())
        );
    }
}
