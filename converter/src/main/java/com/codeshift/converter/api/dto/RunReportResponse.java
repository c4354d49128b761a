package com.codeshift.converter.api.dto;

import com.codeshift.converter.model.RunReport;

import java.time.Instant;
import java.util.List;

/**
 * JSON form of a RunReport, shared by GET /runs/{id} and the CLI's
 * --report file.
 */
public record RunReportResponse(
        String                   runId,
        Instant                  startedAt,
        int                      expectedJobs,
        boolean                  complete,
        String                   verdict,
        long                     validated,
        long                     rejected,
        List<JobOutcomeResponse> jobs
) {
    public static RunReportResponse from(RunReport report) {
        return new RunReportResponse(
                report.runId(),
                report.startedAt(),
                report.expectedJobs(),
                report.isComplete(),
                report.passed() ? "PASS" : "FAIL",
                report.validatedCount(),
                report.rejectedCount(),
                report.outcomes().stream().map(JobOutcomeResponse::from).toList()
        );
    }
}
