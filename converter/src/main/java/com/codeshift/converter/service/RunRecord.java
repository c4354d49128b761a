package com.codeshift.converter.service;

import com.codeshift.converter.model.ConversionRequest;
import com.codeshift.converter.model.RunReport;
import com.codeshift.converter.model.RunStatus;

import java.time.Instant;

/**
 * Immutable snapshot of a submitted run. RunService replaces the whole
 * record on every status change, so readers never see a half-written one.
 * The report is only attached once the run is COMPLETED.
 */
public record RunRecord(String runId,
                        RunStatus status,
                        ConversionRequest request,
                        Instant submittedAt,
                        RunReport report,
                        String error) {

    static RunRecord queued(ConversionRequest request, Instant now) {
        return new RunRecord(request.runId(), RunStatus.QUEUED, request, now, null, null);
    }

    RunRecord running() {
        return new RunRecord(runId, RunStatus.RUNNING, request, submittedAt, null, null);
    }

    RunRecord completed(RunReport report) {
        return new RunRecord(runId, RunStatus.COMPLETED, request, submittedAt, report, null);
    }

    RunRecord aborted(String error) {
        return new RunRecord(runId, RunStatus.ABORTED, request, submittedAt, null, error);
    }
}
