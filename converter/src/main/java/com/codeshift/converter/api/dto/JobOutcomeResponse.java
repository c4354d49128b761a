package com.codeshift.converter.api.dto;

import com.codeshift.converter.governance.GovernanceHeader;
import com.codeshift.converter.model.JobOutcome;
import com.codeshift.converter.model.Violation;

import java.util.List;
import java.util.UUID;

/**
 * Audit view of one job in a run report.
 *
 * For VALIDATED jobs the header fields and staged path are set; for
 * REJECTED jobs failedStage, reason, detail and (for validation failures)
 * the violation list are.
 */
public record JobOutcomeResponse(
        UUID         jobId,
        String       sourcePath,
        String       targetLanguage,
        String       model,
        String       state,
        int          gatewayRetries,
        String       stagedPath,
        String       runId,
        String       generatedAt,
        String       promptHash,
        String       failedStage,
        String       reason,
        String       detail,
        List<String> violations
) {
    public static JobOutcomeResponse from(JobOutcome outcome) {
        if (outcome instanceof JobOutcome.Validated v) {
            GovernanceHeader h = v.artifact().header();
            return new JobOutcomeResponse(v.jobId(), v.sourcePath(), v.targetLanguage().name(),
                    v.model(), v.finalState().name(), v.gatewayRetries(), v.stagedPath(),
                    h.runId(), h.generatedAt().toString(), h.promptHash(),
                    null, null, null, List.of());
        }
        JobOutcome.Rejected r = (JobOutcome.Rejected) outcome;
        return new JobOutcomeResponse(r.jobId(), r.sourcePath(), r.targetLanguage().name(),
                r.model(), r.finalState().name(), r.gatewayRetries(), null,
                null, null, null,
                r.failedStage().name(), r.reason().name(), r.detail(),
                r.violations().stream().map(Violation::toString).toList());
    }
}
