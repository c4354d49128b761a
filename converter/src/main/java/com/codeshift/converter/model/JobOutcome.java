package com.codeshift.converter.model;

import java.util.List;
import java.util.UUID;

/**
 * Final result of one job: the trust boundary between model output and
 * the review stage. Only a {@link Validated} outcome carries an artifact
 * that may be staged; a {@link Rejected} one carries the reasons instead.
 */
public sealed interface JobOutcome permits JobOutcome.Validated, JobOutcome.Rejected {

    UUID           jobId();
    String         sourcePath();
    TargetLanguage targetLanguage();
    String         model();
    int            gatewayRetries();

    JobState finalState();

    /**
     * The artifact passed every structural check and was handed to staging.
     *
     * @param stagedPath where the staging collaborator put the file
     */
    record Validated(UUID jobId,
                     String sourcePath,
                     TargetLanguage targetLanguage,
                     String model,
                     int gatewayRetries,
                     StampedArtifact artifact,
                     ValidationOutcome validation,
                     String stagedPath) implements JobOutcome {

        @Override
        public JobState finalState() { return JobState.VALIDATED; }
    }

    /**
     * The job stopped at {@code failedStage}. For validation failures the
     * full violation list is kept for audit.
     */
    record Rejected(UUID jobId,
                    String sourcePath,
                    TargetLanguage targetLanguage,
                    String model,
                    int gatewayRetries,
                    JobState failedStage,
                    FailureReason reason,
                    String detail,
                    List<Violation> violations) implements JobOutcome {

        public Rejected {
            violations = List.copyOf(violations);
        }

        @Override
        public JobState finalState() { return JobState.REJECTED; }
    }
}
