package com.codeshift.converter.cli;

import com.codeshift.converter.model.JobState;
import com.codeshift.converter.model.RunReport;

/**
 * Process exit codes. A failed run exits with the code of the stage where
 * its first rejected job stopped.
 */
public final class ExitCodes {

    public static final int OK            = 0;
    public static final int FAILURE       = 1;
    public static final int CONFIGURATION = 2;
    public static final int GATEWAY       = 3;
    public static final int EXTRACTION    = 4;
    public static final int VALIDATION    = 5;
    public static final int UNREADABLE    = 6;

    private ExitCodes() {}

    public static int forStage(JobState stage) {
        return switch (stage) {
            case ASSEMBLING -> UNREADABLE;
            case INVOKING   -> GATEWAY;
            case EXTRACTING -> EXTRACTION;
            case VALIDATING -> VALIDATION;
            default         -> FAILURE;
        };
    }

    public static int forReport(RunReport report) {
        if (report.passed()) {
            return OK;
        }
        return report.firstRejection()
                .map(r -> forStage(r.failedStage()))
                .orElse(FAILURE);
    }
}
