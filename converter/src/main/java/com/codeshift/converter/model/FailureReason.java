package com.codeshift.converter.model;

/**
 * Why a job ended up REJECTED.
 */
public enum FailureReason {
    SOURCE_UNREADABLE,      // ASSEMBLING: the legacy file could not be read
    EXHAUSTED_RETRIES,      // INVOKING: transient errors outlasted the retry budget
    REJECTED_REQUEST,       // INVOKING: the backend refused the request (auth, 4xx)
    NO_CODE_BLOCK_FOUND,    // EXTRACTING: the reply had no fenced code
    VALIDATION_FAILED       // VALIDATING: one or more structural checks failed
}
