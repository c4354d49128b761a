package com.codeshift.converter.model;

/**
 * Lifecycle of a run submitted through the REST API.
 *
 *   QUEUED → RUNNING → COMPLETED   (report holds one outcome per file)
 *                    → ABORTED     (configuration or environment error)
 */
public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    ABORTED
}
