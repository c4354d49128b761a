package com.codeshift.converter.service;

/**
 * Thrown when an artifact or failure log cannot be written. Unlike model
 * or validation failures this points at the environment (disk, permissions),
 * so it aborts the run instead of rejecting a single job.
 */
public class StagingException extends RuntimeException {

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
