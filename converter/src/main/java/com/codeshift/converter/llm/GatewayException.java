package com.codeshift.converter.llm;

/**
 * Terminal failure of the gateway stage for one job.
 *
 * Unchecked like the other pipeline exceptions; the orchestrator catches
 * it and records the job as rejected, then moves on to the next file.
 */
public class GatewayException extends RuntimeException {

    public enum Kind { EXHAUSTED_RETRIES, REJECTED_REQUEST }

    private final Kind kind;
    private final int  retries;
    private final int  httpStatus;

    public GatewayException(Kind kind, String message, int retries, int httpStatus) {
        super("[" + kind + "] " + message);
        this.kind       = kind;
        this.retries    = retries;
        this.httpStatus = httpStatus;
    }

    public Kind getKind()       { return kind; }
    public int  getRetries()    { return retries; }
    public int  getHttpStatus() { return httpStatus; }
}
