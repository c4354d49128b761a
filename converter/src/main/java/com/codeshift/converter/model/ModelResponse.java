package com.codeshift.converter.model;

import java.time.Duration;

/**
 * One reply (or failed attempt) from the generative backend.
 *
 * @param body       the assistant text on success, or an error description
 * @param latency    wall-clock time of the call
 * @param httpStatus HTTP status code, or 0 when no response arrived
 * @param status     retry classification
 */
public record ModelResponse(String body, Duration latency, int httpStatus, ResponseStatus status) {

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }

    /**
     * Classify an HTTP exchange that produced assistant text.
     * A 2xx without text counts as transient: the backend answered but
     * gave nothing usable, and a second attempt usually does better.
     */
    public static ModelResponse classify(int httpStatus, String text, Duration latency) {
        if (httpStatus >= 200 && httpStatus < 300) {
            return (text == null || text.isBlank())
                    ? new ModelResponse("Empty response body", latency, httpStatus, ResponseStatus.TRANSIENT_ERROR)
                    : new ModelResponse(text, latency, httpStatus, ResponseStatus.SUCCESS);
        }
        return new ModelResponse(text, latency, httpStatus, classifyError(httpStatus));
    }

    /** A call that never got an HTTP response (timeout, refused connection). */
    public static ModelResponse unreachable(String reason, Duration latency) {
        return new ModelResponse(reason, latency, 0, ResponseStatus.TRANSIENT_ERROR);
    }

    private static ResponseStatus classifyError(int httpStatus) {
        if (httpStatus == 429 || httpStatus == 408 || httpStatus >= 500) {
            return ResponseStatus.TRANSIENT_ERROR;
        }
        return ResponseStatus.PERMANENT_ERROR;
    }
}
