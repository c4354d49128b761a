package com.codeshift.converter.model;

/**
 * How the gateway should treat a backend response.
 */
public enum ResponseStatus {
    SUCCESS,            // 2xx with a non-empty body
    TRANSIENT_ERROR,    // timeout, connection failure, 5xx, 429: retry with backoff
    PERMANENT_ERROR     // any other 4xx or an unusable reply: never retried
}
