package com.codeshift.converter.config;

/**
 * Thrown when the converter is misconfigured: a prompt template is missing,
 * the target language is not supported, or the backend cannot be reached
 * as configured (no API credential, malformed endpoint).
 *
 * These errors are never retried and abort the whole run before any
 * network call is made. Per-file failures use their own types and never
 * reach this exception.
 */
public class ConfigurationException extends RuntimeException {

    public enum Kind { TEMPLATE_MISSING, UNSUPPORTED_LANGUAGE, UNSUPPORTED_PROVIDER, MISSING_CREDENTIAL, INVALID_ENDPOINT }

    private final Kind kind;

    public ConfigurationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
