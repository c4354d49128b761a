package com.codeshift.converter.model;

/**
 * One failed structural check.
 *
 * @param check  which check failed
 * @param detail what was found, e.g. "3 '{' vs 4 '}'"
 */
public record Violation(Check check, String detail) {

    public enum Check {
        BALANCED_DELIMITERS,
        DECLARATION_PRESENT,
        GOVERNANCE_HEADER_PRESENT
    }

    @Override
    public String toString() {
        return check + ": " + detail;
    }
}
