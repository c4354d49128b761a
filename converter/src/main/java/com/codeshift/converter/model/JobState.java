package com.codeshift.converter.model;

/**
 * States of a single file conversion (one ConversionJob).
 *
 * Transitions (happy path):
 *   PENDING → ASSEMBLING → INVOKING → EXTRACTING → STAMPING → VALIDATING → VALIDATED
 *
 * Any non-terminal state can transition straight to REJECTED on a
 * per-file failure. The gateway's retry loop happens inside INVOKING
 * and never shows up as a transition.
 */
public enum JobState {
    PENDING,
    ASSEMBLING,
    INVOKING,
    EXTRACTING,
    STAMPING,
    VALIDATING,
    VALIDATED,
    REJECTED;

    public boolean isTerminal() {
        return this == VALIDATED || this == REJECTED;
    }

    /** The only state reachable on success, or null from a terminal state. */
    public JobState next() {
        return switch (this) {
            case PENDING    -> ASSEMBLING;
            case ASSEMBLING -> INVOKING;
            case INVOKING   -> EXTRACTING;
            case EXTRACTING -> STAMPING;
            case STAMPING   -> VALIDATING;
            case VALIDATING -> VALIDATED;
            case VALIDATED, REJECTED -> null;
        };
    }
}
