package com.codeshift.converter.model;

import java.util.List;

/**
 * Result of the structural admission gate. Violations keep the order the
 * checks ran in; an empty list means the artifact passed.
 */
public record ValidationOutcome(List<Violation> violations) {

    public ValidationOutcome {
        violations = List.copyOf(violations);
    }

    public static ValidationOutcome pass() {
        return new ValidationOutcome(List.of());
    }

    public boolean passed() {
        return violations.isEmpty();
    }
}
