package com.driftsentinel.core.model;

import java.util.List;

/**
 * Thrown when a prediction result or a monitor configuration is malformed.
 *
 * <p>
 * Carries every violation found, not only the first one, so that callers can
 * report the full set of problems in a single round trip.
 * </p>
 *
 * @since 1.0.0
 */
public class ValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    /**
     * @param context  short description of what was validated
     * @param violations one entry per failed check; must not be empty
     */
    public ValidationException(String context, List<String> violations) {
        super(context + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    /**
     * @return unmodifiable list of violation messages
     */
    public List<String> getViolations() {
        return violations;
    }
}
