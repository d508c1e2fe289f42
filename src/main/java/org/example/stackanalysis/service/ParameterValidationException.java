package org.example.stackanalysis.service;

import java.util.List;

/**
 * Operator input that cannot be analysed. Carries every problem found.
 */
public class ParameterValidationException extends RuntimeException {

    private final List<String> violations;

    public ParameterValidationException(List<String> violations) {
        super(violations.size() + " parameter error(s): " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
