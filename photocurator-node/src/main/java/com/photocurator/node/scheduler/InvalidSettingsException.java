package com.photocurator.node.scheduler;

import java.util.List;

/**
 * Rejected settings change. Carries every violation found.
 */
public class InvalidSettingsException extends IllegalArgumentException {

    private final List<String> violations;

    public InvalidSettingsException(List<String> violations) {
        super("Invalid processing settings: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
