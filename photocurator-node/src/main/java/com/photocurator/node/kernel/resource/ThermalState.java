package com.photocurator.node.kernel.resource;

/**
 * Device thermal states as reported by the platform, in increasing severity.
 */
public enum ThermalState {
    NOMINAL,
    FAIR,
    SERIOUS,
    CRITICAL;

    public boolean isAtLeast(ThermalState other) {
        return compareTo(other) >= 0;
    }
}
