package com.photocurator.node.kernel.resource;

import com.photocurator.node.scheduler.ProcessingSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a resource snapshot against the pause policies enabled in the settings.
 * Any single violation is enough to pause processing.
 */
public final class ResourcePolicy {

    private ResourcePolicy() {
    }

    /**
     * Lists every enabled policy the snapshot violates; empty when processing may run.
     */
    public static List<String> violations(ProcessingSettings settings, ResourceStatus status) {
        List<String> violations = new ArrayList<>();

        if (settings.pauseOnLowBattery()
                && !status.charging()
                && status.batteryLevel() < settings.batteryThreshold()) {
            violations.add(String.format("Battery %.0f%% below threshold %.0f%% and not charging",
                    status.batteryLevel() * 100, settings.batteryThreshold() * 100));
        }

        if (settings.pauseOnHighMemory() && status.memoryUsage() > settings.memoryThreshold()) {
            violations.add(String.format("Memory usage %.0f%% above threshold %.0f%%",
                    status.memoryUsage() * 100, settings.memoryThreshold() * 100));
        }

        if (settings.pauseOnThermalThrottling() && status.thermalState().isAtLeast(ThermalState.SERIOUS)) {
            violations.add("Thermal state " + status.thermalState() + " at or above " + ThermalState.SERIOUS);
        }

        return violations;
    }

    public static boolean permits(ProcessingSettings settings, ResourceStatus status) {
        return violations(settings, status).isEmpty();
    }
}
