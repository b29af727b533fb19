package com.photocurator.node.kernel.resource;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time snapshot of device resources.
 *
 * @param batteryLevel battery charge, 0..1
 * @param charging     whether the device is plugged in
 * @param memoryUsage  used memory ratio, 0..1
 * @param thermalState platform thermal state
 * @param sampledAt    when the snapshot was taken
 */
public record ResourceStatus(
        double batteryLevel,
        boolean charging,
        double memoryUsage,
        ThermalState thermalState,
        Instant sampledAt
) {
    public ResourceStatus {
        batteryLevel = clampRatio(batteryLevel);
        memoryUsage = clampRatio(memoryUsage);
        thermalState = thermalState != null ? thermalState : ThermalState.NOMINAL;
        sampledAt = sampledAt != null ? sampledAt : Instant.now();
    }

    /**
     * Snapshot assumed before the first reading: full battery, no pressure.
     */
    public static ResourceStatus nominal() {
        return new ResourceStatus(1.0, false, 0.0, ThermalState.NOMINAL, Instant.now());
    }

    public ResourceStatus withBatteryLevel(double level) {
        return new ResourceStatus(level, charging, memoryUsage, thermalState, Instant.now());
    }

    public ResourceStatus withCharging(boolean isCharging) {
        return new ResourceStatus(batteryLevel, isCharging, memoryUsage, thermalState, Instant.now());
    }

    public ResourceStatus withMemoryUsage(double usage) {
        return new ResourceStatus(batteryLevel, charging, usage, thermalState, Instant.now());
    }

    public ResourceStatus withThermalState(ThermalState state) {
        return new ResourceStatus(batteryLevel, charging, memoryUsage, state, Instant.now());
    }

    /**
     * Compares the readings only, ignoring the sample time.
     */
    public boolean sameReadings(ResourceStatus other) {
        return other != null
                && Double.compare(batteryLevel, other.batteryLevel) == 0
                && charging == other.charging
                && Double.compare(memoryUsage, other.memoryUsage) == 0
                && Objects.equals(thermalState, other.thermalState);
    }

    private static double clampRatio(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
