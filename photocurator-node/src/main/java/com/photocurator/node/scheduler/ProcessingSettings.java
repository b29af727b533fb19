package com.photocurator.node.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * User-tunable processing settings. Read on every scheduling decision and
 * changed only through {@link BackgroundScheduler#updateSettings(SettingsUpdate)}.
 */
public record ProcessingSettings(
        ProcessingIntensity intensity,
        int maxConcurrentTasks,
        double batteryThreshold,
        double memoryThreshold,
        boolean pauseOnLowBattery,
        boolean pauseOnHighMemory,
        boolean pauseOnThermalThrottling
) {
    public static final int MIN_CONCURRENT_TASKS = 1;
    public static final int MAX_CONCURRENT_TASKS = 4;

    public ProcessingSettings {
        List<String> violations = validate(intensity, maxConcurrentTasks, batteryThreshold, memoryThreshold);
        if (!violations.isEmpty()) {
            throw new InvalidSettingsException(violations);
        }
    }

    /**
     * Balanced defaults: medium intensity, two tasks, every pause policy enabled.
     */
    public static ProcessingSettings defaults() {
        return new ProcessingSettings(
                ProcessingIntensity.MEDIUM,
                2,      // maxConcurrentTasks
                0.2,    // batteryThreshold
                0.8,    // memoryThreshold
                true,
                true,
                true
        );
    }

    /**
     * Defaults with the concurrency limit taken from the intensity.
     */
    public static ProcessingSettings forIntensity(ProcessingIntensity intensity) {
        ProcessingSettings defaults = defaults();
        return new ProcessingSettings(intensity, intensity.concurrencyCap(),
                defaults.batteryThreshold, defaults.memoryThreshold,
                defaults.pauseOnLowBattery, defaults.pauseOnHighMemory, defaults.pauseOnThermalThrottling);
    }

    /**
     * Effective concurrency ceiling: the smaller of the configured limit and the intensity cap.
     */
    public int concurrencyCeiling() {
        return Math.min(maxConcurrentTasks, intensity.concurrencyCap());
    }

    /**
     * Returns new settings with the update applied.
     *
     * @throws InvalidSettingsException listing every out-of-range value; nothing is applied
     */
    public ProcessingSettings apply(SettingsUpdate update) {
        if (update == null) {
            return this;
        }
        ProcessingIntensity newIntensity = update.intensity() != null ? update.intensity() : intensity;
        int newMax = update.maxConcurrentTasks() != null ? update.maxConcurrentTasks() : maxConcurrentTasks;
        double newBattery = update.batteryThreshold() != null ? update.batteryThreshold() : batteryThreshold;
        double newMemory = update.memoryThreshold() != null ? update.memoryThreshold() : memoryThreshold;

        return new ProcessingSettings(
                newIntensity,
                newMax,
                newBattery,
                newMemory,
                update.pauseOnLowBattery() != null ? update.pauseOnLowBattery() : pauseOnLowBattery,
                update.pauseOnHighMemory() != null ? update.pauseOnHighMemory() : pauseOnHighMemory,
                update.pauseOnThermalThrottling() != null ? update.pauseOnThermalThrottling() : pauseOnThermalThrottling
        );
    }

    static List<String> validate(ProcessingIntensity intensity, int maxConcurrentTasks,
                                 double batteryThreshold, double memoryThreshold) {
        List<String> violations = new ArrayList<>();
        if (intensity == null) {
            violations.add("intensity is required");
        }
        if (maxConcurrentTasks < MIN_CONCURRENT_TASKS || maxConcurrentTasks > MAX_CONCURRENT_TASKS) {
            violations.add("maxConcurrentTasks must be between " + MIN_CONCURRENT_TASKS
                    + " and " + MAX_CONCURRENT_TASKS + " but was " + maxConcurrentTasks);
        }
        if (!isRatio(batteryThreshold)) {
            violations.add("batteryThreshold must be between 0 and 1 but was " + batteryThreshold);
        }
        if (!isRatio(memoryThreshold)) {
            violations.add("memoryThreshold must be between 0 and 1 but was " + memoryThreshold);
        }
        return violations;
    }

    private static boolean isRatio(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
