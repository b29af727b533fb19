package com.photocurator.node.scheduler;

/**
 * Partial settings change; null fields keep their current value.
 */
public record SettingsUpdate(
        ProcessingIntensity intensity,
        Integer maxConcurrentTasks,
        Double batteryThreshold,
        Double memoryThreshold,
        Boolean pauseOnLowBattery,
        Boolean pauseOnHighMemory,
        Boolean pauseOnThermalThrottling
) {
    public static Builder builder() {
        return new Builder();
    }

    public static SettingsUpdate intensity(ProcessingIntensity intensity) {
        return builder().intensity(intensity).build();
    }

    public static SettingsUpdate maxConcurrentTasks(int maxConcurrentTasks) {
        return builder().maxConcurrentTasks(maxConcurrentTasks).build();
    }

    public static final class Builder {
        private ProcessingIntensity intensity;
        private Integer maxConcurrentTasks;
        private Double batteryThreshold;
        private Double memoryThreshold;
        private Boolean pauseOnLowBattery;
        private Boolean pauseOnHighMemory;
        private Boolean pauseOnThermalThrottling;

        private Builder() {
        }

        public Builder intensity(ProcessingIntensity intensity) {
            this.intensity = intensity;
            return this;
        }

        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }

        public Builder batteryThreshold(double batteryThreshold) {
            this.batteryThreshold = batteryThreshold;
            return this;
        }

        public Builder memoryThreshold(double memoryThreshold) {
            this.memoryThreshold = memoryThreshold;
            return this;
        }

        public Builder pauseOnLowBattery(boolean pause) {
            this.pauseOnLowBattery = pause;
            return this;
        }

        public Builder pauseOnHighMemory(boolean pause) {
            this.pauseOnHighMemory = pause;
            return this;
        }

        public Builder pauseOnThermalThrottling(boolean pause) {
            this.pauseOnThermalThrottling = pause;
            return this;
        }

        public SettingsUpdate build() {
            return new SettingsUpdate(intensity, maxConcurrentTasks, batteryThreshold, memoryThreshold,
                    pauseOnLowBattery, pauseOnHighMemory, pauseOnThermalThrottling);
        }
    }
}
