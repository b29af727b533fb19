package com.photocurator.node.scheduler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Static configuration of the background processing kernel.
 *
 * @param retryLimit               retries granted to a failing task before it is marked FAILED
 * @param historyWindow            completed tasks per type averaged for the ETA
 * @param terminalRetention        finished tasks kept for lookup before the oldest are evicted
 * @param shutdownGrace            how long stop() waits for running bodies
 * @param resourceSamplingInterval polling interval when a resource sampler is attached
 * @param storeDirectory           directory of the JSON task store, null for an in-memory queue
 * @param initialSettings          settings in force at start
 */
public record SchedulerConfig(
        int retryLimit,
        int historyWindow,
        int terminalRetention,
        Duration shutdownGrace,
        Duration resourceSamplingInterval,
        Path storeDirectory,
        ProcessingSettings initialSettings
) {
    public static final String RESOURCE_NAME = "photocurator-node.properties";
    public static final String PREFIX = "photocurator.scheduler.";

    public SchedulerConfig {
        if (retryLimit < 0) {
            throw new IllegalArgumentException("retryLimit cannot be negative");
        }
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be at least 1");
        }
        if (terminalRetention < 0) {
            throw new IllegalArgumentException("terminalRetention cannot be negative");
        }
        shutdownGrace = shutdownGrace != null ? shutdownGrace : Duration.ofSeconds(5);
        resourceSamplingInterval = resourceSamplingInterval != null ? resourceSamplingInterval : Duration.ofSeconds(5);
        initialSettings = initialSettings != null ? initialSettings : ProcessingSettings.defaults();
    }

    /**
     * Defaults for general use: two retries, in-memory queue.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
                2,                          // retryLimit
                10,                         // historyWindow
                100,                        // terminalRetention
                Duration.ofSeconds(5),      // shutdownGrace
                Duration.ofSeconds(5),      // resourceSamplingInterval
                null,                       // storeDirectory
                ProcessingSettings.defaults()
        );
    }

    /**
     * Defaults with a durable queue in the given directory.
     */
    public static SchedulerConfig durable(Path storeDirectory) {
        return defaults().withStoreDirectory(storeDirectory);
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the classpath, then applies
     * {@code photocurator.scheduler.*} system properties on top.
     */
    public static SchedulerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                properties.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(properties);
    }

    /**
     * Builds a config from {@code photocurator.scheduler.*} keys; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException for malformed values
     */
    public static SchedulerConfig fromProperties(Properties properties) {
        SchedulerConfig defaults = defaults();
        ProcessingSettings settings = defaults.initialSettings();

        String store = value(properties, "store-directory");
        ProcessingSettings initial = new ProcessingSettings(
                enumValue(properties, "intensity", settings.intensity()),
                intValue(properties, "max-concurrent-tasks", settings.maxConcurrentTasks()),
                doubleValue(properties, "battery-threshold", settings.batteryThreshold()),
                doubleValue(properties, "memory-threshold", settings.memoryThreshold()),
                booleanValue(properties, "pause-on-low-battery", settings.pauseOnLowBattery()),
                booleanValue(properties, "pause-on-high-memory", settings.pauseOnHighMemory()),
                booleanValue(properties, "pause-on-thermal-throttling", settings.pauseOnThermalThrottling())
        );

        return new SchedulerConfig(
                intValue(properties, "retry-limit", defaults.retryLimit()),
                intValue(properties, "history-window", defaults.historyWindow()),
                intValue(properties, "terminal-retention", defaults.terminalRetention()),
                Duration.ofMillis(longValue(properties, "shutdown-grace-ms", defaults.shutdownGrace().toMillis())),
                Duration.ofMillis(longValue(properties, "resource-sampling-interval-ms",
                        defaults.resourceSamplingInterval().toMillis())),
                store != null && !store.isBlank() ? Path.of(store.trim()) : null,
                initial
        );
    }

    public SchedulerConfig withStoreDirectory(Path directory) {
        return new SchedulerConfig(retryLimit, historyWindow, terminalRetention, shutdownGrace, resourceSamplingInterval,
                directory, initialSettings);
    }

    public SchedulerConfig withRetryLimit(int limit) {
        return new SchedulerConfig(limit, historyWindow, terminalRetention, shutdownGrace, resourceSamplingInterval,
                storeDirectory, initialSettings);
    }

    public SchedulerConfig withInitialSettings(ProcessingSettings settings) {
        return new SchedulerConfig(retryLimit, historyWindow, terminalRetention, shutdownGrace, resourceSamplingInterval,
                storeDirectory, settings);
    }

    public SchedulerConfig withTerminalRetention(int retention) {
        return new SchedulerConfig(retryLimit, historyWindow, retention, shutdownGrace, resourceSamplingInterval,
                storeDirectory, initialSettings);
    }

    public SchedulerConfig withShutdownGrace(Duration grace) {
        return new SchedulerConfig(retryLimit, historyWindow, terminalRetention, grace, resourceSamplingInterval,
                storeDirectory, initialSettings);
    }

    private static String value(Properties properties, String key) {
        String value = properties.getProperty(PREFIX + key);
        return value != null ? value.trim() : null;
    }

    private static int intValue(Properties properties, String key, int fallback) {
        String value = value(properties, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PREFIX + key + ": " + value, e);
        }
    }

    private static long longValue(Properties properties, String key, long fallback) {
        String value = value(properties, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties properties, String key, double fallback) {
        String value = value(properties, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal for " + PREFIX + key + ": " + value, e);
        }
    }

    private static boolean booleanValue(Properties properties, String key, boolean fallback) {
        String value = value(properties, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        return Boolean.parseBoolean(value);
    }

    private static ProcessingIntensity enumValue(Properties properties, String key, ProcessingIntensity fallback) {
        String value = value(properties, key);
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        try {
            return ProcessingIntensity.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid intensity for " + PREFIX + key + ": " + value, e);
        }
    }
}
