package com.photocurator.node.scheduler;

import java.time.Duration;

/**
 * How hard background processing may push the device.
 */
public enum ProcessingIntensity {
    LOW(1, Duration.ofMillis(100)),
    MEDIUM(2, Duration.ofMillis(20)),
    HIGH(3, Duration.ofMillis(5)),
    AGGRESSIVE(4, Duration.ZERO);

    private final int concurrencyCap;
    private final Duration yieldPause;

    ProcessingIntensity(int concurrencyCap, Duration yieldPause) {
        this.concurrencyCap = concurrencyCap;
        this.yieldPause = yieldPause;
    }

    /**
     * Upper bound on concurrently running tasks at this intensity.
     */
    public int concurrencyCap() {
        return concurrencyCap;
    }

    /**
     * Pause a task body takes at every checkpoint.
     */
    public Duration yieldPause() {
        return yieldPause;
    }
}
