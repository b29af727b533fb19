package com.photocurator.node.kernel.resource;

import com.photocurator.node.kernel.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Default resource monitor. Platform code pushes readings through the setters,
 * or {@link #startMonitoring(ResourceSampler, Duration)} polls a sampler periodically.
 * Listeners are notified only when a reading actually changes, one update at a
 * time and in the order the readings were applied.
 */
public class DeviceResourceMonitor implements ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeviceResourceMonitor.class);

    private final AtomicReference<ResourceStatus> current;
    private final CopyOnWriteArrayList<Consumer<ResourceStatus>> listeners;
    private final Object updateLock = new Object();
    private ScheduledExecutorService sampling;
    private ScheduledFuture<?> samplingTask;

    public DeviceResourceMonitor() {
        this(ResourceStatus.nominal());
    }

    public DeviceResourceMonitor(ResourceStatus initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "Initial status cannot be null"));
        this.listeners = new CopyOnWriteArrayList<>();
    }

    @Override
    public ResourceStatus getSnapshot() {
        return current.get();
    }

    @Override
    public Subscription onChange(Consumer<ResourceStatus> listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // Setters for updating resource state (called by platform-specific code)

    public void setBatteryLevel(double level) {
        modify(status -> status.withBatteryLevel(level));
    }

    public void setCharging(boolean charging) {
        modify(status -> status.withCharging(charging));
    }

    public void setMemoryUsage(double usage) {
        modify(status -> status.withMemoryUsage(usage));
    }

    public void setThermalState(ThermalState state) {
        modify(status -> status.withThermalState(state));
    }

    /**
     * Replaces all readings at once, notifying listeners a single time.
     */
    public void update(ResourceStatus status) {
        Objects.requireNonNull(status, "Status cannot be null");
        synchronized (updateLock) {
            apply(status);
        }
    }

    private void modify(UnaryOperator<ResourceStatus> change) {
        synchronized (updateLock) {
            apply(change.apply(current.get()));
        }
    }

    // caller holds updateLock, so listeners see readings in the order they were set
    private void apply(ResourceStatus status) {
        ResourceStatus previous = current.getAndSet(status);
        if (status.sameReadings(previous)) {
            return;
        }
        log.debug("Resources changed: battery={} charging={} memory={} thermal={}",
                status.batteryLevel(), status.charging(), status.memoryUsage(), status.thermalState());
        for (Consumer<ResourceStatus> listener : listeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                log.warn("Resource listener failed", e);
            }
        }
    }

    /**
     * Starts polling the sampler at a fixed interval, taking one sample immediately.
     * Calling it again replaces the previous sampler.
     */
    public synchronized void startMonitoring(ResourceSampler sampler, Duration interval) {
        Objects.requireNonNull(sampler, "Sampler cannot be null");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Sampling interval must be positive");
        }
        stopMonitoring();
        sampling = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "photocurator-resource-monitor");
            thread.setDaemon(true);
            return thread;
        });
        samplingTask = sampling.scheduleWithFixedDelay(
                () -> sampleOnce(sampler), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stopMonitoring() {
        if (samplingTask != null) {
            samplingTask.cancel(false);
            samplingTask = null;
        }
        if (sampling != null) {
            sampling.shutdownNow();
            sampling = null;
        }
    }

    public synchronized boolean isMonitoring() {
        return samplingTask != null;
    }

    private void sampleOnce(ResourceSampler sampler) {
        try {
            ResourceStatus sample = sampler.sample();
            if (sample != null) {
                update(sample);
            }
        } catch (Exception e) {
            // keep the last good snapshot
            log.warn("Failed to sample device resources: {}", e.getMessage());
        }
    }
}
