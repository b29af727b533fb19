package com.photocurator.node.kernel.resource;

import com.photocurator.node.kernel.event.Subscription;

import java.util.function.Consumer;

/**
 * Source of device resource readings consumed by the scheduler.
 */
public interface ResourceMonitor {

    /**
     * Returns the most recent snapshot, never null.
     */
    ResourceStatus getSnapshot();

    /**
     * Registers a listener invoked whenever the readings change.
     *
     * @return handle that removes the listener
     */
    Subscription onChange(Consumer<ResourceStatus> listener);
}
