package com.photocurator.node.kernel.event;

/**
 * Handle returned by every subscribe call; cancelling it stops further deliveries.
 * Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
