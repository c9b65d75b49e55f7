package com.largomodo.gamemeta.core;

import com.largomodo.gamemeta.core.domain.DiscoveredCollection;

/**
 * Observer interface for collection processing lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only
 * the events they care about.
 *
 * @see BatchRunner
 */
public interface CollectionObserver {

    /**
     * Called when processing of a collection begins.
     *
     * @param collection the collection being processed
     */
    default void onStart(DiscoveredCollection collection) {}

    /**
     * Called when a collection was processed successfully.
     *
     * @param collection the collection that was processed
     * @param gameCount  number of games parsed
     */
    default void onSuccess(DiscoveredCollection collection, int gameCount) {}

    /**
     * Called when a collection failed (I/O error or closure mismatch).
     *
     * @param collection the collection that failed
     * @param e          the exception that caused the failure
     */
    default void onFailure(DiscoveredCollection collection, Exception e) {}
}
