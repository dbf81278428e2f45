// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import io.livequery.core.model.EventKind;

/**
 * Interface for collecting metrics from the publication engine.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or a custom collector.
 * By default a no-op implementation is used ({@link #noop()}).
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * SubscriptionRegistry registry = new SubscriptionRegistry(index, engine);
 * registry.setMetrics(new MyMicrometerMetrics(meterRegistry));
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe; sessions
 * report from their own event and timer threads concurrently.
 */
public interface LiveQueryMetrics {

    /**
     * Called when a session reaches the streaming state.
     *
     * @param collection the collection name
     */
    default void onSubscribed(String collection) {
    }

    /**
     * Called once when a session stops, whatever the reason.
     *
     * @param collection the collection name
     */
    default void onStopped(String collection) {
    }

    /**
     * Called for every document message published.
     *
     * @param collection the collection name
     * @param kind       the diff event kind that produced the message
     */
    default void onMessage(String collection, EventKind kind) {
    }

    /**
     * Called when a permission check rejects a subscribe request.
     *
     * @param collection the collection name
     */
    default void onAuthorizationDenied(String collection) {
    }

    /**
     * Called when initial evaluation or observation fails.
     *
     * @param collection the collection name
     * @param error      the failure
     */
    default void onQueryFailed(String collection, Throwable error) {
    }

    /**
     * Called when a single count or aggregation refresh tick fails.
     *
     * @param collection the collection name
     * @param error      the failure
     */
    default void onRefreshFailed(String collection, Throwable error) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     *
     * @return a no-op LiveQueryMetrics instance
     */
    static LiveQueryMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of LiveQueryMetrics.
 */
enum NoopMetrics implements LiveQueryMetrics {
    INSTANCE
}
