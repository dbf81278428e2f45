// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

/**
 * Represents an active subscription to a live search result.
 */
public interface SubscriptionHandle {

    /**
     * Returns the unique identifier for this subscription.
     *
     * @return the subscription ID
     */
    String id();

    SessionState state();

    /**
     * Stops the subscription. Once this returns no further messages are published.
     * Safe to call more than once.
     */
    void stop();

    default boolean isActive() {
        return state() != SessionState.STOPPED;
    }
}
