// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

import io.livequery.core.model.DiffEvent;

/**
 * Receives the positional diff stream of one live search result.
 *
 * <p>Implementations of {@link SearchResult} must never invoke a listener
 * concurrently with itself.
 */
public interface DiffListener {

    void onEvent(DiffEvent event);

    /**
     * Called when observation fails. No further events follow.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
