// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

/**
 * How a subscription recomputes its result count.
 */
public enum CountingStrategy {
    /** Recount matching documents against the document store on every refresh. */
    FULL_RECOUNT,
    /**
     * Re-read {@link io.livequery.engine.spi.SearchResult#count()}. The value is only
     * as fresh as the engine makes it: an engine that fixes the count when the
     * search runs, like the in-memory one, republishes that value on every
     * refresh. Use {@link #FULL_RECOUNT} to follow store changes.
     */
    ENGINE,
    /**
     * Engine count at subscribe time, adjusted by every added and removed event
     * since. While the observed page is full the limit may hide matches, so the
     * count is recounted instead.
     */
    RUNNING_TALLY
}
