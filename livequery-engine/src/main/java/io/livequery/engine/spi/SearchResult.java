// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

import java.util.Optional;

/**
 * The outcome of evaluating one query, as produced by a {@link SearchEngine}.
 */
public interface SearchResult {

    /**
     * Returns the number of matches the engine reported for this search.
     * Engines may fix this value when the search runs; {@link #recount()}
     * always reflects the store.
     *
     * @return the engine count
     */
    int count();

    /**
     * Recounts the matches against the document store right now.
     *
     * @return the current number of matching documents
     */
    int recount();

    /**
     * Computes facet aggregations for the current matches.
     *
     * @return the aggregations, or empty if this engine or index produces none
     */
    Optional<Object> aggregations();

    /**
     * Starts observing the ordered result. A result can be observed only once.
     *
     * @param listener receives diff events after the initial documents
     * @return the initial documents and a stop handle
     * @throws IllegalStateException if this result is already observed
     */
    LiveResult observe(DiffListener listener);
}
