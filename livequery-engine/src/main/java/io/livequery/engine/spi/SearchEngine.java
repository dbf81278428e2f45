// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

import java.util.Map;

import org.jspecify.annotations.Nullable;

import io.livequery.core.error.QueryValidationException;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.SearchIndexConfig;

/**
 * Executes queries against a document store and yields live, ordered results.
 *
 * <p>Implementations must apply {@link SearchIndexConfig#transform()} to every
 * document they return and must be safe for concurrent use by many sessions.
 */
public interface SearchEngine {

    /**
     * Returns the engine-specific index name, appended to the collection name.
     *
     * @return the index name, or {@code null} for the default
     */
    @Nullable String indexName();

    /**
     * Evaluates a query.
     *
     * @param definition the query definition
     * @param options    the query options
     * @param index      the index being searched
     * @return the search result
     */
    SearchResult search(QueryDefinition definition, QueryOptions options, SearchIndexConfig index);

    /**
     * Checks query parameters before any evaluation happens. The default accepts
     * any text search and structured searches over configured fields only.
     *
     * @param definition the query definition
     * @param options    the query options
     * @param index      the index being searched
     * @throws QueryValidationException if the parameters are not acceptable
     */
    default void checkSearchParam(QueryDefinition definition, QueryOptions options, SearchIndexConfig index) {
        if (!definition.isStructured()) {
            return;
        }
        for (Map.Entry<String, String> entry : definition.fields().entrySet()) {
            if (!index.fields().contains(entry.getKey())) {
                throw new QueryValidationException(
                        "Field \"" + entry.getKey() + "\" not configured to be searched");
            }
            if (entry.getValue() == null) {
                throw new QueryValidationException(
                        "Search term for field \"" + entry.getKey() + "\" must not be null");
            }
        }
    }
}
