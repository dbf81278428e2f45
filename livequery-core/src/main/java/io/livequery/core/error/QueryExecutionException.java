// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

/**
 * Thrown when the search engine or the document store fails, either while
 * evaluating the initial result or while observing it afterwards.
 *
 * <p>
 * This error always terminates the subscription it belongs to.
 */
public final class QueryExecutionException extends LiveQueryException {

    public static final String CODE = "query-failed";

    public QueryExecutionException(final String message, final Throwable cause) {
        super(CODE, message, cause);
    }
}
