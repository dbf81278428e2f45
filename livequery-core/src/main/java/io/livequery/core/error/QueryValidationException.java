// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

/**
 * Thrown when a query definition or its options fail the synchronous parameter check.
 */
public final class QueryValidationException extends LiveQueryException {

    public static final String CODE = "invalid-query";

    public QueryValidationException(final String message) {
        super(CODE, message);
    }

    public QueryValidationException(final String message, final Throwable cause) {
        super(CODE, message, cause);
    }
}
