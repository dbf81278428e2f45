// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

/**
 * Thrown when periodic count or aggregation refreshes keep failing for one subscription.
 */
public final class RefreshException extends LiveQueryException {

    public static final String CODE = "refresh-failed";

    private final int consecutiveFailures;

    public RefreshException(final String message, final int consecutiveFailures, final Throwable cause) {
        super(CODE, message, cause);
        this.consecutiveFailures = consecutiveFailures;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }
}
