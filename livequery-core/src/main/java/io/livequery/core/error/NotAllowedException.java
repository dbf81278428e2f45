// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

/**
 * Thrown when an index's permission check rejects a subscribe request.
 *
 * <p>
 * Raised before any search engine call; the subscription never leaves its
 * initializing state and no messages are published.
 */
public final class NotAllowedException extends LiveQueryException {

    public static final String CODE = "not-allowed";

    private final String indexName;

    public NotAllowedException(final String indexName) {
        super(CODE, "You're not allowed to search this index: " + indexName);
        this.indexName = indexName;
    }

    public String indexName() {
        return indexName;
    }
}
