// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import java.util.Map;

import org.jspecify.annotations.Nullable;

import io.livequery.core.error.LiveQueryException;

/**
 * The ordered, reliable message channel of one subscription.
 *
 * <p>Many subscriptions may share one underlying connection; keys are scoped by
 * query fingerprint so their records never collide. Calls for one subscription
 * never overlap.
 */
public interface PublicationChannel {

    /**
     * A record entered the subscription's namespace.
     *
     * @param collection the collection name
     * @param key        the record key
     * @param fields     the full record
     */
    void added(String collection, String key, Map<String, @Nullable Object> fields);

    /**
     * A record changed; {@code fields} replace the corresponding fields of the
     * current record (last write wins).
     *
     * @param collection the collection name
     * @param key        the record key
     * @param fields     the changed fields
     */
    void changed(String collection, String key, Map<String, @Nullable Object> fields);

    void removed(String collection, String key);

    /**
     * The initial result, count and aggregations have been delivered.
     */
    void ready();

    /**
     * The subscription terminated with an error. No further messages follow.
     *
     * @param error the failure
     */
    void error(LiveQueryException error);

    /**
     * Registers a callback the transport runs when the channel is lost.
     *
     * @param callback teardown to run on channel loss
     */
    default void onStop(Runnable callback) {
    }
}
