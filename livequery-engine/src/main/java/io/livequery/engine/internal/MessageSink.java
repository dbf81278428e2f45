// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import java.util.Map;

import org.jspecify.annotations.Nullable;

import io.livequery.core.model.EventKind;

/**
 * Where a session's publishers write. Implementations drop every message once
 * the session has stopped.
 */
public interface MessageSink {

    void added(String key, Map<String, @Nullable Object> fields, EventKind cause);

    void changed(String key, Map<String, @Nullable Object> fields, EventKind cause);

    void removed(String key);

    /**
     * Publishes a synthetic (count or aggregation) record for the first time.
     */
    void addedRecord(String key, Map<String, @Nullable Object> fields);

    /**
     * Republishes a synthetic record after a refresh.
     */
    void changedRecord(String key, Map<String, @Nullable Object> fields);
}
