// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

import java.util.List;

import io.livequery.core.model.Document;

/**
 * An observed search result: the ordered documents at registration time, and a
 * handle to stop the diff stream that follows them.
 */
public interface LiveResult {

    /**
     * Returns the ordered result captured atomically with the listener registration,
     * so the first diff event applies to exactly this list.
     *
     * @return the initial ordered documents
     */
    List<Document> initialDocuments();

    /**
     * Stops the diff stream. Idempotent.
     */
    void stop();
}
