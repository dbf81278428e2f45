// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

import java.util.Collection;
import java.util.Optional;

import io.livequery.core.model.Document;

/**
 * The underlying document storage and its change notifications.
 *
 * <p>Implementations must be safe for concurrent reads. Nothing in LiveQuery
 * writes to a store.
 */
public interface DocumentStore {

    /**
     * Looks up a document by its store identity.
     *
     * @param id the document id
     * @return the document, or empty if it does not exist
     */
    Optional<Document> findById(String id);

    /**
     * Returns the number of documents in the store.
     *
     * @return the document count
     */
    int count();

    /**
     * Returns a snapshot of every document in the store.
     *
     * @return an unmodifiable snapshot
     */
    Collection<Document> all();

    /**
     * Registers a listener invoked after every write, with the id of the written document.
     *
     * @param listener the change listener
     * @return a registration that removes the listener when closed
     */
    Registration watch(ChangeListener listener);

    /**
     * Receives store change notifications.
     */
    @FunctionalInterface
    interface ChangeListener {
        void onChange(String documentId);
    }
}
