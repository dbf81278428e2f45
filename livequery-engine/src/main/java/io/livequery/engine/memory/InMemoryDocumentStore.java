// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.memory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.model.Document;
import io.livequery.engine.spi.DocumentStore;
import io.livequery.engine.spi.Registration;

/**
 * Thread-safe in-memory {@link DocumentStore}.
 *
 * <p>Listeners are notified synchronously on the writing thread, after the write
 * is visible to readers. A listener that throws does not prevent the others from
 * being notified.
 */
public final class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final ConcurrentHashMap<String, Document> documents = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ChangeListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Inserts a new document.
     *
     * @param document the document
     * @throws IllegalArgumentException if a document with the same id exists
     */
    public void insert(Document document) {
        Objects.requireNonNull(document, "document");
        if (documents.putIfAbsent(document.id(), document) != null) {
            throw new IllegalArgumentException("document already exists: " + document.id());
        }
        notifyListeners(document.id());
    }

    /**
     * Replaces an existing document.
     *
     * @param document the new version
     * @throws IllegalArgumentException if no document with that id exists
     */
    public void update(Document document) {
        Objects.requireNonNull(document, "document");
        if (documents.replace(document.id(), document) == null) {
            throw new IllegalArgumentException("no such document: " + document.id());
        }
        notifyListeners(document.id());
    }

    /**
     * Removes a document.
     *
     * @param id the document id
     * @return true if a document was removed
     */
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id");
        if (documents.remove(id) == null) {
            return false;
        }
        notifyListeners(id);
        return true;
    }

    @Override
    public Optional<Document> findById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public int count() {
        return documents.size();
    }

    @Override
    public Collection<Document> all() {
        return List.copyOf(documents.values());
    }

    @Override
    public Registration watch(ChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    private void notifyListeners(String documentId) {
        for (ChangeListener listener : listeners) {
            try {
                listener.onChange(documentId);
            } catch (RuntimeException e) {
                log.warn("Change listener failed for document {}", documentId, e);
            }
        }
    }
}
