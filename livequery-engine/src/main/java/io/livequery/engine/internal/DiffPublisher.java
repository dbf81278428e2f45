// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;

import io.livequery.core.identity.IdentityMapper;
import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;
import io.livequery.core.model.EventKind;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.core.model.ReservedFields;
import io.livequery.engine.BeforePublishHook;
import io.livequery.engine.spi.DocumentStore;

/**
 * Translates positional diff events into channel messages.
 *
 * <p>Every outbound record is a new map: the shaped document's fields plus the
 * {@link ReservedFields} metadata. Documents returned by the search engine are
 * never modified.
 *
 * <ul>
 * <li>{@code AddedAt} becomes {@code added}</li>
 * <li>{@code ChangedAt} becomes {@code changed}</li>
 * <li>{@code MovedTo} becomes {@code changed} for the document that now follows
 * the moved one, stamped with the move's source position, then {@code changed}
 * for the moved document at its target position</li>
 * <li>{@code RemovedAt} becomes {@code removed}</li>
 * </ul>
 */
public final class DiffPublisher {

    private final QueryFingerprint fingerprint;
    private final BeforePublishHook beforePublish;
    private final UnaryOperator<Document> transform;
    private final DocumentStore store;
    private final MessageSink sink;

    public DiffPublisher(QueryFingerprint fingerprint, BeforePublishHook beforePublish,
            UnaryOperator<Document> transform, DocumentStore store, MessageSink sink) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.beforePublish = Objects.requireNonNull(beforePublish, "beforePublish");
        this.transform = Objects.requireNonNull(transform, "transform");
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Publishes an initial ordered result as a run of {@code AddedAt} events.
     *
     * @param documents the initial documents, in result order
     */
    public void publishInitial(List<Document> documents) {
        for (int i = 0; i < documents.size(); i++) {
            String beforeId = i + 1 < documents.size() ? documents.get(i + 1).id() : null;
            publish(new DiffEvent.AddedAt(documents.get(i), i, beforeId));
        }
    }

    public void publish(DiffEvent event) {
        if (event instanceof DiffEvent.AddedAt added) {
            Document shaped = shape(event);
            String id = added.doc().id();
            sink.added(keyOf(id), stamp(shaped, added.position(), id), EventKind.ADDED_AT);
        } else if (event instanceof DiffEvent.ChangedAt changed) {
            Document shaped = shape(event);
            String id = changed.doc().id();
            sink.changed(keyOf(id), stamp(shaped, changed.position(), id), EventKind.CHANGED_AT);
        } else if (event instanceof DiffEvent.MovedTo moved) {
            publishMove(moved);
        } else if (event instanceof DiffEvent.RemovedAt removed) {
            shape(event);
            sink.removed(keyOf(removed.doc().id()));
        } else {
            throw new IllegalArgumentException("unknown diff event: " + event);
        }
    }

    private void publishMove(DiffEvent.MovedTo moved) {
        Document shaped = shape(moved);
        String beforeId = moved.beforeId();
        if (beforeId != null) {
            Optional<Document> neighbor = store.findById(beforeId).map(transform);
            neighbor.ifPresent(doc -> sink.changed(
                    keyOf(doc.id()), stamp(doc, moved.fromPosition(), null), EventKind.MOVED_TO));
        }
        sink.changed(keyOf(moved.doc().id()), stamp(shaped, moved.toPosition(), null), EventKind.MOVED_TO);
    }

    private Document shape(DiffEvent event) {
        Document shaped = beforePublish.apply(event);
        if (shaped == null) {
            throw new IllegalStateException(
                    "beforePublish returned null for " + event.kind().wireName() + " of " + event.doc().id());
        }
        return shaped;
    }

    private String keyOf(String originalId) {
        return IdentityMapper.identity(originalId, fingerprint);
    }

    private Map<String, @Nullable Object> stamp(Document doc, int position, @Nullable String originalId) {
        Map<String, @Nullable Object> fields = new LinkedHashMap<>(doc.fields());
        fields.put(ReservedFields.SEARCH_DEFINITION, fingerprint.definition());
        fields.put(ReservedFields.SEARCH_OPTIONS, fingerprint.options());
        fields.put(ReservedFields.SORT_POSITION, position);
        if (originalId != null) {
            fields.put(ReservedFields.ORIGINAL_ID, originalId);
        }
        return Collections.unmodifiableMap(fields);
    }
}
