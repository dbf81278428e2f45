// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A positional change to the ordered result of a live query.
 *
 * <p>Positions are zero-based and reflect the result ordering at the moment
 * the event is emitted. {@code beforeId} names the document that now follows
 * the affected one, or is {@code null} when it ends up last.
 */
public sealed interface DiffEvent {

    /**
     * Returns the document this event is about.
     *
     * @return the current (or, for removals, last known) document
     */
    Document doc();

    EventKind kind();

    /**
     * A new document entered the ordered result at {@code position}.
     */
    record AddedAt(Document doc, int position, @Nullable String beforeId) implements DiffEvent {
        public AddedAt {
            Objects.requireNonNull(doc, "doc");
            requireNonNegative(position, "position");
        }

        @Override
        public EventKind kind() {
            return EventKind.ADDED_AT;
        }
    }

    /**
     * An existing document's content changed without reordering.
     */
    record ChangedAt(Document doc, Document oldDoc, int position) implements DiffEvent {
        public ChangedAt {
            Objects.requireNonNull(doc, "doc");
            Objects.requireNonNull(oldDoc, "oldDoc");
            requireNonNegative(position, "position");
        }

        @Override
        public EventKind kind() {
            return EventKind.CHANGED_AT;
        }
    }

    /**
     * An existing document moved from {@code fromPosition} to {@code toPosition}.
     */
    record MovedTo(Document doc, int fromPosition, int toPosition, @Nullable String beforeId) implements DiffEvent {
        public MovedTo {
            Objects.requireNonNull(doc, "doc");
            requireNonNegative(fromPosition, "fromPosition");
            requireNonNegative(toPosition, "toPosition");
        }

        @Override
        public EventKind kind() {
            return EventKind.MOVED_TO;
        }
    }

    /**
     * A document left the ordered result; {@code position} is where it was.
     */
    record RemovedAt(Document doc, int position) implements DiffEvent {
        public RemovedAt {
            Objects.requireNonNull(doc, "doc");
            requireNonNegative(position, "position");
        }

        @Override
        public EventKind kind() {
            return EventKind.REMOVED_AT;
        }
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
        }
    }
}
