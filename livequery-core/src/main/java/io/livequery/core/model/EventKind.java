// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

/**
 * The four kinds of positional diff events.
 */
public enum EventKind {
    ADDED_AT("addedAt"),
    CHANGED_AT("changedAt"),
    MOVED_TO("movedTo"),
    REMOVED_AT("removedAt");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name shaping hooks and traces use for this kind.
     *
     * @return e.g. {@code "addedAt"}
     */
    public String wireName() {
        return wireName;
    }
}
