// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * An immutable document: its store identity plus an insertion-ordered field map.
 *
 * <p>Field values may be {@code null}; the map itself can never be modified.
 * Use {@link #with(String, Object)} or {@link #withFields(Map)} to derive a changed copy.
 *
 * @param id     the document's identity in the document store
 * @param fields the document's fields (copied)
 */
public record Document(String id, Map<String, @Nullable Object> fields) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fields, "fields");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Document of(final String id, final Map<String, @Nullable Object> fields) {
        return new Document(id, fields);
    }

    public @Nullable Object get(final String field) {
        return fields.get(field);
    }

    public Document with(final String field, final @Nullable Object value) {
        Map<String, @Nullable Object> copy = new LinkedHashMap<>(fields);
        copy.put(field, value);
        return new Document(id, copy);
    }

    public Document withFields(final Map<String, @Nullable Object> extra) {
        Map<String, @Nullable Object> copy = new LinkedHashMap<>(fields);
        copy.putAll(extra);
        return new Document(id, copy);
    }
}
