// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;

/**
 * What to search for: either free text, or a structured map of field to search term.
 *
 * <p>Exactly one of {@code text} and {@code fields} is meaningful;
 * {@link #isStructured()} tells which one.
 *
 * @param text   the free-text search, or {@code null} for structured definitions
 * @param fields field to term mapping for structured definitions, empty for text
 */
public record QueryDefinition(@Nullable String text, Map<String, String> fields) {

    public QueryDefinition {
        Objects.requireNonNull(fields, "fields");
        if (text != null && !fields.isEmpty()) {
            throw new IllegalArgumentException("a definition is either text or structured, not both");
        }
        if (text == null && fields.isEmpty()) {
            throw new IllegalArgumentException("structured definition must name at least one field");
        }
        fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    public static QueryDefinition text(final String text) {
        return new QueryDefinition(Objects.requireNonNull(text, "text"), Map.of());
    }

    public static QueryDefinition structured(final Map<String, String> fields) {
        return new QueryDefinition(null, fields);
    }

    public boolean isStructured() {
        return text == null;
    }

    /**
     * Returns the value that is serialized into the query fingerprint.
     *
     * @return the text, or the sorted field map
     */
    public Object fingerprintValue() {
        return text != null ? text : fields;
    }
}
