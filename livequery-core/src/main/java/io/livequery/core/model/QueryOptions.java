// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Per-query options sent along with a {@link QueryDefinition}.
 *
 * <p>Only {@code props} take part in the query fingerprint; {@code limit} and
 * {@code sortField} shape the search itself.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * QueryOptions options = QueryOptions.builder()
 *     .limit(20)
 *     .prop("category", "books")
 *     .build();
 * }</pre>
 *
 * @param props     application-defined properties, fingerprinted
 * @param limit     maximum number of documents in the ordered result (must be &gt;= 0)
 * @param sortField field to rank by, or {@code null} for the engine default
 */
public record QueryOptions(Map<String, @Nullable Object> props, int limit, @Nullable String sortField) {

    /** Default page size. */
    public static final int DEFAULT_LIMIT = 10;

    public QueryOptions {
        Objects.requireNonNull(props, "props");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
        props = Collections.unmodifiableMap(new LinkedHashMap<>(props));
    }

    public static QueryOptions defaults() {
        return new QueryOptions(Map.of(), DEFAULT_LIMIT, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link QueryOptions}.
     */
    public static final class Builder {
        private final Map<String, @Nullable Object> props = new LinkedHashMap<>();
        private int limit = DEFAULT_LIMIT;
        private @Nullable String sortField;

        private Builder() {}

        public Builder prop(String key, @Nullable Object value) {
            props.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder props(Map<String, @Nullable Object> values) {
            props.putAll(values);
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder sortField(@Nullable String sortField) {
            this.sortField = sortField;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(props, limit, sortField);
        }
    }
}
