// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

import io.livequery.core.model.Document;
import io.livequery.engine.spi.DocumentStore;

/**
 * Configuration of one searchable index and the subscriptions served from it.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * SearchIndexConfig index = SearchIndexConfig.builder("players", store)
 *     .fields(List.of("name", "team"))
 *     .permission(PermissionCheck.authenticatedOnly())
 *     .countUpdateIntervalMs(1_000)
 *     .build();
 * }</pre>
 *
 * <p>An interval of {@code 0} disables the corresponding periodic refresh; the
 * baseline count and aggregations are published either way.
 *
 * @param name                          index name (non-blank), first part of the collection name
 * @param store                         the document store the index searches
 * @param fields                        fields searched, and the only fields structured definitions may name
 * @param facetFields                   fields aggregated into facet counts
 * @param permission                    authorization gate evaluated once per subscribe
 * @param transform                     applied by the search engine to every returned document
 * @param beforePublish                 per-event shaping hook applied before publication
 * @param countUpdateIntervalMs         count refresh period in milliseconds (must be &gt;= 0)
 * @param aggsUpdateIntervalMs          aggregation refresh period in milliseconds (must be &gt;= 0)
 * @param countingStrategy              how refreshes recompute the count
 * @param maxConsecutiveRefreshFailures failed ticks in a row that terminate a session (must be &gt;= 1)
 */
public record SearchIndexConfig(
        String name,
        DocumentStore store,
        List<String> fields,
        List<String> facetFields,
        PermissionCheck permission,
        UnaryOperator<Document> transform,
        BeforePublishHook beforePublish,
        long countUpdateIntervalMs,
        long aggsUpdateIntervalMs,
        CountingStrategy countingStrategy,
        int maxConsecutiveRefreshFailures) {

    /** Default number of failed refresh ticks in a row before a session is terminated. */
    public static final int DEFAULT_MAX_CONSECUTIVE_REFRESH_FAILURES = 3;

    public SearchIndexConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(permission, "permission");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(beforePublish, "beforePublish");
        Objects.requireNonNull(countingStrategy, "countingStrategy");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (countUpdateIntervalMs < 0) {
            throw new IllegalArgumentException("countUpdateIntervalMs must be >= 0, got: " + countUpdateIntervalMs);
        }
        if (aggsUpdateIntervalMs < 0) {
            throw new IllegalArgumentException("aggsUpdateIntervalMs must be >= 0, got: " + aggsUpdateIntervalMs);
        }
        if (maxConsecutiveRefreshFailures < 1) {
            throw new IllegalArgumentException(
                    "maxConsecutiveRefreshFailures must be >= 1, got: " + maxConsecutiveRefreshFailures);
        }
        fields = List.copyOf(fields);
        facetFields = List.copyOf(facetFields);
    }

    public boolean countRefreshEnabled() {
        return countUpdateIntervalMs > 0;
    }

    public boolean aggregationRefreshEnabled() {
        return aggsUpdateIntervalMs > 0;
    }

    /**
     * Creates a new builder.
     *
     * @param name  the index name
     * @param store the document store
     * @return a new builder initialized with default values
     */
    public static Builder builder(String name, DocumentStore store) {
        return new Builder(name, store);
    }

    /**
     * Builder for {@link SearchIndexConfig}.
     *
     * <p>All optional values start at their defaults: every request allowed,
     * identity transform and hook, refreshes disabled, full recount.
     */
    public static final class Builder {
        private final String name;
        private final DocumentStore store;
        private List<String> fields = List.of();
        private List<String> facetFields = List.of();
        private PermissionCheck permission = PermissionCheck.allowAll();
        private UnaryOperator<Document> transform = UnaryOperator.identity();
        private BeforePublishHook beforePublish = BeforePublishHook.identity();
        private long countUpdateIntervalMs = 0;
        private long aggsUpdateIntervalMs = 0;
        private CountingStrategy countingStrategy = CountingStrategy.FULL_RECOUNT;
        private int maxConsecutiveRefreshFailures = DEFAULT_MAX_CONSECUTIVE_REFRESH_FAILURES;

        private Builder(String name, DocumentStore store) {
            this.name = name;
            this.store = store;
        }

        public Builder fields(List<String> fields) {
            this.fields = Objects.requireNonNull(fields, "fields");
            return this;
        }

        public Builder facetFields(List<String> facetFields) {
            this.facetFields = Objects.requireNonNull(facetFields, "facetFields");
            return this;
        }

        public Builder permission(PermissionCheck permission) {
            this.permission = permission;
            return this;
        }

        public Builder transform(UnaryOperator<Document> transform) {
            this.transform = transform;
            return this;
        }

        public Builder beforePublish(BeforePublishHook beforePublish) {
            this.beforePublish = beforePublish;
            return this;
        }

        public Builder countUpdateIntervalMs(long countUpdateIntervalMs) {
            this.countUpdateIntervalMs = countUpdateIntervalMs;
            return this;
        }

        public Builder aggsUpdateIntervalMs(long aggsUpdateIntervalMs) {
            this.aggsUpdateIntervalMs = aggsUpdateIntervalMs;
            return this;
        }

        public Builder countingStrategy(CountingStrategy countingStrategy) {
            this.countingStrategy = countingStrategy;
            return this;
        }

        public Builder maxConsecutiveRefreshFailures(int maxConsecutiveRefreshFailures) {
            this.maxConsecutiveRefreshFailures = maxConsecutiveRefreshFailures;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new immutable {@link SearchIndexConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public SearchIndexConfig build() {
            return new SearchIndexConfig(name, store, fields, facetFields, permission, transform,
                    beforePublish, countUpdateIntervalMs, aggsUpdateIntervalMs, countingStrategy,
                    maxConsecutiveRefreshFailures);
        }
    }
}
