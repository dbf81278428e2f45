// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.model.Document;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.SearchIndexConfig;
import io.livequery.engine.spi.DiffListener;
import io.livequery.engine.spi.DocumentStore;
import io.livequery.engine.spi.LiveResult;
import io.livequery.engine.spi.Registration;
import io.livequery.engine.spi.SearchEngine;
import io.livequery.engine.spi.SearchResult;

/**
 * Reference {@link SearchEngine} that scans a {@link DocumentStore} in memory.
 *
 * <p><strong>Matching:</strong> a text definition matches a document when any
 * searchable field contains the text, ignoring case (empty text matches
 * everything). A structured definition matches when every named field contains
 * its term.
 *
 * <p><strong>Ordering:</strong> by the sort field (the query's
 * {@link QueryOptions#sortField()} or the engine default), numerically
 * descending, documents without a numeric value last; ties by id. The query's
 * limit is applied after ordering.
 *
 * <p><strong>Counts:</strong> {@link SearchResult#count()} is the number of
 * matches when {@code search} ran and never changes; {@link SearchResult#recount()}
 * scans the store again.
 *
 * <p><strong>Live results:</strong> every store write re-evaluates each observed
 * query and emits the {@link OrderedDiff} between the previous and the new
 * ordered result. Evaluation and delivery for one query hold that query's
 * monitor, so its listener never sees overlapping events.
 */
public final class InMemorySearchEngine implements SearchEngine {

    private static final Logger log = LoggerFactory.getLogger(InMemorySearchEngine.class);

    private final @Nullable String indexName;
    private final String defaultSortField;

    /**
     * Creates an engine.
     *
     * @param indexName        the engine index name, or {@code null} for the default
     * @param defaultSortField field ranked by when the query names none
     */
    public InMemorySearchEngine(@Nullable String indexName, String defaultSortField) {
        this.indexName = indexName;
        this.defaultSortField = Objects.requireNonNull(defaultSortField, "defaultSortField");
    }

    @Override
    public @Nullable String indexName() {
        return indexName;
    }

    @Override
    public SearchResult search(QueryDefinition definition, QueryOptions options, SearchIndexConfig index) {
        Query query = new Query(definition, options, index,
                options.sortField() != null ? options.sortField() : defaultSortField);
        return new InMemorySearchResult(query, query.matches().size());
    }

    private static final class Query {
        private final QueryDefinition definition;
        private final QueryOptions options;
        private final SearchIndexConfig index;
        private final Comparator<Document> order;

        Query(QueryDefinition definition, QueryOptions options, SearchIndexConfig index, String sortField) {
            this.definition = definition;
            this.options = options;
            this.index = index;
            this.order = Comparator
                    .comparingDouble((Document doc) -> rank(doc, sortField))
                    .reversed()
                    .thenComparing(Document::id);
        }

        /** All matching documents, transformed and ordered, without the limit. */
        List<Document> matches() {
            List<Document> matched = new ArrayList<>();
            for (Document doc : index.store().all()) {
                if (matches(doc)) {
                    matched.add(index.transform().apply(doc));
                }
            }
            matched.sort(order);
            return matched;
        }

        List<Document> page() {
            List<Document> matched = matches();
            return matched.size() > options.limit()
                    ? new ArrayList<>(matched.subList(0, options.limit()))
                    : matched;
        }

        private boolean matches(Document doc) {
            if (!definition.isStructured()) {
                String text = definition.text().toLowerCase(Locale.ROOT);
                if (text.isEmpty()) {
                    return true;
                }
                for (String field : index.fields()) {
                    if (contains(doc.get(field), text)) {
                        return true;
                    }
                }
                return false;
            }
            for (Map.Entry<String, String> term : definition.fields().entrySet()) {
                if (!contains(doc.get(term.getKey()), term.getValue().toLowerCase(Locale.ROOT))) {
                    return false;
                }
            }
            return true;
        }

        private static boolean contains(@Nullable Object value, String lowerCaseTerm) {
            return value != null && String.valueOf(value).toLowerCase(Locale.ROOT).contains(lowerCaseTerm);
        }

        private static double rank(Document doc, String sortField) {
            Object value = doc.get(sortField);
            return value instanceof Number ? ((Number) value).doubleValue() : Double.NEGATIVE_INFINITY;
        }
    }

    private static final class InMemorySearchResult implements SearchResult, LiveResult {
        private final Query query;
        private final int engineCount;

        // guarded by this
        private @Nullable DiffListener listener;
        private @Nullable Registration registration;
        private List<Document> current = List.of();
        private boolean stopped;

        InMemorySearchResult(Query query, int engineCount) {
            this.query = query;
            this.engineCount = engineCount;
        }

        @Override
        public int count() {
            return engineCount;
        }

        @Override
        public int recount() {
            return query.matches().size();
        }

        @Override
        public Optional<Object> aggregations() {
            List<String> facetFields = query.index.facetFields();
            if (facetFields.isEmpty()) {
                return Optional.empty();
            }
            List<Document> matched = query.matches();
            Map<String, Map<String, Long>> facets = new TreeMap<>();
            for (String field : facetFields) {
                Map<String, Long> buckets = new TreeMap<>();
                for (Document doc : matched) {
                    Object value = doc.get(field);
                    if (value != null) {
                        buckets.merge(String.valueOf(value), 1L, Long::sum);
                    }
                }
                facets.put(field, buckets);
            }
            return Optional.of(facets);
        }

        @Override
        public synchronized LiveResult observe(DiffListener diffListener) {
            Objects.requireNonNull(diffListener, "listener");
            if (listener != null || stopped) {
                throw new IllegalStateException("search result is already observed");
            }
            listener = diffListener;
            current = query.page();
            registration = query.index.store().watch(this::onStoreChange);
            return this;
        }

        @Override
        public synchronized List<Document> initialDocuments() {
            return List.copyOf(current);
        }

        private synchronized void onStoreChange(String documentId) {
            if (stopped || listener == null) {
                return;
            }
            DiffListener target = listener;
            try {
                List<Document> next = query.page();
                OrderedDiff.diff(current, next, target::onEvent);
                current = next;
            } catch (RuntimeException e) {
                log.warn("Re-evaluation after change of {} failed", documentId, e);
                stopped = true;
                closeRegistration();
                target.onError(e);
            }
        }

        @Override
        public synchronized void stop() {
            if (stopped) {
                return;
            }
            stopped = true;
            closeRegistration();
        }

        private void closeRegistration() {
            if (registration != null) {
                registration.close();
                registration = null;
            }
        }
    }
}
