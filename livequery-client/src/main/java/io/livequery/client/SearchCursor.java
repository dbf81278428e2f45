// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.client;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.livequery.core.error.LiveQueryException;
import io.livequery.core.identity.IdentityMapper;
import io.livequery.core.model.Document;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.core.model.ReservedFields;

/**
 * Query-bound read view over a client's local mirror.
 *
 * <p>Every read reflects the messages received so far; cursors hold no state of
 * their own and are cheap to create.
 */
public final class SearchCursor {

    private static final String COUNT_FIELD = "count";
    private static final String AGGREGATIONS_FIELD = "aggregations";

    private final LocalCollection local;
    private final String collection;
    private final QueryFingerprint fingerprint;
    private final LiveSearchClient.ClientSubscription subscription;

    SearchCursor(LocalCollection local, String collection, QueryFingerprint fingerprint,
            LiveSearchClient.ClientSubscription subscription) {
        this.local = Objects.requireNonNull(local, "local");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.subscription = Objects.requireNonNull(subscription, "subscription");
    }

    /**
     * Returns the matching documents in result order, with metadata fields
     * stripped and the original document ids restored.
     *
     * @return the documents
     */
    public List<Document> fetch() {
        List<Map.Entry<String, Map<String, @Nullable Object>>> matching = new ArrayList<>();
        for (Map.Entry<String, Map<String, @Nullable Object>> entry : local.snapshot(collection).entrySet()) {
            Map<String, @Nullable Object> fields = entry.getValue();
            if (IdentityMapper.isDocumentKey(entry.getKey())
                    && fingerprint.definition().equals(fields.get(ReservedFields.SEARCH_DEFINITION))
                    && fingerprint.options().equals(fields.get(ReservedFields.SEARCH_OPTIONS))) {
                matching.add(entry);
            }
        }
        matching.sort(Comparator
                .comparingInt((Map.Entry<String, Map<String, @Nullable Object>> e) -> sortPosition(e.getValue()))
                .thenComparing(Map.Entry::getKey));

        List<Document> documents = new ArrayList<>(matching.size());
        for (Map.Entry<String, Map<String, @Nullable Object>> entry : matching) {
            documents.add(new Document(IdentityMapper.originalId(entry.getKey()), strip(entry.getValue())));
        }
        return documents;
    }

    /**
     * Returns the count record's value, or 0 before it has arrived.
     *
     * @return the total match count
     */
    public int count() {
        return countRecord()
                .map(fields -> fields.get(COUNT_FIELD))
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).intValue())
                .orElse(0);
    }

    /**
     * Tells whether the count comes from a live count record.
     *
     * @return true once the count record has arrived
     */
    public boolean isReactive() {
        return countRecord().isPresent();
    }

    public Optional<Object> aggregations() {
        return local.findOne(collection, fingerprint.aggregationsKey())
                .map(fields -> fields.get(AGGREGATIONS_FIELD));
    }

    public ResultView view() {
        Optional<Map<String, @Nullable Object>> countRecord = countRecord();
        return new ResultView(fetch(), count(), countRecord.isPresent());
    }

    public boolean isReady() {
        return subscription.isReady();
    }

    public Optional<LiveQueryException> error() {
        return Optional.ofNullable(subscription.error());
    }

    public QueryFingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Stops the underlying subscription. Other cursors for the same query stop
     * receiving updates too.
     */
    public void stop() {
        subscription.stop();
    }

    private Optional<Map<String, @Nullable Object>> countRecord() {
        return local.findOne(collection, fingerprint.countKey());
    }

    private static int sortPosition(Map<String, @Nullable Object> fields) {
        Object position = fields.get(ReservedFields.SORT_POSITION);
        return position instanceof Number ? ((Number) position).intValue() : Integer.MAX_VALUE;
    }

    private static Map<String, @Nullable Object> strip(Map<String, @Nullable Object> fields) {
        Map<String, @Nullable Object> stripped = new LinkedHashMap<>();
        for (Map.Entry<String, @Nullable Object> field : fields.entrySet()) {
            if (!ReservedFields.isReserved(field.getKey())) {
                stripped.put(field.getKey(), field.getValue());
            }
        }
        return stripped;
    }
}
