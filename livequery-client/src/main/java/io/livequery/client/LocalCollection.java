// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;

import org.jspecify.annotations.Nullable;

/**
 * Local mirror of the records published to one client connection.
 *
 * <p>Records are addressed by {@code (collection, key)}. Later messages for a
 * key supersede earlier state: {@code added} replaces the record, {@code changed}
 * overwrites the fields it carries, {@code removed} deletes it.
 *
 * <p>Thread-safe. Readers always see whole records, never a half-applied change.
 */
public final class LocalCollection {

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Map<String, @Nullable Object>>> collections =
            new ConcurrentHashMap<>();

    public void added(String collection, String key, Map<String, @Nullable Object> fields) {
        records(collection).put(key, freeze(fields));
    }

    public void changed(String collection, String key, Map<String, @Nullable Object> fields) {
        records(collection).merge(key, freeze(fields), (previous, update) -> {
            Map<String, @Nullable Object> merged = new LinkedHashMap<>(previous);
            merged.putAll(update);
            return Collections.unmodifiableMap(merged);
        });
    }

    public void removed(String collection, String key) {
        records(collection).remove(key);
    }

    public Optional<Map<String, @Nullable Object>> findOne(String collection, String key) {
        return Optional.ofNullable(records(collection).get(key));
    }

    /**
     * Returns a snapshot of all records of a collection, keyed by record key.
     *
     * @param collection the collection name
     * @return an unmodifiable snapshot
     */
    public Map<String, Map<String, @Nullable Object>> snapshot(String collection) {
        return Map.copyOf(records(collection));
    }

    /**
     * Removes every record of a collection that matches a predicate.
     *
     * @param collection the collection name
     * @param predicate  tested with each record's key and fields
     * @return the number of records removed
     */
    public int removeIf(String collection, BiPredicate<String, Map<String, @Nullable Object>> predicate) {
        ConcurrentHashMap<String, Map<String, @Nullable Object>> records = records(collection);
        int removed = 0;
        for (Map.Entry<String, Map<String, @Nullable Object>> entry : records.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue()) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public int size(String collection) {
        return records(collection).size();
    }

    public void clear() {
        collections.clear();
    }

    private ConcurrentHashMap<String, Map<String, @Nullable Object>> records(String collection) {
        Objects.requireNonNull(collection, "collection");
        return collections.computeIfAbsent(collection, name -> new ConcurrentHashMap<>());
    }

    private static Map<String, @Nullable Object> freeze(Map<String, @Nullable Object> fields) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
