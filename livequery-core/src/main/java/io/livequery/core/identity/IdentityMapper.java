// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.identity;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.livequery.core.internal.Json;
import io.livequery.core.model.QueryFingerprint;

/**
 * Derives the channel key of a document within one subscription's namespace.
 *
 * <p>A key is the canonical JSON array {@code [originalId, definition, options]}.
 * JSON string escaping makes the encoding injective: distinct
 * {@code (id, fingerprint)} pairs never produce the same key, and the original id
 * can always be recovered with {@link #originalId(String)}. Document keys start
 * with {@code '['} and so never collide with the {@code count:} and {@code aggs:}
 * synthetic record keys.
 */
public final class IdentityMapper {

    private IdentityMapper() {
    }

    /**
     * Returns the channel key for a document published under a fingerprint.
     *
     * @param originalId  the document's store identity
     * @param fingerprint the subscription's query fingerprint
     * @return the deterministic channel key
     */
    public static String identity(final String originalId, final QueryFingerprint fingerprint) {
        Objects.requireNonNull(originalId, "originalId");
        Objects.requireNonNull(fingerprint, "fingerprint");
        try {
            return Json.canonical(List.of(originalId, fingerprint.definition(), fingerprint.options()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("string array serialization failed", e);
        }
    }

    /**
     * Recovers the store identity from a key produced by {@link #identity}.
     *
     * @param key a document channel key
     * @return the original document id
     * @throws IllegalArgumentException if {@code key} is not a document key
     */
    public static String originalId(final String key) {
        Objects.requireNonNull(key, "key");
        final List<String> parts;
        try {
            parts = Json.readStringArray(key);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("not a document key: " + key, e);
        }
        if (parts.size() != 3) {
            throw new IllegalArgumentException("document key must have 3 parts, got: " + parts.size());
        }
        return parts.get(0);
    }

    /**
     * Tells whether a key addresses a document (as opposed to a synthetic record).
     *
     * @param key a channel key
     * @return true for document keys
     */
    public static boolean isDocumentKey(final String key) {
        return key.startsWith("[");
    }
}
