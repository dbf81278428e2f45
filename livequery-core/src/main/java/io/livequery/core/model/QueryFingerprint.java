// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;

import io.livequery.core.error.QueryValidationException;
import io.livequery.core.internal.Json;

/**
 * Deterministic serialization of a query definition and its options' props.
 *
 * <p>Used as the namespace for every record a subscription publishes. Maps are
 * serialized in key order, so two structurally equal queries always produce the
 * same fingerprint regardless of insertion order.
 *
 * @param definition canonical JSON of the query definition
 * @param options    canonical JSON of {@link QueryOptions#props()}
 */
public record QueryFingerprint(String definition, String options) {

    private static final String COUNT_PREFIX = "count:";
    private static final String AGGREGATIONS_PREFIX = "aggs:";

    public QueryFingerprint {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(options, "options");
    }

    /**
     * Computes the fingerprint of a query.
     *
     * @param definition the query definition
     * @param options    the query options
     * @return the fingerprint
     * @throws QueryValidationException if the props cannot be serialized
     */
    public static QueryFingerprint of(final QueryDefinition definition, final QueryOptions options) {
        try {
            return new QueryFingerprint(
                    Json.canonical(definition.fingerprintValue()),
                    Json.canonical(options.props()));
        } catch (JsonProcessingException e) {
            throw new QueryValidationException("query options props are not serializable", e);
        }
    }

    /**
     * Returns the combined namespace string. Two fingerprints have the same value
     * if and only if both parts are equal.
     *
     * @return the namespace value
     */
    public String value() {
        try {
            return Json.canonical(List.of(definition, options));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("string array serialization failed", e);
        }
    }

    /**
     * Key of the synthetic record carrying the result count.
     *
     * @return {@code "count:" + value()}
     */
    public String countKey() {
        return COUNT_PREFIX + value();
    }

    /**
     * Key of the synthetic record carrying facet aggregations.
     *
     * @return {@code "aggs:" + value()}
     */
    public String aggregationsKey() {
        return AGGREGATIONS_PREFIX + value();
    }
}
