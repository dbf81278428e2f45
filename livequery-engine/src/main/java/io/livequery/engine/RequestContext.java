// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Who is subscribing, and over which connection.
 *
 * @param connectionId the transport connection the subscription belongs to
 * @param userId       the authenticated user, or {@code null} when anonymous
 * @param attributes   additional transport-supplied attributes
 */
public record RequestContext(String connectionId, @Nullable String userId, Map<String, Object> attributes) {

    public RequestContext {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(attributes, "attributes");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static RequestContext anonymous(final String connectionId) {
        return new RequestContext(connectionId, null, Map.of());
    }

    public static RequestContext user(final String connectionId, final String userId) {
        return new RequestContext(connectionId, Objects.requireNonNull(userId, "userId"), Map.of());
    }
}
