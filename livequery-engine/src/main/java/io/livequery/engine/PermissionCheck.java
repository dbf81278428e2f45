// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import io.livequery.core.model.QueryOptions;

/**
 * Authorization gate evaluated once per subscribe request.
 */
@FunctionalInterface
public interface PermissionCheck {

    boolean allowed(RequestContext context, QueryOptions options);

    static PermissionCheck allowAll() {
        return (context, options) -> true;
    }

    static PermissionCheck authenticatedOnly() {
        return (context, options) -> context.userId() != null;
    }
}
