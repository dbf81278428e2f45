// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;

/**
 * Shapes a document right before it is published.
 *
 * <p>The hook sees the whole event, so it can branch on {@link DiffEvent#kind()}
 * and read the positional arguments. It must return a document and must not
 * depend on being called for the neighbor updates of a move.
 */
@FunctionalInterface
public interface BeforePublishHook {

    Document apply(DiffEvent event);

    static BeforePublishHook identity() {
        return DiffEvent::doc;
    }
}
