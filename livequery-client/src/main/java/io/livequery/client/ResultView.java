// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.client;

import java.util.List;
import java.util.Objects;

import io.livequery.core.model.Document;

/**
 * A point-in-time read of a live search.
 *
 * @param documents matching documents in result order, metadata stripped
 * @param count     the total match count, or 0 when no count has arrived
 * @param reactive  true once the count record has arrived
 */
public record ResultView(List<Document> documents, int count, boolean reactive) {

    public ResultView {
        documents = List.copyOf(Objects.requireNonNull(documents, "documents"));
    }
}
