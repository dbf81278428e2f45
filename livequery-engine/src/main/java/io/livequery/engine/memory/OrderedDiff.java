// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.memory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;

/**
 * Computes the positional events that turn one ordered result into another.
 *
 * <p>Events are emitted in application order: every position refers to the
 * list as it stands after all previous events were applied. Removals come
 * first (highest position first), then the new order is built front to back
 * with moves, additions and content changes. A document whose content changed
 * while also moving yields {@code ChangedAt} at its old position followed by
 * {@code MovedTo}.
 *
 * <p>A final pass re-stamps positions: every document whose last published
 * position differs from its index in the new result gets a content-preserving
 * {@code ChangedAt} at that index. Subscribers ordering by position metadata
 * thus end up with exactly the new order. A {@code MovedTo} counts as
 * publishing the document at {@code beforeId} with the move's source position.
 */
public final class OrderedDiff {

    private OrderedDiff() {
    }

    public static void diff(List<Document> oldResult, List<Document> newResult, Consumer<DiffEvent> sink) {
        List<Document> working = new ArrayList<>(oldResult);
        Map<String, Integer> published = new HashMap<>();
        for (int i = 0; i < oldResult.size(); i++) {
            published.put(oldResult.get(i).id(), i);
        }

        Set<String> newIds = new HashSet<>();
        for (Document doc : newResult) {
            newIds.add(doc.id());
        }
        for (int i = working.size() - 1; i >= 0; i--) {
            Document doc = working.get(i);
            if (!newIds.contains(doc.id())) {
                working.remove(i);
                published.remove(doc.id());
                sink.accept(new DiffEvent.RemovedAt(doc, i));
            }
        }

        for (int i = 0; i < newResult.size(); i++) {
            Document target = newResult.get(i);
            int current = indexOf(working, target.id(), i);
            if (current == i) {
                Document previous = working.get(i);
                if (!previous.equals(target)) {
                    working.set(i, target);
                    published.put(target.id(), i);
                    sink.accept(new DiffEvent.ChangedAt(target, previous, i));
                }
            } else if (current > i) {
                Document previous = working.get(current);
                if (!previous.equals(target)) {
                    working.set(current, target);
                    sink.accept(new DiffEvent.ChangedAt(target, previous, current));
                }
                working.remove(current);
                working.add(i, target);
                String beforeId = idAt(working, i + 1);
                if (beforeId != null) {
                    published.put(beforeId, current);
                }
                published.put(target.id(), i);
                sink.accept(new DiffEvent.MovedTo(target, current, i, beforeId));
            } else {
                working.add(i, target);
                published.put(target.id(), i);
                sink.accept(new DiffEvent.AddedAt(target, i, idAt(working, i + 1)));
            }
        }

        for (int i = 0; i < working.size(); i++) {
            Document doc = working.get(i);
            Integer position = published.get(doc.id());
            if (position == null || position != i) {
                sink.accept(new DiffEvent.ChangedAt(doc, doc, i));
            }
        }
    }

    private static int indexOf(List<Document> documents, String id, int from) {
        for (int i = from; i < documents.size(); i++) {
            if (documents.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static @Nullable String idAt(List<Document> documents, int index) {
        return index < documents.size() ? documents.get(index).id() : null;
    }
}
