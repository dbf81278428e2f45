// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.livequery.core.error.QueryValidationException;
import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.SearchIndexConfig;
import io.livequery.engine.spi.DiffListener;
import io.livequery.engine.spi.LiveResult;
import io.livequery.engine.spi.SearchResult;

class InMemorySearchEngineTest {

    private InMemoryDocumentStore store;
    private SearchIndexConfig index;
    private final InMemorySearchEngine engine = new InMemorySearchEngine("memory", "score");

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.insert(Document.of("A", Map.of("name", "Marie Curie", "team", "red", "score", 9)));
        store.insert(Document.of("B", Map.of("name", "Pierre Curie", "team", "blue", "score", 7)));
        store.insert(Document.of("C", Map.of("name", "Irene Curie", "team", "red", "score", 5)));
        store.insert(Document.of("X", Map.of("name", "Ada Lovelace", "team", "blue", "score", 100)));
        index = SearchIndexConfig.builder("players", store)
                .fields(List.of("name", "team"))
                .facetFields(List.of("team"))
                .build();
    }

    private static List<String> ids(List<Document> docs) {
        return docs.stream().map(Document::id).collect(Collectors.toList());
    }

    @Test
    void textSearchMatchesIgnoringCaseAndOrdersByScore() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        LiveResult live = result.observe(new CollectingListener());

        assertEquals(List.of("A", "B", "C"), ids(live.initialDocuments()));
        assertEquals(3, result.count());
        live.stop();
    }

    @Test
    void structuredSearchRequiresEveryField() {
        SearchResult result = engine.search(
                QueryDefinition.structured(Map.of("name", "curie", "team", "red")), QueryOptions.defaults(), index);

        assertEquals(List.of("A", "C"), ids(result.observe(new CollectingListener()).initialDocuments()));
    }

    @Test
    void limitTruncatesButCountDoesNot() {
        SearchResult result = engine.search(QueryDefinition.text("curie"),
                QueryOptions.builder().limit(2).build(), index);

        assertEquals(List.of("A", "B"), ids(result.observe(new CollectingListener()).initialDocuments()));
        assertEquals(3, result.count());
        assertEquals(3, result.recount());
    }

    @Test
    void engineCountIsASnapshotButRecountIsLive() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        store.insert(Document.of("D", Map.of("name", "Eve Curie", "score", 8)));

        assertEquals(3, result.count());
        assertEquals(4, result.recount());
    }

    @Test
    void transformIsApplied() {
        SearchIndexConfig shouting = SearchIndexConfig.builder("players", store)
                .fields(List.of("name"))
                .transform(doc -> doc.with("name", String.valueOf(doc.get("name")).toUpperCase()))
                .build();
        SearchResult result = engine.search(QueryDefinition.text("ada"), QueryOptions.defaults(), shouting);

        assertEquals("ADA LOVELACE", result.observe(new CollectingListener()).initialDocuments().get(0).get("name"));
        assertEquals("Ada Lovelace", store.findById("X").orElseThrow().get("name"));
    }

    @Test
    void aggregationsCountFacetValues() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);

        assertEquals(Map.of("team", Map.of("red", 2L, "blue", 1L)), result.aggregations().orElseThrow());
    }

    @Test
    void noAggregationsWithoutFacetFields() {
        SearchIndexConfig plain = SearchIndexConfig.builder("players", store).fields(List.of("name")).build();
        assertTrue(engine.search(QueryDefinition.text(""), QueryOptions.defaults(), plain).aggregations().isEmpty());
    }

    @Test
    void storeChangesProducePositionalEvents() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        CollectingListener listener = new CollectingListener();
        result.observe(listener);

        Document b = store.findById("B").orElseThrow();
        Document c = store.findById("C").orElseThrow();
        Document d = Document.of("D", Map.of("name", "Eve Curie", "score", 8));
        store.insert(d);
        store.remove("C");

        assertEquals(List.of(
                new DiffEvent.AddedAt(d, 1, "B"),
                new DiffEvent.ChangedAt(b, b, 2),
                new DiffEvent.ChangedAt(c, c, 3),
                new DiffEvent.RemovedAt(c, 3)), listener.events);
    }

    @Test
    void unrelatedChangesProduceNoEvents() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        CollectingListener listener = new CollectingListener();
        result.observe(listener);

        store.insert(Document.of("Y", Map.of("name", "Grace Hopper", "score", 50)));

        assertTrue(listener.events.isEmpty());
    }

    @Test
    void stopUnregistersFromTheStore() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        CollectingListener listener = new CollectingListener();
        LiveResult live = result.observe(listener);
        assertEquals(1, store.listenerCount());

        live.stop();
        live.stop();
        store.insert(Document.of("D", Map.of("name", "Eve Curie", "score", 8)));

        assertEquals(0, store.listenerCount());
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void resultCanBeObservedOnlyOnce() {
        SearchResult result = engine.search(QueryDefinition.text("curie"), QueryOptions.defaults(), index);
        result.observe(new CollectingListener());

        assertThrows(IllegalStateException.class, () -> result.observe(new CollectingListener()));
    }

    @Test
    void reEvaluationFailureIsReportedAndStopsObservation() {
        SearchIndexConfig fragile = SearchIndexConfig.builder("players", store)
                .fields(List.of("name"))
                .transform(doc -> {
                    if (doc.id().equals("BAD")) {
                        throw new IllegalStateException("cannot transform");
                    }
                    return doc;
                })
                .build();
        SearchResult result = engine.search(QueryDefinition.text(""), QueryOptions.defaults(), fragile);
        CollectingListener listener = new CollectingListener();
        result.observe(listener);

        store.insert(Document.of("BAD", Map.of("name", "x")));

        assertInstanceOf(IllegalStateException.class, listener.error);
        assertEquals(0, store.listenerCount());
    }

    @Test
    void checkSearchParamRejectsUnconfiguredFields() {
        QueryValidationException ex = assertThrows(QueryValidationException.class,
                () -> engine.checkSearchParam(
                        QueryDefinition.structured(Map.of("secret", "x")), QueryOptions.defaults(), index));
        assertTrue(ex.getMessage().contains("secret"));

        assertDoesNotThrow(() -> engine.checkSearchParam(
                QueryDefinition.structured(Map.of("name", "x")), QueryOptions.defaults(), index));
        assertDoesNotThrow(() -> engine.checkSearchParam(
                QueryDefinition.text("anything"), QueryOptions.defaults(), index));
    }

    private static final class CollectingListener implements DiffListener {
        final List<DiffEvent> events = new ArrayList<>();
        Throwable error;

        @Override
        public void onEvent(DiffEvent event) {
            events.add(event);
        }

        @Override
        public void onError(Throwable failure) {
            error = failure;
        }
    }
}
