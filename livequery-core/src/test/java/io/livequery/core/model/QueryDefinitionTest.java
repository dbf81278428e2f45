// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

class QueryDefinitionTest {

    @Test
    void textDefinition() {
        QueryDefinition definition = QueryDefinition.text("marie");
        assertFalse(definition.isStructured());
        assertEquals("marie", definition.fingerprintValue());
    }

    @Test
    void structuredDefinitionSortsFields() {
        QueryDefinition definition = QueryDefinition.structured(Map.of("team", "red", "name", "marie"));
        assertTrue(definition.isStructured());
        assertEquals("name", definition.fields().keySet().iterator().next());
    }

    @Test
    void rejectsEmptyStructuredDefinition() {
        assertThrows(IllegalArgumentException.class, () -> QueryDefinition.structured(Map.of()));
    }

    @Test
    void rejectsTextAndFieldsTogether() {
        assertThrows(IllegalArgumentException.class, () -> new QueryDefinition("x", Map.of("a", "b")));
    }

    @Test
    void optionsRejectNegativeLimit() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> QueryOptions.builder().limit(-1).build());
        assertTrue(ex.getMessage().contains("limit must be >= 0"));
    }

    @Test
    void documentIsImmutable() {
        Document doc = Document.of("a", Map.of("name", "Marie"));
        assertThrows(UnsupportedOperationException.class, () -> doc.fields().put("name", "x"));

        Document changed = doc.with("score", 9);
        assertNull(doc.get("score"));
        assertEquals(9, changed.get("score"));
        assertEquals("a", changed.id());
    }

    @Test
    void diffEventsRejectNegativePositions() {
        Document doc = Document.of("a", Map.of());
        assertThrows(IllegalArgumentException.class, () -> new DiffEvent.AddedAt(doc, -1, null));
        assertThrows(IllegalArgumentException.class, () -> new DiffEvent.MovedTo(doc, 0, -2, null));
        assertEquals(EventKind.REMOVED_AT, new DiffEvent.RemovedAt(doc, 0).kind());
        assertEquals("movedTo", new DiffEvent.MovedTo(doc, 1, 0, "b").kind().wireName());
    }
}
