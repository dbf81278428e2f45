// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LiveQueryExceptionTest {

    @Test
    void codesAreStable() {
        assertEquals("not-allowed", new NotAllowedException("players").code());
        assertEquals("invalid-query", new QueryValidationException("bad").code());
        assertEquals("query-failed", new QueryExecutionException("boom", null).code());
        assertEquals("refresh-failed", new RefreshException("again", 3, null).code());
    }

    @Test
    void notAllowedNamesTheIndex() {
        NotAllowedException ex = new NotAllowedException("players");
        assertEquals("players", ex.indexName());
        assertTrue(ex.getMessage().contains("not allowed"));
    }

    @Test
    void causeIsKept() {
        IllegalStateException cause = new IllegalStateException("store down");
        QueryExecutionException ex = new QueryExecutionException("failed", cause);
        assertSame(cause, ex.getCause());
        assertTrue(ex.toString().contains("code=query-failed"));
    }

    @Test
    void everyFailureIsALiveQueryException() {
        LiveQueryException ex = new RefreshException("again", 3, null);
        assertInstanceOf(RuntimeException.class, ex);
        assertEquals(3, ((RefreshException) ex).consecutiveFailures());
    }
}
