// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.livequery.core.error.LiveQueryException;
import io.livequery.core.error.RefreshException;
import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.CountingStrategy;
import io.livequery.engine.LiveQueryMetrics;
import io.livequery.engine.SearchIndexConfig;
import io.livequery.engine.memory.InMemoryDocumentStore;
import io.livequery.engine.spi.LiveResult;
import io.livequery.engine.spi.SearchResult;

@ExtendWith(MockitoExtension.class)
class AggregateRefresherTest {

    private static final Map<String, Object> AGGS = Map.of("team", Map.of("red", 2L));

    @Mock
    private SearchResult result;

    @Mock
    private MessageSink sink;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private LiveQueryMetrics metrics;

    @Mock
    private ScheduledFuture<Object> countFuture;

    @Mock
    private ScheduledFuture<Object> aggsFuture;

    private final QueryFingerprint fingerprint =
            QueryFingerprint.of(QueryDefinition.text("curie"), QueryOptions.defaults());
    private final List<LiveQueryException> fatal = new ArrayList<>();

    private SearchIndexConfig.Builder index() {
        return SearchIndexConfig.builder("players", new InMemoryDocumentStore());
    }

    private AggregateRefresher refresher(SearchIndexConfig config) {
        ResultObserver observer = new ResultObserver(result, event -> { }, error -> { });
        return new AggregateRefresher("players/search", fingerprint, config, result, observer,
                QueryOptions.DEFAULT_LIMIT, sink, scheduler, metrics, fatal::add);
    }

    @Test
    void baselinePublishesCountAndAggregations() {
        when(result.recount()).thenReturn(3);
        when(result.aggregations()).thenReturn(Optional.of(AGGS));
        AggregateRefresher refresher = refresher(index().build());

        refresher.prepare();
        refresher.publishBaseline();

        verify(sink).addedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 3));
        verify(sink).addedRecord(fingerprint.aggregationsKey(), Map.of(AggregateRefresher.AGGREGATIONS_FIELD, AGGS));
    }

    @Test
    void noAggregationRecordWhenEngineProducesNone() {
        when(result.recount()).thenReturn(0);
        when(result.aggregations()).thenReturn(Optional.empty());
        AggregateRefresher refresher = refresher(index().aggsUpdateIntervalMs(1_000).build());

        refresher.prepare();
        refresher.publishBaseline();
        refresher.start();

        verify(sink).addedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 0));
        verify(sink, never()).addedRecord(eq(fingerprint.aggregationsKey()), anyMap());
        verifyNoInteractions(scheduler);
        assertFalse(refresher.isAggregationTimerActive());
    }

    @Test
    void baselineUsesConfiguredCountingStrategy() {
        when(result.count()).thenReturn(42);
        when(result.aggregations()).thenReturn(Optional.empty());
        AggregateRefresher refresher = refresher(index().countingStrategy(CountingStrategy.ENGINE).build());

        refresher.prepare();
        refresher.publishBaseline();

        verify(sink).addedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 42));
        verify(result, never()).recount();
    }

    @Test
    void zeroIntervalsScheduleNothing() {
        when(result.recount()).thenReturn(1);
        when(result.aggregations()).thenReturn(Optional.of(AGGS));
        AggregateRefresher refresher = refresher(index().build());

        refresher.prepare();
        refresher.start();

        verifyNoInteractions(scheduler);
        assertFalse(refresher.isCountTimerActive());
    }

    @Test
    void timersHaveDistinctHandlesAndAreCancelledOnce() {
        when(result.recount()).thenReturn(1);
        when(result.aggregations()).thenReturn(Optional.of(AGGS));
        doReturn(countFuture).doReturn(aggsFuture)
                .when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        AggregateRefresher refresher = refresher(index().countUpdateIntervalMs(1_000).aggsUpdateIntervalMs(5_000).build());

        refresher.prepare();
        refresher.start();

        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(1_000L), eq(1_000L), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(5_000L), eq(5_000L), eq(TimeUnit.MILLISECONDS));
        assertTrue(refresher.isCountTimerActive());
        assertTrue(refresher.isAggregationTimerActive());

        refresher.cancel();
        refresher.cancel();

        verify(countFuture, times(1)).cancel(false);
        verify(aggsFuture, times(1)).cancel(false);
        assertFalse(refresher.isCountTimerActive());
        assertFalse(refresher.isAggregationTimerActive());
    }

    @Test
    void startAfterCancelSchedulesNothing() {
        AggregateRefresher refresher = refresher(index().countUpdateIntervalMs(1_000).build());

        refresher.cancel();
        refresher.start();

        verifyNoInteractions(scheduler);
    }

    @Test
    void countTickPublishesChangedRecord() {
        when(result.recount()).thenReturn(3, 5);
        when(result.aggregations()).thenReturn(Optional.empty());
        doReturn(countFuture)
                .when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        AggregateRefresher refresher = refresher(index().countUpdateIntervalMs(1_000).build());
        refresher.prepare();
        refresher.start();

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(tick.capture(), anyLong(), anyLong(), any(TimeUnit.class));
        tick.getValue().run();

        verify(sink).changedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 5));
    }

    @Test
    void aggregationTickRecomputesAggregations() {
        Map<String, Object> updated = Map.of("team", Map.of("red", 3L));
        when(result.recount()).thenReturn(2);
        when(result.aggregations()).thenReturn(Optional.of(AGGS), Optional.of(updated));
        AggregateRefresher refresher = refresher(index().build());
        refresher.prepare();

        refresher.refreshAggregations();

        verify(sink).changedRecord(fingerprint.aggregationsKey(),
                Map.of(AggregateRefresher.AGGREGATIONS_FIELD, updated));
    }

    @Test
    void repeatedFailuresTerminateWithRefreshException() {
        IllegalStateException down = new IllegalStateException("store down");
        when(result.recount()).thenReturn(3).thenThrow(down);
        when(result.aggregations()).thenReturn(Optional.empty());
        AggregateRefresher refresher = refresher(index().maxConsecutiveRefreshFailures(2).build());
        refresher.prepare();

        refresher.refreshCount();
        assertTrue(fatal.isEmpty());
        refresher.refreshCount();

        assertEquals(1, fatal.size());
        RefreshException error = assertInstanceOf(RefreshException.class, fatal.get(0));
        assertEquals(2, error.consecutiveFailures());
        assertSame(down, error.getCause());
        verify(metrics, times(2)).onRefreshFailed("players/search", down);
        verify(sink, never()).changedRecord(any(), anyMap());
    }

    @Test
    void successfulTickResetsFailureCount() {
        IllegalStateException down = new IllegalStateException("store down");
        when(result.recount()).thenReturn(3).thenThrow(down).thenReturn(4).thenThrow(down);
        when(result.aggregations()).thenReturn(Optional.empty());
        AggregateRefresher refresher = refresher(index().maxConsecutiveRefreshFailures(2).build());
        refresher.prepare();

        refresher.refreshCount();
        refresher.refreshCount();
        refresher.refreshCount();

        assertTrue(fatal.isEmpty());
        verify(sink).changedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 4));
    }

    @Test
    void runningTallyFollowsObserverEvents() {
        when(result.count()).thenReturn(2);
        LiveResult live = mock(LiveResult.class);
        when(result.observe(any())).thenReturn(live);
        when(live.initialDocuments()).thenReturn(List.of());
        SearchIndexConfig config = index().countingStrategy(CountingStrategy.RUNNING_TALLY).build();
        ResultObserver observer = new ResultObserver(result, event -> { }, error -> { });
        AggregateRefresher refresher = new AggregateRefresher("players/search", fingerprint, config, result,
                observer, QueryOptions.DEFAULT_LIMIT, sink, scheduler, metrics, fatal::add);

        observer.start();
        observer.release();
        observer.onEvent(new DiffEvent.AddedAt(Document.of("D", Map.of()), 0, null));

        assertEquals(3, refresher.currentCount());
        verify(result, never()).recount();
    }

    @Test
    void runningTallyRecountsWhileThePageIsFull() {
        when(result.count()).thenReturn(3);
        LiveResult live = mock(LiveResult.class);
        when(result.observe(any())).thenReturn(live);
        when(live.initialDocuments()).thenReturn(List.of(Document.of("A", Map.of()), Document.of("B", Map.of())));
        when(result.recount()).thenReturn(4);
        SearchIndexConfig config = index().countingStrategy(CountingStrategy.RUNNING_TALLY).build();
        ResultObserver observer = new ResultObserver(result, event -> { }, error -> { });
        AggregateRefresher refresher = new AggregateRefresher("players/search", fingerprint, config, result,
                observer, 2, sink, scheduler, metrics, fatal::add);

        observer.start();
        observer.release();
        observer.onEvent(new DiffEvent.AddedAt(Document.of("D", Map.of()), 1, "B"));
        observer.onEvent(new DiffEvent.RemovedAt(Document.of("B", Map.of()), 2));

        assertEquals(4, refresher.currentCount());
    }

    @Test
    void engineStrategyRepublishesWhatTheEngineReports() {
        when(result.count()).thenReturn(3);
        when(result.aggregations()).thenReturn(Optional.empty());
        AggregateRefresher refresher = refresher(index().countingStrategy(CountingStrategy.ENGINE).build());
        refresher.prepare();

        refresher.refreshCount();

        verify(sink).changedRecord(fingerprint.countKey(), Map.of(AggregateRefresher.COUNT_FIELD, 3));
        verify(result, never()).recount();
    }

    @Test
    void rejectsNegativePageLimit() {
        ResultObserver observer = new ResultObserver(result, event -> { }, error -> { });
        assertThrows(IllegalArgumentException.class, () -> new AggregateRefresher("players/search", fingerprint,
                index().build(), result, observer, -1, sink, scheduler, metrics, fatal::add));
    }
}
