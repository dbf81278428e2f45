// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.error.LiveQueryException;
import io.livequery.core.error.RefreshException;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.engine.LiveQueryMetrics;
import io.livequery.engine.SearchIndexConfig;
import io.livequery.engine.spi.SearchResult;

/**
 * Keeps the count and aggregation records of one session fresh.
 *
 * <p>Lifecycle: {@link #prepare()} computes the baseline values,
 * {@link #publishBaseline()} publishes them (count always, aggregations only
 * when the engine produces them), {@link #start()} schedules the enabled
 * refresh timers and {@link #cancel()} cancels them. Each timer has its own
 * handle; both are cancelled exactly once.
 *
 * <p>Refresh values are computed outside the session monitor and published
 * through the session's {@link MessageSink}, which drops them after stop.
 */
public final class AggregateRefresher {

    private static final Logger log = LoggerFactory.getLogger(AggregateRefresher.class);

    static final String COUNT_FIELD = "count";
    static final String AGGREGATIONS_FIELD = "aggregations";

    private final String collection;
    private final QueryFingerprint fingerprint;
    private final SearchIndexConfig index;
    private final SearchResult result;
    private final ResultObserver observer;
    private final int pageLimit;
    private final MessageSink sink;
    private final ScheduledExecutorService scheduler;
    private final LiveQueryMetrics metrics;
    private final Consumer<LiveQueryException> onFatal;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private int baselineCount;
    private @Nullable Object baselineAggregations;

    // guarded by this
    private @Nullable ScheduledFuture<?> countTimer;
    private @Nullable ScheduledFuture<?> aggregationTimer;
    private boolean cancelled;

    public AggregateRefresher(String collection, QueryFingerprint fingerprint, SearchIndexConfig index,
            SearchResult result, ResultObserver observer, int pageLimit, MessageSink sink,
            ScheduledExecutorService scheduler, LiveQueryMetrics metrics, Consumer<LiveQueryException> onFatal) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.index = Objects.requireNonNull(index, "index");
        this.result = Objects.requireNonNull(result, "result");
        this.observer = Objects.requireNonNull(observer, "observer");
        if (pageLimit < 0) {
            throw new IllegalArgumentException("pageLimit must be >= 0, got: " + pageLimit);
        }
        this.pageLimit = pageLimit;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.onFatal = Objects.requireNonNull(onFatal, "onFatal");
    }

    /**
     * Computes the baseline count and aggregations. Failures propagate to the caller.
     */
    public void prepare() {
        baselineCount = currentCount();
        baselineAggregations = result.aggregations().orElse(null);
    }

    public void publishBaseline() {
        sink.addedRecord(fingerprint.countKey(), Map.of(COUNT_FIELD, baselineCount));
        if (baselineAggregations != null) {
            sink.addedRecord(fingerprint.aggregationsKey(), Map.of(AGGREGATIONS_FIELD, baselineAggregations));
        }
    }

    /**
     * Schedules the refresh timers enabled by the index configuration. Aggregation
     * refresh only runs when the baseline produced aggregations.
     */
    public synchronized void start() {
        if (cancelled) {
            return;
        }
        long countInterval = index.countUpdateIntervalMs();
        if (countInterval > 0 && countTimer == null) {
            countTimer = scheduler.scheduleAtFixedRate(
                    this::refreshCount, countInterval, countInterval, TimeUnit.MILLISECONDS);
        }
        long aggsInterval = index.aggsUpdateIntervalMs();
        if (baselineAggregations != null && aggsInterval > 0 && aggregationTimer == null) {
            aggregationTimer = scheduler.scheduleAtFixedRate(
                    this::refreshAggregations, aggsInterval, aggsInterval, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Cancels both timers. Idempotent, and safe when none were started.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (countTimer != null) {
            countTimer.cancel(false);
            countTimer = null;
        }
        if (aggregationTimer != null) {
            aggregationTimer.cancel(false);
            aggregationTimer = null;
        }
    }

    void refreshCount() {
        try {
            int count = currentCount();
            sink.changedRecord(fingerprint.countKey(), Map.of(COUNT_FIELD, count));
            consecutiveFailures.set(0);
        } catch (RuntimeException e) {
            onFailure("count", e);
        }
    }

    void refreshAggregations() {
        try {
            Optional<Object> aggregations = result.aggregations();
            if (aggregations.isPresent()) {
                sink.changedRecord(fingerprint.aggregationsKey(), Map.of(AGGREGATIONS_FIELD, aggregations.get()));
            }
            consecutiveFailures.set(0);
        } catch (RuntimeException e) {
            onFailure("aggregation", e);
        }
    }

    int currentCount() {
        switch (index.countingStrategy()) {
            case FULL_RECOUNT:
                return result.recount();
            case ENGINE:
                return result.count();
            case RUNNING_TALLY:
                // a full page may hide matches beyond the limit
                return observer.pageSize() < pageLimit
                        ? Math.max(0, observer.runningTally())
                        : result.recount();
            default:
                throw new IllegalStateException("unknown counting strategy: " + index.countingStrategy());
        }
    }

    private void onFailure(String what, RuntimeException error) {
        int failures = consecutiveFailures.incrementAndGet();
        metrics.onRefreshFailed(collection, error);
        log.warn("{} refresh failed for {} ({} in a row)", what, collection, failures, error);
        if (failures >= index.maxConsecutiveRefreshFailures()) {
            onFatal.accept(new RefreshException(
                    what + " refresh failed " + failures + " times in a row for " + collection, failures, error));
        }
    }

    public synchronized boolean isCountTimerActive() {
        return countTimer != null;
    }

    public synchronized boolean isAggregationTimerActive() {
        return aggregationTimer != null;
    }
}
