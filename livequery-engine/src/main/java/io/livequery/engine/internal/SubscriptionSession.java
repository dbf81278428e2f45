// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.DebugLogger;
import io.livequery.core.error.LiveQueryException;
import io.livequery.core.error.NotAllowedException;
import io.livequery.core.error.QueryExecutionException;
import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;
import io.livequery.core.model.EventKind;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.LiveQueryMetrics;
import io.livequery.engine.PublicationChannel;
import io.livequery.engine.RequestContext;
import io.livequery.engine.SearchIndexConfig;
import io.livequery.engine.SessionState;
import io.livequery.engine.SubscriptionHandle;
import io.livequery.engine.spi.SearchEngine;
import io.livequery.engine.spi.SearchResult;

/**
 * One subscription: owns its result observer, diff publisher and refresh timers.
 *
 * <p><b>Thread Safety:</b> diff events, refresh ticks and {@link #stop()} may run on
 * different threads. Every message is published while holding the session
 * monitor and only after checking the stopped flag, and {@code stop()} sets that
 * flag under the same monitor. Once {@code stop()} returns nothing more is
 * published. Timers and the observer are released outside the monitor, exactly
 * once, whichever path stopped the session.
 */
public final class SubscriptionSession implements SubscriptionHandle {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSession.class);

    private final String id;
    private final String collection;
    private final RequestContext context;
    private final QueryDefinition definition;
    private final QueryOptions options;
    private final SearchIndexConfig index;
    private final SearchEngine engine;
    private final PublicationChannel channel;
    private final ScheduledExecutorService scheduler;
    private final LiveQueryMetrics metrics;
    private final Consumer<SubscriptionSession> onTerminated;

    private final Object lock = new Object();
    private final MessageSink sink = new GuardedSink();

    // guarded by lock
    private SessionState state = SessionState.INITIALIZING;
    private boolean stopped;

    private volatile @Nullable QueryFingerprint fingerprint;
    private volatile @Nullable DiffPublisher publisher;
    private volatile @Nullable ResultObserver observer;
    private volatile @Nullable AggregateRefresher refresher;

    public SubscriptionSession(String id, String collection, RequestContext context, QueryDefinition definition,
            QueryOptions options, SearchIndexConfig index, SearchEngine engine, PublicationChannel channel,
            ScheduledExecutorService scheduler, LiveQueryMetrics metrics, Consumer<SubscriptionSession> onTerminated) {
        this.id = Objects.requireNonNull(id, "id");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.context = Objects.requireNonNull(context, "context");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.options = Objects.requireNonNull(options, "options");
        this.index = Objects.requireNonNull(index, "index");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.onTerminated = Objects.requireNonNull(onTerminated, "onTerminated");
    }

    /**
     * Runs the session from {@code INITIALIZING} to {@code STREAMING}: checks
     * permission, validates parameters, evaluates the query, publishes the initial
     * result with the count and aggregation baselines and signals ready.
     *
     * @throws NotAllowedException if the permission check fails
     * @throws io.livequery.core.error.QueryValidationException if the parameters are invalid
     * @throws QueryExecutionException if the initial evaluation fails
     */
    public void start() {
        DebugLogger.logLifecycle("[SESSION-START] id={} collection={} connection={}",
                id, collection, context.connectionId());

        if (!index.permission().allowed(context, options)) {
            metrics.onAuthorizationDenied(collection);
            stop();
            throw new NotAllowedException(index.name());
        }

        final List<Document> initial;
        try {
            engine.checkSearchParam(definition, options, index);
            QueryFingerprint fp = QueryFingerprint.of(definition, options);
            this.fingerprint = fp;
            this.publisher = new DiffPublisher(fp, index.beforePublish(), index.transform(), index.store(), sink);

            SearchResult result = engine.search(definition, options, index);
            ResultObserver resultObserver = new ResultObserver(result, this::onDiff, this::onObserverError);
            this.observer = resultObserver;
            initial = resultObserver.start();

            AggregateRefresher aggregateRefresher = new AggregateRefresher(collection, fp, index, result,
                    resultObserver, options.limit(), sink, scheduler, metrics, this::fail);
            this.refresher = aggregateRefresher;
            aggregateRefresher.prepare();
        } catch (LiveQueryException e) {
            stop();
            throw e;
        } catch (RuntimeException e) {
            metrics.onQueryFailed(collection, e);
            stop();
            throw new QueryExecutionException("Initial evaluation failed for " + collection, e);
        }

        RuntimeException failure = null;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            try {
                publisher.publishInitial(initial);
                refresher.publishBaseline();
                channel.ready();
                state = SessionState.STREAMING;
                refresher.start();
            } catch (RuntimeException e) {
                failure = e;
            }
        }
        if (failure != null) {
            metrics.onQueryFailed(collection, failure);
            stop();
            throw new QueryExecutionException("Initial publication failed for " + collection, failure);
        }

        metrics.onSubscribed(collection);
        log.debug("Session {} streaming {} documents of {}", id, initial.size(), collection);
        observer.release();
    }

    @Override
    public String id() {
        return id;
    }

    public String connectionId() {
        return context.connectionId();
    }

    public @Nullable QueryFingerprint fingerprint() {
        return fingerprint;
    }

    @Override
    public SessionState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Stops the session. Idempotent and safe in any state.
     */
    @Override
    public void stop() {
        synchronized (lock) {
            if (!markStopped()) {
                return;
            }
        }
        release();
    }

    /**
     * Terminates the session with an asynchronous error: the channel receives the
     * error as its last message, then the session is released.
     *
     * @param error the failure
     */
    void fail(LiveQueryException error) {
        synchronized (lock) {
            if (!markStopped()) {
                return;
            }
            log.warn("Session {} on {} terminated: {}", id, collection, error.getMessage());
            try {
                channel.error(error);
            } catch (RuntimeException e) {
                log.warn("Failed to deliver error to channel of session {}", id, e);
            }
        }
        release();
    }

    private void onDiff(DiffEvent event) {
        RuntimeException failure = null;
        synchronized (lock) {
            if (stopped) {
                return;
            }
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                failure = e;
            }
        }
        if (failure != null) {
            metrics.onQueryFailed(collection, failure);
            fail(new QueryExecutionException(
                    "Publishing " + event.kind().wireName() + " failed for " + collection, failure));
        }
    }

    private void onObserverError(Throwable error) {
        metrics.onQueryFailed(collection, error);
        fail(new QueryExecutionException("Observing " + collection + " failed", error));
    }

    // requires lock
    private boolean markStopped() {
        if (stopped) {
            return false;
        }
        stopped = true;
        state = SessionState.STOPPED;
        return true;
    }

    private void release() {
        AggregateRefresher aggregateRefresher = refresher;
        if (aggregateRefresher != null) {
            aggregateRefresher.cancel();
        }
        ResultObserver resultObserver = observer;
        if (resultObserver != null) {
            try {
                resultObserver.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping observer of session {}", id, e);
            }
        }
        metrics.onStopped(collection);
        onTerminated.accept(this);
        DebugLogger.logLifecycle("[SESSION-STOP] id={} collection={}", id, collection);
    }

    /**
     * Sink handed to the publisher and refresher; drops messages after stop.
     */
    private final class GuardedSink implements MessageSink {

        @Override
        public void added(String key, Map<String, @Nullable Object> fields, EventKind cause) {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                channel.added(collection, key, fields);
                metrics.onMessage(collection, cause);
                DebugLogger.logPublish("[ADDED] session={} key={} fields={}", id, key, fields);
            }
        }

        @Override
        public void changed(String key, Map<String, @Nullable Object> fields, EventKind cause) {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                channel.changed(collection, key, fields);
                metrics.onMessage(collection, cause);
                DebugLogger.logPublish("[CHANGED] session={} key={} fields={}", id, key, fields);
            }
        }

        @Override
        public void removed(String key) {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                channel.removed(collection, key);
                metrics.onMessage(collection, EventKind.REMOVED_AT);
                DebugLogger.logPublish("[REMOVED] session={} key={}", id, key);
            }
        }

        @Override
        public void addedRecord(String key, Map<String, @Nullable Object> fields) {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                channel.added(collection, key, fields);
                DebugLogger.logPublish("[RECORD-ADDED] session={} key={} fields={}", id, key, fields);
            }
        }

        @Override
        public void changedRecord(String key, Map<String, @Nullable Object> fields) {
            synchronized (lock) {
                if (stopped) {
                    return;
                }
                channel.changed(collection, key, fields);
                DebugLogger.logPublish("[RECORD-CHANGED] session={} key={} fields={}", id, key, fields);
            }
        }
    }
}
