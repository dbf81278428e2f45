// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryOptions;
import io.livequery.engine.internal.SubscriptionSession;
import io.livequery.engine.spi.SearchEngine;

/**
 * Serves live search subscriptions for one index and tracks every active session.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (SubscriptionRegistry registry = new SubscriptionRegistry(index, engine)) {
 *     SubscriptionHandle handle = registry.subscribe(
 *             RequestContext.user("conn-1", "alice"),
 *             QueryDefinition.text("marie"),
 *             QueryOptions.defaults(),
 *             channel);
 *     // ... messages flow to channel ...
 *     handle.stop();
 * }
 * }</pre>
 *
 * <p>
 * A session is removed from the registry whenever it stops: explicit
 * {@link SubscriptionHandle#stop()}, {@link #connectionLost(String)}, the
 * channel's own stop callback, or an asynchronous query or refresh failure.
 *
 * <p>
 * <b>Scheduler ownership:</b> a scheduler passed to the constructor is NOT shut
 * down by {@link #close()}; one created internally is.
 */
public final class SubscriptionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private static final String DEFAULT_ENGINE_INDEX_NAME = "search";

    private final SearchIndexConfig index;
    private final SearchEngine engine;
    private final ScheduledExecutorService scheduler;
    /** True if we created the scheduler internally and are responsible for shutting it down. */
    private final boolean ownsScheduler;
    private final String collectionName;

    private final ConcurrentHashMap<String, SubscriptionSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile LiveQueryMetrics metrics = LiveQueryMetrics.noop();

    public SubscriptionRegistry(SearchIndexConfig index, SearchEngine engine) {
        this(index, engine, LiveQueryExecutors.newRefreshScheduler(), true);
    }

    public SubscriptionRegistry(SearchIndexConfig index, SearchEngine engine, ScheduledExecutorService scheduler) {
        this(index, engine, scheduler, false);
    }

    private SubscriptionRegistry(SearchIndexConfig index, SearchEngine engine, ScheduledExecutorService scheduler,
            boolean ownsScheduler) {
        this.index = Objects.requireNonNull(index, "index");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        String engineIndexName = engine.indexName();
        this.collectionName = index.name() + "/"
                + (engineIndexName != null ? engineIndexName : DEFAULT_ENGINE_INDEX_NAME);
    }

    /**
     * Sets a custom metrics collector for observability.
     *
     * @param metrics the metrics collector (must not be null)
     * @throws NullPointerException if metrics is null
     */
    public void setMetrics(LiveQueryMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Returns the name every message of this registry is published under:
     * {@code indexName + "/" + engineIndexName}.
     *
     * @return the collection name
     */
    public String collectionName() {
        return collectionName;
    }

    /**
     * Subscribes a channel to the live result of a query.
     *
     * <p>
     * On return the channel has received the initial result as {@code added}
     * messages in result order, the count record, the aggregation record if the
     * engine produces one, and {@code ready()}.
     *
     * @param context    who is subscribing, and over which connection
     * @param definition the query definition
     * @param options    the query options
     * @param channel    receives the subscription's messages
     * @return a handle to stop the subscription
     * @throws io.livequery.core.error.NotAllowedException if the permission check fails
     * @throws io.livequery.core.error.QueryValidationException if the parameters are invalid
     * @throws io.livequery.core.error.QueryExecutionException if the initial evaluation fails
     * @throws IllegalStateException if the registry is closed
     */
    public SubscriptionHandle subscribe(RequestContext context, QueryDefinition definition, QueryOptions options,
            PublicationChannel channel) {
        Objects.requireNonNull(channel, "channel");
        if (closed.get()) {
            throw new IllegalStateException("SubscriptionRegistry for " + collectionName + " is closed");
        }

        String id = "sub-" + idGenerator.getAndIncrement();
        SubscriptionSession session = new SubscriptionSession(id, collectionName, context, definition, options,
                index, engine, channel, scheduler, metrics, this::onTerminated);
        sessions.put(id, session);

        session.start();
        channel.onStop(session::stop);

        if (closed.get()) {
            // close() raced with this subscribe
            session.stop();
        }
        return session;
    }

    /**
     * Stops every session of a connection, as when the underlying channel is lost.
     *
     * @param connectionId the lost connection
     * @return the number of sessions stopped
     */
    public int connectionLost(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        List<SubscriptionSession> affected = new ArrayList<>();
        for (SubscriptionSession session : sessions.values()) {
            if (session.connectionId().equals(connectionId)) {
                affected.add(session);
            }
        }
        affected.forEach(SubscriptionSession::stop);
        if (!affected.isEmpty()) {
            log.debug("Connection {} lost, stopped {} sessions on {}", connectionId, affected.size(), collectionName);
        }
        return affected.size();
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Stops every session and releases the scheduler if it was created internally.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return; // Already closed
        }
        new ArrayList<>(sessions.values()).forEach(SubscriptionSession::stop);
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.debug("SubscriptionRegistry for {} closed", collectionName);
    }

    private void onTerminated(SubscriptionSession session) {
        sessions.remove(session.id(), session);
    }
}
