// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.client;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.livequery.core.error.LiveQueryException;
import io.livequery.core.model.QueryDefinition;
import io.livequery.core.model.QueryFingerprint;
import io.livequery.core.model.QueryOptions;
import io.livequery.core.model.ReservedFields;
import io.livequery.engine.PublicationChannel;
import io.livequery.engine.RequestContext;
import io.livequery.engine.SubscriptionHandle;
import io.livequery.engine.SubscriptionRegistry;

/**
 * One client connection to a {@link SubscriptionRegistry}.
 *
 * <p>All subscriptions of the client publish into one shared
 * {@link LocalCollection}; their records are kept apart by query fingerprint.
 * Identical queries (same definition and options) share a subscription. Queries
 * with the same fingerprint but a different limit or sort field would write the
 * same records, so the newer one replaces the older subscription; cursors
 * obtained earlier then read the replacement's records.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (LiveSearchClient client = new LiveSearchClient(registry, RequestContext.user("conn-1", "alice"))) {
 *     SearchCursor cursor = client.find(QueryDefinition.text("marie"), QueryOptions.defaults());
 *     ResultView view = cursor.view();
 *     view.documents().forEach(System.out::println);
 * }
 * }</pre>
 */
public final class LiveSearchClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveSearchClient.class);

    private final SubscriptionRegistry registry;
    private final RequestContext context;
    private final LocalCollection local = new LocalCollection();
    private final ConcurrentHashMap<QueryFingerprint, ClientSubscription> subscriptions = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Runnable> stopCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    public LiveSearchClient(SubscriptionRegistry registry, RequestContext context) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Subscribes to a query, or reuses the existing subscription for it, and
     * returns a cursor over its locally mirrored results.
     *
     * @param definition the query definition
     * @param options    the query options
     * @return a cursor bound to the query
     * @throws LiveQueryException if the subscription is rejected or fails to start
     * @throws IllegalStateException if the client is disconnected
     */
    public SearchCursor find(QueryDefinition definition, QueryOptions options) {
        if (disconnected.get()) {
            throw new IllegalStateException("client is disconnected");
        }
        QueryFingerprint fingerprint = QueryFingerprint.of(definition, options);
        ClientSubscription subscription = subscriptions.get(fingerprint);
        if (subscription != null && subscription.isActive() && !subscription.serves(options)) {
            log.debug("Replacing subscription for {}: limit or sort field changed", fingerprint.value());
            subscription.stop();
            subscription = null;
        }
        if (subscription == null || !subscription.isActive()) {
            subscription = subscribe(definition, options, fingerprint);
        }
        return new SearchCursor(local, registry.collectionName(), fingerprint, subscription);
    }

    /**
     * Simulates loss of the connection: every subscription is torn down as the
     * transport would on disconnect, and the local mirror is cleared.
     */
    public void disconnect() {
        if (!disconnected.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : stopCallbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Stop callback failed on disconnect of {}", context.connectionId(), e);
            }
        }
        stopCallbacks.clear();
        subscriptions.clear();
        local.clear();
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public LocalCollection localCollection() {
        return local;
    }

    @Override
    public void close() {
        disconnect();
    }

    private ClientSubscription subscribe(QueryDefinition definition, QueryOptions options,
            QueryFingerprint fingerprint) {
        ClientSubscription subscription = new ClientSubscription(fingerprint, options);
        subscriptions.put(fingerprint, subscription);
        try {
            subscription.handle = registry.subscribe(context, definition, options, subscription);
        } catch (RuntimeException e) {
            subscriptions.remove(fingerprint, subscription);
            throw e;
        }
        return subscription;
    }

    /**
     * The channel of one subscription; writes into the shared local mirror.
     */
    final class ClientSubscription implements PublicationChannel {
        private final QueryFingerprint fingerprint;
        private final QueryOptions options;
        private volatile @Nullable SubscriptionHandle handle;
        private volatile boolean ready;
        private volatile @Nullable LiveQueryException error;
        private final List<Runnable> ownCallbacks = new CopyOnWriteArrayList<>();

        ClientSubscription(QueryFingerprint fingerprint, QueryOptions options) {
            this.fingerprint = fingerprint;
            this.options = options;
        }

        @Override
        public void added(String collection, String key, Map<String, @Nullable Object> fields) {
            local.added(collection, key, fields);
        }

        @Override
        public void changed(String collection, String key, Map<String, @Nullable Object> fields) {
            local.changed(collection, key, fields);
        }

        @Override
        public void removed(String collection, String key) {
            local.removed(collection, key);
        }

        @Override
        public void ready() {
            ready = true;
        }

        @Override
        public void error(LiveQueryException failure) {
            error = failure;
            subscriptions.remove(fingerprint, this);
        }

        @Override
        public void onStop(Runnable callback) {
            ownCallbacks.add(callback);
            stopCallbacks.add(callback);
        }

        boolean isReady() {
            return ready;
        }

        @Nullable LiveQueryException error() {
            return error;
        }

        /** Props are already equal when fingerprints match. */
        boolean serves(QueryOptions requested) {
            return options.limit() == requested.limit()
                    && Objects.equals(options.sortField(), requested.sortField());
        }

        boolean isActive() {
            SubscriptionHandle current = handle;
            return error == null && (current == null || current.isActive());
        }

        void stop() {
            SubscriptionHandle current = handle;
            if (current != null) {
                current.stop();
            }
            stopCallbacks.removeAll(ownCallbacks);
            subscriptions.remove(fingerprint, this);
            local.removeIf(registry.collectionName(), (key, fields) ->
                    key.equals(fingerprint.countKey())
                            || key.equals(fingerprint.aggregationsKey())
                            || (fingerprint.definition().equals(fields.get(ReservedFields.SEARCH_DEFINITION))
                                    && fingerprint.options().equals(fields.get(ReservedFields.SEARCH_OPTIONS))));
        }
    }
}
