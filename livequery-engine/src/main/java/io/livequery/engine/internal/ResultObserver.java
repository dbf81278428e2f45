// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.internal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import io.livequery.core.model.DiffEvent;
import io.livequery.core.model.Document;
import io.livequery.engine.spi.DiffListener;
import io.livequery.engine.spi.LiveResult;
import io.livequery.engine.spi.SearchResult;

/**
 * Binds one search result to one session.
 *
 * <p>{@link #start()} returns the initial ordered documents. Diff events that
 * arrive before the session calls {@link #release()} are held back and replayed
 * in order, so the subscriber always sees the initial result first. Delivery is
 * serialized on this observer's monitor.
 *
 * <p>The observer also keeps the running tally used by
 * {@link io.livequery.engine.CountingStrategy#RUNNING_TALLY}, and the size of the
 * observed page, which tells whether the limit may hide further matches.
 */
public final class ResultObserver implements DiffListener {

    private final SearchResult result;
    private final Consumer<DiffEvent> onEvent;
    private final Consumer<Throwable> onError;
    private final AtomicInteger tally = new AtomicInteger();
    private final AtomicInteger pageSize = new AtomicInteger();

    // guarded by this
    private final Deque<DiffEvent> held = new ArrayDeque<>();
    private boolean released;
    private boolean stopped;

    private volatile LiveResult live;

    public ResultObserver(SearchResult result, Consumer<DiffEvent> onEvent, Consumer<Throwable> onError) {
        this.result = Objects.requireNonNull(result, "result");
        this.onEvent = Objects.requireNonNull(onEvent, "onEvent");
        this.onError = Objects.requireNonNull(onError, "onError");
    }

    /**
     * Starts observing and returns the initial ordered result.
     *
     * @return the initial documents, in result order
     */
    public List<Document> start() {
        tally.set(result.count());
        LiveResult observed = result.observe(this);
        this.live = observed;
        List<Document> initial = List.copyOf(observed.initialDocuments());
        pageSize.set(initial.size());
        return initial;
    }

    /**
     * Replays held events, then lets further events through directly. Events
     * that arrive while the replay runs are queued behind the held ones. The
     * replay ends early if delivering an event stops this observer.
     */
    public synchronized void release() {
        if (released) {
            return;
        }
        while (!stopped && !held.isEmpty()) {
            onEvent.accept(held.pollFirst());
        }
        held.clear();
        released = true;
    }

    @Override
    public synchronized void onEvent(DiffEvent event) {
        if (stopped) {
            return;
        }
        if (event instanceof DiffEvent.AddedAt) {
            tally.incrementAndGet();
            pageSize.incrementAndGet();
        } else if (event instanceof DiffEvent.RemovedAt) {
            tally.decrementAndGet();
            pageSize.decrementAndGet();
        }
        if (released) {
            onEvent.accept(event);
        } else {
            held.addLast(event);
        }
    }

    @Override
    public void onError(Throwable error) {
        synchronized (this) {
            if (stopped) {
                return;
            }
        }
        onError.accept(error);
    }

    public int runningTally() {
        return tally.get();
    }

    /**
     * Returns the number of documents currently on the observed page.
     *
     * @return the page size
     */
    public int pageSize() {
        return pageSize.get();
    }

    /**
     * Stops the underlying diff stream. Idempotent.
     */
    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
            held.clear();
        }
        LiveResult observed = live;
        if (observed != null) {
            observed.stop();
        }
    }
}
