package com.courtdata.scraper.service.core;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opaque handle on one remote browsing session. Owned by a single search run
 * and passed explicitly to every page operation.
 * <p>Closing is idempotent: the first {@link #close()} releases the
 * underlying resources, later calls do nothing.</p>
 */
public abstract class BrowserSession implements AutoCloseable {

    private final UUID id = UUID.randomUUID();
    private final AtomicBoolean closed = new AtomicBoolean();

    public UUID getId() {
        return id;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public final void close() {
        if (closed.compareAndSet(false, true)) {
            release();
        }
    }

    /**
     * Fails fast when the session was already torn down.
     */
    protected void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Browser session " + id + " is closed");
        }
    }

    /** Releases everything the session holds. Called at most once. */
    protected abstract void release();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + (isClosed() ? ", closed]" : "]");
    }
}
