package io.llmanalytics.backpressure.store;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the number of in-flight calls to a delegate store, the way a client connection pool
 * bounds connections.
 *
 * A permit is held for exactly one logical operation; an {@link #atomically} transaction is one
 * logical operation and its inner calls go straight to the delegate on the same permit. Callers
 * wait for a free permit up to acquireTimeout and then get a BackingStoreException.
 *
 * {@link #acquireConnection()} checks a permit out for as long as the caller holds it, which is
 * how a connection-capacity test occupies the pool.
 */
public class PooledTimeOrderedStore implements TimeOrderedStore {
    private static final Logger logger = LoggerFactory.getLogger(PooledTimeOrderedStore.class);

    static final String PING_KEY = "pool:ping";

    private final TimeOrderedStore delegate;
    private final Semaphore permits;
    private final int poolSize;
    private final long acquireTimeoutNanos;

    public PooledTimeOrderedStore(TimeOrderedStore delegate, int poolSize, Duration acquireTimeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (poolSize <= 0)
            throw new IllegalArgumentException("poolSize must be > 0");
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        this.poolSize = poolSize;
        this.permits = new Semaphore(poolSize, true);
        this.acquireTimeoutNanos = acquireTimeout.toNanos();
    }

    @Override
    public void addTimedMember(String key, long score, String member) throws BackingStoreException {
        acquire();
        try {
            delegate.addTimedMember(key, score, member);
        } finally {
            permits.release();
        }
    }

    @Override
    public long removeMembersBelow(String key, long score) throws BackingStoreException {
        acquire();
        try {
            return delegate.removeMembersBelow(key, score);
        } finally {
            permits.release();
        }
    }

    @Override
    public long countMembers(String key) throws BackingStoreException {
        acquire();
        try {
            return delegate.countMembers(key);
        } finally {
            permits.release();
        }
    }

    @Override
    public void setTtl(String key, Duration ttl) throws BackingStoreException {
        acquire();
        try {
            delegate.setTtl(key, ttl);
        } finally {
            permits.release();
        }
    }

    @Override
    public <T> T atomically(String key, StoreTransaction<T> tx) throws BackingStoreException {
        acquire();
        try {
            return delegate.atomically(key, tx);
        } finally {
            permits.release();
        }
    }

    /**
     * Holds one permit until the returned connection is closed.
     *
     * @throws BackingStoreException when no permit frees up within acquireTimeout
     */
    public Connection acquireConnection() throws BackingStoreException {
        acquire();
        return new Connection();
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int availableConnections() {
        return permits.availablePermits();
    }

    private void acquire() throws BackingStoreException {
        try {
            if (!permits.tryAcquire(acquireTimeoutNanos, TimeUnit.NANOSECONDS)) {
                logger.debug("No free connection after {} ms (pool size {})",
                    TimeUnit.NANOSECONDS.toMillis(acquireTimeoutNanos), poolSize);
                throw new BackingStoreException("connection pool exhausted (size " + poolSize + ")");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BackingStoreException("interrupted while waiting for a connection", ie);
        }
    }

    /**
     * A checked-out permit. Calls made through it go to the delegate without touching the pool.
     */
    public final class Connection implements AutoCloseable {
        private final AtomicBoolean closed = new AtomicBoolean();

        private Connection() {
        }

        /**
         * Round trip to the delegate store.
         */
        public void ping() throws BackingStoreException {
            if (closed.get())
                throw new BackingStoreException("connection already closed");
            delegate.countMembers(PING_KEY);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true))
                permits.release();
        }
    }
}
