package io.llmanalytics.backpressure.store;

import java.time.Duration;

/**
 * External - an addressable, per-key set of members ordered by a numeric score
 * (an ordered-set store, a table indexed on time, an in-memory structure).
 */
public interface TimeOrderedStore {

    /**
     * Adds member with the given score under key. Re-adding an existing member replaces its score.
     */
    void addTimedMember(String key, long score, String member) throws BackingStoreException;

    /**
     * Removes every member of key whose score is strictly below the given score.
     * Returns the number of members removed.
     */
    long removeMembersBelow(String key, long score) throws BackingStoreException;

    long countMembers(String key) throws BackingStoreException;

    /**
     * (Re)sets the time-to-live of key. When it elapses the key and all its members disappear.
     */
    void setTtl(String key, Duration ttl) throws BackingStoreException;

    /**
     * Runs tx with key isolated from concurrent callers. Implementations that can isolate a key
     * (a lock, MULTI/EXEC, a server-side script) must override this; the default gives no isolation.
     */
    default <T> T atomically(String key, StoreTransaction<T> tx) throws BackingStoreException {
        return tx.execute(this);
    }
}
