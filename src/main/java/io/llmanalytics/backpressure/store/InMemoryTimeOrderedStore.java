package io.llmanalytics.backpressure.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory TimeOrderedStore used by the load harness and tests.
 *
 * Each key owns a slot holding an ordered set of (score, member) pairs and its own
 * ReentrantLock, so single-key transactions never contend with other keys. Expiry is lazy:
 * a key whose TTL elapsed is emptied the next time it is touched, and a key left empty is
 * dropped from memory together with its slot. {@link #keyCount()} sweeps every slot.
 */
public class InMemoryTimeOrderedStore implements TimeOrderedStore {

    private static final Comparator<ScoredMember> ORDER =
        Comparator.comparingLong((ScoredMember m) -> m.score).thenComparing(m -> m.member);

    private final ConcurrentHashMap<String, KeySlot> slots = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTimeOrderedStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTimeOrderedStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void addTimedMember(String key, long score, String member) {
        Objects.requireNonNull(member, "member");
        KeySlot slot = lockSlot(key);
        try {
            slot.expireIfDue(clock.millis());
            Long previous = slot.scores.put(member, score);
            if (previous != null) {
                slot.ordered.remove(new ScoredMember(previous, member));
            }
            slot.ordered.add(new ScoredMember(score, member));
        } finally {
            unlock(key, slot);
        }
    }

    @Override
    public long removeMembersBelow(String key, long score) {
        KeySlot slot = lockSlot(key);
        try {
            slot.expireIfDue(clock.millis());
            long removed = 0;
            Iterator<ScoredMember> it = slot.ordered.iterator();
            while (it.hasNext()) {
                ScoredMember m = it.next();
                if (m.score >= score)
                    break;
                it.remove();
                slot.scores.remove(m.member);
                removed++;
            }
            return removed;
        } finally {
            unlock(key, slot);
        }
    }

    @Override
    public long countMembers(String key) {
        KeySlot slot = lockSlot(key);
        try {
            slot.expireIfDue(clock.millis());
            return slot.ordered.size();
        } finally {
            unlock(key, slot);
        }
    }

    @Override
    public void setTtl(String key, Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        KeySlot slot = lockSlot(key);
        try {
            long now = clock.millis();
            slot.expireIfDue(now);
            // setting a TTL on a missing key is a no-op, as in ordered-set stores
            if (!slot.ordered.isEmpty()) {
                slot.expiresAtMillis = now + ttl.toMillis();
            }
        } finally {
            unlock(key, slot);
        }
    }

    /**
     * Runs tx holding the key's lock. The lock is reentrant, so the operations tx issues on
     * this store for the same key proceed without blocking. The slot is not evicted before tx
     * returns, even if tx empties it midway.
     */
    @Override
    public <T> T atomically(String key, StoreTransaction<T> tx) throws BackingStoreException {
        KeySlot slot = lockSlot(key);
        try {
            return tx.execute(this);
        } finally {
            unlock(key, slot);
        }
    }

    /**
     * Number of keys currently holding at least one live member. Expired and empty keys found on
     * the way are evicted.
     */
    public int keyCount() {
        long now = clock.millis();
        int live = 0;
        for (Map.Entry<String, KeySlot> e : slots.entrySet()) {
            KeySlot slot = e.getValue();
            slot.lock.lock();
            try {
                if (slot.dead)
                    continue;
                slot.expireIfDue(now);
                if (!slot.ordered.isEmpty())
                    live++;
            } finally {
                unlock(e.getKey(), slot);
            }
        }
        return live;
    }

    /**
     * Score currently stored for member, or null when absent. Helper for tests.
     */
    public Long scoreOf(String key, String member) {
        KeySlot slot = lockSlot(key);
        try {
            slot.expireIfDue(clock.millis());
            return slot.scores.get(member);
        } finally {
            unlock(key, slot);
        }
    }

    /**
     * Slots held in memory, live or not yet swept.
     */
    int retainedSlots() {
        return slots.size();
    }

    private KeySlot lockSlot(String key) {
        Objects.requireNonNull(key, "key");
        while (true) {
            KeySlot slot = slots.computeIfAbsent(key, k -> new KeySlot());
            slot.lock.lock();
            if (!slot.dead)
                return slot;
            // evicted between lookup and lock; a fresh slot is (or will be) in the map
            slot.lock.unlock();
        }
    }

    // an empty slot leaves the map only when its outermost holder releases it
    private void unlock(String key, KeySlot slot) {
        try {
            if (slot.ordered.isEmpty() && slot.lock.getHoldCount() == 1 && !slot.dead) {
                slot.dead = true;
                slots.remove(key, slot);
            }
        } finally {
            slot.lock.unlock();
        }
    }

    private static final class KeySlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final TreeSet<ScoredMember> ordered = new TreeSet<>(ORDER);
        private final Map<String, Long> scores = new HashMap<>();
        private long expiresAtMillis = Long.MAX_VALUE;
        private boolean dead;

        // caller holds lock; a key is still alive at exactly its expiry instant
        private void expireIfDue(long nowMillis) {
            if (nowMillis > expiresAtMillis) {
                ordered.clear();
                scores.clear();
                expiresAtMillis = Long.MAX_VALUE;
            }
        }
    }

    private static final class ScoredMember {
        private final long score;
        private final String member;

        private ScoredMember(long score, String member) {
            this.score = score;
            this.member = member;
        }
    }
}
