package com.balancebeam.core.upstream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks which upstreams are currently considered alive.
 * <p>
 * The address list is fixed at construction and indices stay stable for the
 * lifetime of the registry. Liveness flags are guarded by a single
 * reader/writer lock: routing decisions take the read lock and may run
 * concurrently, while health-check cycles and failure-induced kills take the
 * write lock. Every upstream starts alive.
 * </p>
 */
public class UpstreamRegistry {

    private final List<UpstreamAddress> addresses;
    private final boolean[] alive;
    private int liveCount;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates a registry with every upstream marked alive.
     *
     * @param addresses Upstream addresses in configuration order.
     */
    public UpstreamRegistry(List<UpstreamAddress> addresses) {
        this.addresses = Collections.unmodifiableList(new ArrayList<>(addresses));
        this.alive = new boolean[addresses.size()];
        Arrays.fill(alive, true);
        this.liveCount = addresses.size();
    }

    public int size() {
        return addresses.size();
    }

    public UpstreamAddress address(int idx) {
        return addresses.get(idx);
    }

    public List<UpstreamAddress> addresses() {
        return addresses;
    }

    public boolean isAlive(int idx) {
        lock.readLock().lock();
        try {
            return alive[idx];
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean allDead() {
        return liveCount() == 0;
    }

    public int liveCount() {
        lock.readLock().lock();
        try {
            return liveCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Marks an upstream dead. No-op if it is already dead.
     *
     * @param idx Upstream index.
     */
    public void setDead(int idx) {
        lock.writeLock().lock();
        try {
            markDead(idx);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks an upstream alive. No-op if it is already alive.
     *
     * @param idx Upstream index.
     */
    public void setAlive(int idx) {
        lock.writeLock().lock();
        try {
            markAlive(idx);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies one health-check cycle. All flags change under a single write
     * lock acquisition, so readers see either the previous cycle or this one.
     *
     * @param results One entry per upstream index, true for alive.
     * @throws IllegalArgumentException If the vector size differs from the pool
     *                                  size.
     */
    public void applyProbeResults(boolean[] results) {
        if (results.length != alive.length) {
            throw new IllegalArgumentException(
                    "Expected " + alive.length + " probe results but got " + results.length);
        }
        lock.writeLock().lock();
        try {
            for (int i = 0; i < results.length; i++) {
                if (results[i]) {
                    markAlive(i);
                } else {
                    markDead(i);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Picks a live upstream uniformly at random. Draws over the full index
     * range and re-draws on dead entries; the read lock is held throughout so
     * the pool cannot empty mid-draw.
     *
     * @param random Source of randomness.
     * @return A live index, or empty if every upstream is dead.
     */
    public OptionalInt selectLive(Random random) {
        lock.readLock().lock();
        try {
            if (liveCount == 0) {
                return OptionalInt.empty();
            }
            int idx;
            do {
                idx = random.nextInt(alive.length);
            } while (!alive[idx]);
            return OptionalInt.of(idx);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void markDead(int idx) {
        if (alive[idx]) {
            alive[idx] = false;
            liveCount--;
        }
    }

    private void markAlive(int idx) {
        if (!alive[idx]) {
            alive[idx] = true;
            liveCount++;
        }
    }
}
