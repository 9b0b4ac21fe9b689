package com.tasknexus.channel.feishu.internal.dedup;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * DedupWindow
 * =============================================================================
 * Bounded set of recently seen message identifiers used to suppress
 * redelivery of at-least-once events.
 *
 * <h2>Admission</h2>
 * {@link #admit(String)} checks membership and records the identifier as one
 * atomic step. The first admit of an identifier returns {@code true}; every
 * later admit returns {@code false} for as long as the identifier remains in
 * the window.
 *
 * <h2>Eviction</h2>
 * When an insertion pushes the size above {@code capacity}, half of the
 * current membership is removed before {@code admit} returns, so the window
 * keeps accepting new identifiers without unbounded growth. Identifiers are
 * evicted in insertion order; callers must not rely on that order, only on
 * the bound. The identifier inserted by the triggering call is never evicted
 * by that call.
 *
 * <h2>Thread Safety</h2>
 * All operations are guarded by the window's own monitor. Concurrent
 * {@code admit} calls are linearizable.
 */
public final class DedupWindow
{
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Set<String> seen = new LinkedHashSet<>();

    public DedupWindow() {
        this(DEFAULT_CAPACITY);
    }

    public DedupWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Record {@code id} if it has not been seen.
     *
     * @return {@code true} if {@code id} is new; {@code false} for a duplicate
     */
    public synchronized boolean admit(String id) {
        Objects.requireNonNull(id, "id");

        if (!seen.add(id)) {
            return false;
        }
        if (seen.size() > capacity) {
            evictHalf();
        }
        return true;
    }

    public synchronized boolean contains(String id) {
        return seen.contains(id);
    }

    public synchronized int size() {
        return seen.size();
    }

    public int capacity() {
        return capacity;
    }

    // size / 2 < size, so the newest entry (last in iteration order) survives.
    private void evictHalf() {
        int toRemove = seen.size() / 2;
        Iterator<String> it = seen.iterator();
        while (toRemove-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
        }
    }
}
