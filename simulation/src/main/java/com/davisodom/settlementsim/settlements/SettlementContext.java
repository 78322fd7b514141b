package com.davisodom.settlementsim.settlements;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A settlement plus the lock that serializes every mutation of it.
 *
 * Tick processing and player commands for the same settlement both go through
 * {@link #withLock(Supplier)}; different settlements never share a lock.
 */
public class SettlementContext {

    private final Settlement settlement;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean staffingDirty = true;

    public SettlementContext(Settlement settlement) {
        this.settlement = settlement;
    }

    public Settlement getSettlement() {
        return settlement;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acquire the lock for work that throws checked exceptions; pair with {@link #unlock()}.
     */
    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Mark that structures or headcount changed so staffing is recomputed.
     */
    public void markStaffingDirty() {
        staffingDirty = true;
    }

    /**
     * Read and reset the staffing flag.
     */
    public boolean consumeStaffingDirty() {
        boolean dirty = staffingDirty;
        staffingDirty = false;
        return dirty;
    }
}
