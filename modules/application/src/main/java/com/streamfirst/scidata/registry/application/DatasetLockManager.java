package com.streamfirst.scidata.registry.application;

import com.google.common.util.concurrent.Striped;
import com.streamfirst.scidata.registry.domain.CancelledException;
import com.streamfirst.scidata.registry.domain.DatasetId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Per-dataset mutual exclusion for mutating registry operations.
 *
 * <p>Datasets are mapped onto a fixed number of lock stripes, so memory stays bounded however many
 * identifiers callers pass in; two datasets may share a stripe. When an operation touches two
 * datasets (a new upload and the predecessor it replaces) their stripes are taken in stripe order,
 * and only once if they coincide, so concurrent uploads racing for the same predecessor cannot
 * deadlock. Waiting for a lock is interruptible; an interrupted caller gets a
 * {@link CancelledException} before anything was applied.
 */
@Slf4j
public class DatasetLockManager {

    public static final int DEFAULT_STRIPES = 256;

    private final Striped<Lock> stripes;

    public DatasetLockManager() {
        this(DEFAULT_STRIPES);
    }

    public DatasetLockManager(int stripes) {
        this.stripes = Striped.lock(stripes);
    }

    public <T> T withLock(DatasetId id, Supplier<T> action) {
        Lock lock = acquire(stripes.get(id), "dataset " + id);
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public <T> T withLocks(DatasetId first, DatasetId second, Supplier<T> action) {
        List<Lock> ordered = new ArrayList<>(2);
        for (Lock lock : stripes.bulkGet(List.of(first, second))) {
            if (ordered.isEmpty() || ordered.get(0) != lock) {
                ordered.add(lock);
            }
        }
        String label = "datasets " + first + " and " + second;
        Lock outer = acquire(ordered.get(0), label);
        try {
            if (ordered.size() == 1) {
                return action.get();
            }
            Lock inner = acquire(ordered.get(1), label);
            try {
                return action.get();
            } finally {
                inner.unlock();
            }
        } finally {
            outer.unlock();
        }
    }

    /**
     * @return true if a thread other than the caller holds the stripe of the dataset
     */
    public boolean isLocked(DatasetId id) {
        Lock lock = stripes.get(id);
        if (lock.tryLock()) {
            lock.unlock();
            return false;
        }
        return true;
    }

    public int stripeCount() {
        return stripes.size();
    }

    private Lock acquire(Lock lock, String label) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for the lock of {}", label);
            throw new CancelledException("Interrupted while waiting for " + label, e);
        }
        return lock;
    }
}
