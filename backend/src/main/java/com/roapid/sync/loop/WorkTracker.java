package com.roapid.sync.loop;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts running background units and blocks shutdown until they are done.
 * Once closed, no new unit may begin.
 */
class WorkTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private int active;
    private boolean closed;

    /**
     * @return false when shutdown has started; the caller must not run
     */
    boolean tryBegin() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            active++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void end() {
        lock.lock();
        try {
            active--;
            if (active <= 0) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects new units and waits for running ones.
     *
     * @return false if interrupted before all units finished
     */
    boolean closeAndAwait() {
        lock.lock();
        try {
            closed = true;
            while (active > 0) {
                idle.await();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            lock.unlock();
        }
    }
}
