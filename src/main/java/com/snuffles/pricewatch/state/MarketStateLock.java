package com.snuffles.pricewatch.state;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single reentrant lock guarding breaker state, caches, the price buffer and user data.
 * <p>
 * Cache population calls into breaker bookkeeping while already holding it, hence reentrant.
 * Never perform network I/O or wait on fetch workers while holding this lock: workers need it
 * to record breaker outcomes.
 */
@Component
public class MarketStateLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
