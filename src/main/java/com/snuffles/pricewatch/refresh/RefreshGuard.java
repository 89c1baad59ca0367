package com.snuffles.pricewatch.refresh;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-slot, non-blocking permit: at most one refresh in flight.
 */
public class RefreshGuard {

    private final AtomicBoolean held = new AtomicBoolean(false);

    public boolean tryAcquire() {
        return held.compareAndSet(false, true);
    }

    public void release() {
        held.set(false);
    }

    public boolean isHeld() {
        return held.get();
    }
}
